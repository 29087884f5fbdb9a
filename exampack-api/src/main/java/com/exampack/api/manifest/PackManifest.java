package com.exampack.api.manifest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 对应 manifest.json 的根节点
 * <p>
 * 描述内容包的身份、完整性摘要与应用版本兼容窗口。
 * {@code checksum} 为归档文件的 SHA-256，{@code signature} 为发布方对身份字段的 Ed25519 签名（十六进制）。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PackManifest implements Serializable {

    // === 身份 ===
    private String id;
    private String version;
    private String name;
    private String description;
    private String author;

    // === 兼容窗口 ===
    private String minAppVersion;
    private String maxAppVersion;

    // === 完整性 ===
    private String checksum;
    private String signature;
    private Long createdAt;

    // === 内容 ===
    private PackFiles files;
    private ManifestMetadata metadata;

    @Override
    public String toString() {
        return String.format("PackManifest{id='%s', version='%s'}", id, version);
    }
}
