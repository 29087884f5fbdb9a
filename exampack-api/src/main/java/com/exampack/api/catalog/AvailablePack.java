package com.exampack.api.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分发服务器上可供下载的内容包
 * <p>
 * {@code installed} / {@code installedVersion} 由本地安装状态回填，服务端不下发。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AvailablePack {
    private String id;
    private String name;
    private String version;
    private String description;
    private long size;
    private String downloadUrl;
    private String manifestUrl;
    private boolean installed;
    private String installedVersion;
}
