package com.exampack.core.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 安装时写入安全存储的记录，后续篡改检测以此为准
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PackMetadataRecord {
    private long installTime;
    private String version;
    private String checksum;
    private String signature;
    private boolean verified;
}
