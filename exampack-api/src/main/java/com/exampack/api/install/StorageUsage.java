package com.exampack.api.install;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 磁盘占用统计（单位：字节）
 */
@Value
@Builder
public class StorageUsage {
    long totalSize;
    long packsSize;
    long tempSize;
    @Singular
    List<PackStorageInfo> packs;

    public static StorageUsage empty() {
        return StorageUsage.builder().build();
    }
}
