package com.exampack.api.install;

import lombok.Builder;
import lombok.Value;

/**
 * 进度快照 (不可变，不持久化)
 */
@Value
@Builder
public class DownloadProgress {
    String packId;
    long downloaded;
    long total;
    int percentage;
    DownloadStatus status;
    String error;

    public static DownloadProgress downloading(String packId, long downloaded, long total) {
        int percentage = total > 0 ? (int) Math.round(downloaded * 100.0 / total) : 0;
        return DownloadProgress.builder()
                .packId(packId)
                .downloaded(downloaded)
                .total(total)
                .percentage(percentage)
                .status(DownloadStatus.DOWNLOADING)
                .build();
    }

    /**
     * 安装阶段的进度以 0-100 的刻度表示
     */
    public static DownloadProgress stage(String packId, DownloadStatus status, int percentage) {
        return DownloadProgress.builder()
                .packId(packId)
                .downloaded(percentage)
                .total(100)
                .percentage(percentage)
                .status(status)
                .build();
    }

    public static DownloadProgress error(String packId, String error) {
        return DownloadProgress.builder()
                .packId(packId)
                .downloaded(0)
                .total(100)
                .percentage(0)
                .status(DownloadStatus.ERROR)
                .error(error)
                .build();
    }
}
