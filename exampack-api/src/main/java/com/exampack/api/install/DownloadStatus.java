package com.exampack.api.install;

public enum DownloadStatus {
    DOWNLOADING, // 下载中
    VERIFYING, // 校验中
    INSTALLING, // 安装中
    COMPLETE, // 已完成
    ERROR // 失败
}
