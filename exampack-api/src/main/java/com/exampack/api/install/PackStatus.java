package com.exampack.api.install;

/**
 * 单个内容包的生命周期状态
 * <p>
 * 任一中间态失败后都回到尝试前的状态（INSTALLED 或 NOT_INSTALLED），不存在"部分安装"。
 */
public enum PackStatus {
    NOT_INSTALLED, // 未安装
    DOWNLOADING, // 下载中
    VERIFYING, // 校验中
    INSTALLING, // 安装中
    INSTALLED // 已安装
}
