package com.exampack.api.event.lifecycle;

import java.nio.file.Path;

/**
 * 安装前置事件 (可拦截)
 * <p>
 * 在完整性校验和内容校验通过之后、改动安装目录之前发布。
 */
public class PackInstallingEvent extends PackLifecycleEvent {
    private final Path archivePath;

    public PackInstallingEvent(String packId, String version, Path archivePath) {
        super(packId, version);
        this.archivePath = archivePath;
    }

    public Path getArchivePath() {
        return archivePath;
    }
}
