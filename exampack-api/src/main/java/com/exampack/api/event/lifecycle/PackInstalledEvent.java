package com.exampack.api.event.lifecycle;

import java.nio.file.Path;

/**
 * 安装完成事件
 */
public class PackInstalledEvent extends PackLifecycleEvent {
    private final Path packDirectory;
    private final String previousVersion;

    public PackInstalledEvent(String packId, String version, Path packDirectory, String previousVersion) {
        super(packId, version);
        this.packDirectory = packDirectory;
        this.previousVersion = previousVersion;
    }

    public Path getPackDirectory() {
        return packDirectory;
    }

    /**
     * 被替换的旧版本，首次安装为 null
     */
    public String getPreviousVersion() {
        return previousVersion;
    }
}
