package com.exampack.api.event.lifecycle;

import java.util.Collections;
import java.util.List;

/**
 * 安装失败事件（安装目录保持尝试前的状态）
 */
public class PackInstallFailedEvent extends PackLifecycleEvent {
    private final List<String> errors;

    public PackInstallFailedEvent(String packId, String version, List<String> errors) {
        super(packId, version);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
