package com.exampack.api.event.lifecycle;

import com.exampack.api.event.AbstractPackEvent;
import lombok.Getter;

/**
 * 内容包生命周期事件基类
 */
@Getter
public abstract class PackLifecycleEvent extends AbstractPackEvent {
    private final String packId;
    private final String version;

    protected PackLifecycleEvent(String packId, String version) {
        super();
        this.packId = packId;
        this.version = version;
    }

    @Override
    public String toString() {
        return super.toString() + " source=" + packId + ":" + version;
    }
}
