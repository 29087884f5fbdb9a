package com.exampack.api.event.lifecycle;

/**
 * 卸载完成事件
 */
public class PackUninstalledEvent extends PackLifecycleEvent {

    public PackUninstalledEvent(String packId, String version) {
        super(packId, version);
    }
}
