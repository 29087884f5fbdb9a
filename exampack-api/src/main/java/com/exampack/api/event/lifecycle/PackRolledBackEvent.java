package com.exampack.api.event.lifecycle;

/**
 * 回滚事件：新版本写入失败，已恢复备份
 */
public class PackRolledBackEvent extends PackLifecycleEvent {
    private final boolean restored;
    private final String cause;

    public PackRolledBackEvent(String packId, String version, boolean restored, String cause) {
        super(packId, version);
        this.restored = restored;
        this.cause = cause;
    }

    /**
     * 备份是否成功还原（首次安装没有备份时同样为 true）
     */
    public boolean isRestored() {
        return restored;
    }

    public String getCause() {
        return cause;
    }
}
