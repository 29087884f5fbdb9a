package com.exampack.api.event;

public abstract class AbstractPackEvent implements PackEvent {

    private final long timestamp;

    protected AbstractPackEvent() {
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + timestamp;
    }
}
