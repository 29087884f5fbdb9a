package com.exampack.api.event;

/**
 * 框架事件标记接口
 */
public interface PackEvent {

    long getTimestamp();
}
