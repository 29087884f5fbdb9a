package com.exampack.api.event;

/**
 * 事件监听器
 * <p>
 * 对于可拦截的前置事件（如 {@code PackInstallingEvent}），抛出运行时异常即可阻止后续流程。
 */
@FunctionalInterface
public interface PackEventListener<E extends PackEvent> {

    void onEvent(E event);
}
