package com.exampack.core.event;

import com.exampack.api.event.PackEvent;
import com.exampack.api.event.PackEventListener;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
public class EventBus {

    private final Map<Class<? extends PackEvent>, List<ListenerWrapper>> listeners =
            new ConcurrentHashMap<>();

    // 包装器，记录监听器归属的订阅方
    @Value
    static class ListenerWrapper {
        String ownerId;
        PackEventListener<? extends PackEvent> listener;
    }

    /**
     * 注册监听器
     *
     * @param ownerId 订阅方标识，用于批量注销
     */
    public <E extends PackEvent> void subscribe(String ownerId, Class<E> eventType, PackEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(new ListenerWrapper(ownerId, listener));
    }

    /**
     * 移除某订阅方注册的全部监听器
     */
    public void unsubscribeAll(String ownerId) {
        log.debug("Removing event listeners of owner: {}", ownerId);
        for (List<ListenerWrapper> list : listeners.values()) {
            list.removeIf(wrapper -> wrapper.getOwnerId().equals(ownerId));
        }
    }

    /**
     * 同步发布事件
     * <p>
     * 监听器抛出的运行时异常会继续向上传播（Fail-Fast），前置事件据此实现拦截。
     */
    public <E extends PackEvent> void publish(E event) {
        List<ListenerWrapper> wrappers = listeners.get(event.getClass());
        if (wrappers == null) {
            return;
        }
        for (ListenerWrapper wrapper : wrappers) {
            @SuppressWarnings("unchecked")
            PackEventListener<E> listener = (PackEventListener<E>) wrapper.getListener();
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener of {} for {} threw, propagating: {}",
                        wrapper.getOwnerId(), event, e.getMessage());
                throw e;
            }
        }
    }
}
