package com.exampack.core.event;

import com.exampack.api.event.lifecycle.PackInstalledEvent;
import com.exampack.api.event.lifecycle.PackInstallingEvent;
import com.exampack.api.exception.PackException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventBus 单元测试")
public class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    @DisplayName("只投递给订阅了该事件类型的监听器")
    void deliversByType() {
        List<String> received = new ArrayList<>();
        eventBus.subscribe("ui", PackInstalledEvent.class, e -> received.add("installed:" + e.getPackId()));
        eventBus.subscribe("ui", PackInstallingEvent.class, e -> received.add("installing:" + e.getPackId()));

        eventBus.publish(new PackInstalledEvent("net", "1.0.0", Paths.get("packs/net"), null));

        assertEquals(1, received.size());
        assertEquals("installed:net", received.get(0));
    }

    @Test
    @DisplayName("监听器异常向上传播，用于拦截安装")
    void listenerExceptionPropagates() {
        eventBus.subscribe("policy", PackInstallingEvent.class, e -> {
            throw new PackException("Pack " + e.getPackId() + " is blocked");
        });

        PackException ex = assertThrows(PackException.class,
                () -> eventBus.publish(new PackInstallingEvent("net", "1.0.0", Paths.get("net.zip"))));
        assertEquals("Pack net is blocked", ex.getMessage());
    }

    @Test
    @DisplayName("按订阅方批量注销")
    void unsubscribeAll() {
        List<String> received = new ArrayList<>();
        eventBus.subscribe("a", PackInstalledEvent.class, e -> received.add("a"));
        eventBus.subscribe("b", PackInstalledEvent.class, e -> received.add("b"));

        eventBus.unsubscribeAll("a");
        eventBus.publish(new PackInstalledEvent("net", "1.0.0", Paths.get("packs/net"), "0.9.0"));

        assertEquals(1, received.size());
        assertEquals("b", received.get(0));
    }

    @Test
    @DisplayName("没有监听器时发布为空操作")
    void noListeners() {
        assertDoesNotThrow(() -> eventBus.publish(new PackInstalledEvent("net", "1.0.0", Paths.get("x"), null)));
    }
}
