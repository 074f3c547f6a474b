package com.example.apirecovery.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 恢复事件的发布订阅。监听器按注册顺序在发布线程上同步回调，
 * 单个监听器抛出的异常只记录日志，不影响其余监听器和主调用链路。
 */
public class RecoveryEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryEventPublisher.class);

    private final Map<RecoveryEvent, List<RecoveryEventListener>> listeners = new EnumMap<>(RecoveryEvent.class);

    public RecoveryEventPublisher() {
        for (RecoveryEvent event : RecoveryEvent.values()) {
            listeners.put(event, new CopyOnWriteArrayList<>());
        }
    }

    public void register(RecoveryEvent event, RecoveryEventListener listener) {
        listeners.get(event).add(listener);
    }

    public boolean unregister(RecoveryEvent event, RecoveryEventListener listener) {
        return listeners.get(event).remove(listener);
    }

    public void publish(RecoveryEvent event, Map<String, Object> data) {
        for (RecoveryEventListener listener : listeners.get(event)) {
            try {
                listener.onEvent(event, data);
            } catch (RuntimeException e) {
                logger.error("事件监听器处理 {} 失败", event.getEventName(), e);
            }
        }
    }

    public int listenerCount(RecoveryEvent event) {
        return listeners.get(event).size();
    }
}
