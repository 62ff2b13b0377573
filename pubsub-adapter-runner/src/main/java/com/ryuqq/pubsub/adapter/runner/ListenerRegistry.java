package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.application.client.RealtimeListener;
import com.ryuqq.pubsub.core.model.Message;
import com.ryuqq.pubsub.core.status.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 리스너 목록 및 알림 fan-out.
 *
 * <p>한 리스너의 예외는 로그로 남기고 다음 리스너로 계속 진행합니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class ListenerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ListenerRegistry.class);

    private final CopyOnWriteArrayList<RealtimeListener> listeners = new CopyOnWriteArrayList<>();

    public void add(RealtimeListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.addIfAbsent(listener);
    }

    public void remove(RealtimeListener listener) {
        listeners.remove(listener);
    }

    public int size() {
        return listeners.size();
    }

    public void announce(Status status) {
        if (status.isError()) {
            log.warn("{} {} on {} {}: {}", status.operation(), status.category(), status.channels(), status.groups(),
                status.error() == null ? "no cause" : status.error().getMessage());
        }
        for (RealtimeListener listener : listeners) {
            try {
                listener.onStatus(status);
            } catch (RuntimeException e) {
                log.error("Listener failed on status {}", status.category(), e);
            }
        }
    }

    public void announce(Message message) {
        for (RealtimeListener listener : listeners) {
            try {
                listener.onMessage(message);
            } catch (RuntimeException e) {
                log.error("Listener failed on message {} from {}", message.timetoken(), message.channel(), e);
            }
        }
    }
}
