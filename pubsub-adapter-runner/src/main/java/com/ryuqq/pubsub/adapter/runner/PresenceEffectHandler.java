package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.application.presence.PresenceEvent;
import com.ryuqq.pubsub.core.effect.Effect;
import com.ryuqq.pubsub.core.effect.EffectHandler;
import com.ryuqq.pubsub.core.spi.Transport;
import com.ryuqq.pubsub.core.spi.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Presence Event Engine 이펙트 실행기.
 *
 * <p>Heartbeat는 결과 이벤트를 돌려주고, Leave는 결과를 기다리지 않습니다
 * (실패 시 경고 로그만 남김).</p>
 *
 * <p>maintainPresenceState가 켜져 있으면 heartbeat 요청에 해당 채널의 프레즌스 상태를 함께 보냅니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class PresenceEffectHandler implements EffectHandler<PresenceEvent> {

    private static final Logger log = LoggerFactory.getLogger(PresenceEffectHandler.class);

    private final Transport transport;
    private final ScheduledExecutorService timer;
    private final ListenerRegistry listeners;
    private final PresenceStateStore presenceStates;
    private final RealtimeConfig config;

    public PresenceEffectHandler(Transport transport, ScheduledExecutorService timer,
                                 ListenerRegistry listeners, PresenceStateStore presenceStates, RealtimeConfig config) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        if (presenceStates == null) {
            throw new IllegalArgumentException("presenceStates cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.transport = transport;
        this.timer = timer;
        this.listeners = listeners;
        this.presenceStates = presenceStates;
        this.config = config;
    }

    @Override
    public Runnable handle(Effect effect, Consumer<PresenceEvent> completion) {
        if (effect instanceof Effect.Heartbeat heartbeat) {
            return TransportCalls.whenDone(
                () -> transport.execute(TransportRequest.heartbeat(heartbeat.channels(), heartbeat.groups(),
                    config.presenceTimeoutSeconds(), stateFor(heartbeat), config.userId())),
                response -> completion.accept(new PresenceEvent.HeartbeatSuccess()),
                error -> completion.accept(new PresenceEvent.HeartbeatFailure(error))
            );
        }
        if (effect instanceof Effect.Leave leave) {
            TransportCalls.whenDone(
                () -> transport.execute(TransportRequest.leave(leave.channels(), leave.groups(), config.userId())),
                response -> log.debug("Left {} {}", leave.channels(), leave.groups()),
                error -> log.warn("Leave request dropped for {} {}: {}", leave.channels(), leave.groups(), error.getMessage())
            );
            return NO_ABORT;
        }
        if (effect instanceof Effect.Wait wait) {
            ScheduledFuture<?> fire = timer.schedule(
                () -> completion.accept(new PresenceEvent.TimesUp()), wait.delayMs(), TimeUnit.MILLISECONDS);
            return () -> fire.cancel(false);
        }
        if (effect instanceof Effect.EmitStatus emit) {
            listeners.announce(emit.status());
            return NO_ABORT;
        }
        log.warn("Unsupported presence effect: {}", effect);
        return NO_ABORT;
    }

    private Map<String, String> stateFor(Effect.Heartbeat heartbeat) {
        return config.maintainPresenceState() ? presenceStates.stateFor(heartbeat.channels()) : Map.of();
    }
}
