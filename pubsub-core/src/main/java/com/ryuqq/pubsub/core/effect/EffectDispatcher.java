package com.ryuqq.pubsub.core.effect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * 이펙트 실행 및 채널별 취소 관리.
 *
 * <p>채널마다 활성 핸들을 하나만 유지합니다. 같은 채널에 새 이펙트가 들어오면
 * 이전 핸들을 먼저 취소한 뒤 시작합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * dispatch(effect)
 *   ├─ CancelPrevious(ch) → active[ch].cancel()
 *   └─ 그 외:
 *        1. channel != NONE 이면 active[channel].cancel()
 *        2. 새 핸들 생성, active[channel] = 핸들
 *        3. handler.handle(effect, event → sink.deliver(event, 핸들))
 *        4. 반환된 abort hook을 핸들에 연결
 * </pre>
 *
 * <p><strong>취소 보장:</strong> 취소된 핸들에서 나온 결과 이벤트는 {@link EventSink}가
 * 처리 레인에서 버립니다. 하부 전송 호출은 계속 실행될 수 있지만 결과는 반영되지 않습니다.</p>
 *
 * <p>dispatch는 엔진 처리 레인에서 호출되고, {@link #cancelAll()}은 종료 시 다른 스레드에서
 * 호출될 수 있어 메서드 단위로 동기화합니다.</p>
 *
 * @param <E> 엔진 이벤트 타입
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class EffectDispatcher<E> {

    private static final Logger log = LoggerFactory.getLogger(EffectDispatcher.class);

    private final EffectHandler<E> handler;
    private final Map<EffectChannel, DispatchedEffect> active = new EnumMap<>(EffectChannel.class);

    /**
     * 생성자.
     *
     * @param handler 이펙트 실행기
     * @throws IllegalArgumentException handler가 null인 경우
     */
    public EffectDispatcher(EffectHandler<E> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        this.handler = handler;
    }

    /**
     * 이펙트 실행.
     *
     * @param effect 실행할 이펙트
     * @param sink 결과 이벤트를 받을 엔진
     * @return 이펙트 핸들 (CancelPrevious인 경우 이미 취소된 핸들)
     */
    public synchronized EffectHandle dispatch(Effect effect, EventSink<E> sink) {
        if (effect == null) {
            throw new IllegalArgumentException("effect cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }

        if (effect instanceof Effect.CancelPrevious cancel) {
            cancel(cancel.target());
            return DispatchedEffect.cancelled(effect);
        }

        EffectChannel channel = effect.channel();
        if (channel != EffectChannel.NONE) {
            cancel(channel);
        }

        DispatchedEffect handle = new DispatchedEffect(effect);
        if (channel != EffectChannel.NONE) {
            active.put(channel, handle);
        }

        try {
            Runnable abort = handler.handle(effect, event -> sink.deliver(event, handle));
            handle.attachAbort(abort == null ? EffectHandler.NO_ABORT : abort);
        } catch (RuntimeException e) {
            log.error("Effect handler failed to start {}", effect, e);
            handle.cancel();
            active.remove(channel, handle);
        }
        return handle;
    }

    /**
     * 채널의 활성 이펙트 취소.
     *
     * @param channel 취소할 채널
     */
    public synchronized void cancel(EffectChannel channel) {
        DispatchedEffect previous = active.remove(channel);
        if (previous != null && !previous.isCancelled()) {
            log.debug("Cancelling {} on {}", previous.effect(), channel);
            previous.cancel();
        }
    }

    /**
     * 모든 채널의 활성 이펙트 취소 (종료 시 사용).
     */
    public synchronized void cancelAll() {
        for (DispatchedEffect handle : active.values()) {
            handle.cancel();
        }
        active.clear();
    }

    /**
     * 채널에 취소되지 않은 이펙트가 있는지 확인.
     *
     * <p>완료된 이펙트도 다음 이펙트가 시작되기 전까지는 활성으로 남습니다.</p>
     *
     * @param channel 확인할 채널
     * @return 활성 이펙트가 있으면 true
     */
    public synchronized boolean hasActive(EffectChannel channel) {
        DispatchedEffect handle = active.get(channel);
        return handle != null && !handle.isCancelled();
    }

    /**
     * Handle of one dispatched effect; aborts the in-flight work on cancellation.
     */
    static final class DispatchedEffect implements EffectHandle {

        private final Effect effect;
        private Runnable abort;
        private boolean cancelled;

        DispatchedEffect(Effect effect) {
            this.effect = effect;
        }

        static DispatchedEffect cancelled(Effect effect) {
            DispatchedEffect handle = new DispatchedEffect(effect);
            handle.cancelled = true;
            return handle;
        }

        Effect effect() {
            return effect;
        }

        synchronized void attachAbort(Runnable abort) {
            if (cancelled) {
                abort.run();
            } else {
                this.abort = abort;
            }
        }

        @Override
        public void cancel() {
            Runnable toRun;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                cancelled = true;
                toRun = abort;
                abort = null;
            }
            if (toRun != null) {
                toRun.run();
            }
        }

        @Override
        public synchronized boolean isCancelled() {
            return cancelled;
        }
    }
}
