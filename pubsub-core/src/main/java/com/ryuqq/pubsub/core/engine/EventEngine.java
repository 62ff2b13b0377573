package com.ryuqq.pubsub.core.engine;

import com.ryuqq.pubsub.core.effect.Effect;
import com.ryuqq.pubsub.core.effect.EffectChannel;
import com.ryuqq.pubsub.core.effect.EffectDispatcher;
import com.ryuqq.pubsub.core.effect.EffectHandle;
import com.ryuqq.pubsub.core.effect.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 범용 상태 머신 런타임.
 *
 * <p>현재 상태와 컨텍스트를 보관하고, 이벤트를 받아 전이 표에서 전이를 찾아 실행한 뒤
 * 이펙트를 {@link EffectDispatcher}로 내보냅니다.</p>
 *
 * <p><strong>처리 흐름 (이벤트 1건):</strong></p>
 * <pre>
 * 1. 결과 이벤트의 원본 핸들이 취소되었으면 버림
 * 2. table.apply(state, context, event)
 *      → 없음: no-op (상태/컨텍스트 유지)
 * 3. 스냅샷 교체 (새 컨텍스트 값, 이전 값은 수정하지 않음)
 * 4. 상태 태그가 바뀌면 이전 상태의 onExit 채널 취소
 * 5. 리스너 알림
 * 6. 이펙트를 방출 순서대로 dispatch
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>이벤트는 도착 순서대로 한 번에 하나씩 처리 (단일 처리 레인)</li>
 *   <li>처리 중 들어온 이벤트(이펙트 결과, 리스너 호출 포함)는 큐에 쌓였다가 현재 전이가 끝난 뒤 처리</li>
 *   <li>lane Executor가 처리 스레드를 결정: 테스트는 direct executor({@code Runnable::run}),
 *       운영은 단일 스레드 executor</li>
 *   <li>{@link #currentState()}는 락 없이 읽을 수 있는 불변 스냅샷</li>
 * </ul>
 *
 * <p>전이 핸들러에서 예외가 발생하면 로그를 남기고 이전 상태를 유지합니다.
 * 엔진은 어떤 실패에도 다음 이벤트를 받을 수 있는 상태로 남습니다.</p>
 *
 * @param <S> 상태 enum 타입
 * @param <E> 이벤트 기반 타입
 * @param <C> 컨텍스트 타입
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class EventEngine<S extends Enum<S>, E, C> implements EventSink<E> {

    private static final Logger log = LoggerFactory.getLogger(EventEngine.class);

    private final String name;
    private final TransitionTable<S, E, C> table;
    private final EffectDispatcher<E> dispatcher;
    private final Executor lane;
    private final Queue<Pending<E>> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final List<EngineListener<S, C, E>> listeners = new CopyOnWriteArrayList<>();

    private volatile Snapshot<S, C> current;
    private volatile boolean stopped;

    /**
     * 생성자.
     *
     * @param name 로그에 표시할 엔진 이름
     * @param table 전이 표
     * @param initial 초기 스냅샷
     * @param dispatcher 이펙트 디스패처
     * @param lane 처리 레인 executor
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventEngine(String name, TransitionTable<S, E, C> table, Snapshot<S, C> initial,
                       EffectDispatcher<E> dispatcher, Executor lane) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (lane == null) {
            throw new IllegalArgumentException("lane cannot be null");
        }
        this.name = name;
        this.table = table;
        this.current = initial;
        this.dispatcher = dispatcher;
        this.lane = lane;
    }

    /**
     * 외부 이벤트 전송 (비동기 처리).
     *
     * @param event 이벤트
     * @throws IllegalArgumentException event가 null인 경우
     * @throws IllegalStateException 엔진이 중지된 경우
     */
    public void send(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (stopped) {
            throw new IllegalStateException(name + " engine is stopped");
        }
        enqueue(new Pending<>(event, null));
    }

    @Override
    public void deliver(E event, EffectHandle origin) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (stopped) {
            log.debug("{} stopped, dropping {}", name, event);
            return;
        }
        enqueue(new Pending<>(event, origin));
    }

    /**
     * 현재 상태 스냅샷.
     *
     * @return 불변 스냅샷
     */
    public Snapshot<S, C> currentState() {
        return current;
    }

    public void addListener(EngineListener<S, C, E> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(EngineListener<S, C, E> listener) {
        listeners.remove(listener);
    }

    /**
     * 엔진 중지.
     *
     * <p>모든 채널의 이펙트를 취소하고 대기 중인 이벤트를 버립니다. 이후 {@link #send}는 예외를 던집니다.</p>
     */
    public void stop() {
        stopped = true;
        queue.clear();
        dispatcher.cancelAll();
        log.debug("{} engine stopped in {}", name, current.state());
    }

    public boolean isStopped() {
        return stopped;
    }

    public String getName() {
        return name;
    }

    private void enqueue(Pending<E> pending) {
        queue.add(pending);
        lane.execute(this::drain);
    }

    private void drain() {
        do {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                Pending<E> pending;
                while ((pending = queue.poll()) != null) {
                    process(pending);
                }
            } finally {
                draining.set(false);
            }
            // 다른 스레드가 flag 해제 직전에 넣은 이벤트 처리
        } while (!queue.isEmpty());
    }

    private void process(Pending<E> pending) {
        if (stopped) {
            return;
        }
        E event = pending.event();
        if (pending.origin() != null && pending.origin().isCancelled()) {
            log.debug("{} dropped result of cancelled effect: {}", name, event);
            return;
        }

        Snapshot<S, C> from = current;
        Optional<Transition<S, C>> transition;
        try {
            transition = table.apply(from.state(), from.context(), event);
        } catch (RuntimeException e) {
            log.error("{} transition failed in {} for {}", name, from.state(), event, e);
            return;
        }
        if (transition.isEmpty()) {
            log.debug("{} ignored {} in {}", name, event.getClass().getSimpleName(), from.state());
            return;
        }

        Transition<S, C> next = transition.get();
        Snapshot<S, C> to = new Snapshot<>(next.state(), next.context());
        current = to;

        List<Effect> effects = new ArrayList<>();
        if (from.state() != to.state()) {
            for (EffectChannel channel : table.exitChannels(from.state())) {
                effects.add(new Effect.CancelPrevious(channel));
            }
        }
        effects.addAll(next.effects());

        log.debug("{} {} → {} on {} ({} effects)", name, from.state(), to.state(),
            event.getClass().getSimpleName(), effects.size());

        for (EngineListener<S, C, E> listener : listeners) {
            try {
                listener.onTransition(from, event, to);
            } catch (RuntimeException e) {
                log.error("{} listener failed on {} → {}", name, from.state(), to.state(), e);
            }
        }

        for (Effect effect : effects) {
            dispatcher.dispatch(effect, this);
        }
    }

    private record Pending<E>(E event, EffectHandle origin) {
    }
}
