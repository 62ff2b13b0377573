package com.ryuqq.pubsub.application.support;

import com.ryuqq.pubsub.core.effect.Effect;
import com.ryuqq.pubsub.core.effect.EffectHandler;
import com.ryuqq.pubsub.core.status.StatusCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 시작된 이펙트를 기록하고, 테스트가 원하는 시점에 결과 이벤트를 돌려주는 EffectHandler.
 *
 * <p>실제 I/O 없이 전이 표를 구동할 때 사용합니다.</p>
 *
 * @param <E> 결과 이벤트 타입
 * @author PubSub Team
 * @since 1.0.0
 */
public class RecordingEffectHandler<E> implements EffectHandler<E> {

    private final List<Effect> started = new ArrayList<>();
    private final List<Consumer<E>> completions = new ArrayList<>();
    private final List<Effect> aborted = new ArrayList<>();

    @Override
    public synchronized Runnable handle(Effect effect, Consumer<E> completion) {
        started.add(effect);
        completions.add(completion);
        return () -> {
            synchronized (this) {
                aborted.add(effect);
            }
        };
    }

    public synchronized List<Effect> started() {
        return List.copyOf(started);
    }

    public synchronized List<Effect> aborted() {
        return List.copyOf(aborted);
    }

    public synchronized <T extends Effect> List<T> started(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Effect effect : started) {
            if (type.isInstance(effect)) {
                result.add(type.cast(effect));
            }
        }
        return result;
    }

    /**
     * 가장 최근에 시작된 해당 타입의 이펙트.
     */
    public synchronized <T extends Effect> T last(Class<T> type) {
        List<T> matches = started(type);
        if (matches.isEmpty()) {
            throw new AssertionError("No " + type.getSimpleName() + " started, effects: " + started);
        }
        return matches.get(matches.size() - 1);
    }

    public synchronized List<StatusCategory> statuses() {
        List<StatusCategory> result = new ArrayList<>();
        for (Effect.EmitStatus emit : started(Effect.EmitStatus.class)) {
            result.add(emit.status().category());
        }
        return result;
    }

    /**
     * 이펙트의 결과 이벤트를 엔진에 전달.
     *
     * @param effect 완료할 이펙트 (동일 인스턴스로 찾음)
     * @param result 결과 이벤트
     */
    public void complete(Effect effect, E result) {
        Consumer<E> completion;
        synchronized (this) {
            int index = -1;
            for (int i = started.size() - 1; i >= 0; i--) {
                if (started.get(i) == effect) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                throw new AssertionError("Effect was never started: " + effect);
            }
            completion = completions.get(index);
        }
        completion.accept(result);
    }

    public synchronized void clear() {
        started.clear();
        completions.clear();
        aborted.clear();
    }
}
