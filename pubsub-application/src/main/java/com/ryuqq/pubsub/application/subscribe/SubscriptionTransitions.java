package com.ryuqq.pubsub.application.subscribe;

import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.Disconnect;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.HandshakeFailure;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.HandshakeSuccess;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.ReceiveFailure;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.ReceiveSuccess;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.Reconnect;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.Restore;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.Retry;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent.SubscriptionChange;
import com.ryuqq.pubsub.core.effect.Effect;
import com.ryuqq.pubsub.core.effect.EffectChannel;
import com.ryuqq.pubsub.core.effect.EffectDispatcher;
import com.ryuqq.pubsub.core.effect.EffectHandler;
import com.ryuqq.pubsub.core.engine.EventEngine;
import com.ryuqq.pubsub.core.engine.Snapshot;
import com.ryuqq.pubsub.core.engine.Transition;
import com.ryuqq.pubsub.core.engine.TransitionTable;
import com.ryuqq.pubsub.core.exception.PubSubException;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.retry.Endpoint;
import com.ryuqq.pubsub.core.retry.RetryDecision;
import com.ryuqq.pubsub.core.status.Status;
import com.ryuqq.pubsub.core.status.StatusCategory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Executor;

import static com.ryuqq.pubsub.application.subscribe.SubscriptionState.HANDSHAKE_FAILED;
import static com.ryuqq.pubsub.application.subscribe.SubscriptionState.HANDSHAKE_STOPPED;
import static com.ryuqq.pubsub.application.subscribe.SubscriptionState.HANDSHAKING;
import static com.ryuqq.pubsub.application.subscribe.SubscriptionState.RECEIVE_FAILED;
import static com.ryuqq.pubsub.application.subscribe.SubscriptionState.RECEIVE_STOPPED;
import static com.ryuqq.pubsub.application.subscribe.SubscriptionState.RECEIVING;
import static com.ryuqq.pubsub.application.subscribe.SubscriptionState.UNSUBSCRIBED;

/**
 * Subscription Event Engine 전이 표.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <pre>
 * UNSUBSCRIBED  + change/restore    → HANDSHAKING [handshake]  (빈 집합이면 유지)
 * HANDSHAKING   + handshakeSuccess  → RECEIVING [CONNECTED, receiveMessages]
 * HANDSHAKING   + handshakeFailure  → HANDSHAKING [RECONNECTING, wait] 또는 HANDSHAKE_FAILED [CONNECTION_ERROR]
 * HANDSHAKING   + retry             → HANDSHAKING [handshakeReconnect]
 * RECEIVING     + receiveSuccess    → RECEIVING [(RECONNECTED), (REQUEST_MESSAGE_COUNT_EXCEEDED), messages, receiveMessages]
 * RECEIVING     + receiveFailure    → RECEIVING [RECONNECTING, wait] 또는 RECEIVE_FAILED [DISCONNECTED_UNEXPECTEDLY]
 * RECEIVING     + retry             → RECEIVING [receiveReconnect]
 * HANDSHAKING   + disconnect        → HANDSHAKE_STOPPED [DISCONNECTED]
 * RECEIVING     + disconnect        → RECEIVE_STOPPED [DISCONNECTED]
 * *_FAILED      + disconnect        → *_STOPPED
 * HANDSHAKE_*   + reconnect         → HANDSHAKING [handshake]
 * RECEIVE_*     + reconnect         → RECEIVING [receiveMessages] (첫 수신 성공 시 RECONNECTED)
 * (any)         + change/restore    → HANDSHAKING (RECEIVING은 ChannelMergePolicy에 따름)
 * (any)         + 빈 집합 change     → UNSUBSCRIBED (커서 제거)
 * </pre>
 *
 * <p>HANDSHAKING을 떠나면 HANDSHAKE 채널, RECEIVING을 떠나면 RECEIVE 채널이 취소됩니다.
 * 재시도 대기 타이머도 같은 채널을 사용하므로 상태를 벗어나면 함께 취소됩니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class SubscriptionTransitions {

    private static final EnumSet<SubscriptionState> ALL = EnumSet.allOf(SubscriptionState.class);

    private final SubscriptionSettings settings;
    private final TransitionTable<SubscriptionState, SubscriptionEvent, SubscriptionContext> table;

    public SubscriptionTransitions(SubscriptionSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
        this.table = buildTable();
    }

    public TransitionTable<SubscriptionState, SubscriptionEvent, SubscriptionContext> table() {
        return table;
    }

    public SubscriptionSettings settings() {
        return settings;
    }

    /**
     * UNSUBSCRIBED 상태의 새 엔진 생성.
     *
     * @param handler 이펙트 실행기
     * @param lane 이벤트 처리 레인
     * @return 새 엔진
     */
    public EventEngine<SubscriptionState, SubscriptionEvent, SubscriptionContext> newEngine(
            EffectHandler<SubscriptionEvent> handler, Executor lane) {
        return new EventEngine<>(
            "subscribe",
            table,
            new Snapshot<>(UNSUBSCRIBED, SubscriptionContext.empty()),
            new EffectDispatcher<>(handler),
            lane
        );
    }

    private TransitionTable<SubscriptionState, SubscriptionEvent, SubscriptionContext> buildTable() {
        TransitionTable.Builder<SubscriptionState, SubscriptionEvent, SubscriptionContext> builder =
            TransitionTable.builder(SubscriptionState.class);

        // 구독 변경은 모든 상태에서 허용
        for (SubscriptionState state : ALL) {
            builder.on(state, SubscriptionChange.class, (ctx, e) -> change(state, ctx, e));
            builder.on(state, Restore.class, (ctx, e) -> restore(state, ctx, e));
        }

        builder
            .on(HANDSHAKING, HandshakeSuccess.class, this::handshakeSucceeded)
            .on(HANDSHAKING, HandshakeFailure.class, this::handshakeFailed)
            .on(HANDSHAKING, Retry.class, (ctx, e) -> Transition.to(HANDSHAKING, ctx,
                new Effect.HandshakeReconnect(ctx.channels(), ctx.groups(), ctx.attempts())))
            .on(HANDSHAKING, Disconnect.class, (ctx, e) -> Transition.to(HANDSHAKE_STOPPED, ctx.withoutFailure(),
                emit(StatusCategory.DISCONNECTED, ctx)))
            .on(HANDSHAKE_FAILED, Disconnect.class, (ctx, e) -> Transition.to(HANDSHAKE_STOPPED, ctx))
            .on(EnumSet.of(HANDSHAKE_FAILED, HANDSHAKE_STOPPED), Reconnect.class, (ctx, e) -> {
                SubscriptionContext next = e.cursor() == null ? ctx.withoutFailure() : ctx.withCursor(e.cursor());
                return Transition.to(HANDSHAKING, next, new Effect.Handshake(next.channels(), next.groups()));
            })

            .on(RECEIVING, ReceiveSuccess.class, this::receiveSucceeded)
            .on(RECEIVING, ReceiveFailure.class, this::receiveFailed)
            .on(RECEIVING, Retry.class, (ctx, e) -> Transition.to(RECEIVING, ctx,
                new Effect.ReceiveReconnect(ctx.channels(), ctx.groups(), ctx.cursor(), ctx.attempts())))
            .on(RECEIVING, Disconnect.class, (ctx, e) -> Transition.to(RECEIVE_STOPPED, ctx.withoutFailure(),
                emit(StatusCategory.DISCONNECTED, ctx)))
            .on(RECEIVE_FAILED, Disconnect.class, (ctx, e) -> Transition.to(RECEIVE_STOPPED, ctx))
            .on(EnumSet.of(RECEIVE_FAILED, RECEIVE_STOPPED), Reconnect.class, (ctx, e) -> {
                SubscriptionContext next = (e.cursor() == null ? ctx.withoutFailure() : ctx.withCursor(e.cursor()))
                    .asReconnecting();
                return Transition.to(RECEIVING, next,
                    new Effect.ReceiveMessages(next.channels(), next.groups(), next.cursor()));
            })

            .onExit(HANDSHAKING, EffectChannel.HANDSHAKE)
            .onExit(RECEIVING, EffectChannel.RECEIVE);

        return builder.build();
    }

    private Transition<SubscriptionState, SubscriptionContext> change(
            SubscriptionState from, SubscriptionContext ctx, SubscriptionChange event) {
        if (event.isEmpty()) {
            return unsubscribe(from, ctx);
        }
        ChannelMergePolicy policy = settings.mergePolicy();
        Cursor cursor = policy == ChannelMergePolicy.START_FROM_NOW ? null : ctx.cursor();
        SubscriptionContext next = SubscriptionContext.of(event.channels(), event.groups(), cursor);

        if (from == RECEIVING && policy == ChannelMergePolicy.CONTINUE_RECEIVING) {
            return Transition.to(RECEIVING, next,
                emit(StatusCategory.SUBSCRIPTION_CHANGED, next),
                new Effect.ReceiveMessages(next.channels(), next.groups(), next.cursor()));
        }
        return Transition.to(HANDSHAKING, next,
            from == RECEIVING ? emit(StatusCategory.SUBSCRIPTION_CHANGED, next) : null,
            new Effect.Handshake(next.channels(), next.groups()));
    }

    private Transition<SubscriptionState, SubscriptionContext> restore(
            SubscriptionState from, SubscriptionContext ctx, Restore event) {
        if (event.isEmpty()) {
            return unsubscribe(from, ctx);
        }
        SubscriptionContext next = SubscriptionContext.of(event.channels(), event.groups(), event.cursor());
        return Transition.to(HANDSHAKING, next,
            from == RECEIVING ? emit(StatusCategory.SUBSCRIPTION_CHANGED, next) : null,
            new Effect.Handshake(next.channels(), next.groups()));
    }

    private Transition<SubscriptionState, SubscriptionContext> unsubscribe(
            SubscriptionState from, SubscriptionContext ctx) {
        if (from == RECEIVING) {
            return Transition.to(UNSUBSCRIBED, SubscriptionContext.empty(), emit(StatusCategory.DISCONNECTED, ctx));
        }
        return Transition.to(UNSUBSCRIBED, SubscriptionContext.empty());
    }

    private Transition<SubscriptionState, SubscriptionContext> handshakeSucceeded(
            SubscriptionContext ctx, HandshakeSuccess event) {
        // 복원 커서가 있으면 그 timetoken을 유지하고 region만 서버 값을 사용
        Cursor cursor = ctx.cursor() == null || ctx.cursor().isZero()
            ? event.cursor()
            : ctx.cursor().withRegion(event.cursor().region());
        SubscriptionContext next = ctx.withCursor(cursor);
        return Transition.to(RECEIVING, next,
            emit(StatusCategory.CONNECTED, next),
            new Effect.ReceiveMessages(next.channels(), next.groups(), cursor));
    }

    private Transition<SubscriptionState, SubscriptionContext> handshakeFailed(
            SubscriptionContext ctx, HandshakeFailure event) {
        int attempt = ctx.attempts() + 1;
        RetryDecision decision = settings.retryPolicy().shouldRetry(attempt, Endpoint.SUBSCRIBE, event.reason());
        SubscriptionContext next = ctx.withFailure(attempt, event.reason());
        if (decision.retry()) {
            return Transition.to(HANDSHAKING, next,
                emitError(StatusCategory.RECONNECTING, next, event.reason()),
                new Effect.Wait(EffectChannel.HANDSHAKE, decision.delayMs()));
        }
        return Transition.to(HANDSHAKE_FAILED, next, emitError(StatusCategory.CONNECTION_ERROR, next, event.reason()));
    }

    private Transition<SubscriptionState, SubscriptionContext> receiveSucceeded(
            SubscriptionContext ctx, ReceiveSuccess event) {
        Cursor cursor = Cursor.latest(ctx.cursor(), event.cursor());
        SubscriptionContext next = ctx.withCursor(cursor);

        List<Effect> effects = new ArrayList<>(4);
        if (ctx.attempts() > 0 || ctx.reconnecting()) {
            effects.add(emit(StatusCategory.RECONNECTED, next));
        }
        if (settings.exceedsMessageCountThreshold(event.messages().size())) {
            effects.add(emit(StatusCategory.REQUEST_MESSAGE_COUNT_EXCEEDED, next));
        }
        if (!event.messages().isEmpty()) {
            effects.add(new Effect.EmitMessages(event.messages()));
        }
        effects.add(new Effect.ReceiveMessages(next.channels(), next.groups(), cursor));
        return Transition.to(RECEIVING, next, effects);
    }

    private Transition<SubscriptionState, SubscriptionContext> receiveFailed(
            SubscriptionContext ctx, ReceiveFailure event) {
        int attempt = ctx.attempts() + 1;
        RetryDecision decision = settings.retryPolicy().shouldRetry(attempt, Endpoint.SUBSCRIBE, event.reason());
        SubscriptionContext next = ctx.withFailure(attempt, event.reason());
        if (decision.retry()) {
            return Transition.to(RECEIVING, next,
                emitError(StatusCategory.RECONNECTING, next, event.reason()),
                new Effect.Wait(EffectChannel.RECEIVE, decision.delayMs()));
        }
        return Transition.to(RECEIVE_FAILED, next,
            emitError(StatusCategory.DISCONNECTED_UNEXPECTEDLY, next, event.reason()));
    }

    private static Effect emit(StatusCategory category, SubscriptionContext ctx) {
        return new Effect.EmitStatus(Status.subscribe(category, ctx.channels(), ctx.groups(), ctx.cursor()));
    }

    private static Effect emitError(StatusCategory category, SubscriptionContext ctx, PubSubException error) {
        return new Effect.EmitStatus(
            Status.subscribeError(category, ctx.channels(), ctx.groups(), ctx.cursor(), error));
    }
}
