package com.ryuqq.pubsub.application.presence;

import com.ryuqq.pubsub.application.presence.PresenceEvent.Disconnect;
import com.ryuqq.pubsub.application.presence.PresenceEvent.HeartbeatFailure;
import com.ryuqq.pubsub.application.presence.PresenceEvent.HeartbeatSuccess;
import com.ryuqq.pubsub.application.presence.PresenceEvent.Joined;
import com.ryuqq.pubsub.application.presence.PresenceEvent.Left;
import com.ryuqq.pubsub.application.presence.PresenceEvent.LeftAll;
import com.ryuqq.pubsub.application.presence.PresenceEvent.Reconnect;
import com.ryuqq.pubsub.application.presence.PresenceEvent.TimesUp;
import com.ryuqq.pubsub.core.effect.Effect;
import com.ryuqq.pubsub.core.effect.EffectChannel;
import com.ryuqq.pubsub.core.effect.EffectDispatcher;
import com.ryuqq.pubsub.core.effect.EffectHandler;
import com.ryuqq.pubsub.core.engine.EventEngine;
import com.ryuqq.pubsub.core.engine.Snapshot;
import com.ryuqq.pubsub.core.engine.Transition;
import com.ryuqq.pubsub.core.engine.TransitionTable;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.retry.Endpoint;
import com.ryuqq.pubsub.core.retry.RetryDecision;
import com.ryuqq.pubsub.core.status.Status;
import com.ryuqq.pubsub.core.status.StatusCategory;

import java.util.EnumSet;
import java.util.concurrent.Executor;

import static com.ryuqq.pubsub.application.presence.PresenceState.HEARTBEATING;
import static com.ryuqq.pubsub.application.presence.PresenceState.HEARTBEAT_COOLDOWN;
import static com.ryuqq.pubsub.application.presence.PresenceState.HEARTBEAT_FAILED;
import static com.ryuqq.pubsub.application.presence.PresenceState.HEARTBEAT_INACTIVE;
import static com.ryuqq.pubsub.application.presence.PresenceState.HEARTBEAT_STOPPED;

/**
 * Presence Event Engine 전이 표.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <pre>
 * INACTIVE              + joined           → HEARTBEATING [heartbeat]
 * HEARTBEATING          + heartbeatSuccess → COOLDOWN [HEARTBEAT_SUCCEEDED?, wait(interval)]
 * HEARTBEATING          + heartbeatFailure → HEARTBEATING [wait(backoff)] 또는 FAILED [HEARTBEAT_FAILED?]
 * HEARTBEATING/COOLDOWN + timesUp          → HEARTBEATING [heartbeat]
 * 활성 상태/FAILED       + joined/left      → HEARTBEATING [leave?, heartbeat] (빈 집합이면 INACTIVE)
 * 활성 상태/FAILED       + disconnect       → STOPPED [leave? (offline이면 생략)]
 * 활성 상태/FAILED       + leftAll          → INACTIVE [leave? (offline이면 생략)]
 * STOPPED               + joined/left      → STOPPED (멤버 목록만 갱신)
 * STOPPED               + leftAll          → INACTIVE
 * FAILED/STOPPED        + reconnect        → HEARTBEATING [heartbeat]
 * </pre>
 *
 * <p>leave 요청은 {@code suppressLeaveEvents} 설정 시 항상 생략됩니다.
 * {@code -pnpres} 접미사를 가진 이름은 멤버 목록에 추가되지 않습니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class PresenceTransitions {

    private static final EnumSet<PresenceState> ONLINE = EnumSet.of(HEARTBEATING, HEARTBEAT_COOLDOWN, HEARTBEAT_FAILED);

    private final PresenceSettings settings;
    private final TransitionTable<PresenceState, PresenceEvent, PresenceContext> table;

    public PresenceTransitions(PresenceSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
        this.table = buildTable();
    }

    public TransitionTable<PresenceState, PresenceEvent, PresenceContext> table() {
        return table;
    }

    public PresenceSettings settings() {
        return settings;
    }

    /**
     * HEARTBEAT_INACTIVE 상태의 새 엔진 생성.
     *
     * @param handler 이펙트 실행기
     * @param lane 이벤트 처리 레인
     * @return 새 엔진
     */
    public EventEngine<PresenceState, PresenceEvent, PresenceContext> newEngine(
            EffectHandler<PresenceEvent> handler, Executor lane) {
        return new EventEngine<>(
            "presence",
            table,
            new Snapshot<>(HEARTBEAT_INACTIVE, PresenceContext.empty()),
            new EffectDispatcher<>(handler),
            lane
        );
    }

    private TransitionTable<PresenceState, PresenceEvent, PresenceContext> buildTable() {
        TransitionTable.Builder<PresenceState, PresenceEvent, PresenceContext> builder =
            TransitionTable.builder(PresenceState.class);

        builder
            .on(HEARTBEAT_INACTIVE, Joined.class, this::joined)
            .on(ONLINE, Joined.class, this::joined)
            .on(ONLINE, Left.class, this::left)
            .on(ONLINE, Disconnect.class, (ctx, e) -> Transition.to(HEARTBEAT_STOPPED, ctx.withoutFailure(),
                e.offline() ? null : leave(ctx.channels(), ctx.groups())))
            .on(ONLINE, LeftAll.class, (ctx, e) -> Transition.to(HEARTBEAT_INACTIVE, PresenceContext.empty(),
                e.offline() ? null : leave(ctx.channels(), ctx.groups())))

            .on(HEARTBEATING, HeartbeatSuccess.class, this::heartbeatSucceeded)
            .on(HEARTBEATING, HeartbeatFailure.class, this::heartbeatFailed)
            .on(EnumSet.of(HEARTBEATING, HEARTBEAT_COOLDOWN), TimesUp.class, (ctx, e) -> heartbeat(ctx))

            .on(HEARTBEAT_STOPPED, Joined.class, (ctx, e) -> Transition.to(HEARTBEAT_STOPPED, PresenceContext.of(
                ctx.channels().union(e.channels().withoutPresence()),
                ctx.groups().union(e.groups().withoutPresence()))))
            .on(HEARTBEAT_STOPPED, Left.class, (ctx, e) -> {
                PresenceContext next = PresenceContext.of(
                    ctx.channels().difference(e.channels()), ctx.groups().difference(e.groups()));
                return Transition.to(next.isEmpty() ? HEARTBEAT_INACTIVE : HEARTBEAT_STOPPED, next);
            })
            .on(HEARTBEAT_STOPPED, LeftAll.class, (ctx, e) -> Transition.to(HEARTBEAT_INACTIVE, PresenceContext.empty()))
            .on(EnumSet.of(HEARTBEAT_FAILED, HEARTBEAT_STOPPED), Reconnect.class, (ctx, e) -> ctx.isEmpty()
                ? Transition.to(HEARTBEAT_INACTIVE, PresenceContext.empty())
                : heartbeat(ctx.withoutFailure()))

            .onExit(HEARTBEATING, EffectChannel.HEARTBEAT)
            .onExit(HEARTBEAT_COOLDOWN, EffectChannel.HEARTBEAT);

        return builder.build();
    }

    private Transition<PresenceState, PresenceContext> joined(PresenceContext ctx, Joined event) {
        PresenceContext next = PresenceContext.of(
            ctx.channels().union(event.channels().withoutPresence()),
            ctx.groups().union(event.groups().withoutPresence()));
        if (next.isEmpty()) {
            return Transition.to(HEARTBEAT_INACTIVE, PresenceContext.empty());
        }
        return heartbeat(next);
    }

    private Transition<PresenceState, PresenceContext> left(PresenceContext ctx, Left event) {
        ChannelSet removedChannels = ctx.channels().intersection(event.channels());
        GroupSet removedGroups = ctx.groups().intersection(event.groups());
        Effect leave = removedChannels.isEmpty() && removedGroups.isEmpty()
            ? null
            : leave(removedChannels, removedGroups);

        PresenceContext next = PresenceContext.of(
            ctx.channels().difference(event.channels()), ctx.groups().difference(event.groups()));
        if (next.isEmpty()) {
            return Transition.to(HEARTBEAT_INACTIVE, PresenceContext.empty(), leave);
        }
        return Transition.to(HEARTBEATING, next, leave, new Effect.Heartbeat(next.channels(), next.groups()));
    }

    private Transition<PresenceState, PresenceContext> heartbeatSucceeded(PresenceContext ctx, HeartbeatSuccess event) {
        PresenceContext next = ctx.withoutFailure();
        return Transition.to(HEARTBEAT_COOLDOWN, next,
            settings.announceSuccessfulHeartbeats()
                ? new Effect.EmitStatus(Status.heartbeat(StatusCategory.HEARTBEAT_SUCCEEDED, next.channels(), next.groups(), null))
                : null,
            new Effect.Wait(EffectChannel.HEARTBEAT, settings.heartbeatIntervalMs()));
    }

    private Transition<PresenceState, PresenceContext> heartbeatFailed(PresenceContext ctx, HeartbeatFailure event) {
        int attempt = ctx.attempts() + 1;
        RetryDecision decision = settings.retryPolicy().shouldRetry(attempt, Endpoint.PRESENCE, event.reason());
        PresenceContext next = ctx.withFailure(attempt, event.reason());
        if (decision.retry()) {
            return Transition.to(HEARTBEATING, next, new Effect.Wait(EffectChannel.HEARTBEAT, decision.delayMs()));
        }
        return Transition.to(HEARTBEAT_FAILED, next,
            settings.announceFailedHeartbeats()
                ? new Effect.EmitStatus(Status.heartbeat(StatusCategory.HEARTBEAT_FAILED, next.channels(), next.groups(), event.reason()))
                : null);
    }

    private static Transition<PresenceState, PresenceContext> heartbeat(PresenceContext ctx) {
        return Transition.to(HEARTBEATING, ctx, new Effect.Heartbeat(ctx.channels(), ctx.groups()));
    }

    private Effect leave(ChannelSet channels, GroupSet groups) {
        if (settings.suppressLeaveEvents()) {
            return null;
        }
        return new Effect.Leave(channels, groups);
    }
}
