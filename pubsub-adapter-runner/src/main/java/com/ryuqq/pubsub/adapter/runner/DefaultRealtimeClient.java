package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.application.client.RealtimeClient;
import com.ryuqq.pubsub.application.client.RealtimeListener;
import com.ryuqq.pubsub.application.presence.PresenceContext;
import com.ryuqq.pubsub.application.presence.PresenceEvent;
import com.ryuqq.pubsub.application.presence.PresenceState;
import com.ryuqq.pubsub.application.presence.PresenceTransitions;
import com.ryuqq.pubsub.application.subscribe.SubscriptionContext;
import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent;
import com.ryuqq.pubsub.application.subscribe.SubscriptionState;
import com.ryuqq.pubsub.application.subscribe.SubscriptionTransitions;
import com.ryuqq.pubsub.core.engine.EventEngine;
import com.ryuqq.pubsub.core.engine.Snapshot;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.spi.CryptoModule;
import com.ryuqq.pubsub.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * {@link RealtimeClient} 기본 구현체.
 *
 * <p>Subscription Event Engine과 Presence Event Engine을 하나씩 소유하고,
 * 사용자 호출을 각 엔진의 이벤트로 변환합니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>엔진마다 전용 단일 스레드 레인 (엔진 간 순서는 보장하지 않음)</li>
 *   <li>재시도/쿨다운 타이머 공용 ScheduledExecutorService</li>
 *   <li>구독 집합은 이 클래스가 보관하고, 엔진에는 항상 전체 집합을 전달</li>
 *   <li>managePresenceList가 켜져 있고 프레즌스가 활성화된 경우 subscribe/unsubscribe가 join/leave를 함께 수행</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RealtimeClient client = new DefaultRealtimeClient(transport, new RealtimeConfig("user-1"));
 * client.addListener(listener);
 * client.subscribe(ChannelSet.of("room1"), GroupSet.empty());
 * ...
 * client.shutdown();
 * </pre>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class DefaultRealtimeClient implements RealtimeClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultRealtimeClient.class);

    private final RealtimeConfig config;
    private final ListenerRegistry listeners = new ListenerRegistry();
    private final PresenceStateStore presenceStates = new PresenceStateStore();
    private final EventEngine<SubscriptionState, SubscriptionEvent, SubscriptionContext> subscription;
    private final EventEngine<PresenceState, PresenceEvent, PresenceContext> presence;
    private final List<ExecutorService> ownedExecutors = new ArrayList<>();

    private final Object intentLock = new Object();
    private ChannelSet channels = ChannelSet.empty();
    private GroupSet groups = GroupSet.empty();

    /**
     * 생성자 (전용 레인과 타이머 생성, 복호화 없음).
     *
     * @param transport 요청 전송
     * @param config 설정
     */
    public DefaultRealtimeClient(Transport transport, RealtimeConfig config) {
        this(transport, CryptoModule.NONE, config);
    }

    /**
     * 생성자 (전용 레인과 타이머 생성).
     *
     * @param transport 요청 전송
     * @param crypto 메시지 복호화
     * @param config 설정
     */
    public DefaultRealtimeClient(Transport transport, CryptoModule crypto, RealtimeConfig config) {
        this(transport, crypto, config,
            Executors.newSingleThreadExecutor(daemon("pubsub-subscribe")),
            Executors.newSingleThreadExecutor(daemon("pubsub-presence")),
            Executors.newSingleThreadScheduledExecutor(daemon("pubsub-timer")),
            true);
    }

    /**
     * 생성자 (레인과 타이머 주입, 종료는 호출자 책임).
     *
     * @param transport 요청 전송
     * @param crypto 메시지 복호화
     * @param config 설정
     * @param subscribeLane 구독 엔진 레인
     * @param presenceLane 프레즌스 엔진 레인
     * @param timer 타이머
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultRealtimeClient(Transport transport, CryptoModule crypto, RealtimeConfig config,
                                 Executor subscribeLane, Executor presenceLane, ScheduledExecutorService timer) {
        this(transport, crypto, config, subscribeLane, presenceLane, timer, false);
    }

    private DefaultRealtimeClient(Transport transport, CryptoModule crypto, RealtimeConfig config,
                                  Executor subscribeLane, Executor presenceLane, ScheduledExecutorService timer,
                                  boolean ownsExecutors) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (crypto == null) {
            throw new IllegalArgumentException("crypto cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (subscribeLane == null || presenceLane == null || timer == null) {
            throw new IllegalArgumentException("lanes and timer cannot be null");
        }
        this.config = config;

        this.subscription = new SubscriptionTransitions(config.subscriptionSettings()).newEngine(
            new SubscribeEffectHandler(transport, timer, crypto, config.newDedupCache(), listeners, config),
            subscribeLane);

        PresenceTransitions presenceTransitions = config.isPresenceEnabled()
            ? new PresenceTransitions(config.presenceSettings())
            : null;
        this.presence = presenceTransitions == null
            ? null
            : presenceTransitions.newEngine(new PresenceEffectHandler(transport, timer, listeners, presenceStates, config), presenceLane);

        if (ownsExecutors) {
            ownedExecutors.add((ExecutorService) subscribeLane);
            ownedExecutors.add((ExecutorService) presenceLane);
            ownedExecutors.add(timer);
        }
        log.info("Realtime client started for {} (presence: {})", config.userId(),
            config.isPresenceEnabled() ? config.heartbeatIntervalSeconds() + "s" : "disabled");
    }

    @Override
    public void subscribe(ChannelSet channels, GroupSet groups) {
        ChannelSet addedChannels = orEmpty(channels);
        GroupSet addedGroups = orEmpty(groups);
        synchronized (intentLock) {
            this.channels = this.channels.union(addedChannels);
            this.groups = this.groups.union(addedGroups);
            subscription.send(new SubscriptionEvent.SubscriptionChange(this.channels, this.groups));
        }
        if (config.managePresenceList()) {
            sendPresence(new PresenceEvent.Joined(addedChannels, addedGroups));
        }
    }

    @Override
    public void subscribe(ChannelSet channels, GroupSet groups, Cursor cursor) {
        if (cursor == null) {
            subscribe(channels, groups);
            return;
        }
        ChannelSet addedChannels = orEmpty(channels);
        GroupSet addedGroups = orEmpty(groups);
        synchronized (intentLock) {
            this.channels = this.channels.union(addedChannels);
            this.groups = this.groups.union(addedGroups);
            subscription.send(new SubscriptionEvent.Restore(this.channels, this.groups, cursor));
        }
        if (config.managePresenceList()) {
            sendPresence(new PresenceEvent.Joined(addedChannels, addedGroups));
        }
    }

    @Override
    public void unsubscribe(ChannelSet channels, GroupSet groups) {
        ChannelSet removedChannels = orEmpty(channels);
        GroupSet removedGroups = orEmpty(groups);
        synchronized (intentLock) {
            this.channels = this.channels.difference(removedChannels);
            this.groups = this.groups.difference(removedGroups);
            subscription.send(new SubscriptionEvent.SubscriptionChange(this.channels, this.groups));
        }
        if (config.managePresenceList()) {
            presenceStates.remove(removedChannels);
            sendPresence(new PresenceEvent.Left(removedChannels, removedGroups));
        }
    }

    @Override
    public void unsubscribeAll() {
        synchronized (intentLock) {
            this.channels = ChannelSet.empty();
            this.groups = GroupSet.empty();
            subscription.send(new SubscriptionEvent.SubscriptionChange(this.channels, this.groups));
        }
        if (config.managePresenceList()) {
            presenceStates.clear();
            sendPresence(new PresenceEvent.LeftAll(false));
        }
    }

    @Override
    public void reconnect() {
        reconnect(null);
    }

    @Override
    public void reconnect(Cursor cursor) {
        subscription.send(new SubscriptionEvent.Reconnect(cursor));
        sendPresence(new PresenceEvent.Reconnect());
    }

    @Override
    public void disconnect() {
        disconnect(false);
    }

    @Override
    public void disconnect(boolean offline) {
        subscription.send(new SubscriptionEvent.Disconnect());
        sendPresence(new PresenceEvent.Disconnect(offline));
    }

    @Override
    public void join(ChannelSet channels, GroupSet groups) {
        sendPresence(new PresenceEvent.Joined(orEmpty(channels), orEmpty(groups)));
    }

    @Override
    public void leave(ChannelSet channels, GroupSet groups) {
        ChannelSet removedChannels = orEmpty(channels);
        presenceStates.remove(removedChannels);
        sendPresence(new PresenceEvent.Left(removedChannels, orEmpty(groups)));
    }

    @Override
    public void leaveAll() {
        leaveAll(false);
    }

    @Override
    public void leaveAll(boolean offline) {
        presenceStates.clear();
        sendPresence(new PresenceEvent.LeftAll(offline));
    }

    @Override
    public void setPresenceState(ChannelSet channels, String state) {
        if (!config.maintainPresenceState()) {
            log.warn("maintainPresenceState is disabled, presence state for {} is not kept", channels);
            return;
        }
        presenceStates.put(orEmpty(channels), state);
    }

    @Override
    public void addListener(RealtimeListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(RealtimeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public Snapshot<SubscriptionState, SubscriptionContext> subscriptionState() {
        return subscription.currentState();
    }

    @Override
    public Snapshot<PresenceState, PresenceContext> presenceState() {
        if (presence == null) {
            return new Snapshot<>(PresenceState.HEARTBEAT_INACTIVE, PresenceContext.empty());
        }
        return presence.currentState();
    }

    /**
     * 클라이언트 종료.
     *
     * <p>두 엔진을 중지하여 진행 중인 요청과 타이머를 취소하고, 이 클래스가 생성한
     * executor를 종료합니다. leave 요청은 보내지 않으므로 필요하면 먼저
     * {@link #unsubscribeAll()}을 호출해야 합니다.</p>
     */
    @Override
    public void shutdown() {
        subscription.stop();
        if (presence != null) {
            presence.stop();
        }
        for (ExecutorService executor : ownedExecutors) {
            executor.shutdown();
        }
        for (ExecutorService executor : ownedExecutors) {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
        log.info("Realtime client for {} shut down", config.userId());
    }

    private void sendPresence(PresenceEvent event) {
        if (presence == null) {
            log.debug("Presence disabled, ignoring {}", event);
            return;
        }
        presence.send(event);
    }

    private static ChannelSet orEmpty(ChannelSet channels) {
        return channels == null ? ChannelSet.empty() : channels;
    }

    private static GroupSet orEmpty(GroupSet groups) {
        return groups == null ? GroupSet.empty() : groups;
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
