package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.application.subscribe.SubscriptionEvent;
import com.ryuqq.pubsub.core.dedup.DedupCache;
import com.ryuqq.pubsub.core.effect.Effect;
import com.ryuqq.pubsub.core.effect.EffectHandler;
import com.ryuqq.pubsub.core.exception.TransportException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.model.Message;
import com.ryuqq.pubsub.core.spi.CryptoModule;
import com.ryuqq.pubsub.core.spi.Transport;
import com.ryuqq.pubsub.core.spi.TransportRequest;
import com.ryuqq.pubsub.core.spi.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Subscription Event Engine 이펙트 실행기.
 *
 * <p><strong>이펙트별 처리:</strong></p>
 * <ul>
 *   <li>Handshake / HandshakeReconnect → handshake 요청 → HandshakeSuccess / HandshakeFailure</li>
 *   <li>ReceiveMessages / ReceiveReconnect → receive long-poll → ReceiveSuccess / ReceiveFailure</li>
 *   <li>Wait → 타이머 → Retry</li>
 *   <li>EmitStatus → 리스너 알림 (레인에서 즉시)</li>
 *   <li>EmitMessages → 복호화 → 중복 제거 → 리스너 알림 (레인에서 즉시)</li>
 * </ul>
 *
 * <p>요청과 타이머는 취소 가능한 abort hook을 반환합니다. 취소된 요청의 결과는
 * 엔진이 버리므로 이 클래스는 취소 여부를 확인하지 않습니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class SubscribeEffectHandler implements EffectHandler<SubscriptionEvent> {

    private static final Logger log = LoggerFactory.getLogger(SubscribeEffectHandler.class);

    private final Transport transport;
    private final ScheduledExecutorService timer;
    private final CryptoModule crypto;
    private final DedupCache dedupCache;
    private final ListenerRegistry listeners;
    private final RealtimeConfig config;

    /**
     * 생성자.
     *
     * @param transport 요청 전송
     * @param timer 재시도 타이머
     * @param crypto 메시지 복호화
     * @param dedupCache 중복 제거 캐시 (레인에서만 접근)
     * @param listeners 알림 대상
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SubscribeEffectHandler(Transport transport, ScheduledExecutorService timer, CryptoModule crypto,
                                  DedupCache dedupCache, ListenerRegistry listeners, RealtimeConfig config) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        if (crypto == null) {
            throw new IllegalArgumentException("crypto cannot be null");
        }
        if (dedupCache == null) {
            throw new IllegalArgumentException("dedupCache cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.transport = transport;
        this.timer = timer;
        this.crypto = crypto;
        this.dedupCache = dedupCache;
        this.listeners = listeners;
        this.config = config;
    }

    @Override
    public Runnable handle(Effect effect, Consumer<SubscriptionEvent> completion) {
        if (effect instanceof Effect.Handshake handshake) {
            return handshake(handshake.channels(), handshake.groups(), completion);
        }
        if (effect instanceof Effect.HandshakeReconnect reconnect) {
            log.debug("Handshake reconnect attempt {}", reconnect.attempt());
            return handshake(reconnect.channels(), reconnect.groups(), completion);
        }
        if (effect instanceof Effect.ReceiveMessages receive) {
            return receive(receive.channels(), receive.groups(), receive.cursor(), completion);
        }
        if (effect instanceof Effect.ReceiveReconnect reconnect) {
            log.debug("Receive reconnect attempt {} from {}", reconnect.attempt(), reconnect.cursor());
            return receive(reconnect.channels(), reconnect.groups(), reconnect.cursor(), completion);
        }
        if (effect instanceof Effect.Wait wait) {
            ScheduledFuture<?> fire = timer.schedule(
                () -> completion.accept(new SubscriptionEvent.Retry()), wait.delayMs(), TimeUnit.MILLISECONDS);
            return () -> fire.cancel(false);
        }
        if (effect instanceof Effect.EmitStatus emit) {
            listeners.announce(emit.status());
            return NO_ABORT;
        }
        if (effect instanceof Effect.EmitMessages emit) {
            emitMessages(emit.messages());
            return NO_ABORT;
        }
        log.warn("Unsupported subscribe effect: {}", effect);
        return NO_ABORT;
    }

    private Runnable handshake(ChannelSet channels, GroupSet groups, Consumer<SubscriptionEvent> completion) {
        return TransportCalls.whenDone(
            () -> transport.execute(TransportRequest.handshake(
                channels, groups, config.filterExpression(), config.userId())),
            response -> {
                if (response.cursor() == null) {
                    completion.accept(new SubscriptionEvent.HandshakeFailure(
                        new TransportException("Handshake response has no cursor", null)));
                    return;
                }
                completion.accept(new SubscriptionEvent.HandshakeSuccess(response.cursor()));
            },
            error -> completion.accept(new SubscriptionEvent.HandshakeFailure(error))
        );
    }

    private Runnable receive(ChannelSet channels, GroupSet groups, Cursor cursor,
                             Consumer<SubscriptionEvent> completion) {
        return TransportCalls.whenDone(
            () -> transport.execute(TransportRequest.receive(
                channels, groups, cursor, config.filterExpression(), config.userId())),
            response -> completion.accept(new SubscriptionEvent.ReceiveSuccess(
                response.cursor() == null ? cursor : response.cursor(), response.messages())),
            error -> completion.accept(new SubscriptionEvent.ReceiveFailure(error))
        );
    }

    private void emitMessages(List<Message> messages) {
        List<Message> decrypted = new ArrayList<>(messages.size());
        for (Message message : messages) {
            decrypted.add(decrypt(message));
        }
        List<Message> deliverable = dedupCache.filter(decrypted);
        if (deliverable.size() < decrypted.size()) {
            log.debug("Dropped {} duplicate messages", decrypted.size() - deliverable.size());
        }
        for (Message message : deliverable) {
            listeners.announce(message);
        }
    }

    private Message decrypt(Message message) {
        try {
            return message.withPayload(crypto.decrypt(message.payload()));
        } catch (RuntimeException e) {
            log.warn("Failed to decrypt message {} on {}, delivering raw payload", message.timetoken(), message.channel(), e);
            return message;
        }
    }
}
