package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.application.presence.PresenceSettings;
import com.ryuqq.pubsub.application.subscribe.ChannelMergePolicy;
import com.ryuqq.pubsub.application.subscribe.SubscriptionSettings;
import com.ryuqq.pubsub.core.dedup.DedupCache;
import com.ryuqq.pubsub.core.exception.ConfigurationException;
import com.ryuqq.pubsub.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 실시간 클라이언트 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>userId: 이 클라이언트의 식별자 (필수)</li>
 *   <li>dedupOnSubscribe: 수신 메시지 중복 제거 여부 (기본 false)</li>
 *   <li>maximumCacheSize: 중복 제거 캐시 크기 (기본 100)</li>
 *   <li>requestMessageCountThreshold: 한 응답의 메시지 수가 이 값 이상이면 REQUEST_MESSAGE_COUNT_EXCEEDED 알림 (기본 100, 0이면 비활성)</li>
 *   <li>presenceTimeoutSeconds: 서버가 클라이언트를 offline으로 보는 시간 (기본 300초, 320초 초과는 320초로 보정)</li>
 *   <li>heartbeatIntervalSeconds: 하트비트 간격 (기본 presenceTimeout / 2 - 1, 0이면 프레즌스 비활성)</li>
 *   <li>suppressLeaveEvents: leave 요청 억제 (기본 false)</li>
 *   <li>announceSuccessfulHeartbeats: 하트비트 성공 알림 (기본 false)</li>
 *   <li>announceFailedHeartbeats: 하트비트 실패 알림 (기본 true)</li>
 *   <li>managePresenceList: subscribe/unsubscribe 시 프레즌스 join/leave 자동 수행 (기본 true)</li>
 *   <li>maintainPresenceState: 설정한 프레즌스 상태를 heartbeat마다 함께 전송 (기본 true)</li>
 *   <li>channelMergePolicy: 수신 중 구독 변경 처리 방식 (기본 RESUME_FROM_CURSOR)</li>
 *   <li>retryPolicy: 구독/하트비트 재시도 정책 (기본 지수 백오프 2초 ~ 150초, 6회)</li>
 *   <li>filterExpression: 서버 측 메시지 필터 (기본 없음)</li>
 * </ul>
 *
 * @author PubSub Team
 * @since 1.0.0
 * @param userId 클라이언트 식별자
 * @param dedupOnSubscribe 중복 제거 여부
 * @param maximumCacheSize 중복 제거 캐시 크기 (0 이상)
 * @param requestMessageCountThreshold 메시지 수 알림 임계값 (0 이상, 0이면 비활성)
 * @param presenceTimeoutSeconds 프레즌스 타임아웃 (초)
 * @param heartbeatIntervalSeconds 하트비트 간격 (초, 0이면 비활성)
 * @param suppressLeaveEvents leave 요청 억제 여부
 * @param announceSuccessfulHeartbeats 하트비트 성공 알림 여부
 * @param announceFailedHeartbeats 하트비트 실패 알림 여부
 * @param managePresenceList 구독과 프레즌스 연동 여부
 * @param maintainPresenceState 프레즌스 상태 유지 여부
 * @param channelMergePolicy 구독 변경 처리 방식
 * @param retryPolicy 재시도 정책
 * @param filterExpression 메시지 필터 (nullable)
 */
public record RealtimeConfig(
    String userId,
    boolean dedupOnSubscribe,
    int maximumCacheSize,
    int requestMessageCountThreshold,
    int presenceTimeoutSeconds,
    int heartbeatIntervalSeconds,
    boolean suppressLeaveEvents,
    boolean announceSuccessfulHeartbeats,
    boolean announceFailedHeartbeats,
    boolean managePresenceList,
    boolean maintainPresenceState,
    ChannelMergePolicy channelMergePolicy,
    RetryPolicy retryPolicy,
    String filterExpression
) {

    private static final Logger log = LoggerFactory.getLogger(RealtimeConfig.class);

    public static final int DEFAULT_PRESENCE_TIMEOUT_SECONDS = 300;
    public static final int MAXIMUM_PRESENCE_TIMEOUT_SECONDS = 320;

    /**
     * 기본 설정 생성자.
     *
     * @param userId 클라이언트 식별자
     */
    public RealtimeConfig(String userId) {
        this(userId, false, DedupCache.DEFAULT_MAXIMUM_CACHE_SIZE,
            SubscriptionSettings.DEFAULT_REQUEST_MESSAGE_COUNT_THRESHOLD,
            DEFAULT_PRESENCE_TIMEOUT_SECONDS, intervalFor(DEFAULT_PRESENCE_TIMEOUT_SECONDS),
            false, false, true, true, true,
            ChannelMergePolicy.RESUME_FROM_CURSOR, SubscriptionSettings.DEFAULT_RETRY_POLICY, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException 파라미터 검증 실패 시
     */
    public RealtimeConfig {
        if (userId == null || userId.isBlank()) {
            throw new ConfigurationException("userId cannot be null or blank");
        }
        if (maximumCacheSize < 0) {
            throw new ConfigurationException(
                "maximumCacheSize must be non-negative (current: " + maximumCacheSize + ")"
            );
        }
        if (requestMessageCountThreshold < 0) {
            throw new ConfigurationException(
                "requestMessageCountThreshold must be non-negative (current: " + requestMessageCountThreshold + ")"
            );
        }
        presenceTimeoutSeconds = normalizePresenceTimeout(presenceTimeoutSeconds);
        if (heartbeatIntervalSeconds < 0 || heartbeatIntervalSeconds >= presenceTimeoutSeconds) {
            throw new ConfigurationException(
                "heartbeatIntervalSeconds must be between 0 and presenceTimeoutSeconds (current: "
                    + heartbeatIntervalSeconds + ", presenceTimeout: " + presenceTimeoutSeconds + ")"
            );
        }
        if (channelMergePolicy == null) {
            throw new ConfigurationException("channelMergePolicy cannot be null");
        }
        if (retryPolicy == null) {
            throw new ConfigurationException("retryPolicy cannot be null");
        }
        if (filterExpression != null && filterExpression.isBlank()) {
            filterExpression = null;
        }
    }

    /**
     * presenceTimeout 범위 보정.
     *
     * <p>0 이하는 기본값, 최대값 초과는 최대값으로 바꾸고 경고를 남깁니다.</p>
     */
    static int normalizePresenceTimeout(int presenceTimeoutSeconds) {
        if (presenceTimeoutSeconds <= 0) {
            log.warn("presenceTimeoutSeconds should be larger than zero (current: {}), using {}",
                presenceTimeoutSeconds, DEFAULT_PRESENCE_TIMEOUT_SECONDS);
            return DEFAULT_PRESENCE_TIMEOUT_SECONDS;
        }
        if (presenceTimeoutSeconds > MAXIMUM_PRESENCE_TIMEOUT_SECONDS) {
            log.warn("presenceTimeoutSeconds is above the maximum (current: {}), using {}",
                presenceTimeoutSeconds, MAXIMUM_PRESENCE_TIMEOUT_SECONDS);
            return MAXIMUM_PRESENCE_TIMEOUT_SECONDS;
        }
        return presenceTimeoutSeconds;
    }

    /**
     * presenceTimeout 기준 기본 하트비트 간격. 2초 이하 타임아웃은 0(프레즌스 비활성).
     */
    static int intervalFor(int presenceTimeoutSeconds) {
        return Math.max(0, presenceTimeoutSeconds / 2 - 1);
    }

    public boolean isPresenceEnabled() {
        return heartbeatIntervalSeconds > 0;
    }

    public SubscriptionSettings subscriptionSettings() {
        return new SubscriptionSettings(retryPolicy, channelMergePolicy, requestMessageCountThreshold);
    }

    /**
     * 프레즌스 엔진 설정.
     *
     * @return 설정
     * @throws IllegalStateException 프레즌스가 비활성화된 경우
     */
    public PresenceSettings presenceSettings() {
        if (!isPresenceEnabled()) {
            throw new IllegalStateException("Presence is disabled (heartbeatIntervalSeconds = 0)");
        }
        return new PresenceSettings(retryPolicy, heartbeatIntervalSeconds * 1000L, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats);
    }

    public DedupCache newDedupCache() {
        return dedupOnSubscribe ? new DedupCache(maximumCacheSize) : DedupCache.disabled();
    }

    public RealtimeConfig withUserId(String userId) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withDedupOnSubscribe(boolean dedupOnSubscribe) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withMaximumCacheSize(int maximumCacheSize) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withRequestMessageCountThreshold(int requestMessageCountThreshold) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    /**
     * presenceTimeoutSeconds 변경 (하트비트 간격도 presenceTimeout / 2 - 1로 재계산).
     *
     * <p>범위를 벗어난 값은 경고 로그와 함께 보정됩니다.</p>
     */
    public RealtimeConfig withPresenceTimeoutSeconds(int presenceTimeoutSeconds) {
        int effective = normalizePresenceTimeout(presenceTimeoutSeconds);
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            effective, intervalFor(effective), suppressLeaveEvents, announceSuccessfulHeartbeats,
            announceFailedHeartbeats, managePresenceList, maintainPresenceState, channelMergePolicy,
            retryPolicy, filterExpression);
    }

    public RealtimeConfig withHeartbeatIntervalSeconds(int heartbeatIntervalSeconds) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withSuppressLeaveEvents(boolean suppressLeaveEvents) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withAnnounceSuccessfulHeartbeats(boolean announceSuccessfulHeartbeats) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withAnnounceFailedHeartbeats(boolean announceFailedHeartbeats) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withManagePresenceList(boolean managePresenceList) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withMaintainPresenceState(boolean maintainPresenceState) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withChannelMergePolicy(ChannelMergePolicy channelMergePolicy) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }

    public RealtimeConfig withFilterExpression(String filterExpression) {
        return new RealtimeConfig(userId, dedupOnSubscribe, maximumCacheSize, requestMessageCountThreshold,
            presenceTimeoutSeconds, heartbeatIntervalSeconds, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats, managePresenceList, maintainPresenceState,
            channelMergePolicy, retryPolicy, filterExpression);
    }
}
