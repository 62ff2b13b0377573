package com.ryuqq.pubsub.application.presence;

import com.ryuqq.pubsub.core.retry.RetryPolicy;

/**
 * Presence Event Engine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retryPolicy: 하트비트 실패 재시도 정책</li>
 *   <li>heartbeatIntervalMs: 성공 후 다음 하트비트까지 대기 시간 (양수)</li>
 *   <li>suppressLeaveEvents: true면 leave 요청을 보내지 않음 (기본 false)</li>
 *   <li>announceSuccessfulHeartbeats: 성공 상태 알림 여부 (기본 false)</li>
 *   <li>announceFailedHeartbeats: 실패 상태 알림 여부 (기본 true)</li>
 * </ul>
 *
 * @param retryPolicy 하트비트 재시도 정책
 * @param heartbeatIntervalMs 하트비트 간격 (밀리초)
 * @param suppressLeaveEvents leave 요청 억제 여부
 * @param announceSuccessfulHeartbeats 성공 상태 알림 여부
 * @param announceFailedHeartbeats 실패 상태 알림 여부
 * @author PubSub Team
 * @since 1.0.0
 */
public record PresenceSettings(
    RetryPolicy retryPolicy,
    long heartbeatIntervalMs,
    boolean suppressLeaveEvents,
    boolean announceSuccessfulHeartbeats,
    boolean announceFailedHeartbeats
) {

    public PresenceSettings {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (heartbeatIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "heartbeatIntervalMs must be positive (current: " + heartbeatIntervalMs + ")"
            );
        }
    }

    /**
     * 기본 설정: presenceTimeout 300초 기준 간격 149초, 실패만 알림.
     *
     * @param retryPolicy 재시도 정책
     * @return 기본 설정
     */
    public static PresenceSettings defaults(RetryPolicy retryPolicy) {
        return new PresenceSettings(retryPolicy, 149_000, false, false, true);
    }

    public PresenceSettings withHeartbeatIntervalMs(long heartbeatIntervalMs) {
        return new PresenceSettings(retryPolicy, heartbeatIntervalMs, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats);
    }

    public PresenceSettings withSuppressLeaveEvents(boolean suppressLeaveEvents) {
        return new PresenceSettings(retryPolicy, heartbeatIntervalMs, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats);
    }

    public PresenceSettings withAnnounceSuccessfulHeartbeats(boolean announceSuccessfulHeartbeats) {
        return new PresenceSettings(retryPolicy, heartbeatIntervalMs, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats);
    }

    public PresenceSettings withAnnounceFailedHeartbeats(boolean announceFailedHeartbeats) {
        return new PresenceSettings(retryPolicy, heartbeatIntervalMs, suppressLeaveEvents,
            announceSuccessfulHeartbeats, announceFailedHeartbeats);
    }
}
