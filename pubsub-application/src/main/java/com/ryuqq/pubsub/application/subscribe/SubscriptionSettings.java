package com.ryuqq.pubsub.application.subscribe;

import com.ryuqq.pubsub.core.retry.RetryPolicy;

/**
 * Subscription Event Engine 설정 (불변 record).
 *
 * @param retryPolicy 핸드셰이크/수신 실패 재시도 정책
 * @param mergePolicy 수신 중 구독 변경 처리 방식
 * @param requestMessageCountThreshold 한 응답의 메시지 수가 이 값 이상이면
 *                                     REQUEST_MESSAGE_COUNT_EXCEEDED 알림 (0이면 알리지 않음)
 * @author PubSub Team
 * @since 1.0.0
 */
public record SubscriptionSettings(
    RetryPolicy retryPolicy,
    ChannelMergePolicy mergePolicy,
    int requestMessageCountThreshold
) {

    /**
     * 기본 재시도 정책: 지수 백오프 2초 ~ 150초, 최대 6회.
     */
    public static final RetryPolicy DEFAULT_RETRY_POLICY = RetryPolicy.exponential(2_000, 150_000, 6);

    public static final int DEFAULT_REQUEST_MESSAGE_COUNT_THRESHOLD = 100;

    public SubscriptionSettings {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (mergePolicy == null) {
            throw new IllegalArgumentException("mergePolicy cannot be null");
        }
        if (requestMessageCountThreshold < 0) {
            throw new IllegalArgumentException(
                "requestMessageCountThreshold must be non-negative (current: " + requestMessageCountThreshold + ")"
            );
        }
    }

    public static SubscriptionSettings defaults() {
        return new SubscriptionSettings(DEFAULT_RETRY_POLICY, ChannelMergePolicy.RESUME_FROM_CURSOR,
            DEFAULT_REQUEST_MESSAGE_COUNT_THRESHOLD);
    }

    public SubscriptionSettings withRetryPolicy(RetryPolicy retryPolicy) {
        return new SubscriptionSettings(retryPolicy, mergePolicy, requestMessageCountThreshold);
    }

    public SubscriptionSettings withMergePolicy(ChannelMergePolicy mergePolicy) {
        return new SubscriptionSettings(retryPolicy, mergePolicy, requestMessageCountThreshold);
    }

    public SubscriptionSettings withRequestMessageCountThreshold(int requestMessageCountThreshold) {
        return new SubscriptionSettings(retryPolicy, mergePolicy, requestMessageCountThreshold);
    }

    /**
     * 메시지 수 초과 알림 여부.
     *
     * @param messageCount 한 응답에 담긴 메시지 수
     * @return 임계값이 설정되어 있고 메시지 수가 그 이상이면 true
     */
    public boolean exceedsMessageCountThreshold(int messageCount) {
        return requestMessageCountThreshold > 0 && messageCount >= requestMessageCountThreshold;
    }
}
