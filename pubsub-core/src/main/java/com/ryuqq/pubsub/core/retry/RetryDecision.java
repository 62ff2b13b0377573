package com.ryuqq.pubsub.core.retry;

/**
 * 재시도 정책 판단 결과.
 *
 * @param retry 재시도 여부
 * @param delayMs 재시도 전 대기 시간 (밀리초, retry=false이면 0)
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record RetryDecision(boolean retry, long delayMs) {

    private static final RetryDecision GIVE_UP = new RetryDecision(false, 0);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public RetryDecision {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
        if (!retry && delayMs != 0) {
            throw new IllegalArgumentException("delayMs must be 0 when retry is false (current: " + delayMs + ")");
        }
    }

    public static RetryDecision retryAfter(long delayMs) {
        return new RetryDecision(true, delayMs);
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }
}
