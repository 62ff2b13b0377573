package com.ryuqq.pubsub.core.retry;

import java.util.Set;

/**
 * 고정 간격 재시도 정책.
 *
 * <p>매 재시도마다 같은 시간({@code delayMs})을 기다리며, {@code maxRetry}번까지 재시도합니다.</p>
 *
 * @param delayMs 재시도 간격 (밀리초, 양수여야 함)
 * @param maxRetry 최대 재시도 횟수 (1 이상이어야 함)
 * @param excluded 재시도하지 않을 엔드포인트
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record LinearRetryPolicy(long delayMs, int maxRetry, Set<Endpoint> excluded) implements RetryPolicy {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LinearRetryPolicy {
        if (delayMs <= 0) {
            throw new IllegalArgumentException(
                "delayMs must be positive (current: " + delayMs + ")"
            );
        }
        if (maxRetry <= 0) {
            throw new IllegalArgumentException(
                "maxRetry must be positive (current: " + maxRetry + ")"
            );
        }
        excluded = excluded == null ? Set.of() : Set.copyOf(excluded);
    }

    @Override
    public RetryDecision shouldRetry(int attempt, Endpoint endpoint) {
        RetryPolicy.checkArguments(attempt, endpoint);
        if (attempt > maxRetry || excluded.contains(endpoint)) {
            return RetryDecision.giveUp();
        }
        return RetryDecision.retryAfter(delayMs);
    }
}
