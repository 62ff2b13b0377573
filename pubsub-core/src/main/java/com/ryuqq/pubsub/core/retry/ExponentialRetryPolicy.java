package com.ryuqq.pubsub.core.retry;

import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 재시도 정책.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 많은 클라이언트가 동시에 재연결하는 Thundering Herd Problem을 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * base  = min(minDelay * 2^(attempt-1), maxDelay)
 * delay = min(base + jitter, maxDelay)
 * jitter = random(0, base * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (minDelay=2000ms, maxDelay=150000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 2000ms + jitter(0-200ms)</li>
 *   <li>attempt=2: 4000ms + jitter(0-400ms)</li>
 *   <li>attempt=3: 8000ms + jitter(0-800ms)</li>
 *   <li>attempt=8: 256000ms → maxDelay 150000ms로 제한</li>
 * </ul>
 *
 * <p>jitterFactor가 1.0 이하이면 다음 attempt의 최소값(2 * base)이 이전 attempt의 최대값
 * (base * (1 + jitterFactor)) 이상이므로 delay는 attempt에 대해 감소하지 않습니다.</p>
 *
 * @param minDelayMs 최소 지연 시간 (밀리초, 양수여야 함)
 * @param maxDelayMs 최대 지연 시간 (밀리초, minDelayMs 이상이어야 함)
 * @param maxRetry 최대 재시도 횟수 (1 이상이어야 함)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param excluded 재시도하지 않을 엔드포인트
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record ExponentialRetryPolicy(
    long minDelayMs,
    long maxDelayMs,
    int maxRetry,
    double jitterFactor,
    Set<Endpoint> excluded
) implements RetryPolicy {

    /** 기본 jitter 비율. */
    public static final double DEFAULT_JITTER_FACTOR = 0.1;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExponentialRetryPolicy {
        if (minDelayMs <= 0) {
            throw new IllegalArgumentException(
                "minDelayMs must be positive (current: " + minDelayMs + ")"
            );
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= minDelayMs (min: " + minDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (maxRetry <= 0) {
            throw new IllegalArgumentException(
                "maxRetry must be positive (current: " + maxRetry + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
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
        return RetryDecision.retryAfter(delayFor(attempt));
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 현재 연속 실패 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     */
    long delayFor(int attempt) {
        // 1. 지수적 백오프 (shift overflow 방지를 위해 62에서 자름)
        int shift = Math.min(attempt - 1, 62);
        long multiplier = 1L << shift;
        long base = minDelayMs > maxDelayMs / multiplier ? maxDelayMs : Math.min(minDelayMs * multiplier, maxDelayMs);

        // 2. Jitter 추가 (0 ~ base * jitterFactor)
        long jitter = (long) (base * jitterFactor * ThreadLocalRandom.current().nextDouble());

        // 3. 최대값 제한
        return Math.min(base + jitter, maxDelayMs);
    }
}
