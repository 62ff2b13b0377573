package com.ryuqq.pubsub.core.retry;

import com.ryuqq.pubsub.core.exception.PubSubException;

import java.util.Set;

/**
 * 실패한 요청을 다시 시도할지, 얼마나 기다릴지 결정하는 정책.
 *
 * <p>세 가지 변형이 있습니다:</p>
 * <ul>
 *   <li>{@link NoneRetryPolicy}: 재시도하지 않음</li>
 *   <li>{@link LinearRetryPolicy}: 고정 간격, 최대 횟수 제한</li>
 *   <li>{@link ExponentialRetryPolicy}: 지수 증가 간격 + jitter, 최대 횟수 제한</li>
 * </ul>
 *
 * <p><strong>attempt 번호:</strong> 현재 연속 실패 구간에서 몇 번째 실패인지 (1부터 시작).
 * 성공하면 호출자가 카운터를 0으로 되돌립니다. {@code attempt > maxRetry}이면 항상 false입니다.</p>
 *
 * <p>정책 객체는 불변이며 엔진 인스턴스마다 생성자로 주입됩니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public sealed interface RetryPolicy permits NoneRetryPolicy, LinearRetryPolicy, ExponentialRetryPolicy {

    /**
     * 재시도 여부와 대기 시간 계산.
     *
     * @param attempt 현재 연속 실패 횟수 (1 이상)
     * @param endpoint 실패한 요청의 엔드포인트 그룹
     * @return 재시도 판단 결과
     * @throws IllegalArgumentException attempt가 양수가 아니거나 endpoint가 null인 경우
     */
    RetryDecision shouldRetry(int attempt, Endpoint endpoint);

    /**
     * 실패 원인까지 고려한 재시도 판단.
     *
     * <p>재시도해도 결과가 달라지지 않는 오류(4xx 등)는 정책과 무관하게 즉시 포기합니다.</p>
     *
     * @param attempt 현재 연속 실패 횟수 (1 이상)
     * @param endpoint 실패한 요청의 엔드포인트 그룹
     * @param error 실패 원인 (null이면 재시도 가능한 것으로 간주)
     * @return 재시도 판단 결과
     */
    default RetryDecision shouldRetry(int attempt, Endpoint endpoint, PubSubException error) {
        if (error != null && !error.isRetryable()) {
            return RetryDecision.giveUp();
        }
        return shouldRetry(attempt, endpoint);
    }

    /**
     * 재시도 대상에서 제외된 엔드포인트.
     *
     * @return 제외 목록 (불변)
     */
    Set<Endpoint> excluded();

    static RetryPolicy none() {
        return NoneRetryPolicy.INSTANCE;
    }

    static RetryPolicy linear(long delayMs, int maxRetry, Endpoint... excluded) {
        return new LinearRetryPolicy(delayMs, maxRetry, Set.of(excluded));
    }

    static RetryPolicy exponential(long minDelayMs, long maxDelayMs, int maxRetry, Endpoint... excluded) {
        return new ExponentialRetryPolicy(minDelayMs, maxDelayMs, maxRetry,
            ExponentialRetryPolicy.DEFAULT_JITTER_FACTOR, Set.of(excluded));
    }

    /**
     * 공통 인자 검증.
     */
    static void checkArguments(int attempt, Endpoint endpoint) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
    }
}
