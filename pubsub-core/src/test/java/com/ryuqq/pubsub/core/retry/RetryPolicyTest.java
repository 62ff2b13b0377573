package com.ryuqq.pubsub.core.retry;

import com.ryuqq.pubsub.core.exception.ServerException;
import com.ryuqq.pubsub.core.exception.TransportException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryPolicy 공통 동작 및 None/Linear 정책 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
class RetryPolicyTest {

    @Test
    void none_never_retries() {
        RetryPolicy policy = RetryPolicy.none();

        assertThat(policy.shouldRetry(1, Endpoint.SUBSCRIBE).retry()).isFalse();
        assertThat(policy.excluded()).isEmpty();
    }

    @Test
    void linear_constantDelay_untilMaxRetry() {
        // Given
        RetryPolicy policy = RetryPolicy.linear(2_000, 2);

        // Then
        assertThat(policy.shouldRetry(1, Endpoint.SUBSCRIBE)).isEqualTo(RetryDecision.retryAfter(2_000));
        assertThat(policy.shouldRetry(2, Endpoint.SUBSCRIBE)).isEqualTo(RetryDecision.retryAfter(2_000));
        assertThat(policy.shouldRetry(3, Endpoint.SUBSCRIBE).retry()).isFalse();
    }

    @Test
    void shouldRetry_withNonRetryableError_givesUp() {
        // Given
        RetryPolicy policy = RetryPolicy.linear(1_000, 5);

        // Then
        assertThat(policy.shouldRetry(1, Endpoint.SUBSCRIBE, new ServerException(403, "Forbidden")).retry()).isFalse();
        assertThat(policy.shouldRetry(1, Endpoint.SUBSCRIBE, new ServerException(400, "Bad Request")).retry()).isFalse();
    }

    @Test
    void shouldRetry_withRetryableError_followsPolicy() {
        RetryPolicy policy = RetryPolicy.linear(1_000, 5);

        assertThat(policy.shouldRetry(1, Endpoint.SUBSCRIBE, new ServerException(503, null)).retry()).isTrue();
        assertThat(policy.shouldRetry(1, Endpoint.SUBSCRIBE, new ServerException(429, null)).retry()).isTrue();
        assertThat(policy.shouldRetry(1, Endpoint.SUBSCRIBE, new TransportException("timeout", null, true)).retry()).isTrue();
    }

    @Test
    void shouldRetry_zeroAttempt_throwsException() {
        RetryPolicy policy = RetryPolicy.linear(1_000, 5);

        assertThatThrownBy(() -> policy.shouldRetry(0, Endpoint.SUBSCRIBE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt must be positive");
    }

    @Test
    void retryDecision_giveUpWithDelay_isRejected() {
        assertThatThrownBy(() -> new RetryDecision(false, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
