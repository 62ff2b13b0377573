package com.ryuqq.pubsub.application.presence;

import com.ryuqq.pubsub.core.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PresenceSettings 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
class PresenceSettingsTest {

    @Test
    void defaults_실패만_알리고_leave는_전송() {
        PresenceSettings settings = PresenceSettings.defaults(RetryPolicy.none());

        assertThat(settings.heartbeatIntervalMs()).isEqualTo(149_000);
        assertThat(settings.suppressLeaveEvents()).isFalse();
        assertThat(settings.announceSuccessfulHeartbeats()).isFalse();
        assertThat(settings.announceFailedHeartbeats()).isTrue();
    }

    @Test
    void heartbeat_간격은_양수여야_함() {
        PresenceSettings settings = PresenceSettings.defaults(RetryPolicy.none());

        assertThatThrownBy(() -> settings.withHeartbeatIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("heartbeatIntervalMs must be positive");
    }

    @Test
    void retryPolicy_필수() {
        assertThatThrownBy(() -> PresenceSettings.defaults(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
