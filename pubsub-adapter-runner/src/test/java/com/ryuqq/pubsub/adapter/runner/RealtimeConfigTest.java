package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.application.presence.PresenceSettings;
import com.ryuqq.pubsub.application.subscribe.ChannelMergePolicy;
import com.ryuqq.pubsub.core.exception.ConfigurationException;
import com.ryuqq.pubsub.core.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RealtimeConfig 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
class RealtimeConfigTest {

    @Test
    void 기본값() {
        RealtimeConfig config = new RealtimeConfig("user-1");

        assertThat(config.presenceTimeoutSeconds()).isEqualTo(300);
        assertThat(config.heartbeatIntervalSeconds()).isEqualTo(149);
        assertThat(config.isPresenceEnabled()).isTrue();
        assertThat(config.dedupOnSubscribe()).isFalse();
        assertThat(config.maximumCacheSize()).isEqualTo(100);
        assertThat(config.announceSuccessfulHeartbeats()).isFalse();
        assertThat(config.announceFailedHeartbeats()).isTrue();
        assertThat(config.managePresenceList()).isTrue();
        assertThat(config.maintainPresenceState()).isTrue();
        assertThat(config.requestMessageCountThreshold()).isEqualTo(100);
        assertThat(config.channelMergePolicy()).isEqualTo(ChannelMergePolicy.RESUME_FROM_CURSOR);
        assertThat(config.filterExpression()).isNull();
    }

    @Test
    void presenceTimeout_변경_시_heartbeat_간격도_다시_계산() {
        RealtimeConfig config = new RealtimeConfig("user-1").withPresenceTimeoutSeconds(60);

        assertThat(config.heartbeatIntervalSeconds()).isEqualTo(29);
        assertThat(config.presenceSettings().heartbeatIntervalMs()).isEqualTo(29_000);
    }

    @Test
    void presenceTimeout_최대값을_넘으면_최대값으로_보정() {
        RealtimeConfig config = new RealtimeConfig("user-1").withPresenceTimeoutSeconds(321);

        assertThat(config.presenceTimeoutSeconds()).isEqualTo(RealtimeConfig.MAXIMUM_PRESENCE_TIMEOUT_SECONDS);
        assertThat(config.heartbeatIntervalSeconds()).isEqualTo(159);
    }

    @Test
    void presenceTimeout_작은_값은_그대로_0_이하는_기본값으로_보정() {
        RealtimeConfig config = new RealtimeConfig("user-1");

        assertThat(config.withPresenceTimeoutSeconds(10).presenceTimeoutSeconds()).isEqualTo(10);
        assertThat(config.withPresenceTimeoutSeconds(10).heartbeatIntervalSeconds()).isEqualTo(4);
        assertThat(config.withPresenceTimeoutSeconds(1).isPresenceEnabled()).isFalse();
        assertThat(config.withPresenceTimeoutSeconds(0).presenceTimeoutSeconds())
            .isEqualTo(RealtimeConfig.DEFAULT_PRESENCE_TIMEOUT_SECONDS);
        assertThat(config.withPresenceTimeoutSeconds(-5).heartbeatIntervalSeconds()).isEqualTo(149);
    }

    @Test
    void presenceTimeout_정규_생성자도_보정하고_간격은_검증() {
        RealtimeConfig config = new RealtimeConfig("user-1", false, 100, 100, 400, 199,
            false, false, true, true, true, ChannelMergePolicy.RESUME_FROM_CURSOR, RetryPolicy.none(), null);

        assertThat(config.presenceTimeoutSeconds()).isEqualTo(320);
        assertThat(config.heartbeatIntervalSeconds()).isEqualTo(199);
    }

    @Test
    void heartbeat_간격은_presenceTimeout보다_작아야_함() {
        assertThatThrownBy(() -> new RealtimeConfig("user-1").withHeartbeatIntervalSeconds(300))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("heartbeatIntervalSeconds");
    }

    @Test
    void heartbeat_간격_0이면_presence_비활성() {
        RealtimeConfig config = new RealtimeConfig("user-1").withHeartbeatIntervalSeconds(0);

        assertThat(config.isPresenceEnabled()).isFalse();
        assertThatThrownBy(config::presenceSettings).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void userId는_필수() {
        assertThatThrownBy(() -> new RealtimeConfig(" "))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("userId");
    }

    @Test
    void 빈_filterExpression은_null로_정규화() {
        assertThat(new RealtimeConfig("user-1").withFilterExpression("  ").filterExpression()).isNull();
    }

    @Test
    void 설정이_엔진_설정으로_전달됨() {
        RealtimeConfig config = new RealtimeConfig("user-1")
            .withRetryPolicy(RetryPolicy.none())
            .withChannelMergePolicy(ChannelMergePolicy.START_FROM_NOW)
            .withSuppressLeaveEvents(true)
            .withAnnounceSuccessfulHeartbeats(true);

        PresenceSettings presence = config.presenceSettings();

        assertThat(config.subscriptionSettings().retryPolicy()).isSameAs(RetryPolicy.none());
        assertThat(config.subscriptionSettings().mergePolicy()).isEqualTo(ChannelMergePolicy.START_FROM_NOW);
        assertThat(presence.suppressLeaveEvents()).isTrue();
        assertThat(presence.announceSuccessfulHeartbeats()).isTrue();
        assertThat(presence.retryPolicy()).isSameAs(RetryPolicy.none());
        assertThat(config.withRequestMessageCountThreshold(10).subscriptionSettings().requestMessageCountThreshold())
            .isEqualTo(10);
        assertThatThrownBy(() -> config.withRequestMessageCountThreshold(-1))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("requestMessageCountThreshold");
    }

    @Test
    void dedup_설정에_따라_캐시_생성() {
        RealtimeConfig config = new RealtimeConfig("user-1");

        assertThat(config.newDedupCache().isEnabled()).isFalse();
        assertThat(config.withDedupOnSubscribe(true).withMaximumCacheSize(5).newDedupCache().getMaximumCacheSize())
            .isEqualTo(5);
        assertThatThrownBy(() -> config.withMaximumCacheSize(-1)).isInstanceOf(ConfigurationException.class);
    }
}
