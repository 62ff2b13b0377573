package com.ryuqq.pubsub.application.subscribe;

import com.ryuqq.pubsub.core.exception.ServerException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SubscriptionContext / SubscriptionSettings 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
class SubscriptionContextTest {

    @Test
    void withCursor_ClearsFailureState() {
        SubscriptionContext failed = SubscriptionContext.of(ChannelSet.of("a"), null, Cursor.ZERO)
            .withFailure(3, new ServerException(503, null));

        SubscriptionContext next = failed.withCursor(Cursor.of(42L, 1));

        assertEquals(0, next.attempts());
        assertNull(next.reason());
        assertEquals(Cursor.of(42L, 1), next.cursor());
        assertEquals(ChannelSet.of("a"), next.channels());
    }

    @Test
    void constructor_NullSets_BecomeEmpty() {
        SubscriptionContext context = new SubscriptionContext(null, null, null, 0, null, false);

        assertTrue(context.isEmpty());
        assertEquals(GroupSet.empty(), context.groups());
        assertEquals(SubscriptionContext.empty(), context);
    }

    @Test
    void constructor_NegativeAttempts_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new SubscriptionContext(null, null, null, -1, null, false));
    }

    @Test
    void asReconnecting_SurvivesFailure_ClearedByCursor() {
        SubscriptionContext reconnecting = SubscriptionContext.of(ChannelSet.of("a"), null, Cursor.ZERO)
            .asReconnecting();

        assertTrue(reconnecting.withFailure(1, new ServerException(503, null)).reconnecting());
        assertTrue(reconnecting.withoutFailure().reconnecting());
        assertFalse(reconnecting.withCursor(Cursor.of(42L, 1)).reconnecting());
        assertFalse(SubscriptionContext.of(ChannelSet.of("a"), null, null).reconnecting());
    }

    @Test
    void settings_Defaults_ResumeFromCursor() {
        SubscriptionSettings settings = SubscriptionSettings.defaults();

        assertEquals(ChannelMergePolicy.RESUME_FROM_CURSOR, settings.mergePolicy());
        assertEquals(SubscriptionSettings.DEFAULT_REQUEST_MESSAGE_COUNT_THRESHOLD,
            settings.requestMessageCountThreshold());
        assertThrows(IllegalArgumentException.class, () -> settings.withRequestMessageCountThreshold(-1));
        assertSame(SubscriptionSettings.DEFAULT_RETRY_POLICY, settings.retryPolicy());
        assertSame(RetryPolicy.none(), settings.withRetryPolicy(RetryPolicy.none()).retryPolicy());
        assertThrows(IllegalArgumentException.class, () -> settings.withMergePolicy(null));
    }
}
