package com.ryuqq.pubsub.core.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ServerException 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
class ServerExceptionTest {

    @Test
    void isRetryable_ServerErrorsAndThrottling_AreRetryable() {
        assertTrue(new ServerException(500, null).isRetryable());
        assertTrue(new ServerException(503, "unavailable").isRetryable());
        assertTrue(new ServerException(429, "too many requests").isRetryable());
    }

    @Test
    void isRetryable_ClientErrors_AreNotRetryable() {
        ServerException forbidden = new ServerException(403, "{\"error\":\"Forbidden\"}");

        assertFalse(forbidden.isRetryable());
        assertTrue(forbidden.isAccessDenied());
        assertEquals(403, forbidden.getStatusCode());
        assertTrue(forbidden.getMessage().contains("403"));
    }

    @Test
    void constructor_SuccessStatus_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ServerException(200, null)
        );
        assertTrue(exception.getMessage().contains("must not be 2xx"));
    }

    @Test
    void transportException_IsAlwaysRetryable() {
        TransportException timeout = new TransportException("read timed out", null, true);

        assertTrue(timeout.isRetryable());
        assertTrue(timeout.isTimeout());
        assertFalse(new TransportException("reset", null).isTimeout());
    }
}
