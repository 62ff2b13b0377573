package com.ryuqq.pubsub.core.spi;

import com.ryuqq.pubsub.core.exception.ServerException;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.Message;

import java.util.List;

/**
 * Decoded response of a {@link Transport} call.
 *
 * <p>A response always means the server answered. Network level failures never
 * produce a response; the future completes exceptionally instead.</p>
 *
 * @param statusCode HTTP-like status code
 * @param cursor next cursor for handshake/receive responses (nullable otherwise)
 * @param messages decoded messages of a receive response (never null)
 * @param errorBody raw error body of a non-2xx response (nullable)
 * @author PubSub Team
 * @since 1.0.0
 */
public record TransportResponse(int statusCode, Cursor cursor, List<Message> messages, String errorBody) {

    public TransportResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be between 100 and 599 (current: " + statusCode + ")");
        }
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static TransportResponse ok() {
        return new TransportResponse(200, null, List.of(), null);
    }

    public static TransportResponse ok(Cursor cursor) {
        return new TransportResponse(200, cursor, List.of(), null);
    }

    public static TransportResponse ok(Cursor cursor, List<Message> messages) {
        return new TransportResponse(200, cursor, messages, null);
    }

    public static TransportResponse error(int statusCode, String errorBody) {
        return new TransportResponse(statusCode, null, List.of(), errorBody);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Converts a non-2xx response into the matching exception.
     *
     * @return server exception describing this response
     * @throws IllegalStateException if the response is successful
     */
    public ServerException toException() {
        if (isSuccessful()) {
            throw new IllegalStateException("Successful response has no error (status: " + statusCode + ")");
        }
        return new ServerException(statusCode, errorBody);
    }
}
