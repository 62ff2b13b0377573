package com.ryuqq.pubsub.core.spi;

import com.ryuqq.pubsub.core.exception.ServerException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.retry.Endpoint;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TransportRequest / TransportResponse 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
class TransportResponseTest {

    @Test
    void toException_non_2xx_응답은_ServerException으로_변환됨() {
        // Given
        TransportResponse response = TransportResponse.error(502, "Bad Gateway");

        // When
        ServerException exception = response.toException();

        // Then
        assertThat(response.isSuccessful()).isFalse();
        assertThat(exception.getStatusCode()).isEqualTo(502);
        assertThat(exception.getBody()).isEqualTo("Bad Gateway");
        assertThat(exception.isRetryable()).isTrue();
    }

    @Test
    void toException_성공_응답은_예외() {
        assertThatThrownBy(() -> TransportResponse.ok().toException())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void receive_요청은_커서가_필수() {
        assertThatThrownBy(() -> TransportRequest.receive(ChannelSet.of("a"), GroupSet.empty(), null, null, "user-1"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cursor cannot be null");
    }

    @Test
    void 요청_종류별_endpoint() {
        TransportRequest heartbeat = TransportRequest.heartbeat(ChannelSet.of("a"), null, 300, "user-1");

        assertThat(heartbeat.groups().isEmpty()).isTrue();
        assertThat(heartbeat.kind().endpoint()).isEqualTo(Endpoint.PRESENCE);
        assertThat(RequestKind.RECEIVE.endpoint()).isEqualTo(Endpoint.SUBSCRIBE);
        assertThat(TransportRequest.receive(ChannelSet.of("a"), GroupSet.empty(), Cursor.ZERO, null, "user-1").cursor())
            .isEqualTo(Cursor.ZERO);
    }

    @Test
    void heartbeat_프레즌스_상태는_복사되어_불변() {
        // Given
        Map<String, String> state = new HashMap<>();
        state.put("a", "{\"mood\":\"busy\"}");

        // When
        TransportRequest heartbeat = TransportRequest.heartbeat(ChannelSet.of("a"), null, 300, state, "user-1");
        state.put("b", "{}");

        // Then
        assertThat(heartbeat.presenceState()).containsOnly(Map.entry("a", "{\"mood\":\"busy\"}"));
        assertThatThrownBy(() -> heartbeat.presenceState().put("c", "{}"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(TransportRequest.leave(ChannelSet.of("a"), null, "user-1").presenceState()).isEmpty();
    }
}
