package com.ryuqq.pubsub.adapter.inmemory.transport;

import com.ryuqq.pubsub.core.exception.ServerException;
import com.ryuqq.pubsub.core.exception.TransportException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.spi.RequestKind;
import com.ryuqq.pubsub.core.spi.TransportRequest;
import com.ryuqq.pubsub.core.spi.TransportResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryTransport}.
 *
 * <p><strong>Tested Scenarios:</strong></p>
 * <ul>
 *   <li>Scripted outcomes answer the next request of their kind</li>
 *   <li>Unscripted requests stay pending until answered</li>
 *   <li>Cancelled requests are skipped when answering</li>
 *   <li>Leave requests succeed by default</li>
 * </ul>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
class InMemoryTransportTest {

    private static final ChannelSet ROOM1 = ChannelSet.of("room1");
    private static final Cursor CURSOR = new Cursor("15000000000000000", 4);

    private InMemoryTransport transport;

    @BeforeEach
    void setUp() {
        transport = new InMemoryTransport();
    }

    private static TransportRequest handshake() {
        return TransportRequest.handshake(ROOM1, GroupSet.empty(), null, "user-1");
    }

    private static TransportRequest receive() {
        return TransportRequest.receive(ROOM1, GroupSet.empty(), CURSOR, null, "user-1");
    }

    @Test
    void execute_ScriptedResponse_CompletesImmediately() {
        transport.respond(RequestKind.HANDSHAKE, TransportResponse.ok(CURSOR));

        CompletableFuture<TransportResponse> call = transport.execute(handshake());

        assertThat(call).isCompletedWithValue(TransportResponse.ok(CURSOR));
        assertThat(transport.pendingCount(RequestKind.HANDSHAKE)).isZero();
    }

    @Test
    void execute_Unscripted_StaysPendingUntilResponded() {
        CompletableFuture<TransportResponse> call = transport.execute(receive());

        assertThat(call).isNotDone();
        assertThat(transport.pendingCount(RequestKind.RECEIVE)).isEqualTo(1);

        transport.respond(RequestKind.RECEIVE, TransportResponse.ok(CURSOR));

        assertThat(call).isCompletedWithValue(TransportResponse.ok(CURSOR));
        assertThat(transport.pendingCount(RequestKind.RECEIVE)).isZero();
    }

    @Test
    void respond_OtherKind_DoesNotCompletePendingCall() {
        CompletableFuture<TransportResponse> call = transport.execute(receive());

        transport.respond(RequestKind.HANDSHAKE, TransportResponse.ok(CURSOR));

        assertThat(call).isNotDone();
        assertThat(transport.execute(handshake())).isCompleted();
    }

    @Test
    void fail_PendingCall_CompletesExceptionally() {
        CompletableFuture<TransportResponse> call = transport.execute(handshake());
        TransportException timeout = new TransportException("timed out", null, true);

        transport.fail(RequestKind.HANDSHAKE, timeout);

        assertThat(call).isCompletedExceptionally();
        assertThatThrownBy(call::join)
            .isInstanceOf(CompletionException.class)
            .hasCause(timeout);
    }

    @Test
    void respond_SkipsCancelledCalls() {
        CompletableFuture<TransportResponse> first = transport.execute(receive());
        CompletableFuture<TransportResponse> second = transport.execute(receive());
        first.cancel(true);

        transport.respond(RequestKind.RECEIVE, TransportResponse.error(503, "unavailable"));

        assertThat(first).isCancelled();
        assertThat(second).isCompletedWithValue(TransportResponse.error(503, "unavailable"));
        assertThat(transport.cancelledCount(RequestKind.RECEIVE)).isEqualTo(1);
    }

    @Test
    void execute_Leave_SucceedsByDefault() {
        CompletableFuture<TransportResponse> call =
            transport.execute(TransportRequest.leave(ROOM1, GroupSet.empty(), "user-1"));

        assertThat(call).isCompletedWithValue(TransportResponse.ok());
    }

    @Test
    void execute_Leave_UsesScriptedFailure() {
        transport.fail(RequestKind.LEAVE, new ServerException(403, "Forbidden"));

        CompletableFuture<TransportResponse> call =
            transport.execute(TransportRequest.leave(ROOM1, GroupSet.empty(), "user-1"));

        assertThat(call).isCompletedExceptionally();
    }

    @Test
    void requests_RecordsArrivalOrder() {
        transport.execute(handshake());
        transport.execute(TransportRequest.heartbeat(ROOM1, GroupSet.empty(), 300, "user-1"));
        transport.execute(receive());

        assertThat(transport.requests())
            .extracting(TransportRequest::kind)
            .containsExactly(RequestKind.HANDSHAKE, RequestKind.HEARTBEAT, RequestKind.RECEIVE);
        assertThat(transport.requests(RequestKind.HEARTBEAT))
            .singleElement()
            .extracting(TransportRequest::presenceTimeoutSeconds)
            .isEqualTo(300);
    }

    @Test
    void reset_ClearsScriptAndLog() {
        transport.respond(RequestKind.HANDSHAKE, TransportResponse.ok(CURSOR));
        transport.execute(receive());

        transport.reset();

        assertThat(transport.requests()).isEmpty();
        assertThat(transport.pendingCount(RequestKind.RECEIVE)).isZero();
        assertThat(transport.execute(handshake())).isNotDone();
    }

    @Test
    void cancel_PendingCall_LeavesQueueAndIsCounted() {
        for (int i = 0; i < 50; i++) {
            transport.execute(receive()).cancel(true);
        }
        CompletableFuture<TransportResponse> live = transport.execute(receive());

        transport.respond(RequestKind.RECEIVE, TransportResponse.ok(CURSOR));

        assertThat(live).isCompletedWithValue(TransportResponse.ok(CURSOR));
        assertThat(transport.cancelledCount(RequestKind.RECEIVE)).isEqualTo(50);
        assertThat(transport.pendingCount(RequestKind.RECEIVE)).isZero();

        transport.reset();

        assertThat(transport.cancelledCount(RequestKind.RECEIVE)).isZero();
    }

    @Test
    void respond_NullResponse_ThrowsException() {
        assertThatThrownBy(() -> transport.respond(RequestKind.RECEIVE, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("response cannot be null");
    }
}
