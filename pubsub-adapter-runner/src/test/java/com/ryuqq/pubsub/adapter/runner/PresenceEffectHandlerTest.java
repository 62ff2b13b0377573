package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.application.client.RealtimeListener;
import com.ryuqq.pubsub.application.presence.PresenceEvent;
import com.ryuqq.pubsub.core.effect.Effect;
import com.ryuqq.pubsub.core.effect.EffectChannel;
import com.ryuqq.pubsub.core.exception.ServerException;
import com.ryuqq.pubsub.core.exception.TransportException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.spi.RequestKind;
import com.ryuqq.pubsub.core.spi.Transport;
import com.ryuqq.pubsub.core.spi.TransportRequest;
import com.ryuqq.pubsub.core.spi.TransportResponse;
import com.ryuqq.pubsub.core.status.Status;
import com.ryuqq.pubsub.core.status.StatusCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * PresenceEffectHandler 유닛 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PresenceEffectHandlerTest {

    private static final ChannelSet ROOM1 = ChannelSet.of("room1");

    @Mock
    private Transport transport;

    @Mock
    private ScheduledExecutorService timer;

    @Mock
    private RealtimeListener listener;

    private final List<PresenceEvent> results = new ArrayList<>();
    private final PresenceStateStore presenceStates = new PresenceStateStore();
    private ListenerRegistry listeners;
    private PresenceEffectHandler handler;

    @BeforeEach
    void setUp() {
        listeners = new ListenerRegistry();
        listeners.add(listener);
        handler = new PresenceEffectHandler(transport, timer, listeners, presenceStates,
            new RealtimeConfig("user-1").withPresenceTimeoutSeconds(60));
    }

    @Test
    void heartbeat_presence_timeout을_실어_보내고_성공_이벤트_전달() {
        // given
        when(transport.execute(any())).thenReturn(CompletableFuture.completedFuture(TransportResponse.ok()));

        // when
        handler.handle(new Effect.Heartbeat(ROOM1, GroupSet.empty()), results::add);

        // then
        ArgumentCaptor<TransportRequest> request = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).execute(request.capture());
        assertThat(request.getValue().kind()).isEqualTo(RequestKind.HEARTBEAT);
        assertThat(request.getValue().presenceTimeoutSeconds()).isEqualTo(60);
        assertThat(results).containsExactly(new PresenceEvent.HeartbeatSuccess());
    }

    @Test
    void heartbeat_설정된_프레즌스_상태를_heartbeat_채널만큼_실어_보냄() {
        // given
        presenceStates.put(ROOM1, "{\"mood\":\"busy\"}");
        presenceStates.put(ChannelSet.of("elsewhere"), "{\"mood\":\"away\"}");
        when(transport.execute(any())).thenReturn(CompletableFuture.completedFuture(TransportResponse.ok()));

        // when
        handler.handle(new Effect.Heartbeat(ChannelSet.of("room1", "room2"), GroupSet.empty()), results::add);

        // then
        ArgumentCaptor<TransportRequest> request = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).execute(request.capture());
        assertThat(request.getValue().presenceState()).containsOnly(Map.entry("room1", "{\"mood\":\"busy\"}"));
    }

    @Test
    void heartbeat_maintainPresenceState_해제_시_상태를_보내지_않음() {
        // given
        handler = new PresenceEffectHandler(transport, timer, listeners, presenceStates,
            new RealtimeConfig("user-1").withMaintainPresenceState(false));
        presenceStates.put(ROOM1, "{\"mood\":\"busy\"}");
        when(transport.execute(any())).thenReturn(CompletableFuture.completedFuture(TransportResponse.ok()));

        // when
        handler.handle(new Effect.Heartbeat(ROOM1, GroupSet.empty()), results::add);

        // then
        ArgumentCaptor<TransportRequest> request = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).execute(request.capture());
        assertThat(request.getValue().presenceState()).isEmpty();
    }

    @Test
    void heartbeat_Transport가_동기로_예외를_던지면_즉시_HeartbeatFailure() {
        // given
        when(transport.execute(any())).thenThrow(new IllegalStateException("client closed"));

        // when
        Runnable abort = handler.handle(new Effect.Heartbeat(ROOM1, GroupSet.empty()), results::add);

        // then
        assertThat(abort).isSameAs(PresenceEffectHandler.NO_ABORT);
        assertThat(results).singleElement().isInstanceOfSatisfying(PresenceEvent.HeartbeatFailure.class,
            failure -> assertThat(failure.reason()).isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(IllegalStateException.class));
    }

    @Test
    void leave_Transport가_동기로_예외를_던져도_이벤트_없음() {
        // given
        when(transport.execute(any())).thenThrow(new IllegalStateException("client closed"));

        // when
        Runnable abort = handler.handle(new Effect.Leave(ROOM1, GroupSet.empty()), results::add);

        // then
        assertThat(abort).isSameAs(PresenceEffectHandler.NO_ABORT);
        assertThat(results).isEmpty();
    }

    @Test
    void heartbeat_실패_응답은_HeartbeatFailure() {
        // given
        ServerException unavailable = new ServerException(503, "unavailable");
        when(transport.execute(any())).thenReturn(CompletableFuture.failedFuture(unavailable));

        // when
        handler.handle(new Effect.Heartbeat(ROOM1, GroupSet.empty()), results::add);

        // then
        assertThat(results).containsExactly(new PresenceEvent.HeartbeatFailure(unavailable));
    }

    @Test
    void leave_결과를_기다리지_않고_실패해도_이벤트_없음() {
        // given
        when(transport.execute(any())).thenReturn(
            CompletableFuture.failedFuture(new TransportException("connection reset", null)));

        // when
        Runnable abort = handler.handle(new Effect.Leave(ROOM1, GroupSet.empty()), results::add);

        // then
        assertThat(abort).isSameAs(PresenceEffectHandler.NO_ABORT);
        assertThat(results).isEmpty();
        ArgumentCaptor<TransportRequest> request = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).execute(request.capture());
        assertThat(request.getValue().kind()).isEqualTo(RequestKind.LEAVE);
        assertThat(request.getValue().channels()).isEqualTo(ROOM1);
    }

    @Test
    void wait_만료_시_TimesUp_전달() {
        // given
        ScheduledFuture<?> scheduled = mock(ScheduledFuture.class);
        doReturn(scheduled).when(timer).schedule(any(Runnable.class), eq(29_000L), eq(TimeUnit.MILLISECONDS));

        // when
        Runnable abort = handler.handle(new Effect.Wait(EffectChannel.HEARTBEAT, 29_000), results::add);
        ArgumentCaptor<Runnable> fire = ArgumentCaptor.forClass(Runnable.class);
        verify(timer).schedule(fire.capture(), eq(29_000L), eq(TimeUnit.MILLISECONDS));
        fire.getValue().run();
        abort.run();

        // then
        assertThat(results).containsExactly(new PresenceEvent.TimesUp());
        verify(scheduled).cancel(false);
    }

    @Test
    void emitStatus_리스너에_전달() {
        // given
        Status status = Status.heartbeat(StatusCategory.HEARTBEAT_FAILED, ROOM1, GroupSet.empty(),
            new ServerException(500, null));

        // when
        handler.handle(new Effect.EmitStatus(status), results::add);

        // then
        verify(listener).onStatus(status);
        verifyNoInteractions(transport);
    }
}
