package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.application.client.RealtimeListener;
import com.ryuqq.pubsub.core.model.Message;
import com.ryuqq.pubsub.core.status.Status;
import com.ryuqq.pubsub.core.status.StatusCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * ListenerRegistry 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ListenerRegistryTest {

    @Mock
    private RealtimeListener first;

    @Mock
    private RealtimeListener second;

    private final ListenerRegistry registry = new ListenerRegistry();

    @Test
    void add_같은_리스너는_한_번만_등록() {
        registry.add(first);
        registry.add(first);

        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void announce_리스너_예외가_다른_리스너_전달을_막지_않음() {
        // given
        Message message = Message.of("room1", "15000000000000001", "hello");
        doThrow(new IllegalStateException("listener bug")).when(first).onMessage(message);
        registry.add(first);
        registry.add(second);

        // when
        registry.announce(message);

        // then
        verify(second).onMessage(message);
    }

    @Test
    void remove_이후_알림을_받지_않음() {
        // given
        Status status = Status.subscribe(StatusCategory.DISCONNECTED, null, null, null);
        registry.add(first);
        registry.add(second);

        // when
        registry.remove(first);
        registry.announce(status);

        // then
        verify(second).onStatus(status);
        verifyNoInteractions(first);
    }
}
