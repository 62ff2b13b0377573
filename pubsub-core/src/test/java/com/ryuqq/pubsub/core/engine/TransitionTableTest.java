package com.ryuqq.pubsub.core.engine;

import com.ryuqq.pubsub.core.effect.EffectChannel;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TransitionTable 테스트.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
class TransitionTableTest {

    enum Door { OPEN, CLOSED, LOCKED }

    sealed interface DoorEvent {
        record Close() implements DoorEvent { }
        record Lock() implements DoorEvent { }
    }

    @Test
    void apply_등록된_상태와_이벤트만_전이를_반환함() {
        // Given
        TransitionTable<Door, DoorEvent, String> table = TransitionTable.<Door, DoorEvent, String>builder(Door.class)
            .on(Door.OPEN, DoorEvent.Close.class, (ctx, e) -> Transition.to(Door.CLOSED, ctx + "|closed"))
            .build();

        // Then
        assertThat(table.apply(Door.OPEN, "door", new DoorEvent.Close()))
            .hasValueSatisfying(t -> {
                assertThat(t.state()).isEqualTo(Door.CLOSED);
                assertThat(t.context()).isEqualTo("door|closed");
                assertThat(t.effects()).isEmpty();
            });
        assertThat(table.apply(Door.CLOSED, "door", new DoorEvent.Close())).isEmpty();
        assertThat(table.apply(Door.OPEN, "door", new DoorEvent.Lock())).isEmpty();
    }

    @Test
    void on_여러_상태에_같은_handler_등록() {
        // Given
        TransitionTable<Door, DoorEvent, String> table = TransitionTable.<Door, DoorEvent, String>builder(Door.class)
            .on(EnumSet.of(Door.OPEN, Door.CLOSED), DoorEvent.Lock.class, (ctx, e) -> Transition.to(Door.LOCKED, ctx))
            .build();

        // Then
        assertThat(table.handles(Door.OPEN, DoorEvent.Lock.class)).isTrue();
        assertThat(table.handles(Door.CLOSED, DoorEvent.Lock.class)).isTrue();
        assertThat(table.handles(Door.LOCKED, DoorEvent.Lock.class)).isFalse();
    }

    @Test
    void on_같은_상태와_이벤트를_두번_등록하면_예외() {
        TransitionTable.Builder<Door, DoorEvent, String> builder = TransitionTable.<Door, DoorEvent, String>builder(Door.class)
            .on(Door.OPEN, DoorEvent.Close.class, (ctx, e) -> Transition.to(Door.CLOSED, ctx));

        assertThatThrownBy(() -> builder.on(Door.OPEN, DoorEvent.Close.class, (ctx, e) -> Transition.to(Door.OPEN, ctx)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Duplicate transition: OPEN + Close");
    }

    @Test
    void exitChannels_등록하지_않은_상태는_빈_목록() {
        TransitionTable<Door, DoorEvent, String> table = TransitionTable.<Door, DoorEvent, String>builder(Door.class)
            .onExit(Door.OPEN, EffectChannel.HANDSHAKE)
            .build();

        assertThat(table.exitChannels(Door.OPEN)).containsExactly(EffectChannel.HANDSHAKE);
        assertThat(table.exitChannels(Door.CLOSED)).isEmpty();
    }

    @Test
    void transition_null_이펙트는_건너뜀() {
        Transition<Door, String> transition = Transition.to(Door.OPEN, "ctx", null, null);

        assertThat(transition.effects()).isEmpty();
    }
}
