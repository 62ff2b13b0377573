package com.ryuqq.pubsub.core.effect;

import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.model.Message;
import com.ryuqq.pubsub.core.status.Status;

import java.util.List;

/**
 * 상태 전이가 만들어내는 비동기 작업 기술서.
 *
 * <p>Effect 자체는 아무 일도 하지 않는 불변 값이며,
 * {@link EffectDispatcher}가 {@link EffectHandler}를 통해 실행합니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public sealed interface Effect {

    /**
     * 이 이펙트가 속한 채널.
     *
     * @return 채널 태그
     */
    EffectChannel channel();

    /**
     * 구독 루프를 열고 최초 Cursor를 받아오는 요청.
     *
     * @param channels 구독 채널
     * @param groups 구독 그룹
     */
    record Handshake(ChannelSet channels, GroupSet groups) implements Effect {
        @Override
        public EffectChannel channel() {
            return EffectChannel.HANDSHAKE;
        }
    }

    /**
     * 재시도 대기 후 다시 보내는 handshake.
     *
     * @param channels 구독 채널
     * @param groups 구독 그룹
     * @param attempt 현재 연속 실패 횟수
     */
    record HandshakeReconnect(ChannelSet channels, GroupSet groups, int attempt) implements Effect {
        @Override
        public EffectChannel channel() {
            return EffectChannel.HANDSHAKE;
        }
    }

    /**
     * Cursor 이후 메시지를 기다리는 long-poll 요청.
     *
     * @param channels 구독 채널
     * @param groups 구독 그룹
     * @param cursor 수신 시작 위치
     */
    record ReceiveMessages(ChannelSet channels, GroupSet groups, Cursor cursor) implements Effect {
        @Override
        public EffectChannel channel() {
            return EffectChannel.RECEIVE;
        }
    }

    /**
     * 재시도 대기 후 다시 보내는 long-poll 요청.
     *
     * @param channels 구독 채널
     * @param groups 구독 그룹
     * @param cursor 수신 시작 위치
     * @param attempt 현재 연속 실패 횟수
     */
    record ReceiveReconnect(ChannelSet channels, GroupSet groups, Cursor cursor, int attempt) implements Effect {
        @Override
        public EffectChannel channel() {
            return EffectChannel.RECEIVE;
        }
    }

    /**
     * presence heartbeat 요청.
     *
     * @param channels heartbeat 대상 채널
     * @param groups heartbeat 대상 그룹
     */
    record Heartbeat(ChannelSet channels, GroupSet groups) implements Effect {
        @Override
        public EffectChannel channel() {
            return EffectChannel.HEARTBEAT;
        }
    }

    /**
     * presence leave 알림. 완료 결과는 엔진으로 돌아가지 않습니다.
     *
     * @param channels 떠나는 채널
     * @param groups 떠나는 그룹
     */
    record Leave(ChannelSet channels, GroupSet groups) implements Effect {
        @Override
        public EffectChannel channel() {
            return EffectChannel.NONE;
        }
    }

    /**
     * 상태 알림을 리스너에 전달.
     *
     * @param status 전달할 상태
     */
    record EmitStatus(Status status) implements Effect {
        @Override
        public EffectChannel channel() {
            return EffectChannel.NONE;
        }
    }

    /**
     * 수신한 메시지를 (중복 제거 후) 리스너에 전달.
     *
     * @param messages 수신 순서의 메시지
     */
    record EmitMessages(List<Message> messages) implements Effect {
        public EmitMessages {
            messages = List.copyOf(messages);
        }

        @Override
        public EffectChannel channel() {
            return EffectChannel.NONE;
        }
    }

    /**
     * 지정 시간 뒤 엔진에 타이머 만료 이벤트를 보내는 타이머.
     *
     * @param channel 타이머가 속한 채널 (상태 이탈 시 함께 취소됨)
     * @param delayMs 대기 시간 (밀리초)
     */
    record Wait(EffectChannel channel, long delayMs) implements Effect {
        public Wait {
            if (channel == null || channel == EffectChannel.NONE) {
                throw new IllegalArgumentException("Wait requires a cancellable channel (current: " + channel + ")");
            }
            if (delayMs < 0) {
                throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
            }
        }
    }

    /**
     * 채널에서 진행 중인 이펙트를 취소.
     *
     * @param target 취소할 채널
     */
    record CancelPrevious(EffectChannel target) implements Effect {
        public CancelPrevious {
            if (target == null || target == EffectChannel.NONE) {
                throw new IllegalArgumentException("target must be a cancellable channel (current: " + target + ")");
            }
        }

        @Override
        public EffectChannel channel() {
            return target;
        }
    }
}
