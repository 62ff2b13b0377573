package com.ryuqq.pubsub.core.model;

/**
 * 수신 루프에서 전달된 실시간 메시지.
 *
 * <p>payload는 복호화가 끝난 불투명 문자열이며, 엔진은 내용을 해석하지 않습니다.</p>
 *
 * @param channel 메시지가 게시된 채널
 * @param subscription 매칭된 구독 (channel group 또는 wildcard, 직접 구독이면 null)
 * @param timetoken 게시 timetoken (10진수 문자열)
 * @param publisher 게시자 식별자 (null 허용)
 * @param payload 메시지 본문 (null 불가)
 * @param sequence 게시 순번 (서버가 제공하지 않으면 null)
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record Message(
    String channel,
    String subscription,
    String timetoken,
    String publisher,
    String payload,
    Long sequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Message {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
        if (timetoken == null || timetoken.isBlank()) {
            throw new IllegalArgumentException("timetoken cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    /**
     * 채널 직접 구독 메시지 생성.
     *
     * @param channel 채널
     * @param timetoken 게시 timetoken
     * @param payload 본문
     * @return Message 인스턴스
     */
    public static Message of(String channel, String timetoken, String payload) {
        return new Message(channel, null, timetoken, null, payload, null);
    }

    /**
     * payload만 교체한 새 Message (복호화 결과 적용 시 사용).
     *
     * @param payload 새 본문
     * @return 새 Message
     */
    public Message withPayload(String payload) {
        return new Message(channel, subscription, timetoken, publisher, payload, sequence);
    }

    /**
     * 중복 제거용 식별자.
     *
     * @return MessageIdentity
     */
    public MessageIdentity identity() {
        return MessageIdentity.of(this);
    }
}
