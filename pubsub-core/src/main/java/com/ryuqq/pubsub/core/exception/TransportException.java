package com.ryuqq.pubsub.core.exception;

/**
 * 네트워크 오류 또는 요청 타임아웃.
 *
 * <p>응답을 받지 못한 모든 경우를 나타내며 항상 재시도 대상입니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public class TransportException extends PubSubException {

    private final boolean timeout;

    public TransportException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public TransportException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    /**
     * 타임아웃으로 인한 실패 여부.
     *
     * @return 타임아웃이면 true
     */
    public boolean isTimeout() {
        return timeout;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
