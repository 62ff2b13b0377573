package com.ryuqq.pubsub.core.exception;

/**
 * 실시간 엔진에서 발생하는 모든 실패의 기반 예외.
 *
 * <p>엔진은 이 예외를 던지지 않고 이벤트 페이로드로 전달합니다.
 * 재시도 여부는 {@link #isRetryable()}로 판단하며, 최종 판단은
 * {@link com.ryuqq.pubsub.core.retry.RetryPolicy}가 내립니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>{@link TransportException}: 네트워크/타임아웃 (재시도 가능)</li>
 *   <li>{@link ServerException}: 2xx가 아닌 응답 (429, 5xx만 재시도 가능)</li>
 * </ul>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public abstract class PubSubException extends RuntimeException {

    protected PubSubException(String message) {
        super(message);
    }

    protected PubSubException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 재시도 정책에 넘겨도 되는 실패인지 확인.
     *
     * @return 재시도 가능하면 true
     */
    public abstract boolean isRetryable();
}
