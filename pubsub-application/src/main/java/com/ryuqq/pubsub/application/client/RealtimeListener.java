package com.ryuqq.pubsub.application.client;

import com.ryuqq.pubsub.core.model.Message;
import com.ryuqq.pubsub.core.status.Status;

/**
 * 실시간 알림 수신자.
 *
 * <p>콜백은 엔진 처리 레인에서 호출되므로 오래 걸리는 작업은 별도 스레드로 넘겨야 합니다.
 * 콜백에서 발생한 예외는 로그로만 남고 다른 리스너와 엔진에는 영향을 주지 않습니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public interface RealtimeListener {

    /**
     * 연결 상태 또는 하트비트 결과 알림.
     *
     * @param status 상태
     */
    default void onStatus(Status status) {
    }

    /**
     * 중복 제거를 거친 수신 메시지 알림.
     *
     * @param message 메시지
     */
    default void onMessage(Message message) {
    }
}
