package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.core.effect.EffectHandler;
import com.ryuqq.pubsub.core.exception.PubSubException;
import com.ryuqq.pubsub.core.exception.TransportException;
import com.ryuqq.pubsub.core.spi.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Transport 호출 결과를 성공/실패 콜백으로 분기.
 *
 * <p><strong>분기 규칙:</strong></p>
 * <ul>
 *   <li>2xx 응답 → onSuccess</li>
 *   <li>non-2xx 응답 → onFailure(ServerException)</li>
 *   <li>예외 완료 → onFailure(PubSubException, 그 외 예외는 TransportException으로 감쌈)</li>
 *   <li>취소 → 아무 콜백도 호출하지 않음</li>
 *   <li>요청 생성 또는 전송 시작 중 예외 → 즉시 onFailure (호출 스레드에서)</li>
 * </ul>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
final class TransportCalls {

    private static final Logger log = LoggerFactory.getLogger(TransportCalls.class);

    private TransportCalls() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 호출 시작 및 완료 콜백 등록.
     *
     * <p>Transport 구현이 future를 돌려주기 전에 예외를 던지면 그 예외도 실패로 전달합니다.
     * 엔진은 모든 요청에 대해 결과 이벤트를 받아야 다음 상태로 진행할 수 있습니다.</p>
     *
     * @param call 호출을 시작하는 supplier
     * @param onSuccess 성공 콜백
     * @param onFailure 실패 콜백
     * @return 호출을 중단하는 abort hook
     */
    static Runnable whenDone(Supplier<CompletableFuture<TransportResponse>> call,
                             Consumer<TransportResponse> onSuccess,
                             Consumer<PubSubException> onFailure) {
        CompletableFuture<TransportResponse> started;
        try {
            started = call.get();
        } catch (RuntimeException e) {
            log.warn("Transport call failed to start: {}", e.getMessage());
            onFailure.accept(toPubSubException(e));
            return EffectHandler.NO_ABORT;
        }
        if (started == null) {
            onFailure.accept(new TransportException("Transport returned no call", null));
            return EffectHandler.NO_ABORT;
        }
        started.whenComplete((response, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException) {
                    log.debug("Transport call cancelled");
                    return;
                }
                onFailure.accept(toPubSubException(cause));
                return;
            }
            if (!response.isSuccessful()) {
                onFailure.accept(response.toException());
                return;
            }
            onSuccess.accept(response);
        });
        return () -> started.cancel(true);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static PubSubException toPubSubException(Throwable cause) {
        if (cause instanceof PubSubException pubSubException) {
            return pubSubException;
        }
        return new TransportException("Transport call failed: " + cause.getMessage(), cause);
    }
}
