package com.ryuqq.pubsub.core.exception;

/**
 * 서버가 2xx가 아닌 상태 코드로 응답한 경우.
 *
 * <p>429 Too Many Requests와 5xx만 재시도 가능합니다.
 * 4xx(예: 403 권한 없음, 400 잘못된 요청)는 다시 보내도 결과가 같으므로 즉시 실패합니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public class ServerException extends PubSubException {

    private final int statusCode;
    private final String body;

    public ServerException(int statusCode, String body) {
        super("Server responded with status " + statusCode + (body == null ? "" : ": " + body));
        if (statusCode >= 200 && statusCode < 300) {
            throw new IllegalArgumentException("statusCode must not be 2xx (current: " + statusCode + ")");
        }
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * 서버가 보낸 오류 본문.
     *
     * @return 본문 또는 null
     */
    public String getBody() {
        return body;
    }

    /**
     * 접근 거부(403) 여부.
     *
     * @return 403이면 true
     */
    public boolean isAccessDenied() {
        return statusCode == 403;
    }

    @Override
    public boolean isRetryable() {
        return statusCode == 429 || statusCode >= 500;
    }
}
