package com.ryuqq.classdrop.core.error;

/**
 * 원격 API가 2xx가 아닌 상태 코드로 응답했을 때의 예외.
 *
 * <p>전송 계층 실패(타임아웃, 연결 끊김)는 이 예외가 아니라
 * {@link java.io.IOException}으로 표현됩니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class ApiException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String retryAfter;

    /**
     * 생성자.
     *
     * @param status HTTP 상태 코드
     * @param message 오류 메시지
     */
    public ApiException(int status, String message) {
        this(status, message, null);
    }

    /**
     * 생성자 (Retry-After 헤더 포함).
     *
     * @param status HTTP 상태 코드
     * @param message 오류 메시지
     * @param retryAfter Retry-After 헤더 원문 (없으면 null)
     */
    public ApiException(int status, String message, String retryAfter) {
        super("HTTP " + status + (message == null || message.isBlank() ? "" : ": " + message));
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status must be a valid HTTP status (current: " + status + ")");
        }
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Retry-After 헤더 원문.
     *
     * @return 헤더 값 (없으면 null)
     */
    public String getRetryAfter() {
        return retryAfter;
    }

    /**
     * 429 (quota exceeded) 여부.
     *
     * @return 스로틀링 응답이면 true
     */
    public boolean isThrottled() {
        return status == 429;
    }
}
