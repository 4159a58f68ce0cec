package com.ryuqq.classdrop.core.outcome;

import com.ryuqq.classdrop.core.error.ErrorCategory;

/**
 * 영구 실패 결과.
 *
 * <p>재시도해도 결과가 바뀌지 않는 항목 단위 실패입니다.
 * 배치는 중단되지 않고 failed 카운트만 증가합니다.</p>
 *
 * @param errorCode 오류 코드 (예: HTTP_403, FILE_TOO_LARGE)
 * @param message 오류 메시지
 * @param category 분류 (재시도 불가 카테고리만 허용)
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    ErrorCategory category
) implements Outcome {

    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            message = errorCode;
        }
        if (category == null) {
            category = ErrorCategory.TERMINAL_ITEM;
        }
        if (category.isRetryable()) {
            throw new IllegalArgumentException("category must not be retryable (current: " + category + ")");
        }
    }

    /**
     * 항목 단위 실패 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, ErrorCategory.TERMINAL_ITEM);
    }

    /**
     * 자격 증명/저장소 장애처럼 이후 작업도 실패할 가능성이 높은지 여부.
     *
     * @return TERMINAL_BATCH면 true
     */
    public boolean affectsBatch() {
        return category == ErrorCategory.TERMINAL_BATCH;
    }
}
