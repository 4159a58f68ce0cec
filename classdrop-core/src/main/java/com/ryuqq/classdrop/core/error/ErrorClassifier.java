package com.ryuqq.classdrop.core.error;

import java.io.IOException;

/**
 * 예외를 {@link ErrorCategory}로 분류.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>ApiException 429 → THROTTLED</li>
 *   <li>ApiException 408, 5xx → TRANSIENT</li>
 *   <li>ApiException 그 밖의 4xx → TERMINAL_ITEM</li>
 *   <li>IOException → TRANSIENT</li>
 *   <li>CredentialException NETWORK → TRANSIENT, 그 외 → TERMINAL_BATCH</li>
 *   <li>StorageException → TERMINAL_BATCH</li>
 *   <li>그 외 → TERMINAL_ITEM</li>
 * </ul>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class ErrorClassifier {

    // Utility class - prevent instantiation
    private ErrorClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 예외 분류.
     *
     * @param error 분류할 예외
     * @return 오류 분류
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static ErrorCategory classify(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (error instanceof ApiException api) {
            return classifyStatus(api.getStatus());
        }
        if (error instanceof IOException) {
            return ErrorCategory.TRANSIENT;
        }
        if (error instanceof CredentialException credential) {
            return credential.isRetryable() ? ErrorCategory.TRANSIENT : ErrorCategory.TERMINAL_BATCH;
        }
        if (error instanceof StorageException) {
            return ErrorCategory.TERMINAL_BATCH;
        }
        return ErrorCategory.TERMINAL_ITEM;
    }

    /**
     * HTTP 상태 코드 분류.
     *
     * @param status HTTP 상태 코드
     * @return 오류 분류
     */
    public static ErrorCategory classifyStatus(int status) {
        if (status == 429) {
            return ErrorCategory.THROTTLED;
        }
        if (status == 408 || status >= 500) {
            return ErrorCategory.TRANSIENT;
        }
        return ErrorCategory.TERMINAL_ITEM;
    }
}
