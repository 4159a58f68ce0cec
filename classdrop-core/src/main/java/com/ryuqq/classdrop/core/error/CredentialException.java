package com.ryuqq.classdrop.core.error;

/**
 * 자격 증명 제공자 오류.
 *
 * <p>호출 측 UI가 다시 로그인을 요청할지, 네트워크 오류를 보여줄지,
 * 설정 오류를 보여줄지 결정할 수 있도록 종류를 구분합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class CredentialException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * 자격 증명 오류 종류.
     */
    public enum Kind {

        /**
         * 사용자가 로그인 창을 닫음.
         */
        CANCELLED,

        /**
         * 네트워크 장애 (재시도 가능).
         */
        NETWORK,

        /**
         * OAuth 설정 오류.
         */
        CONFIG,

        /**
         * 비대화형 요청에 토큰이 없음, 또는 기타 원인.
         */
        UNAVAILABLE
    }

    private final Kind kind;

    public CredentialException(Kind kind, String message) {
        this(kind, message, null);
    }

    public CredentialException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 재시도로 해결될 수 있는 오류인지 확인.
     *
     * @return NETWORK이면 true
     */
    public boolean isRetryable() {
        return kind == Kind.NETWORK;
    }
}
