package com.ryuqq.classdrop.core.model;

/**
 * 발급된 Bearer 자격 증명과 발급 시각.
 *
 * <p>제공자는 만료 시각을 알려주지 않으므로 발급 시각과 가정된 수명으로
 * 만료를 추정합니다.</p>
 *
 * @param token Bearer 토큰
 * @param issuedAt 발급 시각 (epoch millis)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record Credential(String token, long issuedAt) {

    public Credential {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
        if (issuedAt < 0) {
            throw new IllegalArgumentException("issuedAt must be non-negative (current: " + issuedAt + ")");
        }
    }

    /**
     * 발급 후 경과 시간.
     *
     * @param now 현재 시각 (epoch millis)
     * @return 경과 밀리초 (시계가 뒤로 가면 0)
     */
    public long ageMillis(long now) {
        return Math.max(0, now - issuedAt);
    }

    @Override
    public String toString() {
        // 토큰 값은 로그에 남기지 않음
        return "Credential{issuedAt=" + issuedAt + '}';
    }
}
