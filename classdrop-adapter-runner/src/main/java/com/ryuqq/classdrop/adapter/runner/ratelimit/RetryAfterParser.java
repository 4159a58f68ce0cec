package com.ryuqq.classdrop.adapter.runner.ratelimit;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.OptionalLong;

/**
 * Retry-After 헤더 파서.
 *
 * <p><strong>허용 형식:</strong></p>
 * <ul>
 *   <li>음이 아닌 정수: 초 단위 지연</li>
 *   <li>RFC 1123 HTTP 날짜: {@code max(0, date - now)}. 과거 날짜는 0</li>
 * </ul>
 *
 * <p>그 외 (null, 빈 문자열, 음수, 해석 불가)는 빈 값을 반환하며
 * 호출자가 기본 지연으로 대체합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class RetryAfterParser {

    // Utility class - prevent instantiation
    private RetryAfterParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Retry-After 값을 지연 시간으로 변환.
     *
     * @param value 헤더 값 (null 허용)
     * @param nowMillis 현재 시각 (epoch millis)
     * @return 지연 시간 (밀리초), 해석 실패 시 빈 값
     */
    public static OptionalLong parseDelayMillis(String value, long nowMillis) {
        if (value == null) {
            return OptionalLong.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return OptionalLong.empty();
        }

        if (isInteger(trimmed)) {
            try {
                long seconds = Long.parseLong(trimmed);
                if (seconds < 0) {
                    return OptionalLong.empty();
                }
                return OptionalLong.of(Math.multiplyExact(seconds, 1000L));
            } catch (NumberFormatException | ArithmeticException e) {
                // 자릿수가 너무 큰 값은 어차피 상한에 걸림
                return OptionalLong.of(Long.MAX_VALUE);
            }
        }

        try {
            long dateMillis = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME)
                .toInstant()
                .toEpochMilli();
            return OptionalLong.of(Math.max(0, dateMillis - nowMillis));
        } catch (DateTimeParseException e) {
            return OptionalLong.empty();
        }
    }

    private static boolean isInteger(String value) {
        int start = value.charAt(0) == '-' || value.charAt(0) == '+' ? 1 : 0;
        if (start == value.length()) {
            return false;
        }
        for (int i = start; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
