package com.ryuqq.classdrop.core.error;

/**
 * 오류 분류.
 *
 * <ul>
 *   <li>THROTTLED: 서버 스로틀링, 백오프 후 재시도</li>
 *   <li>TRANSIENT: 네트워크/타임아웃/5xx, 지수 백오프 + jitter 후 재시도</li>
 *   <li>TERMINAL_ITEM: 단일 항목의 401/403/404 등, 기록 후 배치 계속</li>
 *   <li>TERMINAL_BATCH: 자격 증명 없음, 저장소 사용 불가, 배치 전체 중단</li>
 * </ul>
 *
 * <p>잠금 경합은 오류가 아니므로 분류에 없습니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    THROTTLED,

    TRANSIENT,

    TERMINAL_ITEM,

    TERMINAL_BATCH;

    public boolean isRetryable() {
        return this == THROTTLED || this == TRANSIENT;
    }
}
