package com.ryuqq.classdrop.core.protection;

/**
 * Rate Limiter 대기 우선순위.
 *
 * <p>rank가 낮을수록 먼저 허가를 받습니다. 같은 우선순위 안에서는 도착 순서(FIFO)를 따릅니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public enum Priority {

    /**
     * 인증, 강의 메타데이터.
     */
    CRITICAL(0),

    /**
     * 파일 메타데이터, 카탈로그 조회.
     */
    HIGH(1),

    /**
     * 콘텐츠 다운로드.
     */
    NORMAL(2),

    /**
     * 백그라운드 동기화.
     */
    LOW(3);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
