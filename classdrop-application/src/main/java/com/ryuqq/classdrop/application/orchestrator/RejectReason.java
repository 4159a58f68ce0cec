package com.ryuqq.classdrop.application.orchestrator;

/**
 * 배치 제출 거부 사유.
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public enum RejectReason {

    /**
     * 다른 배치가 이미 실행 중.
     */
    BATCH_ALREADY_ACTIVE,

    /**
     * 요청된 항목이 없음.
     */
    NOTHING_SELECTED,

    /**
     * 요청된 식별자 중 카탈로그와 일치하는 첨부가 없음.
     */
    NOTHING_MATCHED,

    /**
     * 유효한 자격 증명을 얻지 못해 시작하지 못함.
     */
    CREDENTIAL_UNAVAILABLE
}
