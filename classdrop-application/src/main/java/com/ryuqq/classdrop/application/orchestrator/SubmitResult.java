package com.ryuqq.classdrop.application.orchestrator;

/**
 * 배치 제출 결과.
 *
 * <p>제출은 작업 완료를 기다리지 않고 즉시 반환되며, 두 가지 상태 중 하나입니다.</p>
 *
 * <ul>
 *   <li><strong>수락 (accepted = true):</strong> batchId와 total이 채워지고,
 *       진행 상황은 {@link DownloadOrchestrator#progress()}로 폴링합니다.</li>
 *   <li><strong>거부 (accepted = false):</strong> reason과 message가 채워지며,
 *       배치는 시작되지 않았습니다 (부분 실패와 구분되는 전체 실패).</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SubmitResult result = orchestrator.submit(catalog, selectedIds);
 * if (result.isAccepted()) {
 *     poll(result.getBatchId());
 * } else if (result.getReason() == RejectReason.CREDENTIAL_UNAVAILABLE) {
 *     promptSignIn(result.getMessage());
 * }
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class SubmitResult {

    private final boolean accepted;
    private final String batchId;
    private final int total;
    private final RejectReason reason;
    private final String message;

    private SubmitResult(boolean accepted, String batchId, int total, RejectReason reason, String message) {
        this.accepted = accepted;
        this.batchId = batchId;
        this.total = total;
        this.reason = reason;
        this.message = message;
    }

    /**
     * 수락 결과 생성.
     *
     * @param batchId 배치 식별자
     * @param total 전체 작업 수 (링크 매니페스트 포함)
     * @return SubmitResult (accepted=true)
     * @throws IllegalArgumentException batchId가 null/blank이거나 total이 양수가 아닌 경우
     */
    public static SubmitResult accepted(String batchId, int total) {
        if (batchId == null || batchId.isBlank()) {
            throw new IllegalArgumentException("batchId cannot be null or blank for accepted result");
        }
        if (total <= 0) {
            throw new IllegalArgumentException("total must be positive (current: " + total + ")");
        }
        return new SubmitResult(true, batchId, total, null, null);
    }

    /**
     * 거부 결과 생성.
     *
     * @param reason 거부 사유
     * @param message 진단 메시지
     * @return SubmitResult (accepted=false)
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public static SubmitResult rejected(RejectReason reason, String message) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null for rejected result");
        }
        return new SubmitResult(false, null, 0, reason, message);
    }

    public boolean isAccepted() {
        return accepted;
    }

    /**
     * 배치 식별자 조회.
     *
     * @return 수락된 경우 배치 식별자, 거부된 경우 null
     */
    public String getBatchId() {
        return batchId;
    }

    public int getTotal() {
        return total;
    }

    /**
     * 거부 사유 조회.
     *
     * @return 거부된 경우 사유, 수락된 경우 null
     */
    public RejectReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (accepted) {
            return "SubmitResult{accepted=true, batchId=" + batchId + ", total=" + total + "}";
        }
        return "SubmitResult{accepted=false, reason=" + reason + ", message=" + message + "}";
    }
}
