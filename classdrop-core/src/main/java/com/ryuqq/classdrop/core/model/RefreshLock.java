package com.ryuqq.classdrop.core.model;

/**
 * 자격 증명 갱신 잠금.
 *
 * <p>프로세스가 갱신 도중 재시작될 수 있으므로 메모리가 아닌
 * 내구성 KV 저장소에 기록됩니다. 일정 시간보다 오래된 잠금은
 * 버려진 것으로 보고 빼앗을 수 있습니다.</p>
 *
 * @param lockId 소유자 식별자
 * @param acquiredAt 획득 시각 (epoch millis)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record RefreshLock(String lockId, long acquiredAt) {

    public RefreshLock {
        if (lockId == null || lockId.isBlank()) {
            throw new IllegalArgumentException("lockId cannot be null or blank");
        }
    }

    /**
     * 잠금이 버려졌는지 확인.
     *
     * @param now 현재 시각
     * @param timeoutMs 잠금 유효 시간
     * @return 획득 후 timeoutMs 이상 지났으면 true
     */
    public boolean isStale(long now, long timeoutMs) {
        return now - acquiredAt >= timeoutMs;
    }

    public boolean isOwnedBy(String candidateId) {
        return lockId.equals(candidateId);
    }
}
