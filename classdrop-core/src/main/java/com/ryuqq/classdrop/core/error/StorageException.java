package com.ryuqq.classdrop.core.error;

/**
 * 내구성 KV 저장소 쓰기 실패.
 *
 * <p>{@link #isQuotaExceeded()}가 true이면 저장소 전체 용량 제한에 걸린 것입니다.
 * 이 경우는 캐시가 항목을 비우고 한 번 재시도할 수 있습니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean quotaExceeded;

    public StorageException(String message, boolean quotaExceeded) {
        super(message);
        this.quotaExceeded = quotaExceeded;
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.quotaExceeded = false;
    }

    public boolean isQuotaExceeded() {
        return quotaExceeded;
    }
}
