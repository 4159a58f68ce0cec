package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.core.model.DriveFile;

/**
 * 네트워크 장애로 실패해 나중에 다시 받을 파일.
 *
 * @param fileId 파일 ID
 * @param title 표시 이름
 * @param mimeType MIME 타입
 * @param sizeBytes 선언된 크기 (모르면 null)
 * @param path 저장 경로 ({@code <folder>/<uniqueName>})
 * @param reason 마지막 실패 사유
 * @param enqueuedAt 큐에 들어간 시각 (epoch millis)
 * @param retryCount 실패한 재생 횟수
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record OfflineQueueItem(
    String fileId,
    String title,
    String mimeType,
    Long sizeBytes,
    String path,
    String reason,
    long enqueuedAt,
    int retryCount
) {

    public OfflineQueueItem {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("fileId cannot be null or blank");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
    }

    /**
     * 실패한 배치 작업으로부터 생성.
     *
     * @param file 원본 파일
     * @param path 저장 경로
     * @param reason 실패 사유
     * @param now 현재 시각 (epoch millis)
     * @return 재생 횟수 0인 항목
     */
    static OfflineQueueItem of(DriveFile file, String path, String reason, long now) {
        return new OfflineQueueItem(file.id(), file.title(), file.mimeType(), file.sizeBytes(), path, reason, now, 0);
    }

    DriveFile toDriveFile() {
        return new DriveFile(fileId, title, mimeType, sizeBytes, null);
    }

    OfflineQueueItem withFailedRetry(String lastReason) {
        return new OfflineQueueItem(fileId, title, mimeType, sizeBytes, path, lastReason, enqueuedAt, retryCount + 1);
    }
}
