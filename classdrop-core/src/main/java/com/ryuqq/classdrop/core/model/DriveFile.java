package com.ryuqq.classdrop.core.model;

import java.util.Optional;

/**
 * Drive 파일 첨부 (다운로드 대상).
 *
 * @param id Drive 파일 ID
 * @param title 파일 제목
 * @param mimeType 원본 MIME 타입 (null 허용)
 * @param sizeBytes 선언된 파일 크기 (알 수 없으면 null)
 * @param alternateLink 웹 링크 (null 허용)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record DriveFile(
    String id,
    String title,
    String mimeType,
    Long sizeBytes,
    String alternateLink
) implements Attachment {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우, sizeBytes가 음수인 경우
     */
    public DriveFile {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (title == null || title.isBlank()) {
            title = "Untitled";
        }
        if (sizeBytes != null && sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be non-negative (current: " + sizeBytes + ")");
        }
    }

    /**
     * 변환 대상 포맷 조회.
     *
     * @return Workspace 문서이면 변환 포맷, 아니면 empty
     */
    public Optional<ExportFormat> exportFormat() {
        return ExportFormat.forSource(mimeType);
    }
}
