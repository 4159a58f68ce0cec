package com.ryuqq.classdrop.core.outcome;

/**
 * 성공 결과.
 *
 * <p>파일이 FileSink에 저장되었음을 나타냅니다.</p>
 *
 * @param fileId 첨부 식별자
 * @param savedPath 저장된 경로 (폴더/파일명)
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record Ok(
    String fileId,
    String savedPath
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException fileId가 null이거나 빈 문자열인 경우
     */
    public Ok {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("fileId cannot be null or blank");
        }
        // savedPath는 null 허용
    }
}
