package com.ryuqq.classdrop.core.model;

import java.util.List;

/**
 * 카탈로그의 부모 레코드 (과제, 자료, 공지).
 *
 * @param id 레코드 ID
 * @param title 레코드 제목
 * @param kind 레코드 종류
 * @param attachments 첨부 목록 (null이면 빈 목록)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record CourseRecord(
    String id,
    String title,
    RecordKind kind,
    List<Attachment> attachments
) {

    public CourseRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (title == null) {
            title = "";
        }
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
