package com.ryuqq.classdrop.core.model;

/**
 * Google Form 첨부 (링크 항목).
 *
 * @param id 첨부 식별자 ({@code form-<hash>})
 * @param title 제목
 * @param formUrl 폼 URL
 * @param responseUrl 응답 URL (null 허용)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record FormLink(String id, String title, String formUrl, String responseUrl) implements Attachment {

    public FormLink {
        if (formUrl == null || formUrl.isBlank()) {
            throw new IllegalArgumentException("formUrl cannot be null or blank");
        }
        if (id == null || id.isBlank()) {
            id = idFor(formUrl);
        }
        if (title == null || title.isBlank()) {
            title = "Google Form";
        }
    }

    public static String idFor(String formUrl) {
        return "form-" + Integer.toHexString(formUrl.hashCode());
    }
}
