package com.ryuqq.classdrop.core.model;

/**
 * 외부 웹 링크 첨부 (링크 항목).
 *
 * <p>식별자를 주지 않으면 URL 해시로 {@code link-<hash>}를 만듭니다.
 * 같은 URL은 항상 같은 식별자를 가지므로 레코드 간 중복 제거가 됩니다.</p>
 *
 * @param id 첨부 식별자
 * @param title 제목
 * @param url 링크 URL
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record WebLink(String id, String title, String url) implements Attachment {

    public WebLink {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (id == null || id.isBlank()) {
            id = idFor(url);
        }
        if (title == null || title.isBlank()) {
            title = url;
        }
    }

    /**
     * URL로 첨부 식별자 생성.
     *
     * @param url 링크 URL
     * @return {@code link-<hash>}
     */
    public static String idFor(String url) {
        return "link-" + Integer.toHexString(url.hashCode());
    }
}
