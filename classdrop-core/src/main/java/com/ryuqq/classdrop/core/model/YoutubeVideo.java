package com.ryuqq.classdrop.core.model;

/**
 * YouTube 동영상 첨부 (링크 항목).
 *
 * <p>식별자는 {@code yt-<videoId>} 형식입니다.</p>
 *
 * @param id 첨부 식별자
 * @param videoId YouTube 동영상 ID
 * @param title 제목
 * @param url 동영상 URL
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record YoutubeVideo(String id, String videoId, String title, String url) implements Attachment {

    public YoutubeVideo {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("videoId cannot be null or blank");
        }
        if (id == null || id.isBlank()) {
            id = idFor(videoId);
        }
        if (title == null || title.isBlank()) {
            title = "YouTube Video";
        }
        if (url == null || url.isBlank()) {
            url = "https://www.youtube.com/watch?v=" + videoId;
        }
    }

    /**
     * 동영상 ID로 첨부 식별자 생성.
     *
     * @param videoId YouTube 동영상 ID
     * @return {@code yt-<videoId>}
     */
    public static String idFor(String videoId) {
        return "yt-" + videoId;
    }
}
