package com.ryuqq.classdrop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 강의 레코드에 첨부된 항목 (tagged union).
 *
 * <p>판별자 필드 {@code type}으로 변형을 구분하며, 각 변형은
 * 자신에게 필요한 필드만 가집니다.</p>
 *
 * <ul>
 *   <li>{@link DriveFile} ({@code driveFile}): 실제 다운로드 대상 파일</li>
 *   <li>{@link YoutubeVideo} ({@code youtube}): 링크 항목</li>
 *   <li>{@link WebLink} ({@code link}): 링크 항목</li>
 *   <li>{@link FormLink} ({@code form}): 링크 항목</li>
 * </ul>
 *
 * <p>링크 항목은 개별로 다운로드되지 않고 배치 종료 시 하나의
 * 리소스 매니페스트 파일로 모입니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DriveFile.class, name = "driveFile"),
    @JsonSubTypes.Type(value = YoutubeVideo.class, name = "youtube"),
    @JsonSubTypes.Type(value = WebLink.class, name = "link"),
    @JsonSubTypes.Type(value = FormLink.class, name = "form")
})
public sealed interface Attachment permits DriveFile, YoutubeVideo, WebLink, FormLink {

    /**
     * 첨부 식별자 (배치 내 중복 제거 기준).
     *
     * @return 식별자
     */
    String id();

    /**
     * 표시용 제목.
     *
     * @return 제목
     */
    String title();

    /**
     * 링크 항목 여부.
     *
     * @return DriveFile이 아니면 true
     */
    @JsonIgnore
    default boolean isLink() {
        return !(this instanceof DriveFile);
    }
}
