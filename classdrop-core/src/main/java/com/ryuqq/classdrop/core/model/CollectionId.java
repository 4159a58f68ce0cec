package com.ryuqq.classdrop.core.model;

/**
 * 카탈로그 컬렉션(강의)의 식별자.
 *
 * <p>RecordCache의 키이자 CatalogApi 조회 단위입니다.
 * 저장소 키의 접미사로 그대로 사용되므로 허용 문자를 제한합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class CollectionId {

    private final String value;

    private CollectionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CollectionId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CollectionId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("CollectionId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * CollectionId 생성.
     *
     * @param value 컬렉션 ID 값
     * @return CollectionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CollectionId of(String value) {
        return new CollectionId(value);
    }

    /**
     * CollectionId 값 조회.
     *
     * @return 컬렉션 ID 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CollectionId that = (CollectionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CollectionId{" + value + '}';
    }
}
