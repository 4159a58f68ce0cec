package com.ryuqq.classdrop.core.model;

/**
 * 강의 레코드 종류.
 *
 * <p>선언 순서는 캐시 축소 시 보존 우선순위입니다 (앞쪽이 더 중요).</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public enum RecordKind {

    ASSIGNMENT,

    MATERIAL,

    ANNOUNCEMENT
}
