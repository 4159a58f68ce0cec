package com.ryuqq.classdrop.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 컬렉션(강의)에 대한 카탈로그 조회 결과.
 *
 * <p>RecordCache에 저장되는 페이로드이며, DownloadOrchestrator가 배치를
 * 구성할 때 읽습니다.</p>
 *
 * <p><strong>순회 순서:</strong> assignments → materials → announcements.
 * 배치 구성과 중복 제거는 이 순서를 따릅니다.</p>
 *
 * @param collectionId 컬렉션 ID
 * @param collectionName 컬렉션 이름 (배치 폴더 이름의 원천)
 * @param assignments 과제 레코드
 * @param materials 자료 레코드
 * @param announcements 공지 레코드
 * @param fetchedAt 조회 시각 (epoch millis)
 * @param truncated 캐시 용량 때문에 축소되었는지 여부
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record CatalogSnapshot(
    String collectionId,
    String collectionName,
    List<CourseRecord> assignments,
    List<CourseRecord> materials,
    List<CourseRecord> announcements,
    long fetchedAt,
    boolean truncated
) {

    public CatalogSnapshot {
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("collectionId cannot be null or blank");
        }
        if (collectionName == null || collectionName.isBlank()) {
            collectionName = "Unknown Course";
        }
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        materials = materials == null ? List.of() : List.copyOf(materials);
        announcements = announcements == null ? List.of() : List.copyOf(announcements);
    }

    /**
     * 전체 레코드를 순회 순서대로 반환.
     *
     * @return assignments, materials, announcements를 이어 붙인 목록
     */
    public List<CourseRecord> allRecords() {
        List<CourseRecord> all = new ArrayList<>(recordCount());
        all.addAll(assignments);
        all.addAll(materials);
        all.addAll(announcements);
        return all;
    }

    public int recordCount() {
        return assignments.size() + materials.size() + announcements.size();
    }

    /**
     * 종류별 레코드 조회.
     *
     * @param kind 레코드 종류
     * @return 해당 종류의 레코드 목록
     */
    public List<CourseRecord> recordsOf(RecordKind kind) {
        switch (kind) {
            case ASSIGNMENT:
                return assignments;
            case MATERIAL:
                return materials;
            case ANNOUNCEMENT:
                return announcements;
            default:
                throw new IllegalArgumentException("Unknown kind: " + kind);
        }
    }

    /**
     * 특정 종류의 레코드를 앞에서부터 limit개만 남긴 사본 생성.
     *
     * @param kind 레코드 종류
     * @param limit 남길 개수 (0이면 전부 제거)
     * @return 축소 표시가 된 새 스냅샷
     */
    public CatalogSnapshot limit(RecordKind kind, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
        List<CourseRecord> a = kind == RecordKind.ASSIGNMENT ? head(assignments, limit) : assignments;
        List<CourseRecord> m = kind == RecordKind.MATERIAL ? head(materials, limit) : materials;
        List<CourseRecord> n = kind == RecordKind.ANNOUNCEMENT ? head(announcements, limit) : announcements;
        return new CatalogSnapshot(collectionId, collectionName, a, m, n, fetchedAt, true);
    }

    private static List<CourseRecord> head(List<CourseRecord> records, int limit) {
        return records.size() <= limit ? records : records.subList(0, limit);
    }
}
