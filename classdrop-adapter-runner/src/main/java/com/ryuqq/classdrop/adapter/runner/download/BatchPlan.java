package com.ryuqq.classdrop.adapter.runner.download;

import java.util.List;

/**
 * 제출 시점에 확정된 배치 구성.
 *
 * @param batchId 배치 식별자 (배치 폴더 이름)
 * @param collectionName 컬렉션 이름
 * @param contentJobs 제출 순서대로 정렬된 콘텐츠 작업
 * @param links 매니페스트 항목
 * @author ClassDrop Team
 * @since 1.0.0
 */
record BatchPlan(String batchId, String collectionName, List<PlannedJob> contentJobs, List<LinkEntry> links) {

    BatchPlan {
        contentJobs = List.copyOf(contentJobs);
        links = List.copyOf(links);
    }

    boolean hasWork() {
        return !contentJobs.isEmpty() || !links.isEmpty();
    }

    boolean hasLinks() {
        return !links.isEmpty();
    }

    /**
     * 전체 작업 수. 링크는 하나의 매니페스트 작업으로 계산합니다.
     */
    int total() {
        return contentJobs.size() + (links.isEmpty() ? 0 : 1);
    }
}
