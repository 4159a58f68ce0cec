package com.ryuqq.classdrop.application.orchestrator;

import com.ryuqq.classdrop.core.model.BatchProgress;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;

import java.util.Set;

/**
 * 다운로드 배치 조정자.
 *
 * <p>캐시된 카탈로그와 선택된 첨부 식별자로 중복 제거된 배치를 만들고,
 * 동시성 상한, 재시도, 취소를 지원하며 비동기로 실행합니다.</p>
 *
 * <p><strong>배치 상태:</strong> {@code IDLE → RUNNING → (COMPLETED | CANCELLED)}.
 * 프로세스 전체에서 동시에 하나의 배치만 RUNNING일 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SubmitResult result = orchestrator.submit(catalog, Set.of("file-1", "file-2", "yt-abc"));
 * if (result.isAccepted()) {
 *     while (orchestrator.progress().active()) {
 *         render(orchestrator.progress());
 *     }
 * }
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface DownloadOrchestrator {

    /**
     * 배치 제출.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>실행 중인 배치가 있으면 즉시 거부 (BATCH_ALREADY_ACTIVE)</li>
     *   <li>카탈로그의 모든 레코드 첨부를 순회하며 requestedIds에 있는 것만 수집, 식별자로 중복 제거</li>
     *   <li>콘텐츠 항목과 링크 항목으로 분리 (링크는 하나의 매니페스트 작업으로 합침)</li>
     *   <li>둘 다 비어 있으면 거부 (NOTHING_SELECTED / NOTHING_MATCHED)</li>
     *   <li>자격 증명 사전 검증 실패 시 거부 (CREDENTIAL_UNAVAILABLE)</li>
     *   <li>진행 상황을 기록하고 즉시 반환, 작업은 비동기로 진행</li>
     * </ol>
     *
     * @param catalog 캐시된 카탈로그
     * @param requestedIds 선택된 첨부 식별자
     * @return 제출 결과
     * @throws IllegalArgumentException catalog가 null인 경우
     */
    SubmitResult submit(CatalogSnapshot catalog, Set<String> requestedIds);

    /**
     * 실행 중인 배치 취소.
     *
     * <p>중단 플래그만 설정합니다. 이미 시작된 전송은 끝까지 진행되고,
     * 새 작업은 꺼내지 않습니다.</p>
     */
    void cancel();

    /**
     * 진행 상황 스냅샷 (자주 폴링해도 안전).
     *
     * @return 현재 또는 마지막 배치의 진행 상황
     */
    BatchProgress progress();

    /**
     * 배치 실행 여부.
     *
     * @return RUNNING 배치가 있으면 true
     */
    boolean isRunning();
}
