package com.ryuqq.classdrop.core.protection;

import com.ryuqq.classdrop.core.error.ApiException;

import java.io.IOException;

/**
 * Rate Limiter SPI.
 *
 * <p>원격 API로 나가는 모든 요청의 속도를 제한하고, 서버가 보낸
 * 스로틀링 신호(429)를 흡수합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>acquire는 지연만 시킬 뿐 실패하지 않습니다 (인터럽트 제외)</li>
 *   <li>429 응답을 받으면 호출자가 {@link #report429(String)}를 호출합니다</li>
 *   <li>성공 응답을 받으면 호출자가 {@link #clearBackoff()}를 호출합니다</li>
 *   <li>{@link #execute(Priority, RemoteCall)}는 위 계약을 대신 수행합니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CatalogSnapshot snapshot = rateLimiter.execute(Priority.HIGH,
 *     () -> catalogApi.fetchCollection(collectionId, token));
 * }</pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 허가를 받을 때까지 대기.
     *
     * <p>백오프 윈도우가 활성이면 버킷 상태와 관계없이 윈도우가 끝날 때까지 대기합니다.
     * 대기자 사이에서는 우선순위가 높은 호출자가 먼저 허가를 받습니다.</p>
     *
     * @param priority 우선순위
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void acquire(Priority priority) throws InterruptedException;

    /**
     * 즉시 허가를 시도 (비블로킹).
     *
     * @return 허가되었으면 true
     */
    boolean tryAcquire();

    /**
     * 429 응답 보고.
     *
     * <p>Retry-After 값(초 단위 정수 또는 HTTP 날짜)으로 백오프 윈도우를 설치하거나 연장합니다.
     * 나중에 들어온 더 짧은 지연은 기존의 더 긴 윈도우를 줄이지 않습니다.</p>
     *
     * @param retryAfterValue Retry-After 헤더 원문 (null 허용)
     */
    void report429(String retryAfterValue);

    /**
     * 성공 응답 보고. 활성 백오프 윈도우를 즉시 해제합니다.
     */
    void clearBackoff();

    /**
     * 관측용 스냅샷. 상태를 변경하지 않습니다.
     *
     * @return 현재 통계
     */
    RateLimiterStats stats();

    /**
     * 설정 조회.
     *
     * @return Rate Limiter 설정
     */
    RateLimiterConfig getConfig();

    /**
     * 허가 획득 후 원격 호출을 실행하고 429/성공 계약을 적용.
     *
     * @param priority 우선순위
     * @param call 원격 호출
     * @param <T> 응답 타입
     * @return 호출 결과
     * @throws ApiException 원격 API 오류 (429 포함, report429 후 재던짐)
     * @throws IOException 전송 실패
     * @throws InterruptedException 대기 중 인터럽트
     */
    default <T> T execute(Priority priority, RemoteCall<T> call) throws ApiException, IOException, InterruptedException {
        acquire(priority);
        try {
            T result = call.call();
            clearBackoff();
            return result;
        } catch (ApiException e) {
            if (e.isThrottled()) {
                report429(e.getRetryAfter());
            }
            throw e;
        }
    }
}
