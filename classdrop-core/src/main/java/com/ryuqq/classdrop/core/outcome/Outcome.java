package com.ryuqq.classdrop.core.outcome;

/**
 * 다운로드 작업 1회 시도의 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 저장까지 완료됨</li>
 *   <li>{@link Retry}: 일시적 실패 (스로틀링, 네트워크), 재시도 가능</li>
 *   <li>{@link Fail}: 항목 단위 영구 실패 (401/403/404 등), 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 허용된 구현을 컴파일 타임에 고정합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok ok) {
 *     progress.recordSuccess(ok.savedPath());
 * } else if (outcome instanceof Retry retry) {
 *     scheduleRetry(retry.attemptCount());
 * } else if (outcome instanceof Fail fail) {
 *     progress.recordFailure(fail.errorCode());
 * }
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
