package com.ryuqq.classdrop.adapter.runner.download;

/**
 * 오프라인 큐 재생 결과.
 *
 * @param retried 이번에 받아서 큐에서 빠진 항목 수
 * @param failed 포기하고 큐에서 뺀 항목 수
 * @param remaining 다음 재생을 기다리는 항목 수
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record OfflineRetryResult(int retried, int failed, int remaining) {

    static OfflineRetryResult empty() {
        return new OfflineRetryResult(0, 0, 0);
    }
}
