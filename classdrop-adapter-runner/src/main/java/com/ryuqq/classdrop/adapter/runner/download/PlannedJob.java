package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.core.model.DownloadJob;

/**
 * 저장 경로가 정해진 콘텐츠 작업.
 *
 * @param job 다운로드 작업 (PENDING)
 * @param path 저장 경로 ({@code <folder>/<uniqueName>})
 * @author ClassDrop Team
 * @since 1.0.0
 */
record PlannedJob(DownloadJob job, String path) {
}
