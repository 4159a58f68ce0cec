package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.application.credential.CredentialService;
import com.ryuqq.classdrop.core.error.ApiException;
import com.ryuqq.classdrop.core.error.CredentialException;
import com.ryuqq.classdrop.core.error.ErrorCategory;
import com.ryuqq.classdrop.core.error.ErrorClassifier;
import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.model.DownloadJob;
import com.ryuqq.classdrop.core.model.DriveFile;
import com.ryuqq.classdrop.core.model.ExportFormat;
import com.ryuqq.classdrop.core.outcome.Fail;
import com.ryuqq.classdrop.core.outcome.Ok;
import com.ryuqq.classdrop.core.outcome.Outcome;
import com.ryuqq.classdrop.core.outcome.Retry;
import com.ryuqq.classdrop.core.protection.Priority;
import com.ryuqq.classdrop.core.protection.RateLimiter;
import com.ryuqq.classdrop.core.spi.ContentApi;
import com.ryuqq.classdrop.core.spi.FileSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * 콘텐츠 작업 한 번의 시도를 실행하고 {@link Outcome}으로 변환.
 *
 * <p><strong>시도 순서:</strong></p>
 * <ol>
 *   <li>선언된 크기가 상한 이상이면 시도 없이 {@code FILE_TOO_LARGE}</li>
 *   <li>{@code rateLimiter.acquire(NORMAL)}</li>
 *   <li>{@code credentials.getToken(false)}</li>
 *   <li>Workspace 문서는 convertAndFetch, 나머지는 fetchContent</li>
 *   <li>성공 시 clearBackoff, 429 시 report429</li>
 *   <li>FileSink에 저장</li>
 * </ol>
 *
 * <p><strong>Outcome 매핑:</strong></p>
 * <ul>
 *   <li>THROTTLED / TRANSIENT → {@link Retry} (다음 지연 포함)</li>
 *   <li>TERMINAL_ITEM / TERMINAL_BATCH → {@link Fail}</li>
 *   <li>협력 객체의 예상치 못한 unchecked 예외, 빈 응답 → {@code UNEXPECTED} / {@code EMPTY_CONTENT} {@link Fail}</li>
 * </ul>
 *
 * <p>어떤 경우에도 예외를 던지지 않고 Outcome을 반환하므로 모든 작업이 진행 상황에 집계됩니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
class DownloadJobExecutor {

    private static final Logger log = LoggerFactory.getLogger(DownloadJobExecutor.class);

    private final RateLimiter rateLimiter;
    private final CredentialService credentials;
    private final ContentApi contentApi;
    private final FileSink fileSink;
    private final DownloadRunnerConfig config;
    private final BackoffCalculator backoffCalculator;

    DownloadJobExecutor(RateLimiter rateLimiter, CredentialService credentials, ContentApi contentApi,
                        FileSink fileSink, DownloadRunnerConfig config, BackoffCalculator backoffCalculator) {
        this.rateLimiter = rateLimiter;
        this.credentials = credentials;
        this.contentApi = contentApi;
        this.fileSink = fileSink;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 한 번의 시도 실행.
     *
     * @param job ACTIVE 상태이며 attemptCount가 이번 시도 번호인 작업
     * @param path 저장 경로
     * @return 시도 결과
     */
    Outcome attempt(DownloadJob job, String path) {
        DriveFile file = (DriveFile) job.source();

        Long size = file.sizeBytes();
        if (size != null && size >= config.maxFileBytes()) {
            log.warn("File too large, skipping: fileId={}, sizeBytes={}", file.id(), size);
            return Fail.of("FILE_TOO_LARGE", "File exceeds " + config.maxFileBytes() + " bytes: " + file.title());
        }
        if (size != null && size >= config.largeFileWarnBytes()) {
            log.warn("Large file download: fileId={}, sizeBytes={}", file.id(), size);
        }

        try {
            rateLimiter.acquire(Priority.NORMAL);
            String token = credentials.getToken(false);
            byte[] bytes = fetch(file, token);
            if (bytes == null) {
                log.warn("Content API returned no body: fileId={}", file.id());
                return Fail.of("EMPTY_CONTENT", "No content returned for " + file.title());
            }
            fileSink.save(path, bytes);
            log.debug("Saved {} ({} bytes, attempt {})", path, bytes.length, job.attemptCount());
            return new Ok(file.id(), path);
        } catch (ApiException e) {
            return toOutcome(job, e, "HTTP_" + e.getStatus());
        } catch (IOException e) {
            return toOutcome(job, e, "IO_ERROR");
        } catch (CredentialException e) {
            return toOutcome(job, e, "CREDENTIAL_" + e.getKind());
        } catch (StorageException e) {
            return toOutcome(job, e, "STORAGE_ERROR");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Fail.of("INTERRUPTED", "Interrupted while downloading " + file.title());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while downloading: fileId={}", file.id(), e);
            return Fail.of("UNEXPECTED", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private byte[] fetch(DriveFile file, String token) throws ApiException, IOException {
        Optional<ExportFormat> format = file.exportFormat();
        try {
            byte[] bytes = format.isPresent()
                ? contentApi.convertAndFetch(file.id(), format.get(), token)
                : contentApi.fetchContent(file.id(), token);
            rateLimiter.clearBackoff();
            return bytes;
        } catch (ApiException e) {
            if (e.isThrottled()) {
                rateLimiter.report429(e.getRetryAfter());
            }
            throw e;
        }
    }

    private Outcome toOutcome(DownloadJob job, Exception error, String errorCode) {
        ErrorCategory category = ErrorClassifier.classify(error);
        if (category.isRetryable()) {
            long delay = backoffCalculator.calculate(job.attemptCount());
            return new Retry(category + ": " + error.getMessage(), category, job.attemptCount(), delay);
        }
        return new Fail(errorCode, String.valueOf(error.getMessage()), category);
    }
}
