/**
 * Bounded-concurrency download runtime.
 *
 * <p>{@link com.ryuqq.classdrop.adapter.runner.download.QueueDownloadRunner} implements
 * {@link com.ryuqq.classdrop.application.orchestrator.DownloadOrchestrator}. A single dispatcher
 * thread releases jobs in submission order and a semaphore caps in-flight transfers. Each attempt
 * resolves to an {@link com.ryuqq.classdrop.core.outcome.Outcome}. Retries back off exponentially
 * with jitter, and terminal failures are counted without stopping the batch.</p>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.adapter.runner.download;
