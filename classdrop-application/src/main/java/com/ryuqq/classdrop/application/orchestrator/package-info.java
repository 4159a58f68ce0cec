/**
 * Download orchestration port.
 *
 * <p>{@link com.ryuqq.classdrop.application.orchestrator.DownloadOrchestrator} is the entry point
 * a UI or background handler calls to start, cancel and poll a download batch.</p>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.application.orchestrator;
