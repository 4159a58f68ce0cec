/**
 * Download attempt outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the result of a single
 * download attempt. The runner decides between recording, retrying and failing a job
 * from these values alone.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.classdrop.core.outcome.Ok} - File fetched and saved</li>
 *   <li>{@link com.ryuqq.classdrop.core.outcome.Retry} - Throttled or transient failure (retryable)</li>
 *   <li>{@link com.ryuqq.classdrop.core.outcome.Fail} - Terminal per-item failure (non-retryable)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.core.outcome;
