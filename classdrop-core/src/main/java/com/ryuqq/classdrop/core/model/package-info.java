/**
 * Core domain model package.
 *
 * <p>Immutable value objects shared by every ClassDrop component:</p>
 *
 * <h2>Catalog</h2>
 * <ul>
 *   <li>{@link com.ryuqq.classdrop.core.model.CollectionId} - Collection (course) identifier</li>
 *   <li>{@link com.ryuqq.classdrop.core.model.CatalogSnapshot} - Cached catalog payload</li>
 *   <li>{@link com.ryuqq.classdrop.core.model.CourseRecord} - Assignment, material or announcement</li>
 *   <li>{@link com.ryuqq.classdrop.core.model.Attachment} - Tagged union of drive file, video, link and form</li>
 * </ul>
 *
 * <h2>Download</h2>
 * <ul>
 *   <li>{@link com.ryuqq.classdrop.core.model.DownloadJob} - One deduplicated job in a batch</li>
 *   <li>{@link com.ryuqq.classdrop.core.model.BatchProgress} - Persisted batch progress snapshot</li>
 * </ul>
 *
 * <h2>Credentials</h2>
 * <ul>
 *   <li>{@link com.ryuqq.classdrop.core.model.Credential} - Bearer token with issuance time</li>
 *   <li>{@link com.ryuqq.classdrop.core.model.RefreshLock} - Durable refresh mutex record</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.core.model;
