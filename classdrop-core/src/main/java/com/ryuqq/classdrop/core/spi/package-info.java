/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Narrow contracts for every collaborator that lives outside ClassDrop. The runtime
 * consumes them as black boxes; adapters provide the implementations.</p>
 *
 * <h2>Remote Services</h2>
 * <ul>
 *   <li>{@link com.ryuqq.classdrop.core.spi.CatalogApi} - Course records</li>
 *   <li>{@link com.ryuqq.classdrop.core.spi.ContentApi} - File bytes and converted exports</li>
 *   <li>{@link com.ryuqq.classdrop.core.spi.CredentialProvider} - Bearer tokens, revoke, introspection</li>
 * </ul>
 *
 * <h2>Host Platform</h2>
 * <ul>
 *   <li>{@link com.ryuqq.classdrop.core.spi.KeyValueStore} - Durable storage surviving restarts</li>
 *   <li>{@link com.ryuqq.classdrop.core.spi.FileSink} - File save facility</li>
 *   <li>{@link com.ryuqq.classdrop.core.spi.AlarmScheduler} - Recurring wall-clock alarms</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>classdrop-adapter-inmemory provides in-memory host implementations for tests and
 * reference; remote services are supplied by the embedding application.</p>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.core.spi;
