/**
 * Protection SPI package.
 *
 * <p>Outbound request pacing. {@link com.ryuqq.classdrop.core.protection.RateLimiter} is the
 * leaf component every remote call passes through; the runner module provides the token
 * bucket implementation and {@code noop} a pass-through one.</p>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.core.protection;
