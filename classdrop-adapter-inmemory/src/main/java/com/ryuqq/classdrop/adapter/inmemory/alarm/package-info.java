/**
 * Manually fired alarm scheduler for deterministic tests.
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.adapter.inmemory.alarm;
