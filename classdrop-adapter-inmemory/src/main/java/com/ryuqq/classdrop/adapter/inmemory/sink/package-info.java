/**
 * In-memory file sink adapter.
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.adapter.inmemory.sink;
