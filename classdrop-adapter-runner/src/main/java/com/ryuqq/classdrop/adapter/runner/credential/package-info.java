/**
 * Credential lifecycle: cached bearer tokens, lock-serialized refresh and proactive renewal.
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.adapter.runner.credential;
