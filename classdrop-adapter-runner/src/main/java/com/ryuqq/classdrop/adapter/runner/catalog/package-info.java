/**
 * Cache-first catalog fetching.
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.adapter.runner.catalog;
