/**
 * Error taxonomy package.
 *
 * <p>Checked exceptions raised by the external collaborators, and the classifier that maps any
 * failure to one of THROTTLED, TRANSIENT, TERMINAL_ITEM or TERMINAL_BATCH.</p>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.core.error;
