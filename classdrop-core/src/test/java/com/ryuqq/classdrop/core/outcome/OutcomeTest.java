package com.ryuqq.classdrop.core.outcome;

import com.ryuqq.classdrop.core.error.ErrorCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome 계층 테스트.
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_IsOkOnly() {
        Outcome outcome = new Ok("f1", "Physics/Notes.pdf");

        assertTrue(outcome.isOk());
        assertFalse(outcome.isRetry());
        assertFalse(outcome.isFail());
    }

    @Test
    void retry_ZeroAttemptCount_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Retry("timeout", ErrorCategory.TRANSIENT, 0, 0)
        );
        assertTrue(exception.getMessage().contains("attemptCount must be positive"));
    }

    @Test
    void retry_NegativeDelay_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Retry("HTTP 503", ErrorCategory.TRANSIENT, 1, -1));
    }

    @Test
    void retry_TerminalCategory_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new Retry("HTTP 404", ErrorCategory.TERMINAL_ITEM, 1, 0));
    }

    @Test
    void retry_Budget_StopsAtMaxAttempts() {
        Retry throttled = new Retry("THROTTLED: HTTP 429", ErrorCategory.THROTTLED, 2, 2000);

        assertTrue(throttled.isThrottled());
        assertTrue(throttled.hasBudget(3));
        assertFalse(throttled.hasBudget(2));
    }

    @Test
    void fail_DefaultsToItemScope() {
        Fail fail = Fail.of("HTTP_403", "Forbidden");

        assertTrue(fail.isFail());
        assertEquals(ErrorCategory.TERMINAL_ITEM, fail.category());
        assertFalse(fail.affectsBatch());
    }

    @Test
    void fail_RetryableCategory_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new Fail("HTTP_503", "Unavailable", ErrorCategory.TRANSIENT));
    }

    @Test
    void fail_CredentialFailure_AffectsBatch() {
        Fail fail = new Fail("CREDENTIAL_CONFIG", "client id missing", ErrorCategory.TERMINAL_BATCH);

        assertTrue(fail.affectsBatch());
    }

    @Test
    void fail_BlankErrorCode_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(" ", "message"));
    }

    @Test
    void ok_BlankFileId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Ok("", null));
    }
}
