package com.example.rabbitretry.backoff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * QuadraticBackoffPolicy 单元测试
 */
class QuadraticBackoffPolicyTest {

    private final BackoffPolicy policy = new QuadraticBackoffPolicy();

    @Test
    void testDelayFor_FirstAttemptIsOneSecond() {
        assertEquals(1L, policy.delayFor(0));
    }

    @Test
    void testDelayFor_GrowsQuadratically() {
        for (int n = 0; n < 100; n++) {
            long expected = (long) (n + 1) * (n + 1);
            assertEquals(expected, policy.delayFor(n));
            if (n > 0) {
                assertTrue(policy.delayFor(n) > policy.delayFor(n - 1));
            }
        }
    }

    @Test
    void testDelayFor_LargeIndexDoesNotOverflow() {
        assertEquals(4_611_686_014_132_420_609L, policy.delayFor(Integer.MAX_VALUE - 1));
    }

    @Test
    void testDelayFor_NegativeIndexRejected() {
        assertThrows(IllegalArgumentException.class, () -> policy.delayFor(-1));
    }
}
