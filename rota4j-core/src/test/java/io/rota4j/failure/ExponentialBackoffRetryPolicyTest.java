package io.rota4j.failure;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExponentialBackoffRetryPolicyTest {

    @Test
    void delayShouldGrowWithinJitterBounds() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1_000, 600_000);

        for (int i = 0; i < 50; i++) {
            long first = policy.computeDelayMs(1);
            long third = policy.computeDelayMs(3);
            assertTrue(first >= 500 && first < 1_500, "first=" + first);
            assertTrue(third >= 2_000 && third < 6_000, "third=" + third);
        }
    }

    @Test
    void delayShouldBeCapped() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(10_000, 60_000);

        for (int i = 0; i < 50; i++) {
            assertTrue(policy.computeDelayMs(40) <= 60_000);
        }
        assertEquals(0L, policy.computeDelayMs(0));
    }

    @Test
    void constructorShouldValidateArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1_000));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1_000, 10));
    }
}
