package uz.greenwhite.servicegateway.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(1000, 10_000, 2.0);

    @Test
    @DisplayName("base delay doubles per attempt up to the cap")
    void exponentialUpToCap() {
        assertThat(policy.baseDelay(1)).isEqualTo(1000);
        assertThat(policy.baseDelay(2)).isEqualTo(2000);
        assertThat(policy.baseDelay(3)).isEqualTo(4000);
        assertThat(policy.baseDelay(4)).isEqualTo(8000);
        assertThat(policy.baseDelay(5)).isEqualTo(10_000);
        assertThat(policy.baseDelay(12)).isEqualTo(10_000);
    }

    @Test
    @DisplayName("base delay never decreases with the attempt number")
    void nonDecreasing() {
        long previous = 0;
        for (int attempt = 1; attempt <= 20; attempt++) {
            long delay = policy.baseDelay(attempt);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            previous = delay;
        }
    }

    @RepeatedTest(50)
    @DisplayName("jitter is non-negative and at most 10% of the base delay")
    void jitterBounds() {
        for (int attempt = 1; attempt <= 6; attempt++) {
            long base = policy.baseDelay(attempt);
            long delay = policy.delay(attempt);

            assertThat(delay).isBetween(base, base + (long) (base * BackoffPolicy.JITTER_RATIO));
        }
    }
}
