package uz.greenwhite.servicegateway.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TokenBucketTest {

    @Test
    @DisplayName("starts full and drains one token per request")
    void drainsOneTokenPerRequest() {
        // given
        TokenBucket bucket = new TokenBucket(3, 1, 0);

        // when & then
        assertThat(bucket.tryConsume(0)).isTrue();
        assertThat(bucket.tryConsume(0)).isTrue();
        assertThat(bucket.tryConsume(0)).isTrue();
        assertThat(bucket.tryConsume(0)).isFalse();
    }

    @Test
    @DisplayName("refills in proportion to elapsed time, capped at max")
    void refillsFromElapsedTime() {
        // given
        TokenBucket bucket = new TokenBucket(10, 2, 0);
        for (int i = 0; i < 10; i++) {
            bucket.tryConsume(0);
        }

        // when
        bucket.refill(1500);

        // then
        assertThat(bucket.getTokens()).isCloseTo(3.0, within(1e-9));

        bucket.refill(60_000);
        assertThat(bucket.getTokens()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("a clock moving backwards does not remove tokens")
    void backwardsClockKeepsTokens() {
        // given
        TokenBucket bucket = new TokenBucket(5, 1, 10_000);
        bucket.tryConsume(10_000);

        // when
        bucket.refill(5_000);

        // then
        assertThat(bucket.getTokens()).isEqualTo(4.0);
        assertThat(bucket.getLastRefill()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("forWindow spreads the limit evenly over the window")
    void forWindowRate() {
        TokenBucket bucket = TokenBucket.forWindow(100, 60_000, 0);

        assertThat(bucket.getMaxTokens()).isEqualTo(100.0);
        assertThat(bucket.getRefillRate()).isCloseTo(100 / 60.0, within(1e-9));
    }

    @Test
    @DisplayName("rejects non-positive capacity and rate")
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new TokenBucket(0, 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucket(1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
