package com.studioscout.core.http;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    void retries_only_on_429_5xx_and_transport_failure() {
        DefaultRetryPolicy p = new DefaultRetryPolicy(3, 250);
        assertThat(p.shouldRetry(429, 1)).isTrue();
        assertThat(p.shouldRetry(503, 1)).isTrue();
        assertThat(p.shouldRetry(-1, 2)).isTrue();
        assertThat(p.shouldRetry(404, 1)).isFalse();
        assertThat(p.shouldRetry(200, 1)).isFalse();
        assertThat(p.shouldRetry(503, 3)).isFalse();
    }

    @Test
    void backoff_doubles_with_ten_percent_jitter() {
        DefaultRetryPolicy p = new DefaultRetryPolicy(5, 200);
        for (int i = 0; i < 50; i++) {
            assertThat(p.nextDelay(1).toMillis()).isBetween(180L, 220L);
            assertThat(p.nextDelay(3).toMillis()).isBetween(720L, 880L);
        }
    }

    @Test
    void max_attempts_is_at_least_one() {
        assertThat(new DefaultRetryPolicy(0, 0).maxAttempts()).isEqualTo(1);
    }
}
