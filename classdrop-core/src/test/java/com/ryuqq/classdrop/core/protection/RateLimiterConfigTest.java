package com.ryuqq.classdrop.core.protection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RateLimiterConfig 테스트.
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
class RateLimiterConfigTest {

    @Test
    void 기본값() {
        RateLimiterConfig config = new RateLimiterConfig();

        assertThat(config.capacity()).isEqualTo(90);
        assertThat(config.refillPerSecond()).isEqualTo(1.5);
        assertThat(config.initialBackoffMs()).isEqualTo(2000);
        assertThat(config.maxBackoffMs()).isEqualTo(64000);
    }

    @Test
    void withX는_한_항목만_바꾼다() {
        RateLimiterConfig config = new RateLimiterConfig().withCapacity(3).withRefillPerSecond(10);

        assertThat(config.capacity()).isEqualTo(3);
        assertThat(config.refillPerSecond()).isEqualTo(10);
        assertThat(config.maxBackoffMs()).isEqualTo(64000);
    }

    @Test
    void 잘못된_값은_거부된다() {
        assertThatThrownBy(() -> new RateLimiterConfig(0, 1.5, 2000, 64000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity must be positive");
        assertThatThrownBy(() -> new RateLimiterConfig(90, 0, 2000, 64000))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimiterConfig(90, 1.5, 2000, 1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxBackoffMs must be >= initialBackoffMs");
    }
}
