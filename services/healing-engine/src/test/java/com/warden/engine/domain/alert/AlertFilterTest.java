package com.warden.engine.domain.alert;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AlertFilter")
class AlertFilterTest {

    @Test
    @DisplayName("should fall back to the default limit for non-positive values")
    void shouldDefaultLimit() {
        assertThat(new AlertFilter(null, null, 0).limit()).isEqualTo(AlertFilter.DEFAULT_LIMIT);
        assertThat(new AlertFilter(null, null, -5).limit()).isEqualTo(AlertFilter.DEFAULT_LIMIT);
    }

    @Test
    @DisplayName("should cap the limit")
    void shouldCapLimit() {
        assertThat(new AlertFilter(null, null, 5000).limit()).isEqualTo(AlertFilter.MAX_LIMIT);
        assertThat(new AlertFilter(null, null, 25).limit()).isEqualTo(25);
    }

    @Test
    @DisplayName("should select active alerts only")
    void shouldSelectActive() {
        assertThat(AlertFilter.active().status()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(AlertFilter.all().status()).isNull();
    }
}
