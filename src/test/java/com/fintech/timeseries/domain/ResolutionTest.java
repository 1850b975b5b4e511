package com.fintech.timeseries.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Resolution Tests")
class ResolutionTest {

    @Test
    @DisplayName("Should convert rate to quantity using interval hours")
    void testToQuantity() {
        assertThat(Resolution.FINE.intervalHours()).isCloseTo(1.0 / 12, within(1e-12));
        assertThat(Resolution.COARSE.intervalHours()).isEqualTo(0.5);
        assertThat(Resolution.FINE.toQuantity(120.0)).isCloseTo(10.0, within(1e-9));
        assertThat(Resolution.COARSE.toQuantity(-50.0)).isEqualTo(-25.0);
    }

    @Test
    @DisplayName("Twelve fine intervals carry the same quantity as two coarse intervals")
    void testQuantityConsistency() {
        double fine = 0;
        for (int i = 0; i < 12; i++) {
            fine += Resolution.FINE.toQuantity(100.0);
        }
        double coarse = 2 * Resolution.COARSE.toQuantity(100.0);

        assertThat(fine).isCloseTo(coarse, within(1e-9));
    }

    @Test
    @DisplayName("Should align timestamps and report interval starts")
    void testAlignment() {
        long t = 1_700_000_000_000L;
        long aligned = Resolution.COARSE.alignDown(t);

        assertThat(Resolution.COARSE.isAligned(aligned)).isTrue();
        assertThat(aligned).isLessThanOrEqualTo(t);
        assertThat(t - aligned).isLessThan(Resolution.COARSE.toMillis());
        assertThat(Resolution.FINE.intervalStart(aligned)).isEqualTo(aligned - 300_000L);
        assertThat(Resolution.FINE.intervalsPer(Resolution.COARSE)).isEqualTo(6);
    }

    @ParameterizedTest
    @CsvSource({"fine,FINE", "5m,FINE", " COARSE ,COARSE", "30min,COARSE"})
    @DisplayName("Should parse resolution aliases")
    void testParse(String input, Resolution expected) {
        assertThat(Resolution.parse(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should reject unknown resolutions")
    void testParseInvalid() {
        assertThatThrownBy(() -> Resolution.parse("1h")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Resolution.COARSE.intervalsPer(Resolution.FINE))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
