package com.example.apo.geo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinateTest {

    @ParameterizedTest
    @CsvSource({
            "90.0001, 0",
            "-90.0001, 0",
            "0, 180.0001",
            "0, -180.0001",
            "NaN, 0",
            "0, Infinity"
    })
    void outOfRangeIsRejected(double lat, double lon) {
        assertThatThrownBy(() -> Coordinate.of(lat, lon))
                .isInstanceOf(InvalidCoordinateException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void boundariesAreAccepted() {
        assertThatCode(() -> {
            Coordinate.of(90, 180);
            Coordinate.of(-90, -180);
        }).doesNotThrowAnyException();
    }

    @Test
    void equalityIsExact() {
        assertThat(Coordinate.of(40.71, -74.00)).isEqualTo(Coordinate.of(40.71, -74.00));
        assertThat(Coordinate.of(40.71, -74.00)).isNotEqualTo(Coordinate.of(40.710001, -74.00));
    }

    @Test
    void negativeZeroEqualsZero() {
        assertThat(Coordinate.of(-0.0, -0.0)).isEqualTo(Coordinate.of(0.0, 0.0));
        assertThat(Coordinate.of(-0.0, 0.0).hashCode()).isEqualTo(Coordinate.of(0.0, 0.0).hashCode());
    }
}
