package com.example.apo.geo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GeoDistanceTest {

    private static final Coordinate NYC = Coordinate.of(40.7128, -74.0060);
    private static final Coordinate LONDON = Coordinate.of(51.5074, -0.1278);

    @ParameterizedTest
    @CsvSource({
            "0, 0",
            "40.71, -74.00",
            "-90, 180",
            "90, -180",
            "-33.8688, 151.2093"
    })
    void distanceToSelfIsZero(double lat, double lon) {
        Coordinate a = Coordinate.of(lat, lon);
        assertThat(GeoDistance.distanceKm(a, a)).isEqualTo(0.0);
    }

    @ParameterizedTest
    @CsvSource({
            "40.71, -74.00, 51.50, -0.12",
            "-33.86, 151.20, 35.68, 139.69",
            "10, 179.9, 10, -179.9",
            "89.9, 0, -89.9, 180"
    })
    void distanceIsSymmetric(double lat1, double lon1, double lat2, double lon2) {
        Coordinate a = Coordinate.of(lat1, lon1);
        Coordinate b = Coordinate.of(lat2, lon2);
        assertThat(GeoDistance.distanceKm(a, b)).isCloseTo(GeoDistance.distanceKm(b, a), within(1e-9));
    }

    @Test
    void nycToLondonMatchesKnownDistance() {
        // ~5570 km on the 6371 km sphere
        assertThat(GeoDistance.distanceKm(NYC, LONDON)).isCloseTo(5570.2, within(5.0));
    }

    @Test
    void oneDegreeOfLatitudeIsAbout111Km() {
        double d = GeoDistance.distanceKm(Coordinate.of(0, 0), Coordinate.of(1, 0));
        assertThat(d).isCloseTo(GeoDistance.KM_PER_DEGREE, within(1e-9));
        assertThat(d).isCloseTo(111.19, within(0.01));
    }

    @Test
    void antimeridianNeighboursAreClose() {
        double d = GeoDistance.distanceKm(Coordinate.of(0, 179.95), Coordinate.of(0, -179.95));
        assertThat(d).isCloseTo(11.12, within(0.01));
    }

    @Test
    void antipodalPointsAreHalfTheCircumference() {
        double d = GeoDistance.distanceKm(Coordinate.of(0, 0), Coordinate.of(0, 180));
        assertThat(d).isCloseTo(Math.PI * GeoDistance.EARTH_RADIUS_KM, within(1e-6));
    }

    @Test
    void rawDegreeOverloadRejectsOutOfRange() {
        assertThatThrownBy(() -> GeoDistance.distanceKm(91, 0, 0, 0))
                .isInstanceOf(InvalidCoordinateException.class)
                .hasMessageContaining("lat=91");
        assertThatThrownBy(() -> GeoDistance.distanceKm(0, 0, 0, -180.5))
                .isInstanceOf(InvalidCoordinateException.class);
    }

    @Test
    void longitudeSpanWidensTowardsThePoles() {
        double equator = GeoDistance.longitudeSpanDegrees(0, 111.0);
        double north = GeoDistance.longitudeSpanDegrees(60, 111.0);
        assertThat(north).isGreaterThan(equator);
        assertThat(GeoDistance.longitudeSpanDegrees(89.5, 111.0)).isEqualTo(180.0);
    }
}
