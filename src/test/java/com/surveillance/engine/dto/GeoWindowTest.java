package com.surveillance.engine.dto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GeoWindowTest {

    private final GeoWindow window = GeoWindow.around(45.5, -122.5, 0.1);

    @Test
    void shouldContainPointsInsideSquare() {
        assertThat(window.contains(45.55, -122.45)).isTrue();
        assertThat(window.contains(45.5, -122.5)).isTrue();
    }

    @Test
    void shouldExcludePointsOutsideEitherAxis() {
        assertThat(window.contains(45.7, -122.5)).isFalse();
        assertThat(window.contains(45.5, -122.3)).isFalse();
    }

    @Test
    void shouldTreatZeroAsValidCoordinate() {
        GeoWindow equator = GeoWindow.around(0.0, 0.0, 0.1);

        assertThat(equator.contains(0.0, 0.05)).isTrue();
        assertThat(equator.minLatitude()).isEqualTo(-0.1);
        assertThat(equator.maxLongitude()).isEqualTo(0.1);
    }

    @Test
    void shouldNeverContainMissingCoordinates() {
        assertThat(window.contains(null, -122.5)).isFalse();
        assertThat(window.contains(45.5, null)).isFalse();
    }
}
