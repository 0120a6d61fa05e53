package com.surveillance.engine.dto;

import org.locationtech.jts.geom.Envelope;

/**
 * Square search window around a detection, in degrees.
 *
 * Backed by a JTS {@link Envelope} with x = longitude and y = latitude. Bounds are
 * inclusive on every side.
 */
public record GeoWindow(Envelope envelope) {

    public static GeoWindow around(double latitude, double longitude, double halfSideDegrees) {
        return new GeoWindow(new Envelope(
            longitude - halfSideDegrees,
            longitude + halfSideDegrees,
            latitude - halfSideDegrees,
            latitude + halfSideDegrees
        ));
    }

    public double minLatitude() {
        return envelope.getMinY();
    }

    public double maxLatitude() {
        return envelope.getMaxY();
    }

    public double minLongitude() {
        return envelope.getMinX();
    }

    public double maxLongitude() {
        return envelope.getMaxX();
    }

    /**
     * Points with a missing coordinate are never inside.
     */
    public boolean contains(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return false;
        }
        return envelope.contains(longitude, latitude);
    }
}
