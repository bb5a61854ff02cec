package com.example.apo.geo;

/**
 * Thrown when a latitude or longitude lies outside its valid range
 * (latitude in [-90, 90], longitude in [-180, 180]) or is not a finite number.
 * <p>
 * Coordinates are validated at construction, so nothing downstream ever
 * processes a partially valid location.
 */
public class InvalidCoordinateException extends IllegalArgumentException {

    private final double latitude;
    private final double longitude;

    public InvalidCoordinateException(double latitude, double longitude) {
        super(String.format(java.util.Locale.ROOT,
                "Invalid coordinate lat=%s lon=%s (expected lat in [-90,90], lon in [-180,180])",
                latitude, longitude));
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double latitude() { return latitude; }
    public double longitude() { return longitude; }
}
