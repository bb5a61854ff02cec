package com.example.apo.geo;

/**
 * Immutable geographic point in decimal degrees.
 *
 * <p>
 * Equality is exact: two coordinates are the same pattern location only when both
 * components compare equal as doubles. No rounding or bucketing is applied; radius
 * queries are how nearby-but-different locations are matched.
 * </p>
 *
 * <pre>{@code
 * Coordinate nyc = Coordinate.of(40.71, -74.00);
 * }</pre>
 *
 * @param latitude  degrees north, in [-90, 90]
 * @param longitude degrees east, in [-180, 180]
 * @throws InvalidCoordinateException if either component is out of range or not finite
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (!isValid(latitude, longitude)) {
            throw new InvalidCoordinateException(latitude, longitude);
        }
        // collapse -0.0 so equals()/hashCode() agree with ==
        latitude = latitude + 0.0;
        longitude = longitude + 0.0;
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    public static boolean isValid(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }
}
