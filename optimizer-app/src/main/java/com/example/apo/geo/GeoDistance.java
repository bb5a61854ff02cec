package com.example.apo.geo;

/**
 * Great-circle distance on a spherical Earth.
 * <p>
 * Uses the haversine formula with the mean Earth radius (6371 km). All methods are
 * pure and thread-safe.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /** Length of one degree of latitude on the mean sphere (≈ 111.19 km). */
    public static final double KM_PER_DEGREE = Math.PI * EARTH_RADIUS_KM / 180.0;

    private GeoDistance() {}

    /**
     * Haversine distance between two coordinates.
     *
     * @return distance in kilometres, always {@code >= 0}
     */
    public static double distanceKm(Coordinate a, Coordinate b) {
        return haversine(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    /**
     * Raw-degree variant; validates both points first.
     *
     * @throws InvalidCoordinateException if any value is out of range
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        if (!Coordinate.isValid(lat1, lon1)) throw new InvalidCoordinateException(lat1, lon1);
        if (!Coordinate.isValid(lat2, lon2)) throw new InvalidCoordinateException(lat2, lon2);
        return haversine(lat1, lon1, lat2, lon2);
    }

    /** Whether {@code b} lies within {@code radiusKm} of {@code a} (inclusive). */
    public static boolean within(Coordinate a, Coordinate b, double radiusKm) {
        return distanceKm(a, b) <= radiusKm;
    }

    /** Latitude span, in degrees, covered by a radius in kilometres. */
    public static double latitudeSpanDegrees(double radiusKm) {
        return radiusKm / KM_PER_DEGREE;
    }

    /**
     * Longitude half-width, in degrees, of the bounding box around {@code latitude}
     * for a radius in kilometres. Returns 180 when the box reaches a pole or the
     * radius wraps the whole parallel.
     */
    public static double longitudeSpanDegrees(double latitude, double radiusKm) {
        double latSpan = latitudeSpanDegrees(radiusKm);
        if (Math.abs(latitude) + latSpan >= 90.0) {
            return 180.0;
        }
        double angular = radiusKm / EARTH_RADIUS_KM;
        double ratio = Math.sin(angular) / Math.cos(Math.toRadians(latitude));
        if (ratio >= 1.0 || angular >= Math.PI / 2) {
            return 180.0;
        }
        return Math.toDegrees(Math.asin(ratio));
    }

    private static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);

        double h = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        // rounding can push h a hair past 1 for antipodal points
        h = Math.min(1.0, Math.max(0.0, h));
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(h));
    }
}
