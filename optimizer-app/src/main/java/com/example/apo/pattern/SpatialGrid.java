package com.example.apo.pattern;

import com.example.apo.geo.Coordinate;
import com.example.apo.geo.GeoDistance;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Uniform latitude/longitude cell index over {@link PatternKey}s.
 *
 * <p>
 * Cells are {@code cellSizeDegrees} wide on both axes. A radius query visits only the
 * cells overlapping the query's bounding box; boxes crossing the antimeridian are split
 * and the whole parallel is scanned once the box touches a pole. Candidates still need an
 * exact distance check by the caller.
 * </p>
 *
 * Thread-safe: cells are concurrent sets inside a {@link ConcurrentHashMap}.
 */
public class SpatialGrid {

    // widen boxes slightly so points sitting exactly on the radius are not lost to rounding
    private static final double EDGE_MARGIN_DEGREES = 1e-9;

    private final double cellSizeDegrees;
    private final int latCells;
    private final int lonCells;
    private final ConcurrentHashMap<Long, Set<PatternKey>> cells = new ConcurrentHashMap<>();

    public SpatialGrid(double cellSizeDegrees) {
        if (!(cellSizeDegrees > 0.0 && cellSizeDegrees <= 180.0)) {
            throw new IllegalArgumentException("cellSizeDegrees must be in (0,180]: " + cellSizeDegrees);
        }
        this.cellSizeDegrees = cellSizeDegrees;
        this.latCells = (int) Math.ceil(180.0 / cellSizeDegrees);
        this.lonCells = (int) Math.ceil(360.0 / cellSizeDegrees);
    }

    public void add(PatternKey key) {
        cells.computeIfAbsent(cellOf(key.location()), c -> ConcurrentHashMap.newKeySet()).add(key);
    }

    /** Keys in every cell that may hold a point within {@code radiusKm} of {@code center}. */
    public List<PatternKey> candidates(Coordinate center, double radiusKm) {
        double latSpan = GeoDistance.latitudeSpanDegrees(radiusKm) + EDGE_MARGIN_DEGREES;
        int minLat = latIndex(Math.max(-90.0, center.latitude() - latSpan));
        int maxLat = latIndex(Math.min(90.0, center.latitude() + latSpan));

        BitSet lonRange = lonCellsCovering(center.longitude(),
                GeoDistance.longitudeSpanDegrees(center.latitude(), radiusKm));

        List<PatternKey> out = new ArrayList<>();
        for (int lat = minLat; lat <= maxLat; lat++) {
            for (int lon = lonRange.nextSetBit(0); lon >= 0; lon = lonRange.nextSetBit(lon + 1)) {
                Set<PatternKey> cell = cells.get(cellId(lat, lon));
                if (cell != null) out.addAll(cell);
            }
        }
        return out;
    }

    /*
     * The box is split at the antimeridian and each part is mapped back into [-180, 180]
     * before indexing, so a partial last cell (360 not a multiple of the cell size) is
     * addressed the same way on both sides.
     */
    private BitSet lonCellsCovering(double centerLon, double lonSpan) {
        BitSet range = new BitSet(lonCells);
        if (lonSpan >= 180.0) {
            range.set(0, lonCells);
            return range;
        }
        double west = centerLon - lonSpan - EDGE_MARGIN_DEGREES;
        double east = centerLon + lonSpan + EDGE_MARGIN_DEGREES;
        if (west <= -180.0) {
            range.set(lonIndex(west + 360.0), lonCells);
            range.set(0, lonIndex(east) + 1);
        } else if (east >= 180.0) {
            range.set(lonIndex(west), lonCells);
            range.set(0, lonIndex(east - 360.0) + 1);
        } else {
            range.set(lonIndex(west), lonIndex(east) + 1);
        }
        return range;
    }

    public Collection<Set<PatternKey>> cells() {
        return cells.values();
    }

    public double cellSizeDegrees() {
        return cellSizeDegrees;
    }

    private long cellOf(Coordinate c) {
        return cellId(latIndex(c.latitude()), lonIndex(c.longitude()));
    }

    private long cellId(int lat, int lon) {
        return (long) lat * lonCells + lon;
    }

    private int latIndex(double latitude) {
        int i = (int) Math.floor((latitude + 90.0) / cellSizeDegrees);
        return Math.min(latCells - 1, Math.max(0, i));
    }

    private int lonIndex(double longitude) {
        int i = (int) Math.floor((longitude + 180.0) / cellSizeDegrees);
        return Math.min(lonCells - 1, Math.max(0, i));
    }
}
