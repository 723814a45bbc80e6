package org.fleetday.geometry;

import lombok.Value;

/**
 * Planar location in kilometre coordinates.
 */
@Value(staticConstructor = "of")
public class Location {
    /** Shared origin, the default depot position. */
    public static final Location ORIGIN = Location.of(0.0d, 0.0d);

    /** Easting in km. */
    double x;
    /** Northing in km. */
    double y;

    /**
     * Returns whether both coordinates are finite numbers.
     */
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
