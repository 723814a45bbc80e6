package org.fleetday.geometry;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Straight-line distance helpers in projected/cartesian coordinate space.
 */
@UtilityClass
public class Geometry {

    /**
     * Computes Euclidean distance between two locations.
     *
     * @param from leg start.
     * @param to leg end.
     * @return distance in km.
     */
    public static double distanceKm(Location from, Location to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return distanceKm(from.getX(), from.getY(), to.getX(), to.getY());
    }

    /**
     * Computes Euclidean distance between two coordinate pairs.
     */
    public static double distanceKm(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }
}
