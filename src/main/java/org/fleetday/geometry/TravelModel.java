package org.fleetday.geometry;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Constant-speed travel model converting leg distances into driving minutes.
 *
 * <pre>
 * travel_minutes = distance_km / average_speed_kmh * 60
 * </pre>
 */
@Accessors(fluent = true)
public final class TravelModel {
    private static final double MINUTES_PER_HOUR = 60.0d;

    @Getter
    private final double averageSpeedKmh;

    /**
     * Creates a travel model for one fleet-wide average speed.
     *
     * @param averageSpeedKmh positive finite speed.
     */
    public TravelModel(double averageSpeedKmh) {
        if (!Double.isFinite(averageSpeedKmh) || averageSpeedKmh <= 0.0d) {
            throw new IllegalArgumentException("averageSpeedKmh must be positive and finite, got " + averageSpeedKmh);
        }
        this.averageSpeedKmh = averageSpeedKmh;
    }

    /**
     * Converts a distance to driving time.
     *
     * @param distanceKm leg length in km.
     * @return driving time in minutes.
     */
    public double travelMinutes(double distanceKm) {
        return distanceKm / averageSpeedKmh * MINUTES_PER_HOUR;
    }

    /**
     * Driving time for the straight leg between two locations.
     */
    public double legMinutes(Location from, Location to) {
        return travelMinutes(Geometry.distanceKm(from, to));
    }
}
