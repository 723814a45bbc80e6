package org.fleetday.fleet;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fleetday.geometry.Location;

import java.util.Objects;

/**
 * Mutable per-day accumulator for one vehicle.
 *
 * <p>The route is kept as ledger slots; {@link #DEPOT_SLOT} marks depot visits. A vehicle
 * starts at the depot with zero load, duty time and distance, and is discarded at the end
 * of its operating day.</p>
 *
 * <p>Invariants enforced on every mutation:</p>
 * <ul>
 * <li>{@code 0 <= load <= capacity}.</li>
 * <li>Duty time and distance never decrease.</li>
 * </ul>
 */
@Accessors(fluent = true)
public final class VehicleState {
    /** Route marker for a depot visit. */
    public static final int DEPOT_SLOT = -1;

    @Getter
    private final int vehicleId;
    @Getter
    private final double capacityKg;
    private final Location depot;
    private final IntArrayList route = new IntArrayList();

    @Getter
    private double loadKg;
    @Getter
    private double dutyMinutes;
    @Getter
    private double distanceKm;
    @Getter
    private Location location;
    @Getter
    private int reloadCount;
    @Getter
    private int deliveryCount;

    /**
     * Creates a fresh vehicle parked at the depot.
     *
     * @param vehicleId 1-based fleet slot.
     * @param capacityKg load limit.
     * @param depot start and reload location.
     */
    public VehicleState(int vehicleId, double capacityKg, Location depot) {
        if (vehicleId < 1) {
            throw new IllegalArgumentException("vehicleId must be >= 1");
        }
        if (!(capacityKg > 0.0d)) {
            throw new IllegalArgumentException("capacityKg must be > 0");
        }
        this.vehicleId = vehicleId;
        this.capacityKg = capacityKg;
        this.depot = Objects.requireNonNull(depot, "depot");
        this.location = depot;
        this.route.add(DEPOT_SLOT);
    }

    /**
     * Returns whether the vehicle currently stands at the depot.
     */
    public boolean atDepot() {
        return route.getInt(route.size() - 1) == DEPOT_SLOT;
    }

    /**
     * Returns a copy of the visited slots, depot visits included.
     */
    public IntList route() {
        return new IntArrayList(route);
    }

    /**
     * Returns remaining load headroom in kg.
     */
    public double remainingCapacityKg() {
        return capacityKg - loadKg;
    }

    /**
     * Applies a committed delivery.
     *
     * @param slot ledger slot of the served customer.
     * @param at customer location.
     * @param weightKg delivered weight.
     * @param legKm distance driven to reach the customer.
     * @param departureMinute duty minute at which unloading completes.
     */
    public void deliver(int slot, Location at, double weightKg, double legKm, double departureMinute) {
        if (slot < 0) {
            throw new IllegalArgumentException("customer slot must be >= 0");
        }
        double newLoad = loadKg + weightKg;
        if (weightKg < 0.0d || newLoad > capacityKg) {
            throw new IllegalStateException(
                    "vehicle " + vehicleId + " cannot carry " + weightKg + " kg on top of " + loadKg + " kg"
            );
        }
        requireNonDecreasing(departureMinute, legKm);
        route.add(slot);
        loadKg = newLoad;
        dutyMinutes = departureMinute;
        distanceKm += legKm;
        location = Objects.requireNonNull(at, "at");
        deliveryCount++;
    }

    /**
     * Drives back to the depot and empties the vehicle.
     *
     * @param legKm distance of the return leg.
     * @param legMinutes driving time of the return leg.
     * @param reloadMinutes fixed time spent emptying the vehicle.
     */
    public void reload(double legKm, double legMinutes, double reloadMinutes) {
        driveToDepot(legKm, legMinutes + reloadMinutes);
        reloadCount++;
    }

    /**
     * Closes the day with a final return leg. No-op when already at the depot.
     *
     * @param legKm distance of the return leg.
     * @param legMinutes driving time of the return leg.
     */
    public void closeAtDepot(double legKm, double legMinutes) {
        if (atDepot()) {
            return;
        }
        driveToDepot(legKm, legMinutes);
    }

    private void driveToDepot(double legKm, double minutes) {
        requireNonDecreasing(dutyMinutes + minutes, legKm);
        route.add(DEPOT_SLOT);
        dutyMinutes += minutes;
        distanceKm += legKm;
        loadKg = 0.0d;
        location = depot;
    }

    private void requireNonDecreasing(double newDutyMinutes, double legKm) {
        if (!(legKm >= 0.0d) || !(newDutyMinutes >= dutyMinutes)) {
            throw new IllegalArgumentException(
                    "vehicle " + vehicleId + " cannot move backwards: leg=" + legKm
                            + " km, duty " + dutyMinutes + " -> " + newDutyMinutes
            );
        }
    }
}
