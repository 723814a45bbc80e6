package org.fleetday.scheduling;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.extern.slf4j.Slf4j;
import org.fleetday.core.math.Rounding;
import org.fleetday.fleet.VehicleState;
import org.fleetday.ledger.CustomerLedger;

import java.util.List;
import java.util.Objects;

/**
 * Plans one operating day for a fixed-size fleet.
 *
 * <p>Vehicles start fresh at the depot and are planned one after another in fleet order
 * against the shared ledger. Each route is closed at the depot and summarised into one
 * {@link DailyMetricRecord}.</p>
 */
@Slf4j
public final class DayScheduler {
    private final SchedulerConfig config;
    private final RouteBuilder routeBuilder;

    public DayScheduler(SchedulerConfig config, RouteBuilder routeBuilder) {
        this.config = Objects.requireNonNull(config, "config");
        this.routeBuilder = Objects.requireNonNull(routeBuilder, "routeBuilder");
    }

    /**
     * Runs one operating day.
     *
     * @param day operating day (1-based).
     * @param ledger shared ledger, mutated in place.
     * @return deliveries, metrics and routes of the day.
     */
    public DayPlan runDay(int day, CustomerLedger ledger) {
        if (day < 1) {
            throw new IllegalArgumentException("day must be >= 1");
        }
        Objects.requireNonNull(ledger, "ledger");
        DayPlan.DayPlanBuilder plan = DayPlan.builder().day(day);

        for (int vehicleId = 1; vehicleId <= config.getFleetSize(); vehicleId++) {
            VehicleState vehicle = new VehicleState(vehicleId, config.getCapacityKg(), config.getDepot());
            List<DeliveryRecord> deliveries = routeBuilder.extendRoute(day, vehicle, ledger);
            routeBuilder.closeRoute(vehicle);

            boolean workdayExceeded = vehicle.dutyMinutes() > config.getWorkdayMinutes();
            if (workdayExceeded) {
                log.warn("day {} vehicle {} closes at {} min, past the {} min workday",
                        day, vehicleId, Rounding.minutes(vehicle.dutyMinutes()), config.getWorkdayMinutes());
            }
            log.debug("day {} vehicle {}: {} deliveries, {} reloads, {} km, {} min",
                    day, vehicleId, vehicle.deliveryCount(), vehicle.reloadCount(),
                    Rounding.distanceKm(vehicle.distanceKm()), Rounding.minutes(vehicle.dutyMinutes()));

            plan.deliveries(deliveries)
                    .metric(DailyMetricRecord.builder()
                            .day(day)
                            .vehicleId(vehicleId)
                            .distanceKm(Rounding.distanceKm(vehicle.distanceKm()))
                            .dutyMinutes(Rounding.minutes(vehicle.dutyMinutes()))
                            .deliveryCount(vehicle.deliveryCount())
                            .reloadCount(vehicle.reloadCount())
                            .workdayExceeded(workdayExceeded)
                            .build())
                    .route(toVehicleRoute(day, vehicle, ledger));
        }
        return plan.build();
    }

    private static VehicleRoute toVehicleRoute(int day, VehicleState vehicle, CustomerLedger ledger) {
        VehicleRoute.VehicleRouteBuilder route = VehicleRoute.builder()
                .day(day)
                .vehicleId(vehicle.vehicleId());
        IntList slots = vehicle.route();
        for (int i = 0; i < slots.size(); i++) {
            int slot = slots.getInt(i);
            route.stop(slot == VehicleState.DEPOT_SLOT
                    ? VehicleRoute.DEPOT_ID
                    : ledger.index().toCustomerId(slot));
        }
        return route.build();
    }
}
