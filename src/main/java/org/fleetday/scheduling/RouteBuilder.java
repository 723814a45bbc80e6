package org.fleetday.scheduling;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.extern.slf4j.Slf4j;
import org.fleetday.core.math.Rounding;
import org.fleetday.fleet.VehicleState;
import org.fleetday.geometry.Geometry;
import org.fleetday.geometry.Location;
import org.fleetday.geometry.TravelModel;
import org.fleetday.ledger.Customer;
import org.fleetday.ledger.CustomerLedger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Greedy route extension for one vehicle on one operating day.
 *
 * <p>Each iteration scans unserved customers in ledger order and evaluates the one-step
 * lookahead cost:</p>
 * <pre>
 * cost(c) = travel(current -> c) + dispatch + travel(c -> depot)
 * </pre>
 * <p>Candidates whose weight does not fit the remaining capacity, or whose cost would push
 * duty time past the workday, are skipped. The cheapest survivor is committed. After every
 * commit, when the lightest unserved customer no longer fits, the vehicle returns to the
 * depot to reload. The reload is taken even when it overruns the workday.</p>
 *
 * <p>The ledger is mutated in place, so a vehicle planned later on the same day only sees
 * customers left over by earlier vehicles.</p>
 */
@Slf4j
public final class RouteBuilder {
    private final SchedulerConfig config;
    private final TravelModel travelModel;

    /**
     * Creates a route builder for one validated configuration.
     *
     * @param config scheduler configuration.
     * @param travelModel travel model bound to {@code config.averageSpeedKmh}.
     */
    public RouteBuilder(SchedulerConfig config, TravelModel travelModel) {
        this.config = Objects.requireNonNull(config, "config");
        this.travelModel = Objects.requireNonNull(travelModel, "travelModel");
    }

    /**
     * Extends a vehicle's route until no feasible customer remains.
     *
     * @param day operating day (1-based).
     * @param vehicle vehicle to extend.
     * @param ledger shared customer ledger; committed customers are marked served.
     * @return delivery records in commit order.
     */
    public List<DeliveryRecord> extendRoute(int day, VehicleState vehicle, CustomerLedger ledger) {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(ledger, "ledger");
        List<DeliveryRecord> deliveries = new ArrayList<>();
        while (!ledger.allServed()) {
            Candidate next = selectCandidate(vehicle, ledger);
            if (next == null) {
                break;
            }
            deliveries.add(commit(day, vehicle, ledger, next));
            reloadIfLightestDoesNotFit(vehicle, ledger);
        }
        return deliveries;
    }

    /**
     * Drives the vehicle back to the depot if it is elsewhere. Taken regardless of the
     * remaining duty budget.
     *
     * @param vehicle vehicle to close.
     */
    public void closeRoute(VehicleState vehicle) {
        if (vehicle.atDepot()) {
            return;
        }
        double legKm = Geometry.distanceKm(vehicle.location(), config.getDepot());
        vehicle.closeAtDepot(legKm, travelModel.travelMinutes(legKm));
    }

    /**
     * Selects the cheapest feasible customer, or {@code null} when none survives.
     */
    Candidate selectCandidate(VehicleState vehicle, CustomerLedger ledger) {
        Location depot = config.getDepot();
        Candidate best = null;
        IntList slots = ledger.unservedSlots();
        for (int i = 0; i < slots.size(); i++) {
            int slot = slots.getInt(i);
            Customer customer = ledger.customer(slot);
            if (vehicle.loadKg() + customer.getWeightKg() > config.getCapacityKg()) {
                continue;
            }

            double legKm = Geometry.distanceKm(vehicle.location(), customer.getLocation());
            double legMinutes = travelModel.travelMinutes(legKm);
            double cost = legMinutes
                    + config.getDispatchMinutes()
                    + travelModel.legMinutes(customer.getLocation(), depot);
            if (vehicle.dutyMinutes() + cost > config.getWorkdayMinutes()) {
                continue;
            }

            if (best == null || cost < best.cost() || (cost == best.cost() && winsTie(customer, best))) {
                best = new Candidate(slot, customer, cost, legKm, legMinutes);
            }
        }
        return best;
    }

    private boolean winsTie(Customer challenger, Candidate incumbent) {
        return config.getTieBreakPolicy() == TieBreakPolicy.CUSTOMER_ID
                && TieBreakPolicy.CUSTOMER_ID_ORDER.compare(challenger.getId(), incumbent.customer().getId()) < 0;
    }

    private DeliveryRecord commit(int day, VehicleState vehicle, CustomerLedger ledger, Candidate candidate) {
        Customer customer = candidate.customer();
        double arrival = vehicle.dutyMinutes() + candidate.legMinutes();
        double departure = arrival + config.getDispatchMinutes();

        vehicle.deliver(
                candidate.slot(),
                customer.getLocation(),
                customer.getWeightKg(),
                candidate.legKm(),
                departure
        );
        ledger.markServed(candidate.slot(), day, vehicle.vehicleId(), arrival, departure);

        if (log.isTraceEnabled()) {
            log.trace("day {} vehicle {} -> {} arrive {} depart {} load {} kg",
                    day, vehicle.vehicleId(), customer.getId(),
                    Rounding.minutes(arrival), Rounding.minutes(departure), vehicle.loadKg());
        }
        return DeliveryRecord.builder()
                .day(day)
                .vehicleId(vehicle.vehicleId())
                .customerId(customer.getId())
                .arrivalMinute(Rounding.minutes(arrival))
                .departureMinute(Rounding.minutes(departure))
                .legDistanceKm(Rounding.distanceKm(candidate.legKm()))
                .build();
    }

    private void reloadIfLightestDoesNotFit(VehicleState vehicle, CustomerLedger ledger) {
        OptionalDouble lightest = ledger.minUnservedWeight();
        if (lightest.isEmpty() || vehicle.loadKg() + lightest.getAsDouble() <= config.getCapacityKg()) {
            return;
        }
        double legKm = Geometry.distanceKm(vehicle.location(), config.getDepot());
        vehicle.reload(legKm, travelModel.travelMinutes(legKm), config.getReloadMinutes());
        log.debug("vehicle {} reloads at depot (lightest pending {} kg), duty now {} min",
                vehicle.vehicleId(), lightest.getAsDouble(), Rounding.minutes(vehicle.dutyMinutes()));
    }

    /**
     * One evaluated customer.
     *
     * @param slot ledger slot.
     * @param customer customer record.
     * @param cost lookahead cost in minutes.
     * @param legKm distance from the vehicle's current location.
     * @param legMinutes driving time from the vehicle's current location.
     */
    record Candidate(int slot, Customer customer, double cost, double legKm, double legMinutes) {
    }
}
