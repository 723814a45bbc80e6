package org.fleetday.scheduling;

import org.fleetday.geometry.TravelModel;
import org.fleetday.ledger.Customer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Detects customers that no vehicle could serve on any day.
 *
 * <p>A fresh vehicle leaves the depot empty with zero duty time, so a customer is servable
 * iff its weight fits the capacity and the depot round trip fits the workday:</p>
 * <pre>
 * travel(depot -> c) + dispatch + travel(c -> depot) &lt;= workday
 * </pre>
 */
public final class FeasibilityAudit {
    private final SchedulerConfig config;
    private final TravelModel travelModel;

    public FeasibilityAudit(SchedulerConfig config, TravelModel travelModel) {
        this.config = Objects.requireNonNull(config, "config");
        this.travelModel = Objects.requireNonNull(travelModel, "travelModel");
    }

    /**
     * Minutes a fresh vehicle needs to serve one customer and return.
     */
    public double depotRoundTripMinutes(Customer customer) {
        return travelModel.legMinutes(config.getDepot(), customer.getLocation())
                + config.getDispatchMinutes()
                + travelModel.legMinutes(customer.getLocation(), config.getDepot());
    }

    public boolean fitsCapacity(Customer customer) {
        return customer.getWeightKg() <= config.getCapacityKg();
    }

    public boolean reachableWithinWorkday(Customer customer) {
        return depotRoundTripMinutes(customer) <= config.getWorkdayMinutes();
    }

    public boolean isServable(Customer customer) {
        return fitsCapacity(customer) && reachableWithinWorkday(customer);
    }

    /**
     * Returns ids of customers that can never be served, in input order.
     */
    public List<String> unservableCustomerIds(List<Customer> customers) {
        List<String> ids = new ArrayList<>();
        for (Customer customer : customers) {
            if (!isServable(customer)) {
                ids.add(customer.getId());
            }
        }
        return ids;
    }
}
