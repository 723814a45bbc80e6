package org.fleetday.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.fleetday.geometry.TravelModel;
import org.fleetday.ledger.Customer;
import org.fleetday.ledger.CustomerLedger;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Multi-day scheduling entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate configuration once at construction.</li>
 * <li>Validate customer records and reject duplicate ids.</li>
 * <li>Optionally reject customers that can never be served.</li>
 * <li>Run {@link DayScheduler} day after day until every customer is served, or fail
 *     with {@link #REASON_DAY_CEILING_EXCEEDED} once {@code maxDays} is used up.</li>
 * </ul>
 *
 * <p>The planner holds no run state; every {@link #plan(List)} call works on a fresh
 * {@link CustomerLedger}.</p>
 */
@Slf4j
public final class DeliveryPlanner implements PlannerService {
    public static final String REASON_CUSTOMERS_REQUIRED = "FD_CUSTOMERS_REQUIRED";
    public static final String REASON_INVALID_CUSTOMER = "FD_INVALID_CUSTOMER";
    public static final String REASON_DUPLICATE_CUSTOMER_ID = "FD_DUPLICATE_CUSTOMER_ID";
    public static final String REASON_INVALID_CONFIGURATION = "FD_INVALID_CONFIGURATION";
    public static final String REASON_UNSERVABLE_CUSTOMER = "FD_UNSERVABLE_CUSTOMER";
    public static final String REASON_DAY_CEILING_EXCEEDED = "FD_DAY_CEILING_EXCEEDED";

    private final SchedulerConfig config;
    private final FeasibilityAudit feasibilityAudit;
    private final DayScheduler dayScheduler;

    /**
     * Creates a planner with default configuration.
     */
    public DeliveryPlanner() {
        this(SchedulerConfig.defaults());
    }

    /**
     * Creates a planner for one configuration.
     *
     * @param config scheduler configuration.
     * @throws SchedulingException with {@link #REASON_INVALID_CONFIGURATION}.
     */
    public DeliveryPlanner(SchedulerConfig config) {
        if (config == null) {
            throw SchedulingException.invalidConfiguration("config is required");
        }
        this.config = config.validate();
        TravelModel travelModel = new TravelModel(config.getAverageSpeedKmh());
        this.feasibilityAudit = new FeasibilityAudit(config, travelModel);
        this.dayScheduler = new DayScheduler(config, new RouteBuilder(config, travelModel));
    }

    public SchedulerConfig config() {
        return config;
    }

    /**
     * Schedules every customer.
     *
     * @param customers customers in input order.
     * @return complete schedule.
     * @throws SchedulingException when input contracts fail or the day ceiling is reached.
     */
    @Override
    public DeliverySchedule plan(List<Customer> customers) {
        validateCustomers(customers);
        if (config.isRejectUnservableCustomers()) {
            List<String> unservable = feasibilityAudit.unservableCustomerIds(customers);
            if (!unservable.isEmpty()) {
                throw SchedulingException.unservableCustomers(unservable);
            }
        }

        CustomerLedger ledger = new CustomerLedger(customers);
        log.info("Scheduling {} customers with {} vehicles ({} kg, {} min workday)",
                ledger.size(), config.getFleetSize(), config.getCapacityKg(), config.getWorkdayMinutes());

        DeliverySchedule.DeliveryScheduleBuilder schedule = DeliverySchedule.builder();
        int day = 0;
        while (!ledger.allServed()) {
            if (day >= config.getMaxDays()) {
                throw SchedulingException.dayCeilingExceeded(day, ledger.unservedCustomerIds());
            }
            day++;
            log.info("Planning day {} ({} customers pending)", day, ledger.unservedCount());
            DayPlan plan = dayScheduler.runDay(day, ledger);
            schedule.deliveries(plan.getDeliveries())
                    .metrics(plan.getMetrics())
                    .routes(plan.getRoutes());
        }

        DeliverySchedule result = schedule
                .daysUsed(day)
                .serviceStates(ledger.serviceStates())
                .build();
        log.info("Scheduled {} deliveries over {} day(s), {} km driven",
                result.getDeliveries().size(), day, result.totalDistanceKm());
        return result;
    }

    private static void validateCustomers(List<Customer> customers) {
        if (customers == null) {
            throw SchedulingException.customersRequired("customers must be non-null");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < customers.size(); i++) {
            Customer customer = customers.get(i);
            if (customer == null) {
                throw SchedulingException.customersRequired("customer at position " + i + " is null");
            }
            String id = customer.getId();
            if (id == null || id.isBlank()) {
                throw SchedulingException.invalidCustomer("customer at position " + i + " has no id");
            }
            if (customer.getLocation() == null || !customer.getLocation().isFinite()) {
                throw SchedulingException.invalidCustomer("customer " + id + " has no finite location");
            }
            double weight = customer.getWeightKg();
            if (!Double.isFinite(weight) || weight < 0.0d) {
                throw SchedulingException.invalidCustomer("customer " + id + " has invalid weight " + weight);
            }
            if (VehicleRoute.DEPOT_ID.equals(id)) {
                throw SchedulingException.duplicateCustomerId(id, "is reserved for the depot");
            }
            if (!seen.add(id)) {
                throw SchedulingException.duplicateCustomerId(id, "appears twice");
            }
        }
    }
}
