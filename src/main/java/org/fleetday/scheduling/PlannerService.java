package org.fleetday.scheduling;

import org.fleetday.ledger.Customer;

import java.util.List;

/**
 * Public multi-day scheduling contract.
 *
 * <p>Implementations validate their input deterministically and throw
 * {@link SchedulingException} for contract failures.</p>
 */
public interface PlannerService {
    /**
     * Schedules every customer over as many operating days as needed.
     *
     * @param customers customers in input order.
     * @return complete multi-day schedule.
     */
    DeliverySchedule plan(List<Customer> customers);
}
