package org.fleetday.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of one customer's service state.
 *
 * <p>When {@code served=false}, all assignment fields are {@code null}.</p>
 */
@Value
@Builder
public class ServiceState {
    /** External customer id. */
    String customerId;
    /** Whether the customer has been committed to a route. */
    boolean served;
    /** Operating day (1-based) of the delivery. */
    Integer assignedDay;
    /** Vehicle slot (1-based) that delivered. */
    Integer vehicleId;
    /** Arrival minute since day start. */
    Double arrivalMinute;
    /** Departure minute since day start (arrival plus dispatch). */
    Double departureMinute;
}
