package org.fleetday.scheduling;

import lombok.Builder;
import lombok.Value;

/**
 * One served customer. Emitted exactly once per customer, in commit order.
 */
@Value
@Builder
public class DeliveryRecord {
    /** Operating day (1-based). */
    int day;
    /** Vehicle slot (1-based). */
    int vehicleId;
    /** Served customer id. */
    String customerId;
    /** Arrival minute since day start, one decimal. */
    double arrivalMinute;
    /** Departure minute since day start, one decimal. */
    double departureMinute;
    /** Distance of the leg that reached the customer, two decimals. */
    double legDistanceKm;
}
