package org.fleetday.scheduling;

import lombok.Builder;
import lombok.Value;

/**
 * Totals for one vehicle on one operating day.
 */
@Value
@Builder
public class DailyMetricRecord {
    /** Operating day (1-based). */
    int day;
    /** Vehicle slot (1-based). */
    int vehicleId;
    /** Total distance including the closing leg, two decimals. */
    double distanceKm;
    /** Total duty time including the closing leg, one decimal. */
    double dutyMinutes;
    /** Number of customers served. */
    int deliveryCount;
    /** Number of forced mid-day reloads. */
    int reloadCount;
    /**
     * Whether a forced reload or the closing leg carried duty time past the workday.
     * Deliveries themselves never start a leg that would overrun it.
     */
    boolean workdayExceeded;
}
