package org.fleetday.scheduling;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of one operating day.
 */
@Value
@Builder
public class DayPlan {
    /** Operating day (1-based). */
    int day;
    /** Deliveries in commit order. */
    @Singular
    List<DeliveryRecord> deliveries;
    /** One metric per vehicle, fleet order. */
    @Singular
    List<DailyMetricRecord> metrics;
    /** One closed route per vehicle, fleet order. */
    @Singular
    List<VehicleRoute> routes;
}
