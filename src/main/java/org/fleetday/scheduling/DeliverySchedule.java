package org.fleetday.scheduling;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.fleetday.core.math.Rounding;
import org.fleetday.ledger.ServiceState;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Complete multi-day delivery schedule.
 *
 * <p>Records are ordered by day, then fleet order, then commit order. {@code daysUsed}
 * is {@code 0} for an empty customer list.</p>
 */
@Value
@Builder
public class DeliverySchedule {
    /** Number of operating days needed to serve every customer. */
    int daysUsed;
    /** Delivery records across all days. */
    @Singular
    List<DeliveryRecord> deliveries;
    /** Metric records across all days. */
    @Singular
    List<DailyMetricRecord> metrics;
    /** Closed vehicle routes across all days. */
    @Singular
    List<VehicleRoute> routes;
    /** Final service state of every customer, input order. */
    @Singular
    List<ServiceState> serviceStates;

    /**
     * Returns deliveries made on one day.
     */
    public List<DeliveryRecord> deliveriesOn(int day) {
        return deliveries.stream()
                .filter(record -> record.getDay() == day)
                .collect(Collectors.toList());
    }

    /**
     * Returns metric records of one day.
     */
    public List<DailyMetricRecord> metricsOn(int day) {
        return metrics.stream()
                .filter(record -> record.getDay() == day)
                .collect(Collectors.toList());
    }

    /**
     * Looks up the route one vehicle drove on one day.
     */
    public Optional<VehicleRoute> route(int day, int vehicleId) {
        return routes.stream()
                .filter(route -> route.getDay() == day && route.getVehicleId() == vehicleId)
                .findFirst();
    }

    /**
     * Sums distance over all days and vehicles, two decimals.
     */
    public double totalDistanceKm() {
        double total = 0.0d;
        for (DailyMetricRecord metric : metrics) {
            total += metric.getDistanceKm();
        }
        return Rounding.distanceKm(total);
    }
}
