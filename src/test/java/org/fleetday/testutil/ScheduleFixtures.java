package org.fleetday.testutil;

import org.fleetday.ledger.Customer;
import org.fleetday.scheduling.SchedulerConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared customer sets and configurations for scheduling tests.
 */
public final class ScheduleFixtures {
    public static final double CAPACITY_KG = 15.0d;
    public static final double WORKDAY_MINUTES = 420.0d;

    private ScheduleFixtures() {
    }

    /**
     * Depot at origin, 60 km/h (one km per minute), 10 min dispatch, 15 kg, 420 min workday,
     * 20 min reload, one vehicle.
     */
    public static SchedulerConfig singleVehicle() {
        return SchedulerConfig.builder()
                .capacityKg(CAPACITY_KG)
                .averageSpeedKmh(60.0d)
                .dispatchMinutes(10.0d)
                .reloadMinutes(20.0d)
                .workdayMinutes(WORKDAY_MINUTES)
                .fleetSize(1)
                .build();
    }

    /**
     * Two 10 kg customers north of the depot at 10 km and 20 km.
     */
    public static List<Customer> northPair() {
        return List.of(
                Customer.of("A", 0.0d, 10.0d, 10.0d),
                Customer.of("B", 0.0d, 20.0d, 10.0d)
        );
    }

    /**
     * Four 10 kg customers 10 km from the depot on each compass point, in N, E, S, W order.
     */
    public static List<Customer> compassRose() {
        return List.of(
                Customer.of("N", 0.0d, 10.0d, 10.0d),
                Customer.of("E", 10.0d, 0.0d, 10.0d),
                Customer.of("S", 0.0d, -10.0d, 10.0d),
                Customer.of("W", -10.0d, 0.0d, 10.0d)
        );
    }

    /**
     * Deterministic pseudo-random customers inside a 60 km square around the depot,
     * weights between 1 and 8 kg.
     */
    public static List<Customer> scattered(int count, long seed) {
        Random random = new Random(seed);
        List<Customer> customers = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            double x = Math.round((random.nextDouble() * 60.0d - 30.0d) * 100.0d) / 100.0d;
            double y = Math.round((random.nextDouble() * 60.0d - 30.0d) * 100.0d) / 100.0d;
            double weight = 1 + random.nextInt(8);
            customers.add(Customer.of("C" + i, x, y, weight));
        }
        return customers;
    }
}
