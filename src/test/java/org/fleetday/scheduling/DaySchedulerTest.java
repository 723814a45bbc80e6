package org.fleetday.scheduling;

import org.fleetday.geometry.TravelModel;
import org.fleetday.ledger.CustomerLedger;
import org.fleetday.testutil.ScheduleFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DayScheduler Tests")
class DaySchedulerTest {
    private static final double EPS = 1e-9;

    @Test
    @DisplayName("Vehicles run in fleet order and later vehicles only see leftovers")
    void testSequentialVehiclesShareLedger() {
        SchedulerConfig config = ScheduleFixtures.singleVehicle().toBuilder()
                .fleetSize(3)
                .workdayMinutes(100.0d)
                .build();
        CustomerLedger ledger = new CustomerLedger(ScheduleFixtures.compassRose());

        DayPlan plan = newScheduler(config).runDay(1, ledger);

        assertEquals(1, plan.getDay());
        assertTrue(ledger.allServed());
        assertEquals(List.of("DEPOT", "N", "DEPOT", "E", "DEPOT"), plan.getRoutes().get(0).getStopIds());
        assertEquals(List.of("DEPOT", "S", "DEPOT", "W", "DEPOT"), plan.getRoutes().get(1).getStopIds());
        assertEquals(List.of("DEPOT"), plan.getRoutes().get(2).getStopIds());

        DailyMetricRecord first = plan.getMetrics().get(0);
        assertEquals(1, first.getVehicleId());
        assertEquals(40.0d, first.getDistanceKm(), EPS);
        assertEquals(100.0d, first.getDutyMinutes(), EPS);
        assertEquals(2, first.getDeliveryCount());
        assertEquals(2, first.getReloadCount());
        assertFalse(first.isWorkdayExceeded());

        DailyMetricRecord second = plan.getMetrics().get(1);
        assertEquals(40.0d, second.getDistanceKm(), EPS);
        assertEquals(80.0d, second.getDutyMinutes(), EPS);
        assertEquals(1, second.getReloadCount());

        DailyMetricRecord idle = plan.getMetrics().get(2);
        assertEquals(3, idle.getVehicleId());
        assertEquals(0.0d, idle.getDistanceKm(), EPS);
        assertEquals(0.0d, idle.getDutyMinutes(), EPS);
        assertEquals(0, idle.getDeliveryCount());
    }

    @Test
    @DisplayName("Delivery records carry day and vehicle of the commit")
    void testDeliveryAttribution() {
        SchedulerConfig config = ScheduleFixtures.singleVehicle().toBuilder()
                .fleetSize(2)
                .workdayMinutes(100.0d)
                .build();
        CustomerLedger ledger = new CustomerLedger(ScheduleFixtures.compassRose());

        DayPlan plan = newScheduler(config).runDay(3, ledger);

        assertEquals(4, plan.getDeliveries().size());
        for (DeliveryRecord record : plan.getDeliveries()) {
            assertEquals(3, record.getDay());
            assertEquals(ledger.serviceState(record.getCustomerId()).getVehicleId(), record.getVehicleId());
        }
        assertEquals(3, ledger.serviceState("W").getAssignedDay());
    }

    @Test
    @DisplayName("Overrun caused by the unconditional reload is flagged on the metric")
    void testWorkdayExceededFlag() {
        SchedulerConfig config = ScheduleFixtures.singleVehicle().toBuilder().workdayMinutes(40.0d).build();
        CustomerLedger ledger = new CustomerLedger(ScheduleFixtures.northPair());

        DayPlan plan = newScheduler(config).runDay(1, ledger);

        DailyMetricRecord metric = plan.getMetrics().get(0);
        assertTrue(metric.isWorkdayExceeded());
        assertEquals(50.0d, metric.getDutyMinutes(), EPS);
        assertEquals(List.of("DEPOT", "A", "DEPOT"), plan.getRoutes().get(0).getStopIds());
        assertEquals(1, ledger.unservedCount());
    }

    @Test
    @DisplayName("A day with nothing left still reports every vehicle")
    void testEmptyLedgerDay() {
        SchedulerConfig config = ScheduleFixtures.singleVehicle().toBuilder().fleetSize(2).build();

        DayPlan plan = newScheduler(config).runDay(1, new CustomerLedger(List.of()));

        assertTrue(plan.getDeliveries().isEmpty());
        assertEquals(2, plan.getMetrics().size());
        assertEquals(2, plan.getRoutes().size());
    }

    @Test
    @DisplayName("Day numbers start at one")
    void testDayValidation() {
        DayScheduler scheduler = newScheduler(ScheduleFixtures.singleVehicle());
        assertThrows(IllegalArgumentException.class, () -> scheduler.runDay(0, new CustomerLedger(List.of())));
    }

    private static DayScheduler newScheduler(SchedulerConfig config) {
        return new DayScheduler(config, new RouteBuilder(config, new TravelModel(config.getAverageSpeedKmh())));
    }
}
