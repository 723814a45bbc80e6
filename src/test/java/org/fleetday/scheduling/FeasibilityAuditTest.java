package org.fleetday.scheduling;

import org.fleetday.geometry.Location;
import org.fleetday.geometry.TravelModel;
import org.fleetday.ledger.Customer;
import org.fleetday.testutil.ScheduleFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeasibilityAuditTest {
    private static final double EPS = 1e-9;

    @Test
    @DisplayName("Round trip charges both legs and one dispatch")
    void testRoundTripMinutes() {
        FeasibilityAudit audit = newAudit(ScheduleFixtures.singleVehicle());

        assertEquals(50.0d, audit.depotRoundTripMinutes(Customer.of("B", 0.0d, 20.0d, 1.0d)), EPS);
        assertEquals(10.0d, audit.depotRoundTripMinutes(Customer.of("at-depot", 0.0d, 0.0d, 1.0d)), EPS);
    }

    @Test
    @DisplayName("Round trip is measured from a configured depot")
    void testShiftedDepot() {
        SchedulerConfig config = ScheduleFixtures.singleVehicle().toBuilder().depot(Location.of(0.0d, 20.0d)).build();
        FeasibilityAudit audit = newAudit(config);

        assertEquals(10.0d, audit.depotRoundTripMinutes(Customer.of("B", 0.0d, 20.0d, 1.0d)), EPS);
    }

    @Test
    @DisplayName("Servable means fits capacity and fits the workday alone")
    void testServability() {
        FeasibilityAudit audit = newAudit(ScheduleFixtures.singleVehicle().toBuilder().workdayMinutes(400.0d).build());
        Customer exactCapacity = Customer.of("full", 0.0d, 1.0d, 15.0d);
        Customer overweight = Customer.of("heavy", 0.0d, 1.0d, 15.5d);
        // 195 + 10 + 195 = 400 exactly
        Customer edgeOfDay = Customer.of("edge", 195.0d, 0.0d, 1.0d);
        Customer beyondDay = Customer.of("beyond", 195.5d, 0.0d, 1.0d);

        assertTrue(audit.isServable(exactCapacity));
        assertFalse(audit.fitsCapacity(overweight));
        assertTrue(audit.reachableWithinWorkday(edgeOfDay));
        assertFalse(audit.reachableWithinWorkday(beyondDay));
        assertEquals(
                List.of("heavy", "beyond"),
                audit.unservableCustomerIds(List.of(exactCapacity, overweight, edgeOfDay, beyondDay))
        );
    }

    private static FeasibilityAudit newAudit(SchedulerConfig config) {
        return new FeasibilityAudit(config, new TravelModel(config.getAverageSpeedKmh()));
    }
}
