package org.fleetday.scheduling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SchedulingException Tests")
class SchedulingExceptionTest {

    @Test
    @DisplayName("Configuration failure keeps the parse cause")
    void testInvalidConfiguration() {
        NumberFormatException cause = new NumberFormatException("x");
        SchedulingException ex = SchedulingException.invalidConfiguration("cannot parse fleetSize", cause);

        assertEquals(DeliveryPlanner.REASON_INVALID_CONFIGURATION, ex.reasonCode());
        assertEquals("[FD_INVALID_CONFIGURATION] cannot parse fleetSize", ex.getMessage());
        assertSame(cause, ex.getCause());
        assertNull(SchedulingException.invalidConfiguration("fleetSize must be > 0").getCause());
    }

    @Test
    @DisplayName("Duplicate id failure names the id")
    void testDuplicateCustomerId() {
        SchedulingException ex = SchedulingException.duplicateCustomerId("42", "appears twice");

        assertEquals(DeliveryPlanner.REASON_DUPLICATE_CUSTOMER_ID, ex.reasonCode());
        assertEquals("[FD_DUPLICATE_CUSTOMER_ID] customer id 42 appears twice", ex.getMessage());
    }

    @Test
    @DisplayName("Long id lists are cut after ten entries")
    void testIdListAbbreviated() {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= 13; i++) {
            ids.add("c" + i);
        }

        SchedulingException ex = SchedulingException.dayCeilingExceeded(365, ids);

        assertEquals(DeliveryPlanner.REASON_DAY_CEILING_EXCEEDED, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[FD_DAY_CEILING_EXCEEDED] 13 customer(s) still unserved after 365 day(s): "));
        assertTrue(ex.getMessage().endsWith("c10] and 3 more"));
        assertEquals("[a, b]", SchedulingException.abbreviate(List.of("a", "b")));
    }

    @Test
    @DisplayName("Unservable failure lists the ids")
    void testUnservableCustomers() {
        SchedulingException ex = SchedulingException.unservableCustomers(List.of("heavy"));

        assertEquals(DeliveryPlanner.REASON_UNSERVABLE_CUSTOMER, ex.reasonCode());
        assertTrue(ex.getMessage().endsWith(": [heavy]"));
    }

    @Test
    @DisplayName("Blank or null reason code is rejected")
    void testReasonCodeRequired() {
        assertThrows(IllegalArgumentException.class, () -> new SchedulingException(" ", "details", null));
        assertThrows(NullPointerException.class, () -> new SchedulingException(null, "details", null));
        assertThrows(NullPointerException.class, () -> SchedulingException.invalidCustomer(null));
    }
}
