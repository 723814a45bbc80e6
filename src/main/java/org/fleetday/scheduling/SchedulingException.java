package org.fleetday.scheduling;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Objects;

/**
 * Planner failure tagged with one of the {@code REASON_*} codes of {@link DeliveryPlanner}.
 *
 * <p>The message reads {@code [REASON_CODE] details}. Instances come from the static
 * factories, one per failure family.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SchedulingException extends RuntimeException {
    static final int MAX_IDS_IN_MESSAGE = 10;

    private final String reasonCode;

    SchedulingException(String reasonCode, String message, Throwable cause) {
        super("[" + requireCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"), cause);
        this.reasonCode = reasonCode;
    }

    public static SchedulingException invalidConfiguration(String message) {
        return invalidConfiguration(message, null);
    }

    public static SchedulingException invalidConfiguration(String message, Throwable cause) {
        return new SchedulingException(DeliveryPlanner.REASON_INVALID_CONFIGURATION, message, cause);
    }

    public static SchedulingException customersRequired(String message) {
        return new SchedulingException(DeliveryPlanner.REASON_CUSTOMERS_REQUIRED, message, null);
    }

    public static SchedulingException invalidCustomer(String message) {
        return new SchedulingException(DeliveryPlanner.REASON_INVALID_CUSTOMER, message, null);
    }

    public static SchedulingException duplicateCustomerId(String id, String message) {
        return new SchedulingException(
                DeliveryPlanner.REASON_DUPLICATE_CUSTOMER_ID,
                "customer id " + id + " " + message,
                null
        );
    }

    /**
     * Customers no vehicle of the configured fleet could ever serve.
     */
    public static SchedulingException unservableCustomers(List<String> ids) {
        return new SchedulingException(
                DeliveryPlanner.REASON_UNSERVABLE_CUSTOMER,
                ids.size() + " customer(s) exceed capacity or cannot be reached within the workday: "
                        + abbreviate(ids),
                null
        );
    }

    /**
     * Customers left over once the day ceiling is reached.
     */
    public static SchedulingException dayCeilingExceeded(int daysPlanned, List<String> unservedIds) {
        return new SchedulingException(
                DeliveryPlanner.REASON_DAY_CEILING_EXCEEDED,
                unservedIds.size() + " customer(s) still unserved after " + daysPlanned + " day(s): "
                        + abbreviate(unservedIds),
                null
        );
    }

    static String abbreviate(List<String> ids) {
        if (ids.size() <= MAX_IDS_IN_MESSAGE) {
            return ids.toString();
        }
        return ids.subList(0, MAX_IDS_IN_MESSAGE) + " and " + (ids.size() - MAX_IDS_IN_MESSAGE) + " more";
    }

    private static String requireCode(String reasonCode) {
        if (Objects.requireNonNull(reasonCode, "reasonCode").isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
