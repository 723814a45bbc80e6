package org.fleetday.ledger;

import lombok.Builder;
import lombok.Value;
import org.fleetday.geometry.Location;

/**
 * Immutable delivery customer as supplied by the data loader.
 */
@Value
@Builder
public class Customer {
    /** Unique external customer id. */
    String id;
    /** Delivery location. */
    Location location;
    /** Delivered weight in kg. */
    double weightKg;

    /**
     * Shorthand factory for coordinate-based customers.
     */
    public static Customer of(String id, double x, double y, double weightKg) {
        return new Customer(id, Location.of(x, y), weightKg);
    }
}
