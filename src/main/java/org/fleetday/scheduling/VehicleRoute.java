package org.fleetday.scheduling;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Closed stop sequence driven by one vehicle on one day.
 *
 * <p>Depot visits appear as {@link #DEPOT_ID}. A vehicle that served nobody has the
 * one-element route {@code [DEPOT]}.</p>
 */
@Value
@Builder
public class VehicleRoute {
    /** Stop id used for the depot in route sequences. */
    public static final String DEPOT_ID = "DEPOT";

    /** Operating day (1-based). */
    int day;
    /** Vehicle slot (1-based). */
    int vehicleId;
    /** Visited stops from first depot departure to final depot arrival. */
    @Singular("stop")
    List<String> stopIds;
}
