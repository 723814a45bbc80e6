package org.fleetday.scheduling;

import lombok.Builder;
import lombok.Value;
import org.fleetday.geometry.Location;

import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Fleet and duty-time parameters for one planner.
 *
 * <p>Defaults describe a four-vehicle fleet with 15 kg capacity, 60 km/h average speed,
 * 10 minutes of unloading per customer, 20 minutes per depot reload and a 7 hour
 * workday.</p>
 */
@Value
@Builder(toBuilder = true)
public class SchedulerConfig {
    public static final String PROPERTY_PREFIX = "fleetday.scheduler.";
    public static final String PROP_CAPACITY_KG = PROPERTY_PREFIX + "capacityKg";
    public static final String PROP_AVERAGE_SPEED_KMH = PROPERTY_PREFIX + "averageSpeedKmh";
    public static final String PROP_DISPATCH_MINUTES = PROPERTY_PREFIX + "dispatchMinutes";
    public static final String PROP_RELOAD_MINUTES = PROPERTY_PREFIX + "reloadMinutes";
    public static final String PROP_WORKDAY_MINUTES = PROPERTY_PREFIX + "workdayMinutes";
    public static final String PROP_FLEET_SIZE = PROPERTY_PREFIX + "fleetSize";
    public static final String PROP_MAX_DAYS = PROPERTY_PREFIX + "maxDays";
    public static final String PROP_TIE_BREAK_POLICY = PROPERTY_PREFIX + "tieBreakPolicy";
    public static final String PROP_REJECT_UNSERVABLE = PROPERTY_PREFIX + "rejectUnservableCustomers";
    public static final String PROP_DEPOT_X = PROPERTY_PREFIX + "depotX";
    public static final String PROP_DEPOT_Y = PROPERTY_PREFIX + "depotY";

    /** Load limit per vehicle in kg. */
    @Builder.Default
    double capacityKg = 15.0d;

    /** Average driving speed in km/h. */
    @Builder.Default
    double averageSpeedKmh = 60.0d;

    /** Fixed unloading time per customer in minutes. */
    @Builder.Default
    double dispatchMinutes = 10.0d;

    /** Fixed time spent at the depot per forced reload in minutes. */
    @Builder.Default
    double reloadMinutes = 20.0d;

    /** Per-day duty budget in minutes. */
    @Builder.Default
    double workdayMinutes = 7 * 60.0d;

    /** Number of vehicles operating each day. */
    @Builder.Default
    int fleetSize = 4;

    /** Highest operating day the multi-day driver may schedule. */
    @Builder.Default
    int maxDays = 365;

    /** Rule for equal-cost candidates. */
    @Builder.Default
    TieBreakPolicy tieBreakPolicy = TieBreakPolicy.INPUT_ORDER;

    /**
     * When true, customers that no vehicle could ever serve are rejected before the
     * first day is planned. When false, they are left to the {@code maxDays} guard.
     */
    @Builder.Default
    boolean rejectUnservableCustomers = true;

    /** Start, reload and end location of every route. */
    @Builder.Default
    Location depot = Location.ORIGIN;

    /**
     * Returns the default configuration.
     */
    public static SchedulerConfig defaults() {
        return SchedulerConfig.builder().build();
    }

    /**
     * Overlays {@code fleetday.scheduler.*} system properties on the defaults.
     *
     * @throws SchedulingException when a set property cannot be parsed.
     */
    public static SchedulerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Overlays {@code fleetday.scheduler.*} entries of the given properties on the defaults.
     * Missing or blank entries keep their default.
     *
     * @param properties property source.
     * @return parsed configuration; not yet validated.
     * @throws SchedulingException when a set property cannot be parsed.
     */
    public static SchedulerConfig fromProperties(Properties properties) {
        SchedulerConfig base = defaults();
        return SchedulerConfig.builder()
                .capacityKg(read(properties, PROP_CAPACITY_KG, Double::parseDouble, base.capacityKg))
                .averageSpeedKmh(read(properties, PROP_AVERAGE_SPEED_KMH, Double::parseDouble, base.averageSpeedKmh))
                .dispatchMinutes(read(properties, PROP_DISPATCH_MINUTES, Double::parseDouble, base.dispatchMinutes))
                .reloadMinutes(read(properties, PROP_RELOAD_MINUTES, Double::parseDouble, base.reloadMinutes))
                .workdayMinutes(read(properties, PROP_WORKDAY_MINUTES, Double::parseDouble, base.workdayMinutes))
                .fleetSize(read(properties, PROP_FLEET_SIZE, Integer::parseInt, base.fleetSize))
                .maxDays(read(properties, PROP_MAX_DAYS, Integer::parseInt, base.maxDays))
                .tieBreakPolicy(read(
                        properties,
                        PROP_TIE_BREAK_POLICY,
                        raw -> TieBreakPolicy.valueOf(raw.toUpperCase(Locale.ROOT)),
                        base.tieBreakPolicy
                ))
                .rejectUnservableCustomers(read(
                        properties,
                        PROP_REJECT_UNSERVABLE,
                        SchedulerConfig::parseBoolean,
                        base.rejectUnservableCustomers
                ))
                .depot(Location.of(
                        read(properties, PROP_DEPOT_X, Double::parseDouble, base.depot.getX()),
                        read(properties, PROP_DEPOT_Y, Double::parseDouble, base.depot.getY())
                ))
                .build();
    }

    /**
     * Checks that the configuration cannot stall the multi-day driver.
     *
     * @return this configuration.
     * @throws SchedulingException with {@link DeliveryPlanner#REASON_INVALID_CONFIGURATION}.
     */
    public SchedulerConfig validate() {
        requirePositive("capacityKg", capacityKg);
        requirePositive("averageSpeedKmh", averageSpeedKmh);
        requirePositive("workdayMinutes", workdayMinutes);
        requireNonNegative("dispatchMinutes", dispatchMinutes);
        requireNonNegative("reloadMinutes", reloadMinutes);
        if (fleetSize <= 0) {
            throw SchedulingException.invalidConfiguration("fleetSize must be > 0, got " + fleetSize);
        }
        if (maxDays <= 0) {
            throw SchedulingException.invalidConfiguration("maxDays must be > 0, got " + maxDays);
        }
        if (tieBreakPolicy == null) {
            throw SchedulingException.invalidConfiguration("tieBreakPolicy is required");
        }
        if (depot == null || !depot.isFinite()) {
            throw SchedulingException.invalidConfiguration("depot must be a finite location");
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw SchedulingException.invalidConfiguration(name + " must be positive and finite, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw SchedulingException.invalidConfiguration(name + " must be >= 0 and finite, got " + value);
        }
    }

    private static boolean parseBoolean(String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        throw new IllegalArgumentException("not a boolean: " + raw);
    }

    private static <T> T read(Properties properties, String key, Function<String, T> parser, T fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw SchedulingException.invalidConfiguration("cannot parse " + key + "='" + raw + "'", ex);
        }
    }
}
