package org.fleetday.core.math;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding used by schedule records.
 *
 * <p>Values are rounded half-even on their exact binary expansion, so {@code 2.675}
 * (stored as {@code 2.67499999...}) rounds to {@code 2.67}.</p>
 */
@UtilityClass
public class Rounding {

    /**
     * Rounds a value to the requested number of decimal places.
     *
     * @param value value to round; non-finite values are returned unchanged.
     * @param decimals number of decimal places, {@code >= 0}.
     * @return rounded value.
     */
    public static double round(double value, int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be >= 0");
        }
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }

    /** Rounds a distance to two decimals (km precision of reports). */
    public static double distanceKm(double km) {
        return round(km, 2);
    }

    /** Rounds a duration to one decimal (minute precision of reports). */
    public static double minutes(double minutes) {
        return round(minutes, 1);
    }
}
