package org.fleetday.scheduling;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Rule for choosing among candidates with identical lookahead cost.
 *
 * <p>{@code INPUT_ORDER} keeps the first candidate in ledger (input) order.</p>
 * <p>{@code CUSTOMER_ID} keeps the smallest customer id under {@link #CUSTOMER_ID_ORDER}.</p>
 */
public enum TieBreakPolicy {
    INPUT_ORDER,
    CUSTOMER_ID;

    private static final Pattern NUMERIC_ID = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

    /**
     * Id order: decimal-number ids first, by value ({@code "2"} before {@code "10"}), then
     * all other ids by string. Numerically equal ids ({@code "07"}, {@code "7"}) fall back to
     * string order.
     */
    public static final Comparator<String> CUSTOMER_ID_ORDER = TieBreakPolicy::compareIds;

    private static int compareIds(String left, String right) {
        boolean leftNumeric = NUMERIC_ID.matcher(left).matches();
        boolean rightNumeric = NUMERIC_ID.matcher(right).matches();
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        if (leftNumeric) {
            int byValue = new BigDecimal(left).compareTo(new BigDecimal(right));
            if (byValue != 0) {
                return byValue;
            }
        }
        return left.compareTo(right);
    }
}
