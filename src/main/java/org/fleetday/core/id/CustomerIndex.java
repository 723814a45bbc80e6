package org.fleetday.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between external customer ids and dense ledger slots.
 *
 * <p>Slots follow input order: the first customer id handed to {@link #of(List)} maps to
 * slot {@code 0}. Ledger scans iterate slots in ascending order, which keeps candidate
 * evaluation deterministic.</p>
 */
public interface CustomerIndex {

    /**
     * Resolves the ledger slot for a customer id.
     *
     * @param customerId external customer id.
     * @return slot in {@code [0, size)}.
     * @throws UnknownCustomerException if the id is not indexed.
     */
    int toSlot(String customerId) throws UnknownCustomerException;

    /**
     * Resolves the customer id stored at a ledger slot.
     *
     * @param slot ledger slot.
     * @return external customer id.
     * @throws IndexOutOfBoundsException if the slot is out of range.
     */
    String toCustomerId(int slot);

    /**
     * Checks whether a customer id is indexed.
     *
     * @param customerId id to test, may be null.
     * @return true when present.
     */
    boolean contains(String customerId);

    /**
     * Returns number of indexed customers.
     *
     * @return index size.
     */
    int size();

    /**
     * Thrown when a customer id has no ledger slot.
     */
    @StandardException
    class UnknownCustomerException extends RuntimeException {
    }

    /**
     * Thrown when the same customer id is indexed twice.
     */
    @StandardException
    class DuplicateCustomerException extends RuntimeException {
    }

    /**
     * Builds the default immutable index from ids in input order.
     *
     * @param customerIds ids in ledger order; must be non-null, non-blank and unique.
     * @return immutable index.
     */
    static CustomerIndex of(List<String> customerIds) {
        return new FastUtilCustomerIndex(customerIds);
    }
}
