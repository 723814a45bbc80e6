package org.fleetday.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * {@link CustomerIndex} backed by a fastutil open hash map.
 *
 * <p>Immutable after construction and safe for concurrent reads.</p>
 */
public final class FastUtilCustomerIndex implements CustomerIndex {
    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Indexes customer ids in the given order.
     *
     * @param customerIds ids in ledger order.
     * @throws IllegalArgumentException if the list is null or holds a null/blank id.
     * @throws DuplicateCustomerException if an id appears twice.
     */
    public FastUtilCustomerIndex(List<String> customerIds) {
        if (customerIds == null) {
            throw new IllegalArgumentException("customerIds cannot be null");
        }
        int size = customerIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int slot = 0; slot < size; slot++) {
            String id = customerIds.get(slot);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("customer id at position " + slot + " is null or blank");
            }
            int previous = forward.putIfAbsent(id, slot);
            if (previous != MISSING) {
                throw new DuplicateCustomerException(
                        "customer id '" + id + "' appears at positions " + previous + " and " + slot
                );
            }
            reverse[slot] = id;
        }
        this.forward.trim();
    }

    @Override
    public int toSlot(String customerId) throws UnknownCustomerException {
        if (customerId == null) {
            throw new IllegalArgumentException("customerId cannot be null");
        }
        int slot = forward.getInt(customerId);
        if (slot == MISSING) {
            throw new UnknownCustomerException("customer id not indexed: " + customerId);
        }
        return slot;
    }

    @Override
    public String toCustomerId(int slot) {
        if (slot < 0 || slot >= reverse.length) {
            throw new IndexOutOfBoundsException("slot " + slot + " outside [0, " + reverse.length + ")");
        }
        return reverse[slot];
    }

    @Override
    public boolean contains(String customerId) {
        return customerId != null && forward.containsKey(customerId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
