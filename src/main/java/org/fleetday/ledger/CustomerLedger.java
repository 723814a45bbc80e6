package org.fleetday.ledger;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.fleetday.core.id.CustomerIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Customer records plus their mutable per-customer service state.
 *
 * <p>Customers live in dense slots following input order. Each slot is committed at most
 * once through {@link #markServed(int, int, int, double, double)}; after that its state is
 * frozen. The ledger is the only state shared by vehicles and across operating days.</p>
 *
 * <p>Not thread-safe. One planner run owns one ledger.</p>
 */
public final class CustomerLedger {
    private final CustomerIndex index;
    private final Customer[] customers;

    private final boolean[] served;
    private final int[] assignedDay;
    private final int[] vehicleId;
    private final double[] arrivalMinute;
    private final double[] departureMinute;
    private int unservedCount;

    /**
     * Creates a ledger with every customer unserved.
     *
     * @param customers customers in input order.
     * @throws IllegalArgumentException for null entries, non-finite locations, or negative weights.
     * @throws CustomerIndex.DuplicateCustomerException when two customers share an id.
     */
    public CustomerLedger(List<Customer> customers) {
        Objects.requireNonNull(customers, "customers");
        int size = customers.size();
        this.customers = new Customer[size];
        List<String> ids = new ArrayList<>(size);
        for (int slot = 0; slot < size; slot++) {
            Customer customer = customers.get(slot);
            if (customer == null) {
                throw new IllegalArgumentException("customer at position " + slot + " is null");
            }
            if (customer.getLocation() == null || !customer.getLocation().isFinite()) {
                throw new IllegalArgumentException("customer " + customer.getId() + " has no finite location");
            }
            if (!Double.isFinite(customer.getWeightKg()) || customer.getWeightKg() < 0.0d) {
                throw new IllegalArgumentException(
                        "customer " + customer.getId() + " has invalid weight " + customer.getWeightKg()
                );
            }
            this.customers[slot] = customer;
            ids.add(customer.getId());
        }
        this.index = CustomerIndex.of(ids);

        this.served = new boolean[size];
        this.assignedDay = new int[size];
        this.vehicleId = new int[size];
        this.arrivalMinute = new double[size];
        this.departureMinute = new double[size];
        Arrays.fill(arrivalMinute, Double.NaN);
        Arrays.fill(departureMinute, Double.NaN);
        this.unservedCount = size;
    }

    public int size() {
        return customers.length;
    }

    public CustomerIndex index() {
        return index;
    }

    public Customer customer(int slot) {
        checkSlot(slot);
        return customers[slot];
    }

    public Customer customer(String customerId) {
        return customers[index.toSlot(customerId)];
    }

    public boolean isServed(int slot) {
        checkSlot(slot);
        return served[slot];
    }

    public int unservedCount() {
        return unservedCount;
    }

    public boolean allServed() {
        return unservedCount == 0;
    }

    /**
     * Returns unserved slots in ascending (input) order.
     */
    public IntList unservedSlots() {
        IntArrayList slots = new IntArrayList(unservedCount);
        for (int slot = 0; slot < customers.length; slot++) {
            if (!served[slot]) {
                slots.add(slot);
            }
        }
        return slots;
    }

    /**
     * Returns the lightest weight among unserved customers, or empty when all are served.
     */
    public OptionalDouble minUnservedWeight() {
        double min = Double.POSITIVE_INFINITY;
        boolean any = false;
        for (int slot = 0; slot < customers.length; slot++) {
            if (!served[slot]) {
                min = Math.min(min, customers[slot].getWeightKg());
                any = true;
            }
        }
        return any ? OptionalDouble.of(min) : OptionalDouble.empty();
    }

    /**
     * Commits one customer to a vehicle route.
     *
     * @param slot customer slot.
     * @param day operating day, {@code >= 1}.
     * @param vehicle vehicle slot, {@code >= 1}.
     * @param arrival arrival minute since day start.
     * @param departure departure minute since day start, {@code >= arrival}.
     * @throws IllegalStateException if the customer was already served.
     */
    public void markServed(int slot, int day, int vehicle, double arrival, double departure) {
        checkSlot(slot);
        if (served[slot]) {
            throw new IllegalStateException(
                    "customer " + customers[slot].getId() + " already served on day " + assignedDay[slot]
            );
        }
        if (day < 1 || vehicle < 1) {
            throw new IllegalArgumentException("day and vehicle must be >= 1, got day=" + day + ", vehicle=" + vehicle);
        }
        if (!(departure >= arrival)) {
            throw new IllegalArgumentException("departure " + departure + " precedes arrival " + arrival);
        }
        served[slot] = true;
        assignedDay[slot] = day;
        vehicleId[slot] = vehicle;
        arrivalMinute[slot] = arrival;
        departureMinute[slot] = departure;
        unservedCount--;
    }

    /**
     * Returns a snapshot of one slot's service state.
     */
    public ServiceState serviceState(int slot) {
        checkSlot(slot);
        ServiceState.ServiceStateBuilder builder = ServiceState.builder()
                .customerId(customers[slot].getId())
                .served(served[slot]);
        if (served[slot]) {
            builder.assignedDay(assignedDay[slot])
                    .vehicleId(vehicleId[slot])
                    .arrivalMinute(arrivalMinute[slot])
                    .departureMinute(departureMinute[slot]);
        }
        return builder.build();
    }

    public ServiceState serviceState(String customerId) {
        return serviceState(index.toSlot(customerId));
    }

    /**
     * Returns snapshots for every customer in input order.
     */
    public List<ServiceState> serviceStates() {
        List<ServiceState> states = new ArrayList<>(customers.length);
        for (int slot = 0; slot < customers.length; slot++) {
            states.add(serviceState(slot));
        }
        return states;
    }

    /**
     * Returns ids of customers still waiting for delivery, in input order.
     */
    public List<String> unservedCustomerIds() {
        List<String> ids = new ArrayList<>(unservedCount);
        for (int slot = 0; slot < customers.length; slot++) {
            if (!served[slot]) {
                ids.add(customers[slot].getId());
            }
        }
        return ids;
    }

    private void checkSlot(int slot) {
        if (slot < 0 || slot >= customers.length) {
            throw new IndexOutOfBoundsException("slot " + slot + " outside [0, " + customers.length + ")");
        }
    }
}
