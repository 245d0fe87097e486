package com.libragraph.weather.core.season;

import com.libragraph.weather.types.SeasonProjector;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Which month slots of the season timeline a history occupies.
 *
 * <p>Slots are numbered 1..24: 1..12 are the months of the first synthetic year, 13..24
 * those of the second. Immutable.
 */
public final class MonthSlotMap {

    private static final MonthSlotMap EMPTY = new MonthSlotMap(new BitSet());

    private final BitSet slots;

    private MonthSlotMap(BitSet slots) {
        this.slots = slots;
    }

    public static MonthSlotMap empty() {
        return EMPTY;
    }

    public static MonthSlotMap of(int... slots) {
        BitSet bits = new BitSet(SeasonProjector.SLOT_COUNT + 1);
        for (int slot : slots) {
            bits.set(checkSlot(slot));
        }
        return new MonthSlotMap(bits);
    }

    /**
     * All slots from {@code start} to {@code end} inclusive.
     */
    public static MonthSlotMap range(int start, int end) {
        checkSlot(start);
        checkSlot(end);
        BitSet bits = new BitSet(SeasonProjector.SLOT_COUNT + 1);
        bits.set(start, end + 1);
        return new MonthSlotMap(bits);
    }

    public boolean isOccupied(int slot) {
        return slots.get(checkSlot(slot));
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public int count() {
        return slots.cardinality();
    }

    /**
     * Occupied slots in ascending order.
     */
    public List<Integer> occupiedSlots() {
        return slots.stream().boxed().collect(Collectors.toUnmodifiableList());
    }

    /**
     * Occupancy indexed by slot, 25 entries with index 0 always false.
     */
    public boolean[] toArray() {
        boolean[] array = new boolean[SeasonProjector.SLOT_COUNT + 1];
        slots.stream().forEach(slot -> array[slot] = true);
        return array;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MonthSlotMap other)) return false;
        return slots.equals(other.slots);
    }

    @Override
    public int hashCode() {
        return slots.hashCode();
    }

    @Override
    public String toString() {
        return "MonthSlotMap" + Arrays.toString(slots.stream().toArray());
    }

    private static int checkSlot(int slot) {
        if (slot < 1 || slot > SeasonProjector.SLOT_COUNT) {
            throw new IllegalArgumentException("slot must be in 1.." + SeasonProjector.SLOT_COUNT + ", got: " + slot);
        }
        return slot;
    }
}
