// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The fixed structure of a crossword puzzle: its slots and the table of overlaps between
 * intersecting slots. Immutable once built. The overlap table is stored in both directions,
 * so {@code overlap(x, y)} and {@code overlap(y, x)} are each a single lookup.
 */
public final class Crossword {
    private final ImmutableSortedSet<Slot> slots;
    private final ImmutableTable<Slot, Slot, Overlap> overlaps;
    private final ImmutableMap<Slot, ImmutableSortedSet<Slot>> neighbors;
    private final ImmutableList<Arc> arcs;

    private Crossword(Set<Slot> slots, Table<Slot, Slot, Overlap> overlaps) {
        this.slots = ImmutableSortedSet.copyOf(slots);
        this.overlaps = ImmutableTable.copyOf(overlaps);
        ImmutableMap.Builder<Slot, ImmutableSortedSet<Slot>> nb = ImmutableMap.builder();
        ImmutableList.Builder<Arc> ab = ImmutableList.builder();
        for (Slot x : this.slots) {
            ImmutableSortedSet<Slot> ns = ImmutableSortedSet.copyOf(overlaps.row(x).keySet());
            nb.put(x, ns);
            for (Slot y : ns) ab.add(new Arc(x, y));
        }
        this.neighbors = nb.build();
        this.arcs = ab.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a crossword from slot geometry alone: two slots overlap iff they cover a common cell.
     * @param slots the slots of the puzzle
     * @return the puzzle structure
     * @throws IllegalArgumentException if a slot repeats, or two slots share more than one cell
     */
    public static Crossword fromSlots(Iterable<Slot> slots) {
        Builder b = builder();
        slots.forEach(b::addSlot);
        List<Slot> ss = new ArrayList<>(b.slots);
        for (int p = 0; p < ss.size(); ++p) {
            for (int q = p + 1; q < ss.size(); ++q) {
                Slot x = ss.get(p), y = ss.get(q);
                int i = -1, j = -1;
                for (int k = 0; k < x.length(); ++k) {
                    int o = y.offsetOf(x.rowOf(k), x.columnOf(k));
                    if (o < 0) continue;
                    if (i >= 0) throw new IllegalArgumentException("slots share more than one cell: " + x + ", " + y);
                    i = k;
                    j = o;
                }
                if (i >= 0) b.addOverlap(x, y, i, j);
            }
        }
        return b.build();
    }

    public ImmutableSortedSet<Slot> slots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    /**
     * @return the slots sharing a cell with x, in slot order
     */
    public ImmutableSortedSet<Slot> neighbors(Slot x) {
        ImmutableSortedSet<Slot> ns = neighbors.get(x);
        if (ns == null) throw new IllegalArgumentException("unknown slot: " + x);
        return ns;
    }

    public int degree(Slot x) {
        return neighbors(x).size();
    }

    public Optional<Overlap> overlap(Slot x, Slot y) {
        return Optional.ofNullable(overlaps.get(x, y));
    }

    /** Every ordered pair of neighboring slots. */
    public ImmutableList<Arc> arcs() {
        return arcs;
    }

    public static class Builder {
        private final Set<Slot> slots = new TreeSet<>();
        private final Table<Slot, Slot, Overlap> overlaps = HashBasedTable.create();

        private Builder() {}

        public Builder addSlot(Slot s) {
            if (!slots.add(s)) throw new IllegalArgumentException("duplicate slot: " + s);
            return this;
        }

        /**
         * Declares that letter i of x's word must equal letter j of y's word.
         * Redeclaring the same overlap is harmless; declaring a different one for the same pair is not.
         */
        public Builder addOverlap(Slot x, Slot y, int i, int j) {
            if (!slots.contains(x)) throw new IllegalArgumentException("unknown slot: " + x);
            if (!slots.contains(y)) throw new IllegalArgumentException("unknown slot: " + y);
            if (x.equals(y)) throw new IllegalArgumentException("slot cannot overlap itself: " + x);
            if (i < 0 || i >= x.length()) throw new IllegalArgumentException("overlap offset " + i + " out of bounds for " + x);
            if (j < 0 || j >= y.length()) throw new IllegalArgumentException("overlap offset " + j + " out of bounds for " + y);
            Overlap o = new Overlap(i, j);
            Overlap prior = overlaps.get(x, y);
            if (prior != null && !prior.equals(o)) {
                throw new IllegalArgumentException("conflicting overlaps for " + x + ", " + y + ": " + prior + " and " + o);
            }
            overlaps.put(x, y, o);
            overlaps.put(y, x, o.reversed());
            return this;
        }

        public Crossword build() {
            return new Crossword(slots, overlaps);
        }
    }
}
