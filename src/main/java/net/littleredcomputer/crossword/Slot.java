// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.Objects;

/**
 * A fillable run of cells: the variable of the crossword CSP. Slots are ordered by
 * position (row, then column) and then orientation; that order is the final tie-break
 * wherever the solver must choose among otherwise equal slots.
 */
public final class Slot implements Comparable<Slot> {
    private static final Comparator<Slot> ORDER = Comparator
            .comparingInt(Slot::row)
            .thenComparingInt(Slot::column)
            .thenComparing(Slot::orientation)
            .thenComparingInt(Slot::length);

    private final int row;
    private final int column;
    private final int length;
    private final Orientation orientation;

    public Slot(int row, int column, Orientation orientation, int length) {
        if (length < 1) throw new IllegalArgumentException("slot length must be positive: " + length);
        if (row < 0 || column < 0) throw new IllegalArgumentException("slot position must be nonnegative");
        this.row = row;
        this.column = column;
        this.orientation = Objects.requireNonNull(orientation);
        this.length = length;
    }

    public int row() { return row; }
    public int column() { return column; }
    public int length() { return length; }
    public Orientation orientation() { return orientation; }

    /** Row of the k-th cell of this slot. */
    int rowOf(int k) { return row + k * orientation.dRow; }

    /** Column of the k-th cell of this slot. */
    int columnOf(int k) { return column + k * orientation.dColumn; }

    /**
     * @return the offset within this slot of the cell (r, c), or -1 if the slot does not cover it
     */
    int offsetOf(int r, int c) {
        int k = orientation == Orientation.ACROSS ? c - column : r - row;
        if (k < 0 || k >= length) return -1;
        return rowOf(k) == r && columnOf(k) == c ? k : -1;
    }

    @Override
    public int compareTo(@Nonnull Slot o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot)) return false;
        Slot s = (Slot) o;
        return row == s.row && column == s.column && length == s.length && orientation == s.orientation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, orientation, length);
    }

    @Override
    public String toString() {
        return String.format("(%d,%d) %s %d", row, column, orientation, length);
    }
}
