// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import java.util.Objects;

/**
 * For an ordered pair of slots (x, y): the letter at offset {@code first} of x's word must
 * equal the letter at offset {@code second} of y's word.
 */
public final class Overlap {
    public final int first;
    public final int second;

    Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    /** The same overlap seen from the other slot of the pair. */
    Overlap reversed() {
        return new Overlap(second, first);
    }

    /**
     * @return true if word x (filling the first slot) and word y (filling the second) agree here
     */
    boolean agrees(String x, String y) {
        int a = letterAt(x, first);
        return a >= 0 && a == letterAt(y, second);
    }

    static int letterAt(String w, int k) {
        return k < w.length() ? w.charAt(k) : -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap that = (Overlap) o;
        return first == that.first && second == that.second;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
