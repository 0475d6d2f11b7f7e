// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import java.util.Objects;

/** A directed constraint edge: x must be made consistent with y. */
public final class Arc {
    public final Slot x;
    public final Slot y;

    public Arc(Slot x, Slot y) {
        this.x = Objects.requireNonNull(x);
        this.y = Objects.requireNonNull(y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arc)) return false;
        Arc arc = (Arc) o;
        return x.equals(arc.x) && y.equals(arc.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return x + " -> " + y;
    }
}
