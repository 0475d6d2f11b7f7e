// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.junit.Test;

import java.util.Arrays;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class CrosswordTest {
    private static final Slot a = new Slot(0, 0, Orientation.ACROSS, 3);
    private static final Slot b = new Slot(0, 1, Orientation.DOWN, 3);
    private static final Slot c = new Slot(4, 0, Orientation.ACROSS, 2);

    @Test
    public void overlapFromGeometry() {
        Crossword x = Crossword.fromSlots(Arrays.asList(a, b, c));
        assertThat(x.overlap(a, b), isPresentAndIs(new Overlap(1, 0)));
        assertThat(x.overlap(b, a), isPresentAndIs(new Overlap(0, 1)));
        assertThat(x.overlap(a, c), isEmpty());
        assertThat(x.neighbors(a), is(ImmutableSortedSet.of(b)));
        assertThat(x.neighbors(c), is(ImmutableSortedSet.<Slot>of()));
        assertThat(x.degree(b), is(1));
        assertThat(x.arcs(), is(ImmutableList.of(new Arc(a, b), new Arc(b, a))));
    }

    @Test
    public void crossingAtLastLetter() {
        Slot across = new Slot(2, 0, Orientation.ACROSS, 4);
        Slot down = new Slot(0, 3, Orientation.DOWN, 3);
        Crossword x = Crossword.fromSlots(Arrays.asList(across, down));
        assertThat(x.overlap(across, down), isPresentAndIs(new Overlap(3, 2)));
    }

    @Test
    public void explicitOverlaps() {
        Crossword x = Crossword.builder().addSlot(a).addSlot(c).addOverlap(a, c, 2, 1).addOverlap(c, a, 1, 2).build();
        assertThat(x.overlap(c, a), isPresentAndIs(new Overlap(1, 2)));
        assertThat(x.degree(a), is(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroLengthSlot() {
        new Slot(0, 0, Orientation.ACROSS, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativePosition() {
        new Slot(-1, 0, Orientation.DOWN, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateSlot() {
        Crossword.fromSlots(Arrays.asList(a, b, new Slot(0, 0, Orientation.ACROSS, 3)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void overlapOffsetOutOfBounds() {
        Crossword.builder().addSlot(a).addSlot(c).addOverlap(a, c, 1, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void overlapWithUnknownSlot() {
        Crossword.builder().addSlot(a).addOverlap(a, b, 1, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void overlapWithSelf() {
        Crossword.builder().addSlot(a).addOverlap(a, a, 0, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void conflictingOverlaps() {
        Crossword.builder().addSlot(a).addSlot(c).addOverlap(a, c, 1, 0).addOverlap(c, a, 1, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void collinearSlotsSharingCells() {
        Crossword.fromSlots(Arrays.asList(a, new Slot(0, 1, Orientation.ACROSS, 4)));
    }

    @Test
    public void collinearSlotsSharingOneCell() {
        Slot d = new Slot(0, 2, Orientation.ACROSS, 3);
        assertThat(Crossword.fromSlots(Arrays.asList(a, d)).overlap(a, d), isPresentAndIs(new Overlap(2, 0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownSlotHasNoNeighbors() {
        Crossword.fromSlots(Arrays.asList(a, b)).neighbors(c);
    }
}
