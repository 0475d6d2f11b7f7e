// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ConsistencyTest {
    private static final Slot a = new Slot(0, 0, Orientation.ACROSS, 3);
    private static final Slot b = new Slot(0, 1, Orientation.DOWN, 3);
    private static final Crossword pair = Crossword.fromSlots(Arrays.asList(a, b));

    // A ladder: three across slots hung from one long down slot, crossing at their first letters.
    private static final Slot spine = new Slot(0, 0, Orientation.DOWN, 5);
    private static final Slot rung0 = new Slot(0, 0, Orientation.ACROSS, 3);
    private static final Slot rung2 = new Slot(2, 0, Orientation.ACROSS, 3);
    private static final Slot rung4 = new Slot(4, 0, Orientation.ACROSS, 3);
    private static final Crossword ladder = Crossword.fromSlots(Arrays.asList(spine, rung0, rung2, rung4));

    private static void assertArcConsistent(Crossword crossword, Domains domains) {
        for (Arc arc : crossword.arcs()) {
            Overlap o = crossword.overlap(arc.x, arc.y).get();
            for (String w : domains.get(arc.x)) {
                assertTrue(arc + " has no support for " + w,
                        domains.get(arc.y).stream().anyMatch(v -> o.agrees(w, v)));
            }
        }
    }

    @Test
    public void nodeConsistencyKeepsOnlyWordsOfSlotLength() {
        Domains d = Domains.of(ladder, Arrays.asList("AN", "ANT", "BEE", "EAGLE", "HORSE", "OX", "WOMBAT"));
        Consistency c = new Consistency(ladder, d);
        c.enforceNodeConsistency();
        for (Slot s : ladder.slots()) {
            assertTrue(d.get(s).stream().allMatch(w -> w.length() == s.length()));
        }
        assertThat(d.get(spine), is(ImmutableSortedSet.of("EAGLE", "HORSE")));
        assertThat(d.get(rung2), is(ImmutableSortedSet.of("ANT", "BEE")));
        c.enforceNodeConsistency();
        assertThat(d.get(rung2), is(ImmutableSortedSet.of("ANT", "BEE")));
    }

    @Test
    public void revise() {
        Domains d = Domains.of(pair, Arrays.asList("CAT", "DOG", "ART", "TIP"));
        Consistency c = new Consistency(pair, d);
        assertThat(c.revise(a, b), is(true));
        // a's middle letter must begin some word of b.
        assertThat(d.get(a), is(ImmutableSortedSet.of("CAT")));
        assertThat(c.revise(a, b), is(false));
        assertThat(c.revise(b, a), is(true));
        assertThat(d.get(b), is(ImmutableSortedSet.of("ART")));
    }

    @Test
    public void reviseWithoutOverlapIsNoOp() {
        Slot far = new Slot(5, 5, Orientation.ACROSS, 3);
        Crossword x = Crossword.fromSlots(Arrays.asList(a, far));
        Domains d = Domains.of(x, Arrays.asList("CAT", "DOG"));
        assertThat(new Consistency(x, d).revise(a, far), is(false));
        assertThat(d.size(a), is(2));
    }

    @Test
    public void reviseDropsWordsTooShortForTheOverlap() {
        Domains d = Domains.of(pair, Arrays.asList("C", "CAT", "ART"));
        new Consistency(pair, d).revise(a, b);
        assertThat(d.get(a), is(ImmutableSortedSet.of("CAT")));
    }

    @Test
    public void arcConsistencyPropagatesAlongTheWholeGraph() {
        // rung4 rules out CLEAR, and that pruning has to come back through the spine to rung0.
        List<String> words = Arrays.asList("CLEAR", "STEAM", "CAT", "SAT", "PIT", "EEL", "ASK", "MOP");
        Domains d = Domains.of(ladder, words);
        Consistency c = new Consistency(ladder, d);
        c.enforceNodeConsistency();
        assertThat(c.enforceArcConsistency(), is(true));
        assertArcConsistent(ladder, d);
        assertThat(d.get(spine), is(ImmutableSortedSet.of("STEAM")));
        assertThat(d.get(rung0), is(ImmutableSortedSet.of("SAT")));
        assertThat(d.get(rung2), is(ImmutableSortedSet.of("EEL")));
        assertThat(d.get(rung4), is(ImmutableSortedSet.of("MOP")));
    }

    @Test
    public void arcConsistencyDrainsWorklistPastUnchangedArcs() {
        // The first two arcs in the worklist change nothing; the inconsistency is found after them.
        Domains d = Domains.of(ladder, Arrays.asList("SPEAR", "SAT", "SIP"));
        Consistency c = new Consistency(ladder, d);
        c.enforceNodeConsistency();
        assertThat(c.enforceArcConsistency(), is(false));
    }

    @Test
    public void arcConsistencyFailsOnEmptyDomain() {
        Domains d = Domains.of(pair, Arrays.asList("CAT", "DOG"));
        Consistency c = new Consistency(pair, d);
        c.enforceNodeConsistency();
        assertThat(c.enforceArcConsistency(), is(false));
    }

    @Test
    public void arcConsistencyFailsWhenNodeConsistencyLeftNothing() {
        Slot lone = new Slot(7, 7, Orientation.DOWN, 6);
        Crossword x = Crossword.fromSlots(Arrays.asList(a, b, lone));
        Domains d = Domains.of(x, Arrays.asList("CAT", "ART"));
        Consistency c = new Consistency(x, d);
        c.enforceNodeConsistency();
        assertThat(c.enforceArcConsistency(), is(false));
    }

    @Test
    public void arcConsistencyFromGivenArcs() {
        Domains d = Domains.of(pair, Arrays.asList("CAT", "DOG", "ART", "TIP"));
        Consistency c = new Consistency(pair, d);
        assertThat(c.enforceArcConsistency(ImmutableList.of()), is(true));
        assertThat(d.size(a), is(4));
        // Shrinking b does not queue (a, b): a is the slot b was revised against.
        assertThat(c.enforceArcConsistency(ImmutableList.of(new Arc(b, a))), is(true));
        assertThat(d.get(b), is(ImmutableSortedSet.of("ART")));
        assertThat(d.size(a), is(4));
    }

    @Test
    public void singleSlotAssignment() {
        Consistency c = new Consistency(pair, Domains.of(pair, Collections.emptyList()));
        assertThat(c.isConsistent(Assignment.empty()), is(true));
        assertThat(c.isConsistent(Assignment.empty().with(a, "CAT")), is(true));
        assertThat(c.isConsistent(Assignment.empty().with(a, "CATS")), is(false));
    }

    @Test
    public void twoSlotAssignment() {
        Consistency c = new Consistency(pair, Domains.of(pair, Collections.emptyList()));
        assertThat(c.isConsistent(Assignment.empty().with(a, "CAT").with(b, "ART")), is(true));
        assertThat(c.isConsistent(Assignment.empty().with(a, "CAT").with(b, "TIP")), is(false));
        assertThat(c.isConsistent(Assignment.empty().with(a, "AAA").with(b, "AAA")), is(false));
    }

    @Test
    public void distinctWordsRequiredEvenWithoutOverlap() {
        Slot far = new Slot(5, 5, Orientation.ACROSS, 3);
        Crossword x = Crossword.fromSlots(Arrays.asList(a, far));
        Consistency c = new Consistency(x, Domains.of(x, Collections.emptyList()));
        assertThat(c.isConsistent(Assignment.empty().with(a, "CAT").with(far, "DOG")), is(true));
        assertThat(c.isConsistent(Assignment.empty().with(a, "CAT").with(far, "CAT")), is(false));
    }
}
