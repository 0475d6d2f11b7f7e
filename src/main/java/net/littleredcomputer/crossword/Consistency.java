// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import gnu.trove.set.hash.TIntHashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node and arc consistency over a crossword's domains, and the consistency test for
 * (partial) assignments.
 */
public class Consistency {
    private static final Logger log = LogManager.getFormatterLogger(Consistency.class);
    private final Crossword crossword;
    private final Domains domains;
    private long revisions;

    public Consistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /** Number of calls to {@link #revise} so far. */
    public long revisions() {
        return revisions;
    }

    /**
     * Removes from each slot's domain every word of the wrong length.
     */
    public void enforceNodeConsistency() {
        int removed = 0;
        for (Slot s : crossword.slots()) {
            List<String> misfits = domains.get(s).stream()
                    .filter(w -> w.length() != s.length())
                    .collect(Collectors.toList());
            for (String w : misfits) if (domains.remove(s, w)) ++removed;
        }
        log.debug("node consistency removed %d words", removed);
    }

    /**
     * Makes x arc consistent with y: removes from x's domain every word that agrees with no
     * word of y's domain at their overlap.
     * @return true if x's domain changed; false if it did not, or x and y do not overlap
     */
    public boolean revise(Slot x, Slot y) {
        ++revisions;
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        final int i = o.get().first, j = o.get().second;
        TIntHashSet supported = new TIntHashSet();
        for (String w : domains.get(y)) {
            int c = Overlap.letterAt(w, j);
            if (c >= 0) supported.add(c);
        }
        List<String> unsupported = domains.get(x).stream()
                .filter(w -> !supported.contains(Overlap.letterAt(w, i)))
                .collect(Collectors.toList());
        for (String w : unsupported) domains.remove(x, w);
        return !unsupported.isEmpty();
    }

    /**
     * Runs AC-3 starting from every arc of the puzzle.
     * @return false if some domain is, or becomes, empty; true otherwise
     */
    @CheckReturnValue
    public boolean enforceArcConsistency() {
        for (Slot s : crossword.slots()) {
            if (domains.isEmpty(s)) {
                log.debug("domain of %s is empty before propagation", s);
                return false;
            }
        }
        return enforceArcConsistency(crossword.arcs());
    }

    /**
     * Runs AC-3 from the given arcs until the worklist is exhausted. Whenever revising (x, y)
     * shrinks x, the arcs (z, x) for the other neighbors z of x are queued again.
     * @param initial the arcs to start from
     * @return false as soon as a revision empties a domain; true once the worklist drains
     */
    @CheckReturnValue
    public boolean enforceArcConsistency(Collection<Arc> initial) {
        Deque<Arc> queue = new ArrayDeque<>(initial);
        Set<Arc> queued = new HashSet<>(initial);
        int processed = 0;
        while (!queue.isEmpty()) {
            Arc a = queue.removeFirst();
            queued.remove(a);
            ++processed;
            if (!revise(a.x, a.y)) continue;
            if (domains.isEmpty(a.x)) {
                log.debug("domain of %s emptied after %d arcs", a.x, processed);
                return false;
            }
            for (Slot z : crossword.neighbors(a.x)) {
                if (z.equals(a.y)) continue;
                Arc b = new Arc(z, a.x);
                if (queued.add(b)) queue.addLast(b);
            }
        }
        log.trace("arc consistency reached after %d arcs", processed);
        return true;
    }

    /**
     * @return true iff the assigned words are distinct, each fits its slot's length, and every
     * pair of assigned neighbors agrees at its overlap. Unassigned slots are unconstrained.
     */
    public boolean isConsistent(Assignment assignment) {
        Set<String> seen = new HashSet<>();
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            if (!seen.add(e.getValue())) return false;
            if (e.getValue().length() != e.getKey().length()) return false;
        }
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            Slot x = e.getKey();
            for (Slot y : crossword.neighbors(x).tailSet(x, false)) {
                String w = assignment.get(y);
                if (w != null && !crossword.overlap(x, y).get().agrees(e.getValue(), w)) return false;
            }
        }
        return true;
    }

    /**
     * @return the arcs (n, x) for each neighbor n of x not in the assignment
     */
    ImmutableList<Arc> arcsInto(Slot x, Assignment assignment) {
        return crossword.neighbors(x).stream()
                .filter(n -> !assignment.contains(n))
                .map(n -> new Arc(n, x))
                .collect(ImmutableList.toImmutableList());
    }
}
