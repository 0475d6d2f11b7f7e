// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The current candidate words of each slot. Domains only shrink, through {@link #remove}, and
 * every removal is pushed on a trail so that a search can {@link #mark} a point and later
 * {@link #restore} the domains to exactly what they were there.
 */
public class Domains {
    private static class Removal {
        final Slot slot;
        final String word;

        Removal(Slot slot, String word) {
            this.slot = slot;
            this.word = word;
        }
    }

    private final Map<Slot, NavigableSet<String>> domains = new TreeMap<>();
    private final Deque<Removal> trail = new ArrayDeque<>();

    private Domains() {}

    /**
     * @return domains giving every slot of the crossword the whole word list
     */
    public static Domains of(Crossword crossword, Iterable<String> words) {
        Domains d = new Domains();
        ImmutableSortedSet<String> ws = ImmutableSortedSet.copyOf(words);
        for (Slot s : crossword.slots()) d.domains.put(s, new TreeSet<>(ws));
        return d;
    }

    /** Read-only view of the slot's domain, in word order. */
    public NavigableSet<String> get(Slot s) {
        return Collections.unmodifiableNavigableSet(domain(s));
    }

    public int size(Slot s) {
        return domain(s).size();
    }

    public boolean isEmpty(Slot s) {
        return domain(s).isEmpty();
    }

    /**
     * Removes word from the domain of s, recording the removal on the trail.
     * @return true if the word was present
     */
    public boolean remove(Slot s, String word) {
        if (!domain(s).remove(word)) return false;
        trail.push(new Removal(s, word));
        return true;
    }

    /** A point on the trail that {@link #restore} can return to. */
    public int mark() {
        return trail.size();
    }

    /** Puts back every word removed since the mark was taken. */
    public void restore(int mark) {
        if (mark > trail.size()) throw new IllegalStateException("mark " + mark + " is beyond trail of size " + trail.size());
        while (trail.size() > mark) {
            Removal r = trail.pop();
            domains.get(r.slot).add(r.word);
        }
    }

    /**
     * Forgets the trail, making every removal so far permanent. Marks taken earlier become
     * invalid.
     */
    public void commit() {
        trail.clear();
    }

    /** A copy of the current domains, for comparison and reporting. */
    public ImmutableMap<Slot, ImmutableSortedSet<String>> snapshot() {
        ImmutableMap.Builder<Slot, ImmutableSortedSet<String>> b = ImmutableMap.builder();
        domains.forEach((s, ws) -> b.put(s, ImmutableSortedSet.copyOf(ws)));
        return b.build();
    }

    private NavigableSet<String> domain(Slot s) {
        NavigableSet<String> d = domains.get(s);
        if (d == null) throw new IllegalArgumentException("unknown slot: " + s);
        return d;
    }
}
