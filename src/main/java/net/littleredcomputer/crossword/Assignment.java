// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Objects;

/**
 * A partial mapping from slots to words. Immutable: extending an assignment yields a new one,
 * so sibling branches of the search never see each other's choices.
 */
public final class Assignment {
    private static final Assignment EMPTY = new Assignment(ImmutableSortedMap.of());

    private final ImmutableSortedMap<Slot, String> words;

    private Assignment(ImmutableSortedMap<Slot, String> words) {
        this.words = words;
    }

    public static Assignment empty() {
        return EMPTY;
    }

    /**
     * @return this assignment extended (or overridden) with slot := word
     */
    public Assignment with(Slot slot, String word) {
        ImmutableSortedMap.Builder<Slot, String> b = ImmutableSortedMap.naturalOrder();
        words.forEach((s, w) -> {
            if (!s.equals(slot)) b.put(s, w);
        });
        b.put(slot, Objects.requireNonNull(word));
        return new Assignment(b.build());
    }

    public boolean contains(Slot slot) {
        return words.containsKey(slot);
    }

    public String get(Slot slot) {
        return words.get(slot);
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public ImmutableSortedMap<Slot, String> asMap() {
        return words;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        return words.equals(((Assignment) o).words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
