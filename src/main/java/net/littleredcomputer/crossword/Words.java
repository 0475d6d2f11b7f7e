// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSortedSet;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.Locale;

public final class Words {
    private Words() {}

    public static ImmutableSortedSet<String> parseFrom(String words) {
        return parseFrom(new StringReader(words));
    }

    /**
     * Reads a word list, one word per line. Words are trimmed and upper-cased; blank lines
     * are skipped and repeats collapse.
     */
    public static ImmutableSortedSet<String> parseFrom(Reader words) {
        return new BufferedReader(words).lines()
                .map(CharMatcher.whitespace()::trimFrom)
                .filter(w -> !w.isEmpty())
                .map(w -> w.toUpperCase(Locale.ROOT))
                .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
    }
}
