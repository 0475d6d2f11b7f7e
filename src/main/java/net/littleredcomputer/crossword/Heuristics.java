// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import gnu.trove.map.hash.TIntIntHashMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Choice of the next slot to branch on, and of the order in which to try its words.
 * Every choice is made by explicit keys, with slot order or word order as the last tie-break,
 * so a search is reproducible.
 */
public class Heuristics {
    public enum SlotOrder {
        FIRST,  // first unassigned slot in slot order
        MRV,    // fewest remaining values, then highest degree
    }

    public enum ValueOrder {
        DOMAIN,              // word order
        LEAST_CONSTRAINING,  // fewest eliminations among unassigned neighbors
    }

    private final Crossword crossword;
    private final Domains domains;
    private SlotOrder slotOrder = SlotOrder.MRV;
    private ValueOrder valueOrder = ValueOrder.LEAST_CONSTRAINING;

    public Heuristics(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    public Heuristics setSlotOrder(SlotOrder slotOrder) {
        this.slotOrder = slotOrder;
        return this;
    }

    public Heuristics setValueOrder(ValueOrder valueOrder) {
        this.valueOrder = valueOrder;
        return this;
    }

    /**
     * @return the unassigned slot to branch on next
     * @throws IllegalStateException if every slot is assigned
     */
    public Slot selectUnassignedSlot(Assignment assignment) {
        Comparator<Slot> c;
        switch (slotOrder) {
            case FIRST:
                c = Comparator.naturalOrder();
                break;
            case MRV:
                c = Comparator.comparingInt(domains::size)
                        .thenComparing(Comparator.comparingInt(crossword::degree).reversed())
                        .thenComparing(Comparator.naturalOrder());
                break;
            default:
                throw new IllegalStateException("unknown slot order: " + slotOrder);
        }
        return crossword.slots().stream()
                .filter(s -> !assignment.contains(s))
                .min(c)
                .orElseThrow(() -> new IllegalStateException("every slot is assigned"));
    }

    /**
     * @return the words of the slot's domain, in the order they should be tried
     */
    public List<String> orderDomainValues(Slot slot, Assignment assignment) {
        List<String> words = new ArrayList<>(domains.get(slot));
        if (valueOrder == ValueOrder.DOMAIN) return words;

        // For each unassigned neighbor n, a histogram of the letters n's words carry at the
        // overlap. A word w then eliminates size(n) - count(letter of w at the overlap).
        List<Overlap> overlaps = new ArrayList<>();
        List<TIntIntHashMap> histograms = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        for (Slot n : crossword.neighbors(slot)) {
            if (assignment.contains(n)) continue;
            Overlap o = crossword.overlap(slot, n).get();
            TIntIntHashMap h = new TIntIntHashMap();
            for (String v : domains.get(n)) {
                int c = Overlap.letterAt(v, o.second);
                if (c >= 0) h.adjustOrPutValue(c, 1, 1);
            }
            overlaps.add(o);
            histograms.add(h);
            sizes.add(domains.size(n));
        }
        Map<String, Integer> score = new HashMap<>();
        for (String w : words) {
            int eliminated = 0;
            for (int k = 0; k < overlaps.size(); ++k) {
                int c = Overlap.letterAt(w, overlaps.get(k).first);
                eliminated += sizes.get(k) - (c >= 0 ? histograms.get(k).get(c) : 0);
            }
            score.put(w, eliminated);
        }
        words.sort(Comparator.comparing((String w) -> score.get(w)).thenComparing(Comparator.naturalOrder()));
        return words;
    }

    /**
     * @return the number of words that assigning word to slot would rule out of the domains
     * of the slot's unassigned neighbors
     */
    public int eliminationScore(Slot slot, String word, Assignment assignment) {
        int eliminated = 0;
        for (Slot n : crossword.neighbors(slot)) {
            if (assignment.contains(n)) continue;
            Overlap o = crossword.overlap(slot, n).get();
            for (String v : domains.get(n)) {
                if (!o.agrees(word, v)) ++eliminated;
            }
        }
        return eliminated;
    }
}
