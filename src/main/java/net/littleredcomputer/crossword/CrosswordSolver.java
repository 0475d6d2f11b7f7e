// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fills a crossword by depth-first backtracking search over its slots, after establishing
 * node and arc consistency. Optionally propagates each tentative choice into the domains of
 * the remaining slots; everything pruned that way is restored when the choice is abandoned.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);
    private static final int logCheckSteps = 1000;

    public enum Inference {
        NONE,
        FORWARD_CHECKING,  // revise each unassigned neighbor once against the new choice
        ARC_CONSISTENCY,   // re-establish arc consistency from the new choice outward
    }

    private final Crossword crossword;
    private final Domains domains;
    private final Consistency consistency;
    private final Heuristics heuristics;
    private Inference inference = Inference.ARC_CONSISTENCY;

    private long nodeCount;
    private long backtrackCount;
    private long lastNodeCount;
    private long progressReports;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public CrosswordSolver(Crossword crossword, Iterable<String> words) {
        this(crossword, Domains.of(crossword, words));
    }

    public CrosswordSolver(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
        this.consistency = new Consistency(crossword, domains);
        this.heuristics = new Heuristics(crossword, domains);
    }

    public CrosswordSolver setInference(Inference inference) {
        this.inference = inference;
        return this;
    }

    public CrosswordSolver setSlotOrder(Heuristics.SlotOrder order) {
        heuristics.setSlotOrder(order);
        return this;
    }

    public CrosswordSolver setValueOrder(Heuristics.ValueOrder order) {
        heuristics.setValueOrder(order);
        return this;
    }

    public CrosswordSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    public Crossword crossword() { return crossword; }
    public Domains domains() { return domains; }
    public Consistency consistency() { return consistency; }
    public Heuristics heuristics() { return heuristics; }
    public long nodeCount() { return nodeCount; }
    public long backtrackCount() { return backtrackCount; }
    long progressReports() { return progressReports; }

    /**
     * Enforces node and arc consistency, then searches.
     * @return a complete, consistent assignment, or empty if the puzzle has none
     */
    public Optional<Assignment> solve() {
        consistency.enforceNodeConsistency();
        if (!consistency.enforceArcConsistency()) {
            log.debug("arc consistency emptied a domain; no solution");
            return Optional.empty();
        }
        return search();
    }

    /**
     * Backtracking search from the domains as they stand. Skipping {@link #solve}'s
     * propagation never changes the answer, only the effort. If no solution is found the
     * domains are left as they were on entry.
     * @return a complete, consistent assignment, or empty if there is none
     */
    public Optional<Assignment> search() {
        domains.commit();
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastNodeCount = nodeCount;
        Optional<Assignment> result;
        try {
            result = backtrack(Assignment.empty());
        } finally {
            stopwatch.stop();
        }
        log.debug("%s after %d nodes, %d backtracks, %d revisions in %s",
                result.isPresent() ? "solved" : "no solution",
                nodeCount, backtrackCount, consistency.revisions(), stopwatch);
        return result;
    }

    private Optional<Assignment> backtrack(Assignment assignment) {
        if (++nodeCount % logCheckSteps == 0) maybeReportProgress(assignment);
        if (assignment.size() == crossword.size()) return Optional.of(assignment);
        Slot slot = heuristics.selectUnassignedSlot(assignment);
        for (String word : heuristics.orderDomainValues(slot, assignment)) {
            Assignment extended = assignment.with(slot, word);
            if (!consistency.isConsistent(extended)) continue;
            int mark = domains.mark();
            if (infer(slot, word, extended)) {
                Optional<Assignment> result = backtrack(extended);
                if (result.isPresent()) return result;
            }
            domains.restore(mark);
            ++backtrackCount;
        }
        return Optional.empty();
    }

    /**
     * Propagates slot := word into the domains of the unassigned slots.
     * @return false if some domain was emptied, so the choice cannot succeed
     */
    private boolean infer(Slot slot, String word, Assignment assignment) {
        if (inference == Inference.NONE) return true;
        for (String w : ImmutableList.copyOf(domains.get(slot))) {
            if (!w.equals(word)) domains.remove(slot, w);
        }
        for (Slot s : crossword.slots()) {
            if (assignment.contains(s)) continue;
            if (domains.remove(s, word) && domains.isEmpty(s)) return false;
        }
        switch (inference) {
            case FORWARD_CHECKING:
                for (Slot n : crossword.neighbors(slot)) {
                    if (assignment.contains(n)) continue;
                    if (consistency.revise(n, slot) && domains.isEmpty(n)) return false;
                }
                return true;
            case ARC_CONSISTENCY:
                return consistency.enforceArcConsistency(consistency.arcsInto(slot, assignment));
            default:
                throw new IllegalStateException("unknown inference: " + inference);
        }
    }

    private void maybeReportProgress(Assignment assignment) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (nodeCount - lastNodeCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d nodes %s %.0f/sec depth %d/%d",
                nodeCount, stopwatch, perSec, assignment.size(), crossword.size()));
        lastLogTime = now;
        lastNodeCount = nodeCount;
        ++progressReports;
    }
}
