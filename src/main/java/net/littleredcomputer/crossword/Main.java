// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Enums;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.time.Duration;
import java.util.Optional;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure (_ for open cells)")
                .addOption("words", true, "filename of word list, one per line")
                .addOption("output", true, "filename of PNG image of the filled grid")
                .addOption("inference", true, "NONE, FORWARD_CHECKING or ARC_CONSISTENCY")
                .addOption("slotorder", true, "FIRST or MRV")
                .addOption("valueorder", true, "DOMAIN or LEAST_CONSTRAINING")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader input(CommandLine cmd, String option) throws FileNotFoundException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        String p = cmd.getOptionValue(option);
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static <E extends Enum<E>> E choice(CommandLine cmd, String option, Class<E> type, E fallback) {
        if (!cmd.hasOption(option)) return fallback;
        String v = cmd.getOptionValue(option);
        return Enums.getIfPresent(type, v).toJavaUtil()
                .orElseThrow(() -> new IllegalArgumentException("unknown " + option + ": " + v));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Grid grid = Grid.parseFrom(input(cmd, "structure"));
        ImmutableSortedSet<String> words = Words.parseFrom(input(cmd, "words"));
        Optional<Assignment> solution = new CrosswordSolver(grid.crossword(), words)
                .setInference(choice(cmd, "inference", CrosswordSolver.Inference.class, CrosswordSolver.Inference.ARC_CONSISTENCY))
                .setSlotOrder(choice(cmd, "slotorder", Heuristics.SlotOrder.class, Heuristics.SlotOrder.MRV))
                .setValueOrder(choice(cmd, "valueorder", Heuristics.ValueOrder.class, Heuristics.ValueOrder.LEAST_CONSTRAINING))
                .setLogInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT1S")))
                .solve();
        if (solution.isPresent()) {
            System.out.print(grid.render(solution.get()));
            if (cmd.hasOption("output")) grid.save(solution.get(), new File(cmd.getOptionValue("output")));
        } else {
            System.out.println("No solution.");
        }
    }
}
