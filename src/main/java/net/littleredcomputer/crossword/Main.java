// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of grid structure ('_' open, anything else blocked)")
                .addOption("words", true, "filename of word list, one word per line")
                .addOption("output", true, "filename of PNG image of the solution")
                .addOption("inference", true, "inference during search: none or forward")
                .addOption("timelimit", true, "give up after this long, in ISO-8601 format")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader input(CommandLine cmd, String option, boolean stdinAllowed) throws FileNotFoundException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        String p = cmd.getOptionValue(option);
        if (p.equals("-") && !stdinAllowed) throw new IllegalArgumentException("-" + option + " must name a file");
        return new BufferedReader(p.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8));
    }

    static CrosswordSolver.Inference inference(CommandLine cmd) {
        String i = cmd.getOptionValue("inference", "none");
        switch (i) {
            case "none": return CrosswordSolver.Inference.NONE;
            case "forward": return CrosswordSolver.Inference.FORWARD_CHECKING;
            default: throw new IllegalArgumentException("unknown inference: " + i);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static Duration timeLimit(CommandLine cmd) {
        return cmd.hasOption("timelimit") ? Duration.parse(cmd.getOptionValue("timelimit")) : null;
    }

    /**
     * Solve the puzzle described by the command line, writing the outcome to out.
     */
    static void run(CommandLine cmd, PrintStream out) throws IOException {
        Crossword crossword;
        try (Reader structure = input(cmd, "structure", true); Reader words = input(cmd, "words", false)) {
            crossword = Crossword.parseFrom(structure, words);
        }
        CrosswordSolver solver = new CrosswordSolver(crossword)
                .setInference(inference(cmd))
                .setLogInterval(logInterval(cmd))
                .setTimeLimit(timeLimit(cmd));
        Optional<Assignment> outcome;
        try {
            outcome = solver.solve();
        } catch (SearchTimeoutException e) {
            out.println("No solution found within time limit.");
            return;
        }
        if (!outcome.isPresent()) {
            out.println("No solution.");
            return;
        }
        Renderer renderer = new Renderer(crossword);
        out.print(renderer.toText(outcome.get()));
        if (cmd.hasOption("output")) renderer.save(outcome.get(), new File(cmd.getOptionValue("output")));
    }

    static CommandLine parse(String... args) throws ParseException {
        return new DefaultParser().parse(options(), args);
    }

    /** A print stream that encodes as UTF-8 whatever the platform default is. */
    static PrintStream utf8(OutputStream os) {
        try {
            return new PrintStream(os, true, StandardCharsets.UTF_8.name());
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        run(parse(args), utf8(new FileOutputStream(FileDescriptor.out)));
    }
}
