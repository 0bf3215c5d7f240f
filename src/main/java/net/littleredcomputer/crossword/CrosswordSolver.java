// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fills a crossword by constraint satisfaction: node consistency, then AC-3, then a
 * backtracking search ordered by the MRV/degree and least-constraining-value heuristics.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);

    public enum Inference {
        /** Check each extension of the assignment against the constraints, nothing more. */
        NONE,
        /** Also re-establish arc consistency around each newly assigned variable. */
        FORWARD_CHECKING,
    }

    private final Crossword crossword;
    private Inference inference = Inference.NONE;
    private Duration logInterval = Duration.ofMillis(1000);
    private Duration timeLimit = null;
    private long logCheckNodes = 1000;

    private Domains domains;
    private ArcConsistency arcConsistency;
    private Heuristics heuristics;
    private ConsistencyChecker checker;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private Instant lastLogTime = Instant.EPOCH;
    private long nodeCount = 0;
    private long lastNodeCount = 0;
    private long backtrackCount = 0;
    private long progressReports = 0;

    public CrosswordSolver(Crossword crossword) {
        this.crossword = crossword;
    }

    public CrosswordSolver setInference(Inference inference) {
        this.inference = inference;
        return this;
    }

    public CrosswordSolver setLogInterval(Duration interval) {
        this.logInterval = interval;
        return this;
    }

    /** How many search nodes pass between looks at the clock for a progress report. */
    CrosswordSolver setLogCheckNodes(long nodes) {
        if (nodes < 1) throw new IllegalArgumentException("log check interval must be positive: " + nodes);
        this.logCheckNodes = nodes;
        return this;
    }

    /**
     * @param limit maximum wall-clock time to spend in solve(), or null for no limit
     */
    public CrosswordSolver setTimeLimit(Duration limit) {
        this.timeLimit = limit;
        return this;
    }

    /** @return the domains as they stood at the end of the last call to solve() */
    public Domains domains() { return domains; }

    /** @return number of assignments tried by the last search */
    public long nodeCount() { return nodeCount; }

    /** @return number of times the last search abandoned a variable after trying all its values */
    public long backtrackCount() { return backtrackCount; }

    /** @return number of progress lines logged during the last search */
    public long progressReports() { return progressReports; }

    /**
     * @return a complete, consistent assignment, or empty if none exists
     * @throws SearchTimeoutException if a time limit was set and the search exceeded it
     */
    public Optional<Assignment> solve() {
        domains = new Domains(crossword);
        arcConsistency = new ArcConsistency(crossword, domains);
        heuristics = new Heuristics(crossword, domains);
        checker = new ConsistencyChecker(crossword);
        nodeCount = lastNodeCount = backtrackCount = progressReports = 0;
        stopwatch.reset().start();
        lastLogTime = Instant.now();

        NodeConsistency.enforce(crossword, domains);
        if (domains.anyEmpty()) {
            stopwatch.stop();
            log.info("no solution: some slot has no word of the right length");
            return Optional.empty();
        }
        if (!arcConsistency.ac3()) {
            stopwatch.stop();
            log.info("no solution: arc consistency emptied a domain after %d revisions", arcConsistency.revisions());
            return Optional.empty();
        }
        Optional<Assignment> result = backtrack(new Assignment());
        stopwatch.stop();
        log.info("%s after %d nodes, %d backtracks in %s",
                result.isPresent() ? "solved" : "no solution", nodeCount, backtrackCount, stopwatch);
        return result;
    }

    /**
     * Extend the assignment to a complete one by depth-first search. On failure the
     * assignment is left as it was found.
     */
    Optional<Assignment> backtrack(Assignment assignment) {
        if (assignment.isComplete(crossword)) return Optional.of(assignment);
        Variable var = heuristics.selectUnassignedVariable(assignment).orElseThrow(IllegalStateException::new);
        for (String value : heuristics.orderDomainValues(var, assignment)) {
            ++nodeCount;
            checkDeadline();
            if (nodeCount % logCheckNodes == 0) maybeReportProgress(assignment);
            assignment.put(var, value);
            if (checker.consistent(assignment)) {
                log.trace("%s = %s", var, value);
                ImmutableMap<Variable, ImmutableSortedSet<String>> saved = null;
                boolean viable = true;
                if (inference == Inference.FORWARD_CHECKING) {
                    saved = domains.snapshot();
                    viable = forwardCheck(var, value, assignment);
                }
                if (viable) {
                    Optional<Assignment> result = backtrack(assignment);
                    if (result.isPresent()) return result;
                }
                if (saved != null) domains.restore(saved);
            }
            assignment.remove(var);
        }
        ++backtrackCount;
        return Optional.empty();
    }

    private boolean forwardCheck(Variable var, String value, Assignment assignment) {
        domains.reduceTo(var, value);
        List<ArcConsistency.Arc> arcs = new ArrayList<>();
        for (Variable n : crossword.neighbors(var)) {
            if (!assignment.contains(n)) arcs.add(new ArcConsistency.Arc(n, var));
        }
        return arcConsistency.ac3(arcs);
    }

    private void checkDeadline() {
        if (timeLimit != null && stopwatch.elapsed().compareTo(timeLimit) >= 0) {
            stopwatch.stop();
            log.info("giving up after %d nodes in %s", nodeCount, stopwatch);
            throw new SearchTimeoutException(timeLimit, nodeCount);
        }
    }

    private void maybeReportProgress(Assignment assignment) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (nodeCount - lastNodeCount) / Math.max(1, tween.toMillis());
        final int depth = assignment.size();
        log.info(() -> new FormattedMessage("%d nodes %s %.0f/sec depth %d/%d",
                nodeCount, stopwatch, perSec, depth, crossword.variables().size()));
        lastLogTime = now;
        lastNodeCount = nodeCount;
        ++progressReports;
    }
}
