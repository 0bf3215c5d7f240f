package net.littleredcomputer.crossword;

import java.time.Duration;

/**
 * Thrown when the search gives up because its time limit expired. This says nothing about
 * whether the puzzle has a solution.
 */
public class SearchTimeoutException extends RuntimeException {
    private final long nodes;

    SearchTimeoutException(Duration limit, long nodes) {
        super(String.format("no solution found within %s (%d nodes searched)", limit, nodes));
        this.nodes = nodes;
    }

    public long nodes() { return nodes; }
}
