// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;

import java.util.Comparator;
import java.util.Objects;

/**
 * A slot in the grid: a maximal run of open squares in one direction, to be filled with one word.
 */
public final class Variable implements Comparable<Variable> {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    private static final Comparator<Variable> canonicalOrder = Comparator
            .comparingInt(Variable::row)
            .thenComparingInt(Variable::col)
            .thenComparing(Variable::direction)
            .thenComparingInt(Variable::length);

    private final int row;
    private final int col;
    private final Direction direction;
    private final int length;

    public Variable(int row, int col, Direction direction, int length) {
        if (length < 1) throw new IllegalArgumentException("variable length must be positive: " + length);
        this.row = row;
        this.col = col;
        this.direction = Objects.requireNonNull(direction);
        this.length = length;
    }

    public int row() { return row; }
    public int col() { return col; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /**
     * @return the squares covered by this slot, as {row, col} pairs in word order
     */
    public ImmutableList<int[]> cells() {
        ImmutableList.Builder<int[]> b = ImmutableList.builder();
        for (int k = 0; k < length; ++k) {
            b.add(new int[]{
                    row + (direction == Direction.DOWN ? k : 0),
                    col + (direction == Direction.ACROSS ? k : 0)});
        }
        return b.build();
    }

    @Override
    public int compareTo(Variable o) {
        return canonicalOrder.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable v = (Variable) o;
        return row == v.row && col == v.col && direction == v.direction && length == v.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col, direction, length);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) %s : %d", row, col, direction.name().toLowerCase(), length);
    }
}
