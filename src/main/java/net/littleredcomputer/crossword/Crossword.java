// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import java.io.Reader;
import java.io.StringReader;
import java.util.*;

/**
 * The crossword puzzle: a grid of open and blocked squares, the slots (variables) that the
 * open squares form, the candidate words, and the overlap relation between crossing slots.
 * Instances are immutable.
 */
public class Crossword {
    private static final char OPEN = '_';

    private final int width;
    private final int height;
    private final boolean[][] structure;
    private final ImmutableSortedSet<Variable> variables;
    private final ImmutableSortedSet<String> words;
    private final ImmutableMap<Variable, ImmutableMap<Variable, Overlap>> overlaps;

    /**
     * @param structure structure[i][j] is true if the square at row i, column j is open.
     *                  All rows must have the same length.
     * @param words candidate words; these are upper-cased and duplicates are collapsed
     */
    Crossword(boolean[][] structure, Iterable<String> words) {
        if (structure.length == 0) throw new IllegalArgumentException("structure has no rows");
        this.height = structure.length;
        this.width = structure[0].length;
        if (width == 0) throw new IllegalArgumentException("structure has no columns");
        this.structure = new boolean[height][];
        for (int i = 0; i < height; ++i) {
            if (structure[i].length != width) {
                throw new IllegalArgumentException(String.format("row %d has length %d; expected %d", i, structure[i].length, width));
            }
            this.structure[i] = structure[i].clone();
        }

        ImmutableSortedSet.Builder<String> wb = ImmutableSortedSet.naturalOrder();
        for (String w : words) {
            String u = CharMatcher.whitespace().trimFrom(w).toUpperCase(Locale.ROOT);
            if (!u.isEmpty()) wb.add(u);
        }
        this.words = wb.build();
        if (this.words.isEmpty()) throw new IllegalArgumentException("no words supplied");

        // owner[d][i][j] is the variable in direction d covering square i,j (if any), and
        // offset[d][i][j] is the index of that square in the variable's word.
        Variable[][][] owner = new Variable[2][height][width];
        int[][][] offset = new int[2][height][width];
        SortedSet<Variable> vs = new TreeSet<>();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                for (Variable.Direction d : Variable.Direction.values()) {
                    Variable v = slotStartingAt(i, j, d);
                    if (v == null) continue;
                    vs.add(v);
                    List<int[]> cells = v.cells();
                    for (int k = 0; k < cells.size(); ++k) {
                        int[] c = cells.get(k);
                        owner[d.ordinal()][c[0]][c[1]] = v;
                        offset[d.ordinal()][c[0]][c[1]] = k;
                    }
                }
            }
        }
        this.variables = ImmutableSortedSet.copyOf(vs);

        Map<Variable, SortedMap<Variable, Overlap>> o = new HashMap<>();
        for (Variable v : variables) o.put(v, new TreeMap<>());
        final int A = Variable.Direction.ACROSS.ordinal();
        final int D = Variable.Direction.DOWN.ordinal();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                Variable across = owner[A][i][j];
                Variable down = owner[D][i][j];
                if (across == null || down == null) continue;
                Overlap p = new Overlap(offset[A][i][j], offset[D][i][j]);
                o.get(across).put(down, p);
                o.get(down).put(across, p.inverse());
            }
        }
        ImmutableMap.Builder<Variable, ImmutableMap<Variable, Overlap>> ob = ImmutableMap.builder();
        for (Variable v : variables) ob.put(v, ImmutableMap.copyOf(o.get(v)));
        this.overlaps = ob.build();
    }

    /**
     * @return the variable of the given direction starting at i,j, or null if no run of two or
     * more open squares starts there
     */
    private Variable slotStartingAt(int i, int j, Variable.Direction d) {
        final int di = d == Variable.Direction.DOWN ? 1 : 0;
        final int dj = d == Variable.Direction.ACROSS ? 1 : 0;
        if (!isOpen(i, j) || isOpen(i - di, j - dj)) return null;
        int length = 1;
        while (isOpen(i + length * di, j + length * dj)) ++length;
        return length > 1 ? new Variable(i, j, d, length) : null;
    }

    public int width() { return width; }
    public int height() { return height; }

    /**
     * @return true if the square at row i, column j is inside the grid and open
     */
    public boolean isOpen(int i, int j) {
        return i >= 0 && i < height && j >= 0 && j < width && structure[i][j];
    }

    /** @return all slots of the grid, in canonical order */
    public ImmutableSortedSet<Variable> variables() { return variables; }

    /** @return the candidate words, upper-cased, in lexicographic order */
    public ImmutableSortedSet<String> words() { return words; }

    /**
     * @return the shared square of x and y as offsets into x's word and y's word; empty if
     * the two do not cross
     */
    public Optional<Overlap> overlap(Variable x, Variable y) {
        ImmutableMap<Variable, Overlap> m = overlaps.get(x);
        if (m == null) throw new IllegalArgumentException("unknown variable: " + x);
        return Optional.ofNullable(m.get(y));
    }

    /**
     * @return the variables crossing v, in canonical order
     */
    public ImmutableList<Variable> neighbors(Variable v) {
        ImmutableMap<Variable, Overlap> m = overlaps.get(v);
        if (m == null) throw new IllegalArgumentException("unknown variable: " + v);
        return m.keySet().asList();
    }

    public static Crossword parseFrom(String structure, String words) {
        return parseFrom(new StringReader(structure), new StringReader(words));
    }

    /**
     * Parses a puzzle. The structure has one line per row of the grid: '_' marks an open
     * square and any other character a blocked one; short rows are padded with blocked
     * squares. The word list has one word per line; blank lines are ignored.
     * @param structure textual grid structure
     * @param words textual word list
     * @return the puzzle
     */
    public static Crossword parseFrom(Reader structure, Reader words) {
        List<String> rows = new ArrayList<>();
        Scanner s = new Scanner(structure);
        while (s.hasNextLine()) rows.add(s.nextLine());
        while (!rows.isEmpty() && rows.get(rows.size() - 1).isEmpty()) rows.remove(rows.size() - 1);
        if (rows.isEmpty()) throw new IllegalArgumentException("empty structure");
        int w = rows.stream().mapToInt(String::length).max().orElse(0);
        boolean[][] grid = new boolean[rows.size()][w];
        for (int i = 0; i < rows.size(); ++i) {
            String row = rows.get(i);
            for (int j = 0; j < row.length(); ++j) grid[i][j] = row.charAt(j) == OPEN;
        }

        List<String> ws = new ArrayList<>();
        Scanner t = new Scanner(words);
        while (t.hasNextLine()) ws.add(t.nextLine());
        return new Crossword(grid, ws);
    }
}
