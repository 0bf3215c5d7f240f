package net.littleredcomputer.crossword;

/**
 * The square shared by two crossing slots, given as the offset into each slot's word.
 */
public final class Overlap {
    private final int first;
    private final int second;

    public Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    /** @return index into the first variable's word */
    public int first() { return first; }

    /** @return index into the second variable's word */
    public int second() { return second; }

    public Overlap inverse() { return new Overlap(second, first); }

    /**
     * @return true if words a (for the first variable) and b (for the second) agree on the shared square
     */
    boolean agrees(String a, String b) {
        return a.charAt(first) == b.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap p = (Overlap) o;
        return first == p.first && second == p.second;
    }

    @Override
    public int hashCode() {
        return 31 * first + second;
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
