package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A partial map from variables to words. The search grows and shrinks it one entry at a time.
 */
public class Assignment {
    private final SortedMap<Variable, String> words = new TreeMap<>();

    public Assignment() {}

    public Assignment(Map<Variable, String> words) {
        this.words.putAll(words);
    }

    public String get(Variable v) { return words.get(v); }
    public boolean contains(Variable v) { return words.containsKey(v); }
    public int size() { return words.size(); }

    void put(Variable v, String word) { words.put(v, word); }
    void remove(Variable v) { words.remove(v); }

    /**
     * @return true if every variable of the crossword holds a nonempty word
     */
    public boolean isComplete(Crossword crossword) {
        if (words.size() != crossword.variables().size()) return false;
        for (Variable v : crossword.variables()) {
            String w = words.get(v);
            if (w == null || w.isEmpty()) return false;
        }
        return true;
    }

    /** @return an immutable copy, in canonical variable order */
    public ImmutableSortedMap<Variable, String> asMap() {
        return ImmutableSortedMap.copyOfSorted(words);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Assignment && words.equals(((Assignment) o).words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
