package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.*;

/**
 * The remaining candidate words of each variable. Domains start out as the whole word list
 * and only shrink, except when a search branch restores a snapshot taken before it began.
 * Each domain is kept sorted so that iteration order is reproducible.
 */
public class Domains {
    private final Map<Variable, SortedSet<String>> domains = new HashMap<>();

    Domains(Crossword crossword) {
        for (Variable v : crossword.variables()) domains.put(v, new TreeSet<>(crossword.words()));
    }

    /** @return a read-only view of the current domain of v */
    public SortedSet<String> get(Variable v) {
        return Collections.unmodifiableSortedSet(live(v));
    }

    public int size(Variable v) {
        return live(v).size();
    }

    public boolean isEmpty(Variable v) {
        return live(v).isEmpty();
    }

    boolean remove(Variable v, String word) {
        return live(v).remove(word);
    }

    /**
     * Replace the domain of v by the single word given.
     */
    void reduceTo(Variable v, String word) {
        SortedSet<String> d = live(v);
        if (!d.contains(word)) throw new IllegalArgumentException(word + " is not in the domain of " + v);
        d.retainAll(Collections.singleton(word));
    }

    /**
     * @return true if some variable has no remaining candidates
     */
    boolean anyEmpty() {
        return domains.values().stream().anyMatch(Set::isEmpty);
    }

    ImmutableMap<Variable, ImmutableSortedSet<String>> snapshot() {
        ImmutableMap.Builder<Variable, ImmutableSortedSet<String>> b = ImmutableMap.builder();
        domains.forEach((v, d) -> b.put(v, ImmutableSortedSet.copyOfSorted(d)));
        return b.build();
    }

    void restore(Map<Variable, ? extends SortedSet<String>> snapshot) {
        snapshot.forEach((v, d) -> {
            SortedSet<String> l = live(v);
            l.clear();
            l.addAll(d);
        });
    }

    private SortedSet<String> live(Variable v) {
        SortedSet<String> d = domains.get(v);
        if (d == null) throw new IllegalArgumentException("unknown variable: " + v);
        return d;
    }

    @Override
    public String toString() {
        return new TreeMap<>(domains).toString();
    }
}
