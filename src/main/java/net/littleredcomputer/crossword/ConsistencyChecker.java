package net.littleredcomputer.crossword;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a (possibly partial) assignment breaks any constraint of the puzzle.
 */
class ConsistencyChecker {
    private final Crossword crossword;

    ConsistencyChecker(Crossword crossword) {
        this.crossword = crossword;
    }

    /**
     * @return true if each assigned word fits its slot, no word is used twice, and every pair
     * of assigned crossing slots agrees on its shared square. Unassigned slots are not consulted.
     */
    boolean consistent(Assignment assignment) {
        Set<String> used = new HashSet<>();
        for (Variable v : crossword.variables()) {
            if (!assignment.contains(v)) continue;
            String w = assignment.get(v);
            if (w.length() != v.length()) return false;
            if (!used.add(w)) return false;
            for (Variable n : crossword.neighbors(v)) {
                if (!assignment.contains(n)) continue;
                Optional<Overlap> o = crossword.overlap(v, n);
                if (o.isPresent() && !o.get().agrees(w, assignment.get(n))) return false;
            }
        }
        return true;
    }
}
