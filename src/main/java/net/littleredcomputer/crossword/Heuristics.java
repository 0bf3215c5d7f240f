package net.littleredcomputer.crossword;

import java.util.*;

import static java.util.stream.Collectors.toList;

/**
 * Variable and value ordering for the backtracking search.
 */
class Heuristics {
    private final Crossword crossword;
    private final Domains domains;

    Heuristics(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /**
     * Choose the unassigned variable with the fewest remaining values (MRV). Among those,
     * prefer the one with the most neighbors; remaining ties go to the first in canonical order.
     * @return the chosen variable, or empty if every variable is assigned
     */
    Optional<Variable> selectUnassignedVariable(Assignment assignment) {
        Variable best = null;
        int bestSize = Integer.MAX_VALUE;
        int bestDegree = -1;
        for (Variable v : crossword.variables()) {
            if (assignment.contains(v)) continue;
            int size = domains.size(v);
            int degree = crossword.neighbors(v).size();
            if (size < bestSize || (size == bestSize && degree > bestDegree)) {
                best = v;
                bestSize = size;
                bestDegree = degree;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * @return the number of values among the domains of the unassigned neighbors of var that
     * would conflict with var = value on a shared square
     */
    int ruledOut(Variable var, String value, Assignment assignment) {
        int count = 0;
        for (Variable n : crossword.neighbors(var)) {
            if (assignment.contains(n)) continue;
            Overlap o = crossword.overlap(var, n).orElseThrow(IllegalStateException::new);
            for (String b : domains.get(n)) if (!o.agrees(value, b)) ++count;
        }
        return count;
    }

    /**
     * Least-constraining value ordering.
     * @return the domain of var, ordered by increasing number of values ruled out for its
     * unassigned neighbors; ties are broken lexicographically
     */
    List<String> orderDomainValues(Variable var, Assignment assignment) {
        Map<String, Integer> cost = new HashMap<>();
        for (String value : domains.get(var)) cost.put(value, ruledOut(var, value, assignment));
        return domains.get(var).stream()
                .sorted(Comparator.<String>comparingInt(cost::get).thenComparing(Comparator.naturalOrder()))
                .collect(toList());
    }
}
