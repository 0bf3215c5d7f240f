// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * The AC-3 algorithm. After a successful run every value remaining in the domain of a
 * variable agrees, on each shared square, with some value in the domain of every neighbor.
 */
class ArcConsistency {
    private static final Logger log = LogManager.getFormatterLogger();

    /**
     * An ordered pair of crossing variables: the domain of x is to be made consistent with that of y.
     */
    static final class Arc {
        final Variable x;
        final Variable y;

        Arc(Variable x, Variable y) {
            this.x = x;
            this.y = y;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Arc)) return false;
            Arc a = (Arc) o;
            return x.equals(a.x) && y.equals(a.y);
        }

        @Override
        public int hashCode() {
            return 31 * x.hashCode() + y.hashCode();
        }

        @Override
        public String toString() {
            return x + " -> " + y;
        }
    }

    private final Crossword crossword;
    private final Domains domains;
    private long revisions = 0;

    ArcConsistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    long revisions() { return revisions; }

    /**
     * Make x arc consistent with y: remove from the domain of x each word having no partner in
     * the domain of y that agrees with it on the shared square.
     * @return true if the domain of x was changed
     */
    boolean revise(Variable x, Variable y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        ++revisions;
        final int i = o.get().first();
        final int j = o.get().second();
        // The letters y can offer at the shared square.
        Set<Character> supported = new HashSet<>();
        for (String b : domains.get(y)) supported.add(b.charAt(j));
        List<String> unsupported = new ArrayList<>();
        for (String a : domains.get(x)) if (!supported.contains(a.charAt(i))) unsupported.add(a);
        for (String a : unsupported) domains.remove(x, a);
        return !unsupported.isEmpty();
    }

    /**
     * @return every arc (v, n) of the problem, v and n in canonical order
     */
    List<Arc> allArcs() {
        List<Arc> arcs = new ArrayList<>();
        for (Variable v : crossword.variables()) {
            for (Variable n : crossword.neighbors(v)) arcs.add(new Arc(v, n));
        }
        return arcs;
    }

    boolean ac3() {
        return ac3(allArcs());
    }

    /**
     * Enforce arc consistency starting from the given arcs.
     * @param arcs initial contents of the work queue
     * @return false if some domain became empty, in which case the puzzle cannot be solved
     * from the current domains; true otherwise
     */
    boolean ac3(Collection<Arc> arcs) {
        Deque<Arc> queue = new ArrayDeque<>(arcs);
        while (!queue.isEmpty()) {
            Arc a = queue.removeFirst();
            if (!revise(a.x, a.y)) continue;
            if (domains.isEmpty(a.x)) {
                log.debug("domain of %s wiped out by %s", a.x, a.y);
                return false;
            }
            for (Variable z : crossword.neighbors(a.x)) {
                if (!z.equals(a.y)) queue.addLast(new Arc(z, a.x));
            }
        }
        return true;
    }
}
