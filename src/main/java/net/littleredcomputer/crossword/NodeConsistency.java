package net.littleredcomputer.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes from each domain the words whose length differs from that of the variable.
 */
class NodeConsistency {
    private static final Logger log = LogManager.getFormatterLogger();

    private NodeConsistency() {}

    static void enforce(Crossword crossword, Domains domains) {
        int removed = 0;
        for (Variable v : crossword.variables()) {
            List<String> misfits = new ArrayList<>();
            for (String w : domains.get(v)) if (w.length() != v.length()) misfits.add(w);
            for (String w : misfits) domains.remove(v, w);
            removed += misfits.size();
            if (domains.isEmpty(v)) log.debug("no word of length %d for %s", v.length(), v);
        }
        log.debug("node consistency removed %d candidates", removed);
    }
}
