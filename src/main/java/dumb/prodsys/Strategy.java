package dumb.prodsys;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.List;
import java.util.Locale;

/**
 * Conflict resolution. Each strategy ranks candidates by a key and breaks ties by
 * enumeration order (rules as declared, then bindings as discovered).
 */
public enum Strategy {
    PRIORITY {
        @Override
        int rank(Instantiation i) {
            return i.rule().pri();
        }
    },
    SPECIFICITY {
        @Override
        int rank(Instantiation i) {
            return i.rule().specificity();
        }
    },
    ORDER {
        @Override
        int rank(Instantiation i) {
            return 0;
        }
    };

    @JsonCreator
    public static Strategy parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown conflict resolution strategy: " + name, e);
        }
    }

    abstract int rank(Instantiation i);

    /**
     * Picks one candidate. The list must be in enumeration order and non-empty;
     * only a strictly higher rank displaces an earlier candidate.
     */
    public Instantiation select(List<Instantiation> candidates) {
        if (candidates.isEmpty())
            throw new IllegalStateException("Conflict resolution invoked on an empty conflict set");
        var best = candidates.get(0);
        var bestRank = rank(best);
        for (var i = 1; i < candidates.size(); i++) {
            var c = candidates.get(i);
            var r = rank(c);
            if (r > bestRank) {
                best = c;
                bestRank = r;
            }
        }
        return best;
    }
}
