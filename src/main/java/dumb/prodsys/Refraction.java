package dumb.prodsys;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only history of fired instantiations for one run.
 */
public class Refraction {
    private final Set<Instantiation> fired = new HashSet<>();

    /** Candidates not fired yet, in their original order. Does not modify the history. */
    public List<Instantiation> eligible(List<Instantiation> candidates) {
        return candidates.stream().filter(i -> !fired.contains(i)).toList();
    }

    public boolean hasFired(Instantiation i) {
        return fired.contains(i);
    }

    void record(Instantiation i) {
        if (!fired.add(i))
            throw new IllegalStateException("Instantiation fired twice: " + i);
    }

    public Set<Instantiation> fired() {
        return Collections.unmodifiableSet(fired);
    }

    public int size() {
        return fired.size();
    }
}
