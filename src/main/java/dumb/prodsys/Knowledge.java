package dumb.prodsys;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Working memory: an insertion-ordered set of ground facts plus the provenance of each derived one.
 * Facts are only ever added. Initial facts carry no provenance.
 */
public class Knowledge {
    private final Set<Fact> facts = new LinkedHashSet<>();
    private final Map<Fact, Provenance> provenance = new HashMap<>();

    public Knowledge(Collection<Fact> initial) {
        initial.forEach(this::assertGiven);
    }

    /** Adds an initial fact. Returns false if it was already known. */
    public boolean assertGiven(Fact fact) {
        return facts.add(requireNonNull(fact));
    }

    /**
     * Adds a derived fact with its provenance. A fact already present is left as is,
     * keeping its original provenance, and false is returned.
     */
    public boolean commit(Fact fact, Provenance why) {
        requireNonNull(fact);
        requireNonNull(why);
        if (facts.contains(fact)) return false;
        for (var s : why.support())
            if (!facts.contains(s))
                throw new IllegalStateException("Support " + s + " for " + fact + " is not in working memory");
        facts.add(fact);
        provenance.put(fact, why);
        return true;
    }

    public boolean contains(Fact fact) {
        return facts.contains(fact);
    }

    public Optional<Provenance> provenance(Fact fact) {
        return Optional.ofNullable(provenance.get(fact));
    }

    public boolean isDerived(Fact fact) {
        return provenance.containsKey(fact);
    }

    /** Unmodifiable view in insertion order. */
    public Set<Fact> facts() {
        return Collections.unmodifiableSet(facts);
    }

    public int size() {
        return facts.size();
    }
}
