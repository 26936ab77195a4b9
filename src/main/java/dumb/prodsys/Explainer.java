package dumb.prodsys;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Builds derivation trees from the provenance recorded in working memory, on demand.
 * Subtrees are cached per fact; shared supports appear once per parent that uses them.
 */
public class Explainer {
    private final Knowledge kb;
    private final Map<Fact, Explanation> cache = new HashMap<>();

    public Explainer(Knowledge kb) {
        this.kb = requireNonNull(kb);
    }

    public Explanation explain(Fact fact) {
        if (!kb.contains(fact))
            throw new IllegalArgumentException("Unknown fact: " + fact);
        return explain(fact, new HashSet<>());
    }

    private Explanation explain(Fact fact, Set<Fact> path) {
        var cached = cache.get(fact);
        if (cached != null) return cached;
        if (!path.add(fact))
            throw new IllegalStateException("Cyclic provenance at " + fact);

        var e = kb.provenance(fact)
                .map(p -> new Explanation(fact, p, p.support().stream().map(s -> explain(s, path)).toList()))
                .orElseGet(() -> Explanation.leaf(fact));

        path.remove(fact);
        cache.put(fact, e);
        return e;
    }
}
