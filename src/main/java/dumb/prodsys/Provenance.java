package dumb.prodsys;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Why a derived fact exists: the rule that fired, its bindings and the ground antecedent instances, in antecedent order.
 */
public record Provenance(String ruleId, Bindings bindings, List<Fact> support) {
    public Provenance {
        requireNonNull(ruleId);
        requireNonNull(bindings);
        support = List.copyOf(requireNonNull(support));
    }
}
