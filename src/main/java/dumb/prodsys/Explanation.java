package dumb.prodsys;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.prodsys.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Derivation tree of a fact. Leaves are initial facts; inner nodes carry the provenance of a derived fact
 * and one child per supporting fact, in antecedent order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Explanation(Fact fact, @Nullable Provenance why, List<Explanation> support) {
    public Explanation {
        requireNonNull(fact);
        support = List.copyOf(requireNonNull(support));
        if (why == null && !support.isEmpty())
            throw new IllegalArgumentException("Initial fact cannot have support: " + fact);
    }

    static Explanation leaf(Fact fact) {
        return new Explanation(fact, null, List.of());
    }

    public boolean given() {
        return why == null;
    }

    /** Longest chain of rule firings below and including this node; 0 for an initial fact. */
    public int depth() {
        return given() ? 0 : 1 + support.stream().mapToInt(Explanation::depth).max().orElse(0);
    }

    /** Rule names in depth-first pre-order, each listed once. */
    public Set<String> supportingRules() {
        var rules = new LinkedHashSet<String>();
        collectRules(this, rules);
        return rules;
    }

    private static void collectRules(Explanation e, Set<String> rules) {
        if (e.why != null) rules.add(e.why.ruleId());
        e.support.forEach(s -> collectRules(s, rules));
    }

    public String render() {
        var sb = new StringBuilder();
        render(sb, 0);
        return sb.toString();
    }

    private void render(StringBuilder sb, int indent) {
        sb.append("  ".repeat(indent)).append(fact.toKif());
        if (why == null)
            sb.append("  [given]");
        else
            sb.append("  <= ").append(why.ruleId()).append(' ').append(why.bindings());
        sb.append('\n');
        support.forEach(s -> s.render(sb, indent + 1));
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    @Override
    public String toString() {
        return render();
    }
}
