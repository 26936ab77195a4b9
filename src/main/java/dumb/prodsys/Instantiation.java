package dumb.prodsys;

import static java.util.Objects.requireNonNull;

/**
 * A rule paired with one consistent binding set. Identity is (rule name, bindings).
 */
public record Instantiation(Rule rule, Bindings bindings) {
    public Instantiation {
        requireNonNull(rule);
        requireNonNull(bindings);
    }

    public String ruleId() {
        return rule.id();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Instantiation i && rule.id().equals(i.rule.id()) && bindings.equals(i.bindings));
    }

    @Override
    public int hashCode() {
        return 31 * rule.id().hashCode() + bindings.hashCode();
    }

    @Override
    public String toString() {
        return rule.id() + " " + bindings;
    }
}
