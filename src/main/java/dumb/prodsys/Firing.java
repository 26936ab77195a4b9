package dumb.prodsys;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One cycle's outcome: the instantiation executed and the fact it added, if any.
 */
public record Firing(int cycle, Instantiation instantiation, @Nullable Fact derived) {
    public Firing {
        requireNonNull(instantiation);
    }

    public String ruleId() {
        return instantiation.ruleId();
    }

    public Optional<Fact> derivedFact() {
        return Optional.ofNullable(derived);
    }

    @Override
    public String toString() {
        return cycle + ": " + instantiation + (derived != null ? " -> " + derived : " (no new fact)");
    }
}
