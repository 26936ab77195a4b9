package dumb.prodsys;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An immutable variable-to-constant substitution. Equality ignores insertion order;
 * iteration and rendering follow the order in which variables were bound.
 */
public final class Bindings {
    public static final Bindings EMPTY = new Bindings(Map.of());

    private final Map<Term.Var, Term.Atom> map;

    private Bindings(Map<Term.Var, Term.Atom> map) {
        this.map = map;
    }

    public static Bindings of(Map<Term.Var, Term.Atom> map) {
        return map.isEmpty() ? EMPTY : new Bindings(Collections.unmodifiableMap(new LinkedHashMap<>(map)));
    }

    public static Bindings of(String... varValuePairs) {
        if (varValuePairs.length % 2 != 0)
            throw new IllegalArgumentException("Expected variable/value pairs");
        var m = new LinkedHashMap<Term.Var, Term.Atom>();
        for (var i = 0; i < varValuePairs.length; i += 2)
            m.put(Term.Var.of(varValuePairs[i]), Term.Atom.of(varValuePairs[i + 1]));
        return of(m);
    }

    @Nullable
    public Term.Atom get(Term.Var var) {
        return map.get(var);
    }

    public boolean isBound(Term.Var var) {
        return map.containsKey(var);
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    /** Returns a new binding set extended with var=value; this one is left untouched. */
    public Bindings with(Term.Var var, Term.Atom value) {
        requireNonNull(var);
        requireNonNull(value);
        var m = new LinkedHashMap<>(map);
        m.put(var, value);
        return new Bindings(Collections.unmodifiableMap(m));
    }

    public Map<Term.Var, Term.Atom> asMap() {
        return map;
    }

    @JsonValue
    public Map<String, String> toStringMap() {
        return map.entrySet().stream().collect(Collectors.toMap(e -> e.getKey().name(), e -> e.getValue().value(), (a, b) -> a, LinkedHashMap::new));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Bindings b && map.equals(b.map));
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.entrySet().stream().map(e -> e.getKey().name() + "=" + e.getValue().toKif()).collect(Collectors.joining(", ", "{", "}"));
    }
}
