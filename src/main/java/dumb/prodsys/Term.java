package dumb.prodsys;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

sealed public interface Term permits Term.Atom, Term.Var, Term.Lst {

    String toKif();

    boolean containsVar();

    Set<Var> vars();

    JSONObject toJson();

    record Var(String name) implements Term {
        private static final Map<String, Var> internCache = new ConcurrentHashMap<>(256);

        public Var {
            requireNonNull(name);
            if (!name.startsWith("?") || name.length() < 2)
                throw new IllegalArgumentException("Variable name must start with '?' and have length > 1: " + name);
        }

        public static Var of(String name) {
            return internCache.computeIfAbsent(name, Var::new);
        }

        @Override
        public String toKif() {
            return name;
        }

        @Override
        public boolean containsVar() {
            return true;
        }

        @Override
        public Set<Var> vars() {
            return Set.of(this);
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "var")
                    .put("name", name);
        }
    }

    /**
     * An ordered tuple of terms. Facts and rule patterns are both tuples; a fact's elements are all atoms.
     */
    final class Lst implements Term {
        public final List<Term> terms;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;
        private volatile String kifStringCache;
        private volatile Set<Var> variablesCache;

        public Lst(List<? extends Term> terms) {
            this.terms = List.copyOf(terms);
        }

        public Lst(Term... terms) {
            this(List.of(terms));
        }

        public static Lst of(String... atoms) {
            return new Lst(Arrays.stream(atoms).map(a -> a.startsWith("?") ? Var.of(a) : Atom.of(a)).toList());
        }

        public Term get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        public boolean isEmpty() {
            return terms.isEmpty();
        }

        /** The leading constant of the tuple, if any; used as the predicate name. */
        public Optional<String> op() {
            return terms.isEmpty() || !(terms.get(0) instanceof Atom a) ? Optional.empty() : Optional.of(a.value());
        }

        /** True when every element is an atom. */
        public boolean isFlat() {
            return terms.stream().noneMatch(Lst.class::isInstance);
        }

        @Override
        public String toKif() {
            if (kifStringCache == null)
                kifStringCache = terms.stream().map(Term::toKif).collect(Collectors.joining(" ", "(", ")"));
            return kifStringCache;
        }

        @Override
        public boolean containsVar() {
            return !vars().isEmpty();
        }

        @Override
        public Set<Var> vars() {
            if (variablesCache == null)
                variablesCache = terms.stream().flatMap(t -> t.vars().stream()).collect(Collectors.toUnmodifiableSet());
            return variablesCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && this.hashCode() == that.hashCode() && terms.equals(that.terms));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = terms.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return toKif();
        }

        @Override
        public JSONObject toJson() {
            var jsonTerms = new JSONArray();
            terms.forEach(term -> jsonTerms.put(term.toJson()));
            return new JSONObject()
                    .put("type", "list")
                    .put("terms", jsonTerms)
                    .put("kifString", toKif());
        }
    }

    record Atom(String value) implements Term {
        private static final Pattern SAFE_ATOM_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-+*/.<>=:!#%&']+$");
        private static final Map<String, Atom> internCache = new ConcurrentHashMap<>(1024);

        public Atom {
            requireNonNull(value);
        }

        public static Atom of(String value) {
            return internCache.computeIfAbsent(value, Atom::new);
        }

        @Override
        public String toKif() {
            var needsQuotes = value.isEmpty() || !SAFE_ATOM_PATTERN.matcher(value).matches();
            return needsQuotes ? '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"' : value;
        }

        @Override
        public boolean containsVar() {
            return false;
        }

        @Override
        public Set<Var> vars() {
            return Set.of();
        }

        @Override
        public String toString() {
            return toKif();
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "atom")
                    .put("value", value);
        }
    }
}
