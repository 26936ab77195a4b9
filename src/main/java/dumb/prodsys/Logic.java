package dumb.prodsys;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

public class Logic {
    public static final String KIF_OP_IMPLIES = "=>";
    public static final String KIF_OP_AND = "and";
    public static final String KIF_OP_DEFRULE = "defrule";
    public static final String KIF_OP_FACT = "fact";

    private Logic() {
    }

    enum Unifier {
        ;

        /**
         * Matches a flat pattern against a ground fact, extending {@code bindings}.
         * Returns null when they do not match; the incoming bindings are never modified.
         */
        @Nullable
        static Bindings match(Term.Lst pattern, Fact fact, Bindings bindings) {
            var s = pattern.size();
            if (s != fact.arity()) return null;
            var current = bindings;
            for (var i = 0; i < s; i++) {
                current = matchTerm(pattern.get(i), fact.get(i), current);
                if (current == null) return null;
            }
            return current;
        }

        @Nullable
        private static Bindings matchTerm(Term p, Term.Atom value, Bindings bindings) {
            if (p instanceof Term.Var v) {
                var bound = bindings.get(v);
                if (bound == null) return bindings.with(v, value);
                return bound.equals(value) ? bindings : null;
            }
            return p.equals(value) ? bindings : null;
        }

        /** Substitutes bound variables; unbound ones are left in place. */
        static Term.Lst subst(Term.Lst pattern, Bindings bindings) {
            if (bindings.isEmpty() || !pattern.containsVar()) return pattern;
            return new Term.Lst(pattern.terms.stream().map(t -> {
                if (t instanceof Term.Var v) {
                    var b = bindings.get(v);
                    return b != null ? b : t;
                }
                return t;
            }).toList());
        }

        /** Substitutes and requires the result to be ground. */
        static Fact ground(Term.Lst pattern, Bindings bindings) {
            var s = subst(pattern, bindings);
            if (s.containsVar())
                throw new IllegalStateException("Pattern not ground after substitution: " + s.toKif() + " with " + bindings);
            return new Fact(s);
        }
    }

    /**
     * Conjunctive matching of a rule's antecedents against working memory, folding over the
     * antecedents left to right and carrying every surviving partial binding set forward.
     */
    enum Matcher {
        ;

        static List<Bindings> matches(Rule rule, Iterable<Fact> facts) {
            List<Bindings> partial = List.of(Bindings.EMPTY);
            for (var antecedent : rule.antecedents()) {
                var next = new ArrayList<Bindings>();
                for (var b : partial)
                    for (var fact : facts) {
                        var extended = Unifier.match(antecedent, fact, b);
                        if (extended != null) next.add(extended);
                    }
                if (next.isEmpty()) return List.of();
                partial = next;
            }
            return partial;
        }

        static List<Instantiation> instantiations(List<Rule> rules, Iterable<Fact> facts) {
            var out = new ArrayList<Instantiation>();
            for (var rule : rules)
                for (var b : matches(rule, facts))
                    out.add(new Instantiation(rule, b));
            return out;
        }

        static List<Fact> support(Instantiation inst) {
            return inst.rule().antecedents().stream().map(a -> Unifier.ground(a, inst.bindings())).toList();
        }
    }
}
