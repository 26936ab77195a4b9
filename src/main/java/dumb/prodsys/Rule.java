package dumb.prodsys;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A production: a conjunction of antecedent patterns and one consequent template.
 */
public record Rule(String id, List<Term.Lst> antecedents, Term.Lst consequent, int pri) {
    public Rule {
        requireNonNull(id);
        requireNonNull(consequent);
        antecedents = List.copyOf(requireNonNull(antecedents));
        if (id.isBlank())
            throw new MalformedRuleException("Rule name must not be blank");
        if (antecedents.isEmpty())
            throw new MalformedRuleException("Rule " + id + " has no antecedents");
        antecedents.forEach(p -> validatePattern(id, p));
        validatePattern(id, consequent);
        validateUnboundVariables(id, antecedents, consequent);
    }

    public static Rule parseRule(String id, Term.Lst ruleForm, int pri) {
        if (!(ruleForm.op().filter(Logic.KIF_OP_IMPLIES::equals).isPresent() && ruleForm.size() == 3))
            throw new MalformedRuleException("Rule form must be (=> ant con): " + ruleForm.toKif());

        var antTerm = ruleForm.get(1);
        if (!(antTerm instanceof Term.Lst antList))
            throw new MalformedRuleException("Antecedent must be a KIF list or (and ...): " + antTerm.toKif());
        var antecedents = antList.op().filter(Logic.KIF_OP_AND::equals).isPresent()
                ? antList.terms.stream().skip(1).map(t -> asPattern(id, t)).toList()
                : List.of(antList);
        return new Rule(id, antecedents, asPattern(id, ruleForm.get(2)), pri);
    }

    private static Term.Lst asPattern(String id, Term t) {
        if (t instanceof Term.Lst l) return l;
        throw new MalformedRuleException("Rule " + id + ": pattern must be a list: " + t.toKif());
    }

    private static void validatePattern(String id, Term.Lst pattern) {
        if (pattern.isEmpty())
            throw new MalformedRuleException("Rule " + id + ": empty pattern");
        if (!pattern.isFlat())
            throw new MalformedRuleException("Rule " + id + ": nested lists are not allowed in patterns: " + pattern.toKif());
    }

    private static void validateUnboundVariables(String id, List<Term.Lst> antecedents, Term.Lst consequent) {
        var unbound = new HashSet<>(consequent.vars());
        antecedents.forEach(a -> unbound.removeAll(a.vars()));
        if (!unbound.isEmpty())
            throw new MalformedRuleException("Rule " + id + ": consequent has variables not bound by any antecedent: "
                    + unbound.stream().map(Term.Var::name).sorted().collect(Collectors.joining(", ")));
    }

    /** Number of antecedents; the Specificity strategy prefers larger values. */
    public int specificity() {
        return antecedents.size();
    }

    public String formString() {
        var ant = antecedents.size() == 1
                ? antecedents.get(0).toKif()
                : antecedents.stream().map(Term.Lst::toKif).collect(Collectors.joining(" ", "(and ", ")"));
        return "(=> " + ant + " " + consequent.toKif() + ")";
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Rule r && id.equals(r.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
