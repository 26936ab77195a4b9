package dumb.prodsys;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A ground tuple held in working memory. Compared structurally.
 */
public record Fact(Term.Lst kif) {
    public Fact {
        requireNonNull(kif);
        if (kif.isEmpty())
            throw new IllegalArgumentException("Fact must not be empty");
        if (!kif.terms.stream().allMatch(Term.Atom.class::isInstance))
            throw new IllegalArgumentException("Fact must contain only constants: " + kif.toKif());
    }

    public static Fact of(String... atoms) {
        return new Fact(Term.Lst.of(atoms));
    }

    public static Fact of(Term term) {
        if (!(term instanceof Term.Lst l))
            throw new IllegalArgumentException("Fact must be a list: " + term.toKif());
        return new Fact(l);
    }

    public int arity() {
        return kif.size();
    }

    public Term.Atom get(int index) {
        return (Term.Atom) kif.get(index);
    }

    public List<Term> terms() {
        return kif.terms;
    }

    @JsonValue
    public String toKif() {
        return kif.toKif();
    }

    @Override
    public String toString() {
        return kif.toKif();
    }
}
