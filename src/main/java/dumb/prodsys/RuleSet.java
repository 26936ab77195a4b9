package dumb.prodsys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dumb.prodsys.Logic.KIF_OP_DEFRULE;
import static dumb.prodsys.Logic.KIF_OP_FACT;
import static java.util.Objects.requireNonNull;

/**
 * An ordered, validated table of rules. Declaration order is the enumeration order used for tie-breaking.
 * <p>
 * Text form:
 * <pre>
 * (defrule grad-only-violation 5
 *   (=> (and (enrolled ?s ?c) (graduate-only ?c)) (flag-violation ?s ?c)))
 * (fact (enrolled Alice CS501))
 * </pre>
 */
public final class RuleSet {
    private static final Logger logger = LoggerFactory.getLogger(RuleSet.class);

    private final List<Rule> rules;
    private final List<Fact> facts;
    private final Map<String, Integer> arities;

    public RuleSet(List<Rule> rules) {
        this(rules, List.of());
    }

    public RuleSet(List<Rule> rules, List<Fact> facts) {
        this.rules = List.copyOf(requireNonNull(rules));
        this.facts = List.copyOf(requireNonNull(facts));
        this.arities = validate(this.rules);
        checkFacts(this.facts);
    }

    public static RuleSet parse(String kif) throws KifParser.ParseException {
        var rules = new ArrayList<Rule>();
        var facts = new ArrayList<Fact>();
        for (var t : KifParser.parseKif(kif)) {
            if (!(t instanceof Term.Lst form))
                throw new MalformedRuleException("Top-level form must be a list: " + t.toKif());
            var op = form.op().orElse("");
            if (op.equals(KIF_OP_DEFRULE)) rules.add(parseDefrule(form));
            else if (op.equals(KIF_OP_FACT)) facts.add(parseFactForm(form));
            else throw new MalformedRuleException("Expected (defrule ...) or (fact ...): " + form.toKif());
        }
        var rs = new RuleSet(rules, facts);
        logger.info("Loaded {} rules and {} facts", rules.size(), facts.size());
        return rs;
    }

    public static RuleSet resource(String name) throws IOException, KifParser.ParseException {
        return parse(readResource(name));
    }

    /** Parses a working memory: bare ground tuples or (fact ...) forms. */
    public static List<Fact> parseFacts(String kif) throws KifParser.ParseException {
        var facts = new ArrayList<Fact>();
        for (var t : KifParser.parseKif(kif)) {
            if (t instanceof Term.Lst l && l.op().filter(KIF_OP_FACT::equals).isPresent() && l.size() == 2 && l.get(1) instanceof Term.Lst)
                facts.add(parseFactForm(l));
            else
                facts.add(Fact.of(t));
        }
        return facts;
    }

    public static List<Fact> factsResource(String name) throws IOException, KifParser.ParseException {
        return parseFacts(readResource(name));
    }

    static String readResource(String name) throws IOException {
        try (InputStream in = RuleSet.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) throw new IOException("Resource not found: " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Rule parseDefrule(Term.Lst form) {
        if (form.size() != 4 || !(form.get(1) instanceof Term.Atom name) || !(form.get(3) instanceof Term.Lst body))
            throw new MalformedRuleException("Expected (defrule <name> <priority> (=> ...)): " + form.toKif());
        if (!(form.get(2) instanceof Term.Atom priAtom))
            throw new MalformedRuleException("Rule priority must be an integer: " + form.toKif());
        int pri;
        try {
            pri = Integer.parseInt(priAtom.value());
        } catch (NumberFormatException e) {
            throw new MalformedRuleException("Rule priority must be an integer: " + priAtom.toKif());
        }
        return Rule.parseRule(name.value(), body, pri);
    }

    private static Fact parseFactForm(Term.Lst form) {
        if (form.size() != 2)
            throw new IllegalArgumentException("Expected (fact <tuple>): " + form.toKif());
        return Fact.of(form.get(1));
    }

    private static Map<String, Integer> validate(List<Rule> rules) {
        var ids = new HashSet<String>();
        var arities = new LinkedHashMap<String, Integer>();
        for (var r : rules) {
            if (!ids.add(r.id()))
                throw new MalformedRuleException("Duplicate rule name: " + r.id());
            var patterns = new ArrayList<>(r.antecedents());
            patterns.add(r.consequent());
            for (var p : patterns)
                p.op().ifPresent(pred -> {
                    var known = arities.putIfAbsent(pred, p.size());
                    if (known != null && known != p.size())
                        throw new MalformedRuleException("Rule " + r.id() + ": predicate " + pred + " used with arity " + p.size() + ", elsewhere " + known);
                });
        }
        return arities;
    }

    /** Rejects facts whose predicate is used by the rules with a different arity. */
    public void checkFacts(Collection<Fact> initial) {
        for (var f : initial) {
            var pred = f.get(0).value();
            var expected = arities.get(pred);
            if (expected != null && expected != f.arity())
                throw new MalformedRuleException("Fact " + f + " has arity " + f.arity() + " but rules use " + pred + " with arity " + expected);
        }
    }

    public List<Rule> rules() {
        return rules;
    }

    /** Facts declared alongside the rules, in declaration order. */
    public List<Fact> facts() {
        return facts;
    }

    public Optional<Rule> rule(String id) {
        return rules.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public int size() {
        return rules.size();
    }

    public Optional<Integer> arity(String predicate) {
        return Optional.ofNullable(arities.get(predicate));
    }
}
