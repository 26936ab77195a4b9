package dumb.prodsys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Forward-chaining production system. Each cycle matches every rule against the current working memory,
 * drops instantiations that already fired, lets the configured {@link Strategy} pick one and executes it.
 * The run ends when no eligible instantiation remains.
 * <p>
 * An instance owns its working memory and firing history and is meant for one run on one thread.
 */
public class Reasoner {
    private static final Logger logger = LoggerFactory.getLogger(Reasoner.class);

    public enum State {RUNNING, SATURATED, FAILED}

    public final Events events = new Events();
    private final RuleSet rules;
    private final Configuration config;
    private final Function<List<Instantiation>, Instantiation> selector;
    private final Knowledge kb;
    private final Refraction refraction = new Refraction();
    private final Explainer explainer;
    private final List<Firing> firings = new ArrayList<>();
    private final List<Fact> derived = new ArrayList<>();
    private State state = State.RUNNING;
    private int cycle = 0;

    public Reasoner(RuleSet rules, Collection<Fact> initial, Configuration config) {
        this(rules, initial, config, config.strategy()::select);
    }

    /** Uses {@code selector} for conflict resolution in place of the configured strategy. */
    Reasoner(RuleSet rules, Collection<Fact> initial, Configuration config,
             Function<List<Instantiation>, Instantiation> selector) {
        this.rules = requireNonNull(rules);
        this.config = requireNonNull(config);
        this.selector = requireNonNull(selector);
        rules.checkFacts(initial);
        this.kb = new Knowledge(initial);
        this.explainer = new Explainer(kb);
    }

    public Reasoner(RuleSet rules, Collection<Fact> initial, Strategy strategy) {
        this(rules, initial, new Configuration(strategy));
    }

    /** Runs over the facts declared in the rule set itself. */
    public Reasoner(RuleSet rules, Configuration config) {
        this(rules, rules.facts(), config);
    }

    /**
     * Eligible instantiations against the current working memory, in enumeration order:
     * rules as declared, bindings in discovery order. Nothing is modified.
     */
    public List<Instantiation> conflictSet() {
        return refraction.eligible(Logic.Matcher.instantiations(rules.rules(), kb.facts()));
    }

    /**
     * Performs one cycle. Returns the firing, or empty when the run has saturated.
     *
     * @throws IllegalStateException if the run already ended
     */
    public Optional<Firing> step() {
        if (state != State.RUNNING)
            throw new IllegalStateException("Reasoner is " + state);
        try {
            cycle++;
            var candidates = conflictSet();
            if (config.trace()) trace(candidates);
            else logger.debug("Cycle {}: {} facts, conflict set {}", cycle, kb.size(), candidates);

            if (candidates.isEmpty()) {
                state = State.SATURATED;
                logger.info("Saturated after {} cycles: {} facts, {} derived", cycle, kb.size(), derived.size());
                events.emit(new Event.SaturatedEvent(cycle, kb.size(), derived));
                return Optional.empty();
            }

            var selected = selector.apply(candidates);
            var firing = fire(selected);
            events.emit(new Event.FiredEvent(cycle, selected.ruleId(), selected.bindings(), firing.derived(), candidates.size()));
            return Optional.of(firing);
        } catch (RuntimeException e) {
            state = State.FAILED;
            logger.error("Cycle {} failed", cycle, e);
            throw e;
        }
    }

    private void trace(List<Instantiation> candidates) {
        logger.info("Cycle {} working memory:\n  {}", cycle,
                String.join("\n  ", kb.facts().stream().map(Fact::toKif).toList()));
        for (var rule : rules.rules()) {
            if (Logic.Matcher.matches(rule, kb.facts()).isEmpty())
                logger.info("Rule {} failing", rule.id());
            else
                logger.info("Rule {} match succeeds", rule.id());
        }
        logger.info("Cycle {} conflict set {}", cycle, candidates);
    }

    /** Cycles until saturation and returns every firing of this run, in order. */
    public List<Firing> run() {
        var more = true;
        while (more) more = step().isPresent();
        return firings();
    }

    private Firing fire(Instantiation inst) {
        var fact = Logic.Unifier.ground(inst.rule().consequent(), inst.bindings());
        var why = new Provenance(inst.ruleId(), inst.bindings(), Logic.Matcher.support(inst));
        var added = kb.commit(fact, why);
        refraction.record(inst);

        Firing firing;
        if (added) {
            derived.add(fact);
            firing = new Firing(cycle, inst, fact);
            logger.info("Fired {} {} -> {}", inst.ruleId(), inst.bindings(), fact);
            events.emit(new Event.DerivedEvent(fact, why));
        } else {
            firing = new Firing(cycle, inst, null);
            logger.info("Fired {} {}: {} already known", inst.ruleId(), inst.bindings(), fact);
        }
        firings.add(firing);
        return firing;
    }

    public Explanation explain(Fact fact) {
        return explainer.explain(fact);
    }

    public State state() {
        return state;
    }

    public Strategy strategy() {
        return config.strategy();
    }

    public int cycles() {
        return cycle;
    }

    public List<Firing> firings() {
        return Collections.unmodifiableList(firings);
    }

    /** Facts added by firings, in derivation order. */
    public List<Fact> derived() {
        return Collections.unmodifiableList(derived);
    }

    public Knowledge knowledge() {
        return kb;
    }

    public Refraction refraction() {
        return refraction;
    }

    public RuleSet rules() {
        return rules;
    }
}
