package dumb.prodsys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the enrollment policy over its sample working memories under each conflict resolution strategy.
 */
public class Demo {
    private static final Logger logger = LoggerFactory.getLogger(Demo.class);

    static final String RULES = "enrollment.kif";
    static final Map<String, String> CASES = new LinkedHashMap<>();

    static {
        CASES.put("CONFLICT TEST CASE", "enrollment-conflict.kif");
        CASES.put("NO-MATCH TEST CASE", "enrollment-nomatch.kif");
    }

    public static void main(String[] args) throws IOException, KifParser.ParseException {
        var config = Configuration.resource(Configuration.DEFAULT_RESOURCE);
        var rules = RuleSet.resource(RULES);

        for (var c : CASES.entrySet()) {
            var wm = RuleSet.factsResource(c.getValue());
            logger.info("==== {} ====", c.getKey());
            // one strategy is enough when nothing can fire
            var strategies = c.getKey().startsWith("NO-MATCH") ? List.of(Strategy.PRIORITY) : List.of(Strategy.values());
            for (var s : strategies)
                run(rules, wm, config.withStrategy(s));
        }
    }

    static Reasoner run(RuleSet rules, List<Fact> wm, Configuration config) {
        logger.info("=== {} strategy ===", config.strategy());
        var r = new Reasoner(rules, wm, config);
        r.events.on(Event.FiredEvent.class, e -> logger.debug("{} {}", e.getEventType(), e.toJson()));
        r.run();
        logger.info("Final working memory:\n  {}", String.join("\n  ", r.knowledge().facts().stream().map(Fact::toKif).toList()));
        r.derived().forEach(f -> logger.info("Explanation:\n{}", r.explain(f).render()));
        return r;
    }
}
