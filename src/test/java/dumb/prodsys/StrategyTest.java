package dumb.prodsys;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class StrategyTest extends AbstractTest {

    private static final String ADVISOR_RULES = """
            (defrule probation-review 1
              (=> (on-probation ?s) (needs-advisor-review ?s)))
            (defrule low-gpa-review 10
              (=> (low-gpa ?s) (needs-advisor-review ?s)))
            (defrule overload-review 2
              (=> (and (credit-overload ?s) (part-time ?s) (employed ?s)) (needs-advisor-review ?s)))
            """;
    private static final String ADVISOR_FACTS = "(on-probation Bob) (low-gpa Bob) (credit-overload Bob) (part-time Bob) (employed Bob)";

    private static final String HOLD = "administrative-hold-prevents-enrollment";
    private static final String PREREQ = "missing-prerequisite-prevents-enrollment";
    private static final String GRAD = "graduate-only-course-restriction";
    private static final String DROP = "cannot-enroll-course-implies-drop-request";
    private static final String NOTIFY = "dropped-request-implies-notify-student";

    static Stream<Arguments> advisorScenario() {
        return Stream.of(
                Arguments.of(Strategy.PRIORITY, "low-gpa-review"),
                Arguments.of(Strategy.SPECIFICITY, "overload-review"),
                Arguments.of(Strategy.ORDER, "probation-review"));
    }

    static Stream<Arguments> enrollmentConflict() {
        return Stream.of(
                Arguments.of(Strategy.PRIORITY, List.of(HOLD, PREREQ, GRAD, DROP, NOTIFY)),
                Arguments.of(Strategy.SPECIFICITY, List.of(PREREQ, GRAD, HOLD, DROP, NOTIFY)),
                Arguments.of(Strategy.ORDER, List.of(GRAD, PREREQ, HOLD, DROP, NOTIFY)));
    }

    @ParameterizedTest
    @MethodSource("advisorScenario")
    void strategyDecidesWhichRuleFiresFirst(Strategy strategy, String expectedFirst) {
        var r = reasoner(ADVISOR_RULES, ADVISOR_FACTS, strategy);
        var firings = r.run();

        assertEquals(expectedFirst, firings.get(0).ruleId());
        assertEquals(fact("(needs-advisor-review Bob)"), firings.get(0).derived());
        assertEquals(3, firings.size());
        assertTrue(firings.stream().skip(1).allMatch(f -> f.derived() == null));

        var why = r.explain(fact("(needs-advisor-review Bob)"));
        assertEquals(expectedFirst, why.why().ruleId());
    }

    @Test
    void finalWorkingMemoryIsTheSameForEveryStrategy() {
        var results = Stream.of(Strategy.values()).map(s -> {
            var r = reasoner(ADVISOR_RULES, ADVISOR_FACTS, s);
            r.run();
            return new HashSet<>(r.knowledge().facts());
        }).toList();
        assertEquals(results.get(0), results.get(1));
        assertEquals(results.get(1), results.get(2));
        assertEquals(6, results.get(0).size());
    }

    @ParameterizedTest
    @MethodSource("enrollmentConflict")
    void enrollmentConflictFiringOrder(Strategy strategy, List<String> expected) {
        var r = new Reasoner(enrollment(), workingMemory(CONFLICT_CASE), strategy);
        r.run();
        assertEquals(expected, firedRules(r));
        assertEquals(11, r.knowledge().size());
        assertEquals(List.of(fact("(cannot-enroll-course Carol CS550)"), fact("(dropped-request Carol CS550)"), fact("(notified-student Carol CS550)")),
                r.derived());
        assertEquals(expected.get(0), r.explain(fact("(cannot-enroll-course Carol CS550)")).why().ruleId());
    }

    @ParameterizedTest
    @EnumSource(Strategy.class)
    void tiesGoToTheEarliestCandidate(Strategy strategy) {
        var rule = Rule.parseRule("r", pattern("(=> (p ?x) (q ?x))"), 1);
        var candidates = List.of(
                new Instantiation(rule, Bindings.of("?x", "a")),
                new Instantiation(rule, Bindings.of("?x", "b")));
        assertSame(candidates.get(0), strategy.select(candidates));
        assertSame(candidates.get(0), strategy.select(candidates));
    }

    @Test
    void selectingFromAnEmptyConflictSetIsAnError() {
        for (var s : Strategy.values())
            assertThrows(IllegalStateException.class, () -> s.select(List.of()));
    }

    @Test
    void parsesStrategyNames() {
        assertEquals(Strategy.SPECIFICITY, Strategy.parse(" Specificity "));
        assertEquals(Strategy.ORDER, Strategy.parse("order"));
        var e = assertThrows(IllegalArgumentException.class, () -> Strategy.parse("recency"));
        assertTrue(e.getMessage().contains("recency"));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
}
