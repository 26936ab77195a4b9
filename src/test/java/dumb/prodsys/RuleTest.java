package dumb.prodsys;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTest extends AbstractTest {

    @Test
    void parsesConjunctiveRule() {
        var r = Rule.parseRule("grad-only-violation", pattern("(=> (and (enrolled ?s ?c) (graduate-only ?c)) (flag-violation ?s ?c))"), 5);
        assertEquals(List.of(pattern("(enrolled ?s ?c)"), pattern("(graduate-only ?c)")), r.antecedents());
        assertEquals(pattern("(flag-violation ?s ?c)"), r.consequent());
        assertEquals(5, r.pri());
        assertEquals(2, r.specificity());
    }

    @Test
    void parsesSingleAntecedentRule() {
        var r = Rule.parseRule("notify", pattern("(=> (dropped-request ?s ?c) (notified-student ?s ?c))"), 3);
        assertEquals(1, r.specificity());
        assertEquals("(=> (dropped-request ?s ?c) (notified-student ?s ?c))", r.formString());
    }

    @Test
    void rejectsZeroAntecedents() {
        assertThrows(MalformedRuleException.class, () -> Rule.parseRule("empty", pattern("(=> (and) (flag x))"), 1));
        assertThrows(MalformedRuleException.class, () -> new Rule("empty", List.of(), pattern("(flag x)"), 1));
    }

    @Test
    void rejectsConsequentVariableNotBoundByAntecedent() {
        var e = assertThrows(MalformedRuleException.class,
                () -> Rule.parseRule("leaky", pattern("(=> (enrolled ?s ?c) (flag ?s ?other))"), 1));
        assertTrue(e.getMessage().contains("?other"), e.getMessage());
    }

    @Test
    void rejectsNestedPatterns() {
        assertThrows(MalformedRuleException.class, () -> Rule.parseRule("nested", pattern("(=> (enrolled (student ?s)) (flag ?s))"), 1));
    }

    @Test
    void rejectsFormThatIsNotAnImplication() {
        assertThrows(MalformedRuleException.class, () -> Rule.parseRule("bad", pattern("(and (a ?x) (b ?x))"), 1));
        assertThrows(MalformedRuleException.class, () -> Rule.parseRule("bad", pattern("(=> (a ?x))"), 1));
    }

    @Test
    void ruleSetKeepsDeclarationOrder() {
        var rs = enrollment();
        assertEquals(7, rs.size());
        assertEquals("graduate-only-course-restriction", rs.rules().get(0).id());
        assertEquals("dropped-request-implies-notify-student", rs.rules().get(6).id());
        assertEquals(9, rs.rule("administrative-hold-prevents-enrollment").orElseThrow().pri());
        assertEquals(3, rs.arity("cannot-enroll-course").orElseThrow());
    }

    @Test
    void ruleSetRejectsDuplicateNames() {
        assertThrows(MalformedRuleException.class, () -> RuleSet.parse("""
                (defrule r 1 (=> (a ?x) (b ?x)))
                (defrule r 2 (=> (b ?x) (c ?x)))
                """));
    }

    @Test
    void ruleSetRejectsInconsistentArity() {
        assertThrows(MalformedRuleException.class, () -> RuleSet.parse("""
                (defrule r1 1 (=> (enrolled ?s ?c) (flag ?s ?c)))
                (defrule r2 1 (=> (enrolled ?s) (flag ?s ?s)))
                """));
    }

    @Test
    void initialFactsMustAgreeWithRuleArity() {
        var rs = rules("(defrule r1 1 (=> (enrolled ?s ?c) (flag ?s ?c)))");
        assertThrows(MalformedRuleException.class, () -> new Reasoner(rs, facts("(enrolled Alice)"), Strategy.ORDER));
        assertDoesNotThrow(() -> new Reasoner(rs, facts("(enrolled Alice CS501) (hobby Alice chess climbing)"), Strategy.ORDER));
    }

    @Test
    void priorityMustBeAnInteger() {
        assertThrows(MalformedRuleException.class, () -> RuleSet.parse("(defrule r high (=> (a ?x) (b ?x)))"));
    }

    @Test
    void unknownTopLevelFormIsRejected() {
        assertThrows(MalformedRuleException.class, () -> RuleSet.parse("(rule r 1 (=> (a ?x) (b ?x)))"));
    }

    @Test
    void factsMustBeGround() {
        assertThrows(IllegalArgumentException.class, () -> RuleSet.parseFacts("(enrolled ?s CS501)"));
        assertThrows(IllegalArgumentException.class, () -> RuleSet.parseFacts("(enrolled (Alice) CS501)"));
    }

    @Test
    void ruleSetCarriesDeclaredFacts() {
        var rs = rules("""
                (defrule grad-only-violation 5
                  (=> (and (enrolled ?s ?c) (graduate-only ?c)) (flag-violation ?s ?c)))
                (fact (enrolled Alice CS501))
                (fact (graduate-only CS501))
                """);
        assertEquals(List.of(fact("(enrolled Alice CS501)"), fact("(graduate-only CS501)")), rs.facts());
    }
}
