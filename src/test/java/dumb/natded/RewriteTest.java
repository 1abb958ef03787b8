package dumb.natded;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static dumb.natded.Prop.*;
import static org.junit.jupiter.api.Assertions.*;

class RewriteTest extends AbstractTest {

    private static Prop instantiate(Prop pattern, Prop pa, Prop pb, Prop pc) {
        var s = new Subst();
        s.bind(hole("a"), pa);
        s.bind(hole("b"), pb);
        s.bind(hole("c"), pc);
        s.bind(refHole("x"), x);
        return s.apply(pattern);
    }

    @ParameterizedTest
    @EnumSource(Rewrite.class)
    void ruleJustifiesItsAtomicInstances(Rewrite rule) {
        var l = instantiate(rule.left, A, B, C);
        var r = instantiate(rule.right, A, B, C);
        assertDoesNotThrow(() -> Unifier.tryRewrite(l, r, rule));
        assertDoesNotThrow(() -> Unifier.tryRewrite(r, l, rule));
    }

    @ParameterizedTest
    @EnumSource(Rewrite.class)
    void ruleJustifiesItsCompoundInstances(Rewrite rule) {
        var l = instantiate(rule.left, and(A, B), not(C), P(c));
        var r = instantiate(rule.right, and(A, B), not(C), P(c));
        assertDoesNotThrow(() -> Unifier.tryRewrite(l, r, rule));
    }

    @ParameterizedTest
    @EnumSource(Rewrite.class)
    void ruleAppliesBeneathUnchangedContext(Rewrite rule) {
        var l = instantiate(rule.left, A, B, C);
        var r = instantiate(rule.right, A, B, C);
        assertDoesNotThrow(() -> Unifier.tryRewrite(imp(D, and(l, H)), imp(D, and(r, H)), rule));
    }

    @Test
    void sharedCitationNames() {
        assertEquals(List.of(Rewrite.OR_COMM, Rewrite.AND_COMM), Rewrite.named("comm"));
        assertEquals(4, Rewrite.named("dm").size());
        assertTrue(Rewrite.named("apply").isEmpty());
        assertEquals(Set.of("comm", "assoc", "dn", "impl", "dm", "dist", "idem", "exp", "contra"), Rewrite.citations());
    }

    @Test
    void quantifierDeMorganBindsBothNamespaces() {
        var s = Unifier.tryRewrite(not(forall(x, P(x))), exists(x, not(P(x))), Rewrite.DEMORGAN_FORALL);
        assertEquals(P(x), s.formulas().get("a"));
        assertEquals(x, s.refs().get("x"));
    }

    @Test
    void quantifierDeMorganRejectsRenamedVariable() {
        assertThrows(ProofException.class, () -> Unifier.tryRewrite(not(forall(x, P(x))), exists(y, not(P(x))), Rewrite.DEMORGAN_FORALL));
    }

    @Test
    void wrongRuleIsNotApplicable() {
        var e = assertThrows(ProofException.class, () -> Unifier.tryRewrite(or(A, B), or(B, A), Rewrite.AND_COMM));
        assertEquals(ProofException.Kind.RULE_NOT_APPLICABLE, e.kind());
    }
}
