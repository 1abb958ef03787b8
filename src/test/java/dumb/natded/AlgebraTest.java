package dumb.natded;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static dumb.natded.Prop.*;
import static org.junit.jupiter.api.Assertions.*;

class AlgebraTest extends AbstractTest {

    private static void assertMismatch(Executable op, String messagePart) {
        var e = assertThrows(ProofException.class, op);
        assertEquals(ProofException.Kind.RULE_MISMATCH, e.kind());
        assertTrue(e.getMessage().contains(messagePart), e.getMessage());
    }

    @Test
    void apply() {
        assertEquals(B, Algebra.apply(imp(A, B), A));
        assertMismatch(() -> Algebra.apply(and(A, B), A), "NotAnImplication");
        assertMismatch(() -> Algebra.apply(imp(A, B), C), "AntecedentMismatch");
    }

    @Test
    void compose() {
        assertEquals(imp(A, C), Algebra.compose(imp(A, B), imp(B, C)));
        assertMismatch(() -> Algebra.compose(imp(A, B), imp(C, D)), "Cannot compose");
        assertMismatch(() -> Algebra.compose(A, imp(B, C)), "NotAnImplication");
    }

    @Test
    void projections() {
        assertEquals(A, Algebra.projL(and(A, B)));
        assertEquals(B, Algebra.projR(and(A, B)));
        assertMismatch(() -> Algebra.projL(or(A, B)), "not a conjunction");
    }

    @Test
    void injections() {
        assertEquals(or(A, B), Algebra.injL(A, B));
        assertEquals(or(B, A), Algebra.injR(A, B));
    }

    @Test
    void diagonals() {
        assertEquals(and(A, A), Algebra.diag(A));
        assertEquals(A, Algebra.codiag(or(A, A)));
        assertMismatch(() -> Algebra.codiag(or(A, B)), "No codiagonal");
        assertMismatch(() -> Algebra.codiag(and(A, A)), "not a disjunction");
    }

    @Test
    void universalProperties() {
        assertEquals(imp(A, and(B, C)), Algebra.univProd(imp(A, B), imp(A, C)));
        assertMismatch(() -> Algebra.univProd(imp(A, B), imp(C, B)), "Domains");
        assertEquals(imp(or(A, B), C), Algebra.univCoprod(imp(A, C), imp(B, C)));
        assertMismatch(() -> Algebra.univCoprod(imp(A, B), imp(A, C)), "Codomains");
    }

    @Test
    void inspectNot() {
        assertEquals(A, Algebra.inspectNot(not(A)));
        assertEquals(not(A), Algebra.inspectNot(not(not(A))));
        assertMismatch(() -> Algebra.inspectNot(imp(A, B)), "not a negation");
    }

    @Test
    void excludedMiddleInEitherOrder() {
        assertTrue(Algebra.isAxiom(or(A, not(A))));
        assertTrue(Algebra.isAxiom(or(not(A), A)));
        assertTrue(Algebra.isAxiom(or(and(A, B), not(and(A, B)))));
        assertFalse(Algebra.isAxiom(or(A, not(B))));
        assertFalse(Algebra.isAxiom(or(A, A)));
        assertFalse(Algebra.isAxiom(A));
    }
}
