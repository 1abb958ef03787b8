package dumb.natded;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static dumb.natded.Prop.*;
import static org.junit.jupiter.api.Assertions.*;

class PropTest extends AbstractTest {

    @Test
    void negationDisplaysAsTilde() {
        assertEquals("~A", not(A).toString());
        assertEquals("~~A", not(not(A)).toString());
        assertEquals("(A -> B)", imp(A, B).toString());
        assertEquals("(~A \\/ (B /\\ C))", or(not(A), and(B, C)).toString());
    }

    @Test
    void quantifiersAndPredicatesDisplay() {
        assertEquals("(forall x, (exists y, R(x, y)))", forall(x, exists(y, R(x, y))).toString());
        assertEquals("?a", hole("a").toString());
        assertEquals("?x", refHole("x").toString());
    }

    @Test
    void equalityIsStructural() {
        assertEquals(and(atom("A"), not(atom("B"))), and(A, not(B)));
        assertEquals(P(ref("a")), P(a));
        assertNotEquals(and(A, B), or(A, B));
        assertNotEquals(Prop.ref("A"), Prop.atom("A"));
        assertEquals(Set.of(and(A, B)), Set.of(new And(A, B)));
    }

    @Test
    void symbolsOfUniversal() {
        var s = forall(x, P(x)).symbols();
        assertEquals(Set.of(x), s.symbols());
        assertEquals(Set.of(x), s.vars());
        assertTrue(s.ground().isEmpty());
    }

    @Test
    void symbolsSeparateGroundFromBound() {
        var s = and(forall(x, R(x, c)), P(a)).symbols();
        assertEquals(Set.of(x, c, a), s.symbols());
        assertEquals(Set.of(x), s.vars());
        assertEquals(Set.of(c, a), s.ground());
    }

    @Test
    void freeRespectsScope() {
        var p = and(forall(x, P(x)), Q(x));
        assertEquals(Set.of(x), p.free());
        assertTrue(p.symbols().ground().isEmpty(), "ground symbols are name-level");
        assertEquals(Set.of(), exists(y, R(y, y)).free());
    }

    @Test
    void holesAreRecognized() {
        assertTrue(hole("a").isHole());
        assertTrue(refHole("x").isHole());
        assertFalse(A.isHole());
        assertTrue(not(A).isNegation());
        assertFalse(imp(A, TRUE).isNegation());
    }

    @Test
    void toJsonCarriesText() {
        var json = imp(A, FALSE).toJson();
        assertEquals("imp", json.get("type").asText());
        assertEquals("~A", json.get("text").asText());
    }

    @Test
    void emptyNamesRejected() {
        assertThrows(IllegalArgumentException.class, () -> atom(""));
        assertThrows(IllegalArgumentException.class, () -> ref(""));
    }
}
