package dumb.natded;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofBuilderTest extends AbstractTest {

    @Test
    void nestedScopesAreRegisteredInnermostFirst() {
        var main = proof()
                .line(1, A, prem())
                .open()
                .line(2, B, hyp())
                .open()
                .line(3, C, hyp())
                .close()
                .close()
                .line(4, D, prem())
                .build(ctx);

        assertEquals(List.of(List.of(3), List.of(2), List.of(1, 4)), List.copyOf(ctx.proofs().keySet()));
        assertSame(main, ctx.mainProof());
    }

    @Test
    void closeWithoutOpenIsRejected() {
        assertThrows(IllegalStateException.class, () -> proof().line(1, A, prem()).close());
    }

    @Test
    void unclosedScopeIsRejected() {
        var p = proof().line(1, A, prem()).open().line(2, B, hyp());
        assertThrows(IllegalStateException.class, () -> p.build(ctx));
    }

    @Test
    void outermostScopeNeedsItsOwnLine() {
        var p = proof().open().line(1, A, hyp()).close();
        var e = assertThrows(IllegalStateException.class, () -> p.build(ctx));
        assertTrue(e.getMessage().contains("outermost scope"), e.getMessage());
        assertTrue(ctx.proofs().isEmpty());
    }

    @Test
    void emptyScopeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> proof().line(1, A, prem()).open().close());
    }

    @Test
    void duplicateLineAcrossScopesIsRejected() {
        var p = proof().line(1, A, prem()).open().line(1, B, hyp()).close();
        assertThrows(IllegalArgumentException.class, () -> p.build(ctx));
    }
}
