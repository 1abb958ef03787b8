package dumb.natded;

import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static dumb.natded.Prop.atom;
import static dumb.natded.Prop.pred;
import static dumb.natded.Prop.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    static final Prop.Atom A = atom("A"), B = atom("B"), C = atom("C"), D = atom("D"), H = atom("H");
    static final Prop.Ref a = ref("a"), b = ref("b"), c = ref("c"), x = ref("x"), y = ref("y");

    protected Context ctx;
    protected List<CheckEvent> events;

    static Prop.Pred P(Prop.Term... args) {
        return pred("P", args);
    }

    static Prop.Pred Q(Prop.Term... args) {
        return pred("Q", args);
    }

    static Prop.Pred R(Prop.Term... args) {
        return pred("R", args);
    }

    static Justification prem() {
        return Justification.PREMISE;
    }

    static Justification hyp() {
        return Justification.HYPOTHESIS;
    }

    static Justification by(String name, int... lines) {
        return Justification.cite(name, Arrays.stream(lines).mapToObj(Justification::at).toArray(Justification.Cite[]::new));
    }

    static Justification box(String name, int from, int to) {
        return Justification.cite(name, Justification.span(from, to));
    }

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        var bus = new Events();
        bus.on(CheckEvent.class, events::add);
        ctx = newContext(Configuration.DEFAULT, bus);
    }

    protected Context newContext(Configuration config, Events bus) {
        return new Context(config, bus);
    }

    protected ProofBuilder proof() {
        return new ProofBuilder();
    }

    protected boolean check(ProofBuilder proof) {
        proof.build(ctx);
        return ctx.check();
    }

    protected void assertVerified(ProofBuilder proof) {
        if (!check(proof))
            fail("Expected the proof to verify:\n" + ctx.failure().map(Throwable::getMessage).orElse("(no failing line)"));
        assertEquals(Context.State.VERIFIED, ctx.state());
    }

    protected Line.Failure assertFails(ProofBuilder proof, ProofException.Kind kind, int lineNumber) {
        assertFalse(check(proof), "Expected the proof to fail");
        assertEquals(Context.State.FAILED, ctx.state());
        var failure = ctx.failure().orElseThrow(() -> new AssertionError("Failed without a failing line"));
        assertEquals(lineNumber, failure.line().number(), failure.getMessage());
        assertEquals(kind, failure.kind(), failure.getMessage());
        return failure;
    }

    protected <T extends CheckEvent> List<T> events(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
