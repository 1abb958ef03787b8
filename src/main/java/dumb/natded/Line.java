package dumb.natded;

import static dumb.natded.ProofException.Kind.RULE_MISMATCH;
import static java.util.Objects.requireNonNull;

/** One numbered proof step: a proposition and the justification that licenses it. */
public record Line(int number, Prop prop, Justification justification) {
    public Line {
        requireNonNull(prop);
        requireNonNull(justification);
    }

    /**
     * Interprets the justification against {@code ctx} and verifies the argument it resolves to.
     *
     * @throws Failure carrying the first violated contract
     */
    Justification.Interpretation check(Context ctx) throws Failure {
        try {
            var in = justification.interpret(this, ctx);
            if (!in.argument().verify(this, ctx.constants()))
                throw new ProofException(RULE_MISMATCH, "Cannot use `" + in.argument() + "` to produce " + prop);
            return in;
        } catch (ProofException e) {
            throw new Failure(this, e);
        }
    }

    @Override
    public String toString() {
        return number + ". " + prop + "  " + justification;
    }

    public static class Failure extends Exception {
        private final Line line;
        private final ProofException.Kind kind;

        Failure(Line line, ProofException cause) {
            super(cause.getMessage(), cause);
            this.line = line;
            this.kind = cause.kind();
        }

        public Line line() {
            return line;
        }

        public ProofException.Kind kind() {
            return kind;
        }

        @Override
        public String getMessage() {
            return "Line " + line + ": " + super.getMessage();
        }
    }
}
