package dumb.natded;

import static java.util.Objects.requireNonNull;

/**
 * A violated proof contract. Raised by the algebra, the unifier, the rewrite engine and renaming;
 * {@link Line#check} turns it into a line-scoped {@link Line.Failure}.
 */
public class ProofException extends RuntimeException {
    private final Kind kind;

    public ProofException(Kind kind, String message) {
        super(message);
        this.kind = requireNonNull(kind);
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind.label + ": " + super.getMessage();
    }

    public enum Kind {
        RULE_MISMATCH("RuleMismatch"),
        RULE_NOT_APPLICABLE("RuleNotApplicable"),
        UNRESOLVED_REFERENCE("UnresolvedReference"),
        AMBIGUOUS_SUBSTITUTION("AmbiguousSubstitution"),
        CAPTURE_VIOLATION("CaptureViolation"),
        INCONSISTENT_CONTEXT("InconsistentContext"),
        UNSUPPORTED("Unsupported");

        public final String label;

        Kind(String label) {
            this.label = label;
        }
    }
}
