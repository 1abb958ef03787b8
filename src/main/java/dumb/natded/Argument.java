package dumb.natded;

import java.util.List;
import java.util.Set;

import static dumb.natded.ProofException.Kind.RULE_NOT_APPLICABLE;
import static java.util.Objects.requireNonNull;

/**
 * A resolved justification. Decides whether it licenses a candidate proposition; contract violations
 * surface as {@link ProofException}s rather than a plain {@code false}.
 */
public interface Argument {

    boolean typecheck(Prop candidate);

    default boolean verify(Line line, Set<Prop.Ref> constants) {
        return typecheck(line.prop());
    }

    /** Premises and hypotheses license exactly what they state. */
    record Assumed(Prop prop) implements Argument {
        public Assumed {
            requireNonNull(prop);
        }

        @Override
        public boolean typecheck(Prop candidate) {
            return prop.equals(candidate);
        }
    }

    record Rewritten(String name, List<Rewrite> rules, Line cited) implements Argument {
        public Rewritten {
            requireNonNull(name);
            rules = List.copyOf(rules);
            requireNonNull(cited);
        }

        @Override
        public boolean typecheck(Prop candidate) {
            ProofException last = null;
            for (var rule : rules) {
                try {
                    Unifier.tryRewrite(cited.prop(), candidate, rule);
                    return true;
                } catch (ProofException e) {
                    if (e.kind() != RULE_NOT_APPLICABLE) throw e;
                    last = e;
                }
            }
            if (rules.size() == 1) throw last;
            throw new ProofException(RULE_NOT_APPLICABLE, "No `" + name + "` rule rewrites " + cited.prop() + " => " + candidate);
        }

        @Override
        public String toString() {
            return name + " " + cited.number();
        }
    }

    /** A table rule from {@link Citations}, bound to its resolved citations. */
    record Applied(Justification.Citation citation, Citations.Rule rule, List<Citations.Cited> cited) implements Argument {
        public Applied {
            requireNonNull(citation);
            requireNonNull(rule);
            cited = List.copyOf(cited);
        }

        @Override
        public boolean typecheck(Prop candidate) {
            return rule.check(cited, candidate, Set.of());
        }

        @Override
        public boolean verify(Line line, Set<Prop.Ref> constants) {
            return rule.check(cited, line.prop(), constants);
        }

        @Override
        public String toString() {
            return citation.toString();
        }
    }
}
