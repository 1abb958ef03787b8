package dumb.natded;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static dumb.natded.ProofException.Kind.RULE_MISMATCH;
import static dumb.natded.ProofException.Kind.RULE_NOT_APPLICABLE;
import static java.util.Objects.requireNonNull;

/**
 * Why a line holds. Interpreting resolves citations against the lines and scopes already checked in a
 * {@link Context}.
 */
public sealed interface Justification permits Justification.Premise, Justification.Hypothesis, Justification.Rewriting, Justification.Citation {

    Premise PREMISE = new Premise();
    Hypothesis HYPOTHESIS = new Hypothesis();

    /** A catalog rewrite when {@code name} names one and the only citation is a line; a table rule otherwise. */
    static Justification cite(String name, Cite... cites) {
        if (!Rewrite.named(name).isEmpty() && cites.length == 1 && cites[0] instanceof At at)
            return new Rewriting(name, List.of(at.line()));
        return new Citation(name, List.of(cites));
    }

    static At at(int line) {
        return new At(line);
    }

    static Span span(int from, int to) {
        return new Span(from, to);
    }

    String name();

    List<Cite> cites();

    Interpretation interpret(Line line, Context ctx);

    sealed interface Cite permits At, Span {
    }

    record At(int line) implements Cite {
        @Override
        public String toString() {
            return String.valueOf(line);
        }
    }

    /** A nested scope, named by its first and last line numbers. */
    record Span(int from, int to) implements Cite {
        public Span {
            if (from > to) throw new IllegalArgumentException("Empty scope range " + from + "-" + to);
        }

        @Override
        public String toString() {
            return from + "-" + to;
        }
    }

    record Interpretation(Argument argument, Set<Prop.Ref> introduced) {
        public Interpretation {
            requireNonNull(argument);
            introduced = Set.copyOf(introduced);
        }
    }

    record Premise() implements Justification {
        @Override
        public String name() {
            return "prem";
        }

        @Override
        public List<Cite> cites() {
            return List.of();
        }

        @Override
        public Interpretation interpret(Line line, Context ctx) {
            return new Interpretation(new Argument.Assumed(line.prop()), Set.of());
        }

        @Override
        public String toString() {
            return name();
        }
    }

    record Hypothesis() implements Justification {
        @Override
        public String name() {
            return "hyp";
        }

        @Override
        public List<Cite> cites() {
            return List.of();
        }

        @Override
        public Interpretation interpret(Line line, Context ctx) {
            return new Interpretation(new Argument.Assumed(line.prop()), Set.of());
        }

        @Override
        public String toString() {
            return name();
        }
    }

    record Rewriting(String name, List<Integer> lines) implements Justification {
        public Rewriting {
            requireNonNull(name);
            lines = List.copyOf(lines);
        }

        @Override
        public List<Cite> cites() {
            return lines.stream().<Cite>map(At::new).toList();
        }

        @Override
        public Interpretation interpret(Line line, Context ctx) {
            var rules = Rewrite.named(name);
            if (rules.isEmpty() || !ctx.configuration().rewriteRules().contains(name))
                throw new ProofException(RULE_NOT_APPLICABLE, "No rewrite rule `" + name + "` is enabled");
            if (lines.size() != 1)
                throw new ProofException(RULE_MISMATCH, "`" + name + "` cites exactly one line, got " + lines.size());
            return new Interpretation(new Argument.Rewritten(name, rules, ctx.resolve(lines.get(0))), Set.of());
        }

        @Override
        public String toString() {
            return name + " " + lines.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
    }

    record Citation(String name, List<Cite> cites) implements Justification {
        public Citation {
            requireNonNull(name);
            cites = List.copyOf(cites);
        }

        @Override
        public Interpretation interpret(Line line, Context ctx) {
            var rule = ctx.citations().lookup(name, cites.size());
            var cited = cites.stream().map(ctx::resolve).toList();
            return new Interpretation(new Argument.Applied(this, rule, cited), rule.introduces(cited, line.prop(), ctx.constants()));
        }

        @Override
        public String toString() {
            return cites.isEmpty() ? name : name + " " + cites.stream().map(Cite::toString).collect(Collectors.joining(", "));
        }
    }
}
