package dumb.natded;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.natded.ProofException.Kind.RULE_MISMATCH;
import static dumb.natded.ProofException.Kind.RULE_NOT_APPLICABLE;
import static dumb.natded.Prop.FALSE;
import static java.util.Objects.requireNonNull;

/**
 * Rules cited by name and number of citations, for everything outside the rewrite catalog. A context
 * owns its own table; {@link #register} extends it.
 */
public final class Citations {
    private final Map<Key, Rule> rules = new LinkedHashMap<>();

    public static Citations standard(Configuration config) {
        var c = new Citations()
                .register("reit", 1, (cited, p, k) -> prop(cited, 0).equals(p))
                .register("apply", 2, Citations::modusPonens)
                .register("compose", 2, (cited, p, k) -> Algebra.compose(prop(cited, 0), prop(cited, 1)).equals(p))
                .register("projl", 1, (cited, p, k) -> Algebra.projL(prop(cited, 0)).equals(p))
                .register("projr", 1, (cited, p, k) -> Algebra.projR(prop(cited, 0)).equals(p))
                .register("injl", 1, (cited, p, k) -> Algebra.injL(prop(cited, 0), disjunction(p).q()).equals(p))
                .register("injr", 1, (cited, p, k) -> Algebra.injR(prop(cited, 0), disjunction(p).p()).equals(p))
                .register("diag", 1, (cited, p, k) -> Algebra.diag(prop(cited, 0)).equals(p))
                .register("codiag", 1, (cited, p, k) -> Algebra.codiag(prop(cited, 0)).equals(p))
                .register("univprod", 2, (cited, p, k) -> Algebra.univProd(prop(cited, 0), prop(cited, 1)).equals(p))
                .register("univcoprod", 2, (cited, p, k) -> Algebra.univCoprod(prop(cited, 0), prop(cited, 1)).equals(p))
                .register("absurd", 2, Citations::absurd)
                .register("ii", 1, Citations::implicationIntro)
                .register("ni", 1, Citations::negationIntro)
                .register("raa", 1, Citations::reductio)
                .register("alle", 1, new UniversalElim())
                .register("exi", 1, Citations::existentialIntro)
                .register("alli", 1, Citations::universalIntro);
        if (config.axioms())
            c.register("lem", 0, (cited, p, k) -> Algebra.isAxiom(p));
        return c;
    }

    /** Adds or replaces the rule cited as {@code name} with {@code arity} citations. */
    public Citations register(String name, int arity, Rule rule) {
        rules.put(new Key(name, arity), requireNonNull(rule));
        return this;
    }

    public boolean has(String name, int arity) {
        return rules.containsKey(new Key(name, arity));
    }

    public Rule lookup(String name, int arity) {
        var rule = rules.get(new Key(name, arity));
        if (rule == null)
            throw new ProofException(RULE_NOT_APPLICABLE, "No rule `" + name + "` taking " + arity + " citation(s)");
        return rule;
    }

    static Prop prop(List<Cited> cited, int i) {
        var c = cited.get(i);
        if (c instanceof Step s) return s.line().prop();
        throw new ProofException(RULE_MISMATCH, "Expected a line as citation " + (i + 1) + ", got scope " + c);
    }

    static Proof.Type type(List<Cited> cited, int i) {
        var c = cited.get(i);
        if (c instanceof Scope s) return s.type();
        throw new ProofException(RULE_MISMATCH, "Expected a scope as citation " + (i + 1) + ", got line " + c);
    }

    private static Prop.Or disjunction(Prop p) {
        if (p instanceof Prop.Or o) return o;
        throw new ProofException(RULE_MISMATCH, p + " is not a disjunction");
    }

    private static Prop.Quantifier quantifier(Prop p, Class<? extends Prop.Quantifier> kind) {
        if (kind.isInstance(p) && ((Prop.Quantifier) p).var() instanceof Prop.Ref) return (Prop.Quantifier) p;
        throw new ProofException(RULE_MISMATCH, p + " is not " + (kind == Prop.ForAll.class ? "a universal" : "an existential") + " over a reference");
    }

    /** Implication and antecedent, cited in either order. */
    private static boolean modusPonens(List<Cited> cited, Prop p, Set<Prop.Ref> constants) {
        var a = prop(cited, 0);
        var b = prop(cited, 1);
        try {
            if (Algebra.apply(a, b).equals(p)) return true;
        } catch (ProofException e) {
            if (e.kind() != RULE_MISMATCH || !(b instanceof Prop.Imp)) throw e;
        }
        return b instanceof Prop.Imp && Algebra.apply(b, a).equals(p);
    }

    private static boolean absurd(List<Cited> cited, Prop p, Set<Prop.Ref> constants) {
        var a = prop(cited, 0);
        var b = prop(cited, 1);
        if (!a.isNegation() && !b.isNegation())
            throw new ProofException(RULE_MISMATCH, "Neither " + a + " nor " + b + " is a negation");
        var contradicts = (b.isNegation() && Algebra.inspectNot(b).equals(a))
                || (a.isNegation() && Algebra.inspectNot(a).equals(b));
        return contradicts && p.equals(FALSE);
    }

    private static boolean implicationIntro(List<Cited> cited, Prop p, Set<Prop.Ref> constants) {
        var type = type(cited, 0);
        if (!(p instanceof Prop.Imp i)) throw new ProofException(RULE_MISMATCH, p + " is not an implication");
        if (!type.assumptions().contains(i.p()))
            throw new ProofException(RULE_MISMATCH, "Scope does not assume " + i.p());
        return type.conclusions().contains(i.q());
    }

    private static boolean negationIntro(List<Cited> cited, Prop p, Set<Prop.Ref> constants) {
        var type = type(cited, 0);
        var assumed = Algebra.inspectNot(p);
        if (!type.assumptions().contains(assumed))
            throw new ProofException(RULE_MISMATCH, "Scope does not assume " + assumed);
        return type.conclusions().contains(FALSE);
    }

    private static boolean reductio(List<Cited> cited, Prop p, Set<Prop.Ref> constants) {
        var type = type(cited, 0);
        var assumed = Prop.not(p);
        if (!type.assumptions().contains(assumed))
            throw new ProofException(RULE_MISMATCH, "Scope does not assume " + assumed);
        return type.conclusions().contains(FALSE);
    }

    private static boolean existentialIntro(List<Cited> cited, Prop p, Set<Prop.Ref> constants) {
        var q = quantifier(p, Prop.Exists.class);
        var x = (Prop.Ref) q.var();
        var instance = prop(cited, 0);
        return Renaming.recover(x, q.body(), instance)
                .map(t -> Renaming.substitute(q.body(), x, t).equals(instance))
                .orElseGet(() -> q.body().equals(instance));
    }

    private static boolean universalIntro(List<Cited> cited, Prop p, Set<Prop.Ref> constants) {
        var q = quantifier(p, Prop.ForAll.class);
        var x = (Prop.Ref) q.var();
        var instance = prop(cited, 0);
        var a = Renaming.recover(x, q.body(), instance);
        if (a.isEmpty()) return q.body().equals(instance);
        if (constants.contains(a.get()))
            throw new ProofException(RULE_MISMATCH, "Cannot generalize over constant " + a.get());
        if (p.free().contains(a.get()))
            throw new ProofException(RULE_MISMATCH, a.get() + " is still free in " + p);
        return Renaming.substitute(q.body(), x, a.get()).equals(instance);
    }

    @FunctionalInterface
    public interface Rule {
        boolean check(List<Cited> cited, Prop candidate, Set<Prop.Ref> constants);

        /** References this step introduces as arbitrary names. */
        default Set<Prop.Ref> introduces(List<Cited> cited, Prop candidate, Set<Prop.Ref> constants) {
            return Set.of();
        }
    }

    public sealed interface Cited permits Step, Scope {
    }

    public record Step(Line line) implements Cited {
        public Step {
            requireNonNull(line);
        }

        @Override
        public String toString() {
            return String.valueOf(line.number());
        }
    }

    public record Scope(Proof proof, Proof.Type type) implements Cited {
        public Scope {
            requireNonNull(proof);
            requireNonNull(type);
        }

        @Override
        public String toString() {
            return proof.first() + "-" + proof.last();
        }
    }

    record Key(String name, int arity) {
        Key {
            requireNonNull(name);
        }
    }

    /** From {@code forall x, phi} to {@code phi[t/x]}; a {@code t} not yet constant becomes arbitrary. */
    private static final class UniversalElim implements Rule {
        @Override
        public boolean check(List<Cited> cited, Prop candidate, Set<Prop.Ref> constants) {
            var q = quantifier(prop(cited, 0), Prop.ForAll.class);
            var x = (Prop.Ref) q.var();
            return Renaming.recover(x, q.body(), candidate)
                    .map(t -> Renaming.substitute(q.body(), x, t).equals(candidate))
                    .orElseGet(() -> q.body().equals(candidate));
        }

        @Override
        public Set<Prop.Ref> introduces(List<Cited> cited, Prop candidate, Set<Prop.Ref> constants) {
            var q = quantifier(prop(cited, 0), Prop.ForAll.class);
            return Renaming.recover((Prop.Ref) q.var(), q.body(), candidate)
                    .filter(t -> !constants.contains(t))
                    .map(Set::of)
                    .orElse(Set.of());
        }
    }
}
