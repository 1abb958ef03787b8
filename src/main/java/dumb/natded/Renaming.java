package dumb.natded;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static dumb.natded.ProofException.Kind.AMBIGUOUS_SUBSTITUTION;
import static dumb.natded.ProofException.Kind.CAPTURE_VIOLATION;
import static dumb.natded.ProofException.Kind.RULE_MISMATCH;

/**
 * Capture-aware substitution of one domain reference for another, and recovery of the substitution
 * relating a quantifier body to one of its instances.
 */
public final class Renaming {
    private final Prop.Ref var;
    private Prop.Ref target;

    private Renaming(Prop.Ref var) {
        this.var = var;
    }

    /**
     * Finds the {@code t} with {@code body[t/var] == instance}.
     *
     * @return empty when {@code var} does not occur free in {@code body} (the two must then be equal)
     * @throws ProofException AMBIGUOUS_SUBSTITUTION if {@code var} maps to two different references,
     *                        CAPTURE_VIOLATION if the recovered reference lands under a binder of the same
     *                        name, RULE_MISMATCH if the shapes differ elsewhere
     */
    public static Optional<Prop.Ref> recover(Prop.Ref var, Prop body, Prop instance) {
        var r = new Renaming(var);
        r.walk(body, instance, new HashSet<>());
        return Optional.ofNullable(r.target);
    }

    /** {@code p[t/x]}, refusing to move {@code t} under a quantifier that binds it. */
    public static Prop substitute(Prop p, Prop.Ref x, Prop.Ref t) {
        return substitute(p, x, t, Set.of());
    }

    private static Prop substitute(Prop p, Prop.Ref x, Prop.Ref t, Set<Prop.Ref> bound) {
        if (p instanceof Prop.Ref r) {
            if (!r.equals(x)) return r;
            if (bound.contains(t)) throw new ProofException(CAPTURE_VIOLATION, t + " would be captured substituting for " + x);
            return t;
        }
        if (p instanceof Prop.And a) return Prop.and(substitute(a.p(), x, t, bound), substitute(a.q(), x, t, bound));
        if (p instanceof Prop.Or o) return Prop.or(substitute(o.p(), x, t, bound), substitute(o.q(), x, t, bound));
        if (p instanceof Prop.Imp i) return Prop.imp(substitute(i.p(), x, t, bound), substitute(i.q(), x, t, bound));
        if (p instanceof Prop.Quantifier q) {
            if (q.var().equals(x)) return q;
            var inner = bound;
            if (q.var() instanceof Prop.Ref v) {
                inner = new HashSet<>(bound);
                inner.add(v);
            }
            var body = substitute(q.body(), x, t, inner);
            return q instanceof Prop.ForAll ? Prop.forall(q.var(), body) : Prop.exists(q.var(), body);
        }
        if (p instanceof Prop.Pred pr)
            return new Prop.Pred(pr.name(), pr.args().stream().map(a -> (Prop.Term) substitute(a, x, t, bound)).toList());
        return p;
    }

    private void walk(Prop g, Prop i, Set<Prop.Ref> bound) {
        if (g.equals(var)) {
            if (!(i instanceof Prop.Ref t))
                throw new ProofException(RULE_MISMATCH, "Expected a reference in place of " + var + ", got " + i);
            if (bound.contains(t))
                throw new ProofException(CAPTURE_VIOLATION, t + " is bound where it replaces " + var);
            if (target != null && !target.equals(t))
                throw new ProofException(AMBIGUOUS_SUBSTITUTION, var + " is replaced by both " + target + " and " + t);
            target = t;
        } else if (g instanceof Prop.Binary a && i instanceof Prop.Binary b && a.getClass() == b.getClass()) {
            walk(a.p(), b.p(), bound);
            walk(a.q(), b.q(), bound);
        } else if (g instanceof Prop.Quantifier a && i instanceof Prop.Quantifier b && a.getClass() == b.getClass()
                && a.var().equals(b.var())) {
            if (a.var().equals(var)) {
                same(a.body(), b.body());
            } else if (a.var() instanceof Prop.Ref v && !bound.contains(v)) {
                bound.add(v);
                walk(a.body(), b.body(), bound);
                bound.remove(v);
            } else {
                walk(a.body(), b.body(), bound);
            }
        } else if (g instanceof Prop.Pred a && i instanceof Prop.Pred b && a.name().equals(b.name()) && a.arity() == b.arity()) {
            for (var k = 0; k < a.arity(); k++)
                walk(a.args().get(k), b.args().get(k), bound);
        } else {
            same(g, i);
        }
    }

    private static void same(Prop g, Prop i) {
        if (!g.equals(i)) throw new ProofException(RULE_MISMATCH, g + " and " + i + " differ outside the substituted reference");
    }
}
