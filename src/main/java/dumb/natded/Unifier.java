package dumb.natded;

import static dumb.natded.ProofException.Kind.INCONSISTENT_CONTEXT;
import static dumb.natded.ProofException.Kind.RULE_NOT_APPLICABLE;
import static dumb.natded.ProofException.Kind.UNSUPPORTED;

/**
 * Deterministic structural unification without backtracking, and rule application localized by
 * {@link #diffTree}.
 */
public enum Unifier {
    ;

    /** Unifies with fresh substitutions. */
    public static boolean unify(Prop p, Prop q) {
        return unify(p, q, new Subst());
    }

    /**
     * Unifies {@code p} with {@code q}, extending {@code s}. A failed call may leave partial bindings
     * in {@code s}, so callers start every top-level attempt from a fresh {@link Subst}.
     */
    public static boolean unify(Prop p, Prop q, Subst s) {
        if (p.isHole() && q.isHole())
            throw new ProofException(UNSUPPORTED, "Cannot unify metavariable " + p + " with metavariable " + q);

        if (p instanceof Prop.Hole h) return !(q instanceof Prop.Term) && s.bind(h, q);
        if (q instanceof Prop.Hole h) return !(p instanceof Prop.Term) && s.bind(h, p);
        if (p instanceof Prop.RefHole h) return q instanceof Prop.Ref r && s.bind(h, r);
        if (q instanceof Prop.RefHole h) return p instanceof Prop.Ref r && s.bind(h, r);

        if (p instanceof Prop.Binary a && q instanceof Prop.Binary b && a.getClass() == b.getClass())
            return unify(a.p(), b.p(), s) && unify(a.q(), b.q(), s);
        if (p instanceof Prop.Quantifier a && q instanceof Prop.Quantifier b && a.getClass() == b.getClass())
            return unify(a.var(), b.var(), s) && unify(a.body(), b.body(), s);
        if (p instanceof Prop.Lit a && q instanceof Prop.Lit b)
            return a.value() == b.value();
        if (p instanceof Prop.Atom a && q instanceof Prop.Atom b)
            return a.name().equals(b.name());
        if (p instanceof Prop.Ref a && q instanceof Prop.Ref b)
            return a.name().equals(b.name());
        if (p instanceof Prop.Pred a && q instanceof Prop.Pred b) {
            if (!a.name().equals(b.name()) || a.arity() != b.arity()) return false;
            for (var i = 0; i < a.arity(); i++)
                if (!unify(a.args().get(i), b.args().get(i), s)) return false;
            return true;
        }
        return false;
    }

    /**
     * Narrows {@code (p, q)} to the smallest corresponding subtrees where they diverge. Only called on
     * unequal trees.
     */
    public static Diff diffTree(Prop p, Prop q) {
        var a = p;
        var b = q;
        while (true) {
            Prop l1, r1, l2, r2;
            if (a instanceof Prop.Binary x && b instanceof Prop.Binary y && x.getClass() == y.getClass()) {
                l1 = x.p();
                r1 = x.q();
                l2 = y.p();
                r2 = y.q();
            } else if (a instanceof Prop.Quantifier x && b instanceof Prop.Quantifier y && x.getClass() == y.getClass()) {
                l1 = x.var();
                r1 = x.body();
                l2 = y.var();
                r2 = y.body();
            } else {
                return new Diff(a, b);
            }

            var leftSame = l1.equals(l2);
            var rightSame = r1.equals(r2);
            if (leftSame && rightSame)
                throw new ProofException(INCONSISTENT_CONTEXT, a + " == " + b + " reached the tree diff");
            if (!leftSame && !rightSame) return new Diff(a, b);
            if (leftSame) {
                a = r1;
                b = r2;
            } else {
                a = l1;
                b = l2;
            }
        }
    }

    /**
     * Licenses rewriting {@code old} into {@code neu} by {@code rule}, in either direction, at the
     * subtree where they differ.
     *
     * @return the substitution that matched; empty when {@code old} equals {@code neu}
     * @throws ProofException RULE_NOT_APPLICABLE when neither direction unifies
     */
    public static Subst tryRewrite(Prop old, Prop neu, Rewrite rule) {
        if (old.equals(neu)) return new Subst();
        var diff = diffTree(old, neu);

        var s = new Subst();
        if (unify(diff.old(), rule.left, s) && unify(diff.neu(), rule.right, s)) return s;

        s = new Subst();
        if (unify(diff.old(), rule.right, s) && unify(diff.neu(), rule.left, s)) return s;

        throw new ProofException(RULE_NOT_APPLICABLE, "Failed to apply rule " + rule + " to " + old + " => " + neu);
    }

    public record Diff(Prop old, Prop neu) {
    }
}
