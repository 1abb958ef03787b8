package dumb.natded;

import static dumb.natded.ProofException.Kind.RULE_MISMATCH;
import static dumb.natded.Prop.and;
import static dumb.natded.Prop.imp;
import static dumb.natded.Prop.not;
import static dumb.natded.Prop.or;

/**
 * Total and partial operations on propositions. Partial ones throw RULE_MISMATCH naming the violated
 * precondition.
 */
public enum Algebra {
    ;

    private static final Prop.Hole EXCLUDED = Prop.hole("a");

    public static Prop apply(Prop f, Prop x) {
        var i = implication(f);
        if (!i.p().equals(x)) throw mismatch("AntecedentMismatch: implication expects " + i.p() + ", got " + x);
        return i.q();
    }

    public static Prop compose(Prop f, Prop g) {
        var i = implication(f);
        var j = implication(g);
        if (!i.q().equals(j.p())) throw mismatch("Cannot compose " + f + " and " + g + ", since " + i.q() + " != " + j.p());
        return imp(i.p(), j.q());
    }

    public static Prop projL(Prop p) {
        return conjunction(p).p();
    }

    public static Prop projR(Prop p) {
        return conjunction(p).q();
    }

    public static Prop injL(Prop p, Prop q) {
        return or(p, q);
    }

    public static Prop injR(Prop p, Prop q) {
        return or(q, p);
    }

    public static Prop diag(Prop p) {
        return and(p, p);
    }

    public static Prop codiag(Prop p) {
        if (!(p instanceof Prop.Or o)) throw mismatch(p + " is not a disjunction");
        if (!o.p().equals(o.q())) throw mismatch("No codiagonal out of " + p);
        return o.p();
    }

    public static Prop univProd(Prop f, Prop g) {
        var i = implication(f);
        var j = implication(g);
        if (!i.p().equals(j.p())) throw mismatch("Domains of " + f + " and " + g + " do not match");
        return imp(i.p(), and(i.q(), j.q()));
    }

    public static Prop univCoprod(Prop f, Prop g) {
        var i = implication(f);
        var j = implication(g);
        if (!i.q().equals(j.q())) throw mismatch("Codomains of " + f + " and " + g + " do not match");
        return imp(or(i.p(), j.p()), i.q());
    }

    public static Prop inspectNot(Prop p) {
        if (!p.isNegation()) throw mismatch(p + " is not a negation");
        return ((Prop.Imp) p).p();
    }

    /** Excluded middle in either order, decided by one unification against a single formula hole. */
    public static boolean isAxiom(Prop p) {
        return Unifier.unify(p, or(EXCLUDED, not(EXCLUDED))) || Unifier.unify(p, or(not(EXCLUDED), EXCLUDED));
    }

    private static Prop.Imp implication(Prop p) {
        if (!(p instanceof Prop.Imp i)) throw mismatch("NotAnImplication: " + p + " is not an implication");
        return i;
    }

    private static Prop.And conjunction(Prop p) {
        if (!(p instanceof Prop.And a)) throw mismatch(p + " is not a conjunction");
        return a;
    }

    private static ProofException mismatch(String message) {
        return new ProofException(RULE_MISMATCH, message);
    }
}
