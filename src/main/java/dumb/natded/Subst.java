package dumb.natded;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The two substitution namespaces filled by one unification: formula holes to propositions and
 * reference holes to domain references. Owned by a single top-level call; never shared.
 */
public final class Subst {
    private final Map<String, Prop> formulas = new LinkedHashMap<>();
    private final Map<String, Prop.Ref> refs = new LinkedHashMap<>();

    /** Binds an unbound hole, or succeeds iff the existing binding equals {@code value}. */
    boolean bind(Prop.Hole hole, Prop value) {
        var existing = formulas.putIfAbsent(hole.name(), requireNonNull(value));
        return existing == null || existing.equals(value);
    }

    boolean bind(Prop.RefHole hole, Prop.Ref value) {
        var existing = refs.putIfAbsent(hole.name(), requireNonNull(value));
        return existing == null || existing.equals(value);
    }

    public Map<String, Prop> formulas() {
        return Collections.unmodifiableMap(formulas);
    }

    public Map<String, Prop.Ref> refs() {
        return Collections.unmodifiableMap(refs);
    }

    public boolean isEmpty() {
        return formulas.isEmpty() && refs.isEmpty();
    }

    /** Fills the holes of {@code pattern}; unbound holes are left in place. */
    public Prop apply(Prop pattern) {
        if (pattern instanceof Prop.Hole h) return formulas.getOrDefault(h.name(), h);
        if (pattern instanceof Prop.RefHole h) return refs.containsKey(h.name()) ? refs.get(h.name()) : h;
        if (pattern instanceof Prop.And a) return Prop.and(apply(a.p()), apply(a.q()));
        if (pattern instanceof Prop.Or o) return Prop.or(apply(o.p()), apply(o.q()));
        if (pattern instanceof Prop.Imp i) return Prop.imp(apply(i.p()), apply(i.q()));
        if (pattern instanceof Prop.ForAll f) return Prop.forall(term(f.var()), apply(f.body()));
        if (pattern instanceof Prop.Exists e) return Prop.exists(term(e.var()), apply(e.body()));
        if (pattern instanceof Prop.Pred p) return new Prop.Pred(p.name(), p.args().stream().map(this::term).toList());
        return pattern;
    }

    private Prop.Term term(Prop.Term t) {
        return (Prop.Term) apply(t);
    }

    @Override
    public String toString() {
        return "Subst" + List.of(formulas, refs);
    }
}
