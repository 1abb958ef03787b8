package dumb.natded;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.natded.util.Json;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable proposition tree. Equality is structural; negation is an implication into {@link #FALSE}.
 */
sealed public interface Prop permits Prop.Atom, Prop.Hole, Prop.Term, Prop.Binary, Prop.Quantifier, Prop.Pred, Prop.Lit {

    Lit TRUE = new Lit(true), FALSE = new Lit(false);

    static Atom atom(String name) {
        return new Atom(name);
    }

    static Ref ref(String name) {
        return new Ref(name);
    }

    static Hole hole(String name) {
        return new Hole(name);
    }

    static RefHole refHole(String name) {
        return new RefHole(name);
    }

    static And and(Prop p, Prop q) {
        return new And(p, q);
    }

    static Or or(Prop p, Prop q) {
        return new Or(p, q);
    }

    static Imp imp(Prop p, Prop q) {
        return new Imp(p, q);
    }

    static Imp not(Prop p) {
        return new Imp(p, FALSE);
    }

    static ForAll forall(Term var, Prop body) {
        return new ForAll(var, body);
    }

    static Exists exists(Term var, Prop body) {
        return new Exists(var, body);
    }

    static Pred pred(String name, Term... args) {
        return new Pred(name, Arrays.asList(args));
    }

    /** True for formula holes and reference holes. */
    default boolean isHole() {
        return this instanceof Hole || this instanceof RefHole;
    }

    default boolean isNegation() {
        return this instanceof Imp i && i.q().equals(FALSE);
    }

    /**
     * Every domain reference occurring in this proposition, and the subset bound by some quantifier.
     */
    default Symbols symbols() {
        var symbols = new LinkedHashSet<Ref>();
        var vars = new LinkedHashSet<Ref>();
        collectSymbols(this, symbols, vars);
        return new Symbols(Collections.unmodifiableSet(symbols), Collections.unmodifiableSet(vars));
    }

    /** References occurring free, respecting quantifier scope. */
    default Set<Ref> free() {
        var free = new LinkedHashSet<Ref>();
        collectFree(this, Set.of(), free);
        return Collections.unmodifiableSet(free);
    }

    default ObjectNode toJson() {
        return Json.the.createObjectNode()
                .put("type", getClass().getSimpleName().toLowerCase())
                .put("text", toString());
    }

    private static void collectSymbols(Prop p, Set<Ref> symbols, Set<Ref> vars) {
        if (p instanceof Ref r) {
            symbols.add(r);
        } else if (p instanceof Binary b) {
            collectSymbols(b.p(), symbols, vars);
            collectSymbols(b.q(), symbols, vars);
        } else if (p instanceof Quantifier q) {
            if (q.var() instanceof Ref r) {
                symbols.add(r);
                vars.add(r);
            }
            collectSymbols(q.body(), symbols, vars);
        } else if (p instanceof Pred pr) {
            pr.args().forEach(a -> collectSymbols(a, symbols, vars));
        }
    }

    private static void collectFree(Prop p, Set<Ref> bound, Set<Ref> free) {
        if (p instanceof Ref r) {
            if (!bound.contains(r)) free.add(r);
        } else if (p instanceof Binary b) {
            collectFree(b.p(), bound, free);
            collectFree(b.q(), bound, free);
        } else if (p instanceof Quantifier q) {
            if (q.var() instanceof Ref r) {
                var inner = new LinkedHashSet<>(bound);
                inner.add(r);
                collectFree(q.body(), inner, free);
            } else {
                collectFree(q.body(), bound, free);
            }
        } else if (p instanceof Pred pr) {
            pr.args().forEach(a -> collectFree(a, bound, free));
        }
    }

    /** Domain-level positions: quantifier variables and predicate arguments. */
    sealed interface Term extends Prop permits Ref, RefHole {
        String name();
    }

    /** The three binary connectives, which unify and diff operand-wise. */
    sealed interface Binary extends Prop permits And, Or, Imp {
        Prop p();

        Prop q();
    }

    sealed interface Quantifier extends Prop permits ForAll, Exists {
        Term var();

        Prop body();
    }

    record Symbols(Set<Ref> symbols, Set<Ref> vars) {
        public Symbols {
            requireNonNull(symbols);
            requireNonNull(vars);
        }

        /** Symbols minus quantifier-bound names. */
        public Set<Ref> ground() {
            return symbols.stream().filter(s -> !vars.contains(s)).collect(Collectors.toUnmodifiableSet());
        }
    }

    record Atom(String name) implements Prop {
        public Atom {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Atom name must not be empty");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** Metavariable over propositions. Only appears in rule patterns. */
    record Hole(String name) implements Prop {
        public Hole {
            requireNonNull(name);
        }

        @Override
        public String toString() {
            return "?" + name;
        }
    }

    record Ref(String name) implements Term {
        public Ref {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Reference name must not be empty");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** Metavariable over domain references. */
    record RefHole(String name) implements Term {
        public RefHole {
            requireNonNull(name);
        }

        @Override
        public String toString() {
            return "?" + name;
        }
    }

    record And(Prop p, Prop q) implements Binary {
        public And {
            requireNonNull(p);
            requireNonNull(q);
        }

        @Override
        public String toString() {
            return "(" + p + " /\\ " + q + ")";
        }
    }

    record Or(Prop p, Prop q) implements Binary {
        public Or {
            requireNonNull(p);
            requireNonNull(q);
        }

        @Override
        public String toString() {
            return "(" + p + " \\/ " + q + ")";
        }
    }

    record Imp(Prop p, Prop q) implements Binary {
        public Imp {
            requireNonNull(p);
            requireNonNull(q);
        }

        @Override
        public String toString() {
            return q.equals(FALSE) ? "~" + p : "(" + p + " -> " + q + ")";
        }
    }

    record ForAll(Term var, Prop body) implements Quantifier {
        public ForAll {
            requireNonNull(var);
            requireNonNull(body);
        }

        @Override
        public String toString() {
            return "(forall " + var + ", " + body + ")";
        }
    }

    record Exists(Term var, Prop body) implements Quantifier {
        public Exists {
            requireNonNull(var);
            requireNonNull(body);
        }

        @Override
        public String toString() {
            return "(exists " + var + ", " + body + ")";
        }
    }

    record Pred(String name, List<Term> args) implements Prop {
        public Pred {
            requireNonNull(name);
            args = List.copyOf(requireNonNull(args));
        }

        public int arity() {
            return args.size();
        }

        @Override
        public String toString() {
            return args.stream().map(Object::toString).collect(Collectors.joining(", ", name + "(", ")"));
        }
    }

    record Lit(boolean value) implements Prop {
        @Override
        public String toString() {
            return value ? "true" : "false";
        }
    }
}
