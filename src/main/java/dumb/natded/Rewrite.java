package dumb.natded;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static dumb.natded.Prop.and;
import static dumb.natded.Prop.exists;
import static dumb.natded.Prop.forall;
import static dumb.natded.Prop.imp;
import static dumb.natded.Prop.not;
import static dumb.natded.Prop.or;

/**
 * The catalog of bidirectional equivalences citable by name. Several entries share a citation name;
 * citing the name tries each of them.
 */
public enum Rewrite {
    OR_COMM("comm", or(Holes.a, Holes.b), or(Holes.b, Holes.a)),
    AND_COMM("comm", and(Holes.a, Holes.b), and(Holes.b, Holes.a)),
    OR_ASSOC("assoc", or(or(Holes.a, Holes.b), Holes.c), or(Holes.a, or(Holes.b, Holes.c))),
    AND_ASSOC("assoc", and(and(Holes.a, Holes.b), Holes.c), and(Holes.a, and(Holes.b, Holes.c))),
    DOUBLE_NEG("dn", Holes.a, not(not(Holes.a))),
    IMPLICATION("impl", imp(Holes.a, Holes.b), or(not(Holes.a), Holes.b)),
    DEMORGAN_AND("dm", not(and(Holes.a, Holes.b)), or(not(Holes.a), not(Holes.b))),
    DEMORGAN_OR("dm", not(or(Holes.a, Holes.b)), and(not(Holes.a), not(Holes.b))),
    DEMORGAN_FORALL("dm", not(forall(Holes.x, Holes.a)), exists(Holes.x, not(Holes.a))),
    DEMORGAN_EXISTS("dm", not(exists(Holes.x, Holes.a)), forall(Holes.x, not(Holes.a))),
    AND_OVER_OR("dist", and(Holes.a, or(Holes.b, Holes.c)), or(and(Holes.a, Holes.b), and(Holes.a, Holes.c))),
    OR_OVER_AND("dist", or(Holes.a, and(Holes.b, Holes.c)), and(or(Holes.a, Holes.b), or(Holes.a, Holes.c))),
    OR_IDEM("idem", or(Holes.a, Holes.a), Holes.a),
    AND_IDEM("idem", and(Holes.a, Holes.a), Holes.a),
    EXPORTATION("exp", imp(and(Holes.a, Holes.b), Holes.c), imp(Holes.a, imp(Holes.b, Holes.c))),
    CONTRAPOSITIVE("contra", imp(Holes.a, Holes.b), imp(not(Holes.b), not(Holes.a)));

    public final String citation;
    public final Prop left, right;

    Rewrite(String citation, Prop left, Prop right) {
        this.citation = citation;
        this.left = left;
        this.right = right;
    }

    /** Catalog entries cited as {@code citation}, in catalog order. */
    public static List<Rewrite> named(String citation) {
        return Arrays.stream(values()).filter(r -> r.citation.equals(citation)).toList();
    }

    public static Set<String> citations() {
        var names = new LinkedHashSet<String>();
        for (var r : values()) names.add(r.citation);
        return names;
    }

    @Override
    public String toString() {
        return citation + " " + left + " <=> " + right;
    }

    private static final class Holes {
        static final Prop.Hole a = Prop.hole("a"), b = Prop.hole("b"), c = Prop.hole("c");
        static final Prop.RefHole x = Prop.refHole("x");
    }
}
