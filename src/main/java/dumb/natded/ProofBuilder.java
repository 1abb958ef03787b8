package dumb.natded;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Assembles nested scopes from a flat stream of lines and scope markers, as a parser produces them
 * once indentation has been turned into explicit delimiters.
 */
public class ProofBuilder {
    private final Deque<List<Line>> open = new ArrayDeque<>();
    private final List<Proof> closed = new ArrayList<>();

    public ProofBuilder() {
        open.push(new ArrayList<>());
    }

    public ProofBuilder line(int number, Prop prop, Justification justification) {
        open.peek().add(new Line(number, prop, justification));
        return this;
    }

    /** Starts a nested scope. */
    public ProofBuilder open() {
        open.push(new ArrayList<>());
        return this;
    }

    /** Ends the innermost nested scope. */
    public ProofBuilder close() {
        if (open.size() < 2) throw new IllegalStateException("Scope closed without being opened");
        closed.add(new Proof(open.pop()));
        return this;
    }

    /**
     * Registers the nested scopes, innermost first, then the outermost scope.
     *
     * @return the outermost scope, now {@link Context#mainProof()}
     */
    public Proof build(Context ctx) {
        if (open.size() != 1) throw new IllegalStateException(open.size() - 1 + " scope(s) left open");
        if (open.peek().isEmpty())
            throw new IllegalStateException("The outermost scope has no lines of its own");
        closed.forEach(ctx::addProof);
        var main = new Proof(open.peek());
        ctx.addProof(main);
        return main;
    }
}
