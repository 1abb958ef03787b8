package dumb.natded;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * One scope of lines. Nested scopes are separate proofs; a proof does not contain the lines of the
 * scopes opened inside it.
 */
public class Proof {
    private final SortedMap<Integer, Line> lines = new TreeMap<>();

    public Proof(List<Line> lines) {
        if (lines.isEmpty()) throw new IllegalArgumentException("A proof needs at least one line");
        for (var line : lines) {
            if (this.lines.putIfAbsent(line.number(), line) != null)
                throw new IllegalArgumentException("Duplicate line number " + line.number());
        }
    }

    /** Sorted line numbers; the registry key of this proof. */
    public List<Integer> key() {
        return List.copyOf(lines.keySet());
    }

    public int first() {
        return lines.firstKey();
    }

    public int last() {
        return lines.lastKey();
    }

    public Collection<Line> lines() {
        return Collections.unmodifiableCollection(lines.values());
    }

    /** Hypotheses become assumptions; every line becomes a conclusion. */
    Type compile(Context ctx) {
        var assumptions = new LinkedHashSet<Prop>();
        var conclusions = new LinkedHashSet<Prop>();
        for (var line : lines.values()) {
            if (line.justification() instanceof Justification.Hypothesis) assumptions.add(line.prop());
            conclusions.add(line.prop());
        }
        var type = new Type(assumptions, conclusions);
        ctx.register(this, type);
        return type;
    }

    @Override
    public String toString() {
        return lines.values().stream().map(Line::toString).collect(Collectors.joining("\n"));
    }

    public record Type(Set<Prop> assumptions, Set<Prop> conclusions) {
        public Type {
            assumptions = Collections.unmodifiableSet(new LinkedHashSet<>(requireNonNull(assumptions)));
            conclusions = Collections.unmodifiableSet(new LinkedHashSet<>(requireNonNull(conclusions)));
        }

        @Override
        public String toString() {
            return assumptions + " |- " + conclusions;
        }
    }
}
