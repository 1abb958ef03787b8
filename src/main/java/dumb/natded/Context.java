package dumb.natded;

import dumb.natded.Line.Failure;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static dumb.natded.Log.error;
import static dumb.natded.Log.message;
import static dumb.natded.Log.warning;
import static dumb.natded.ProofException.Kind.UNRESOLVED_REFERENCE;
import static java.util.Objects.requireNonNull;

/**
 * State of one verification run: every line across all scopes, the scope registry, the constants seen
 * so far and the compiled scope types. Single-use: {@link #check()} runs once.
 */
public class Context {
    private final Configuration configuration;
    private final Events events;
    private final Citations citations;

    private final SortedMap<Integer, Line> lines = new TreeMap<>();
    private final Map<List<Integer>, Proof> proofs = new LinkedHashMap<>();
    private final Map<Proof, Proof.Type> proofTypes = new LinkedHashMap<>();
    private final Set<Prop.Ref> constants = new LinkedHashSet<>();
    private final Set<Prop.Ref> arbitrary = new LinkedHashSet<>();
    private final SortedSet<Integer> checked = new TreeSet<>();

    @Nullable
    private Proof mainProof;
    @Nullable
    private Failure failure;
    private State state = State.UNCHECKED;
    @Nullable
    private Instant started, finished;

    public Context() {
        this(Configuration.DEFAULT, new Events());
    }

    public Context(Configuration configuration, Events events) {
        this.configuration = requireNonNull(configuration);
        this.events = requireNonNull(events);
        this.citations = Citations.standard(configuration);
    }

    /**
     * Registers a scope. Scopes arrive innermost first, so the last one added is the main proof.
     */
    public void addProof(Proof proof) {
        if (state != State.UNCHECKED) throw new IllegalStateException("Cannot add proofs to a context that has run");
        for (var n : proof.key())
            if (lines.containsKey(n)) throw new IllegalArgumentException("Line " + n + " already belongs to a proof");
        proof.lines().forEach(l -> lines.put(l.number(), l));
        proofs.put(proof.key(), proof);
        mainProof = proof;
    }

    /**
     * Checks every line in ascending order, compiling each scope as soon as all its lines pass.
     *
     * @return true iff every line verified; false on the first failing line or when there is nothing to check
     * @throws IllegalStateException when this context has already run
     */
    public boolean check() {
        if (state != State.UNCHECKED)
            throw new IllegalStateException("Context already checked (" + state + "); create a new one to re-check");
        started = Instant.now();
        if (mainProof == null || lines.isEmpty()) {
            warning("No proofs added");
            return finish(State.FAILED);
        }
        state = State.CHECKING;
        message("Checking " + lines.size() + " line(s) in " + proofs.size() + " scope(s)");

        for (var line : lines.values())
            if (line.justification() instanceof Justification.Premise)
                constants.addAll(line.prop().symbols().ground());

        var remaining = new LinkedHashSet<>(proofs.values());
        for (var line : lines.values()) {
            Justification.Interpretation in;
            try {
                in = line.check(this);
            } catch (Failure f) {
                failure = f;
                error(f.getMessage());
                events.emit(CheckEvent.LineFailed.of(f));
                return finish(State.FAILED);
            }

            arbitrary.addAll(in.introduced());
            var ground = line.prop().symbols().ground();
            var j = line.justification();
            if (j instanceof Justification.Premise || j instanceof Justification.Hypothesis) {
                constants.addAll(ground);
            } else {
                ground.stream().filter(s -> !arbitrary.contains(s)).forEach(constants::add);
            }
            checked.add(line.number());
            if (configuration.verbose()) message(line + "  ✓");
            events.emit(CheckEvent.LineChecked.of(line));

            for (var it = remaining.iterator(); it.hasNext(); ) {
                var proof = it.next();
                if (checked.contains(proof.last()) && checked.containsAll(proof.key())) {
                    var type = proof.compile(this);
                    it.remove();
                    message("Compiled scope " + proof.first() + "-" + proof.last() + ": " + type);
                    events.emit(CheckEvent.ProofCompiled.of(proof, type));
                }
            }
        }
        return finish(State.VERIFIED);
    }

    private boolean finish(State outcome) {
        state = outcome;
        finished = Instant.now();
        var verified = outcome == State.VERIFIED;
        message((verified ? "Verified " : "Failed after ") + checked.size() + " of " + lines.size() + " line(s)");
        events.emit(new CheckEvent.CheckFinished(verified, checked.size()));
        return verified;
    }

    void register(Proof proof, Proof.Type type) {
        proofTypes.put(proof, type);
    }

    /** A line that exists and has already been checked. */
    Line resolve(int number) {
        var line = lines.get(number);
        if (line == null) throw new ProofException(UNRESOLVED_REFERENCE, "Line " + number + " does not exist");
        if (!checked.contains(number))
            throw new ProofException(UNRESOLVED_REFERENCE, "Line " + number + " is not checked yet");
        return line;
    }

    Citations.Cited resolve(Justification.Cite cite) {
        if (cite instanceof Justification.At at) return new Citations.Step(resolve(at.line()));
        var span = (Justification.Span) cite;
        var proof = proofs.values().stream()
                .filter(p -> p.first() == span.from() && p.last() == span.to())
                .findFirst()
                .orElseThrow(() -> new ProofException(UNRESOLVED_REFERENCE, "No scope spans lines " + span));
        var type = proofTypes.get(proof);
        if (type == null) throw new ProofException(UNRESOLVED_REFERENCE, "Scope " + span + " is not compiled yet");
        return new Citations.Scope(proof, type);
    }

    /** Every line {@code number} depends on, directly or through other citations. */
    public SortedSet<Integer> dependencies(int number) {
        var seen = new TreeSet<Integer>();
        var work = new ArrayDeque<Integer>();
        work.push(number);
        while (!work.isEmpty()) {
            var line = lines.get(work.pop());
            if (line == null) continue;
            for (var cite : line.justification().cites()) {
                var cited = cite instanceof Justification.At at ? List.of(at.line()) : scopeLines((Justification.Span) cite);
                for (var n : cited)
                    if (seen.add(n)) work.push(n);
            }
        }
        return seen;
    }

    private List<Integer> scopeLines(Justification.Span span) {
        return proofs.values().stream()
                .filter(p -> p.first() == span.from() && p.last() == span.to())
                .findFirst()
                .map(Proof::key)
                .orElse(List.of());
    }

    /** Whether the main proof concludes {@code obligation}. */
    public boolean discharged(Prop obligation) {
        return mainType().map(t -> t.conclusions().contains(obligation)).orElse(false);
    }

    /** Main-proof assumptions other than excluded-middle axioms. */
    public Set<Prop> openAssumptions() {
        var open = new LinkedHashSet<Prop>();
        mainType().ifPresent(t -> t.assumptions().stream().filter(a -> !Algebra.isAxiom(a)).forEach(open::add));
        return Collections.unmodifiableSet(open);
    }

    private Optional<Proof.Type> mainType() {
        return Optional.ofNullable(mainProof).map(proofTypes::get);
    }

    public CheckReport report() {
        return CheckReport.of(this);
    }

    @Nullable
    public Proof mainProof() {
        return mainProof;
    }

    public Map<Proof, Proof.Type> proofTypes() {
        return Collections.unmodifiableMap(proofTypes);
    }

    public Optional<Proof.Type> type(Proof proof) {
        return Optional.ofNullable(proofTypes.get(proof));
    }

    public Map<List<Integer>, Proof> proofs() {
        return Collections.unmodifiableMap(proofs);
    }

    public Set<Prop.Ref> constants() {
        return Collections.unmodifiableSet(constants);
    }

    public Set<Prop.Ref> arbitrary() {
        return Collections.unmodifiableSet(arbitrary);
    }

    public Optional<Line> line(int number) {
        return Optional.ofNullable(lines.get(number));
    }

    public Optional<Failure> failure() {
        return Optional.ofNullable(failure);
    }

    public State state() {
        return state;
    }

    public Configuration configuration() {
        return configuration;
    }

    public Citations citations() {
        return citations;
    }

    public Events events() {
        return events;
    }

    @Nullable
    Instant started() {
        return started;
    }

    @Nullable
    Instant finished() {
        return finished;
    }

    public enum State {UNCHECKED, CHECKING, VERIFIED, FAILED}
}
