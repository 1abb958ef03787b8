package dumb.natded;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.natded.CheckEvent.LineFailed;
import dumb.natded.util.Json;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** JSON-friendly snapshot of a {@link Context} after (or before) checking. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckReport(Context.State state, @Nullable LineFailed failure, List<String> constants,
                          List<CheckEvent.ProofCompiled> scopes, @Nullable Instant started,
                          @Nullable Instant finished) {
    public CheckReport {
        requireNonNull(state);
        constants = List.copyOf(constants);
        scopes = List.copyOf(scopes);
    }

    static CheckReport of(Context ctx) {
        return new CheckReport(
                ctx.state(),
                ctx.failure().map(LineFailed::of).orElse(null),
                ctx.constants().stream().map(Prop.Ref::name).sorted().toList(),
                ctx.proofTypes().entrySet().stream().map(e -> CheckEvent.ProofCompiled.of(e.getKey(), e.getValue())).toList(),
                ctx.started(),
                ctx.finished());
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    @Override
    public String toString() {
        return Json.str(this);
    }
}
