package dumb.natded;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.natded.util.Json;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Per-line progress of {@link Context#check()}, for whatever prints or collects it. */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "eventType",
        visible = true)
@JsonSubTypes({
        @Type(value = CheckEvent.LineChecked.class, name = "LineChecked"),
        @Type(value = CheckEvent.LineFailed.class, name = "LineFailed"),
        @Type(value = CheckEvent.ProofCompiled.class, name = "ProofCompiled"),
        @Type(value = CheckEvent.CheckFinished.class, name = "CheckFinished")
})
public interface CheckEvent {

    @JsonProperty("eventType")
    String getEventType();

    default JsonNode toJson() {
        return Json.node(this);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record LineChecked(int line, String prop, String justification) implements CheckEvent {
        public LineChecked {
            requireNonNull(prop);
            requireNonNull(justification);
        }

        static LineChecked of(Line l) {
            return new LineChecked(l.number(), l.prop().toString(), l.justification().toString());
        }

        @Override
        public String getEventType() {
            return "LineChecked";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record LineFailed(int line, String prop, String justification, ProofException.Kind kind,
                      String message) implements CheckEvent {
        public LineFailed {
            requireNonNull(prop);
            requireNonNull(justification);
            requireNonNull(kind);
            requireNonNull(message);
        }

        static LineFailed of(Line.Failure f) {
            var l = f.line();
            return new LineFailed(l.number(), l.prop().toString(), l.justification().toString(), f.kind(), f.getCause().getMessage());
        }

        @Override
        public String getEventType() {
            return "LineFailed";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ProofCompiled(List<Integer> lines, List<String> assumptions, List<String> conclusions) implements CheckEvent {
        public ProofCompiled {
            lines = List.copyOf(lines);
            assumptions = List.copyOf(assumptions);
            conclusions = List.copyOf(conclusions);
        }

        static ProofCompiled of(Proof p, Proof.Type t) {
            return new ProofCompiled(p.key(),
                    t.assumptions().stream().map(Prop::toString).toList(),
                    t.conclusions().stream().map(Prop::toString).toList());
        }

        @Override
        public String getEventType() {
            return "ProofCompiled";
        }
    }

    record CheckFinished(boolean verified, int linesChecked) implements CheckEvent {
        @Override
        public String getEventType() {
            return "CheckFinished";
        }
    }
}
