package dumb.natded;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.natded.util.Json;

import java.util.Set;

/**
 * Checker settings. Missing JSON fields take their defaults.
 *
 * @param rewriteRules citation names of the enabled catalog rewrites
 * @param axioms       whether {@code lem} may justify excluded middle
 * @param verbose      whether each checked line is also logged
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(
        @JsonProperty("rewriteRules") Set<String> rewriteRules,
        @JsonProperty("axioms") boolean axioms,
        @JsonProperty("verbose") boolean verbose
) {
    public static final boolean DEFAULT_AXIOMS = true;
    public static final boolean DEFAULT_VERBOSE = false;
    public static final Configuration DEFAULT = new Configuration();

    public Configuration {
        rewriteRules = Set.copyOf(rewriteRules);
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("rewriteRules") Set<String> rewriteRules,
            @JsonProperty("axioms") Boolean axioms,
            @JsonProperty("verbose") Boolean verbose
    ) {
        this(
                rewriteRules != null ? rewriteRules : Rewrite.citations(),
                axioms != null ? axioms : DEFAULT_AXIOMS,
                verbose != null ? verbose : DEFAULT_VERBOSE
        );
    }

    public Configuration() {
        this(Rewrite.citations(), DEFAULT_AXIOMS, DEFAULT_VERBOSE);
    }

    public static Configuration parse(String json) throws JsonProcessingException {
        return Json.obj(json, Configuration.class);
    }

    public String toJson() {
        return Json.str(this);
    }
}
