package dumb.natded;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationTest {

    @Test
    void emptyObjectTakesDefaults() throws JsonProcessingException {
        assertEquals(Configuration.DEFAULT, Configuration.parse("{}"));
    }

    @Test
    void defaultsEnableWholeCatalog() {
        var c = new Configuration();
        assertEquals(Rewrite.citations(), c.rewriteRules());
        assertTrue(c.axioms());
        assertFalse(c.verbose());
    }

    @Test
    void partialObjectKeepsOtherDefaults() throws JsonProcessingException {
        var c = Configuration.parse("{\"axioms\": false, \"rewriteRules\": [\"dn\", \"comm\"]}");
        assertFalse(c.axioms());
        assertFalse(c.verbose());
        assertEquals(Set.of("dn", "comm"), c.rewriteRules());
    }

    @Test
    void survivesJson() throws JsonProcessingException {
        var c = new Configuration(Set.of("dm"), false, true);
        assertEquals(c, Configuration.parse(c.toJson()));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(JsonProcessingException.class, () -> Configuration.parse("{\"axioms\": "));
    }

    @Test
    void rulesAreCopied() {
        var rules = new java.util.HashSet<>(Set.of("dn"));
        var c = new Configuration(rules, true, false);
        rules.add("comm");
        assertEquals(Set.of("dn"), c.rewriteRules());
    }
}
