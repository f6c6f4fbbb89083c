package ai.scopeview.analyzer.context;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ContextOptionsTest {
    @Test
    void defaults() {
        var d = ContextOptions.DEFAULTS;
        assertEquals(2048, d.maxTokens());
        assertEquals(0.7, d.similarityWeight());
        assertTrue(d.preserveStructure());
        assertTrue(d.prioritizeFunctions());
        assertEquals(TokenBudgeter.DEFAULT_SUMMARY_COST, d.summaryCost());
        assertEquals(d, ContextOptions.fromProperties(new Properties()));
    }

    @Test
    void readsProperties() {
        var props = new Properties();
        props.setProperty(ContextOptions.PROP_MAX_TOKENS, "512");
        props.setProperty(ContextOptions.PROP_FOCUS_WEIGHT, "2.5");
        props.setProperty(ContextOptions.PROP_PRESERVE_STRUCTURE, "FALSE");
        props.setProperty(ContextOptions.PROP_SUMMARY_COST, " 4 ");

        var options = ContextOptions.fromProperties(props);

        assertEquals(512, options.maxTokens());
        assertEquals(2.5, options.focusWeight());
        assertFalse(options.preserveStructure());
        assertEquals(4, options.summaryCost());
    }

    @Test
    void invalidPropertiesFallBack() {
        var props = new Properties();
        props.setProperty(ContextOptions.PROP_MAX_TOKENS, "-3");
        props.setProperty(ContextOptions.PROP_RECENCY_WEIGHT, "NaN");
        props.setProperty(ContextOptions.PROP_PROXIMITY_WEIGHT, "close");
        props.setProperty(ContextOptions.PROP_PRIORITIZE_FUNCTIONS, "maybe");

        assertEquals(ContextOptions.DEFAULTS, ContextOptions.fromProperties(props));
    }

    @Test
    void constructorValidates() {
        assertThrows(IllegalArgumentException.class, () -> ContextOptions.DEFAULTS.withMaxTokens(-1));
        assertThrows(IllegalArgumentException.class, () -> new ContextOptions(10, -1, 0, 0, 0, 0, true, true, 8));
        assertThrows(IllegalArgumentException.class, () -> new ContextOptions(10, 0, 0, 0, 0, 0, true, true, -8));
        assertEquals(64, ContextOptions.DEFAULTS.withMaxTokens(64).maxTokens());
    }

    @Test
    void queryCoercesNulls() {
        var query = new RelevanceQuery(null, 3, null, null, null);
        assertFalse(query.hasCursor());
        assertEquals("", query.text());
        assertEquals(Set.of(), query.focus());
        assertEquals(Map.of(), query.recency());
        assertTrue(RelevanceQuery.atCursor("a.py", 0).hasCursor());
        assertFalse(RelevanceQuery.atCursor("a.py", -1).hasCursor());
    }
}
