package ai.scopeview.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class LanguageTest {

    @Test
    @DisplayName("fromString accepts tags and aliases")
    void fromStringAcceptsAliases() {
        assertEquals(Language.C, Language.fromString("c"));
        assertEquals(Language.CPP, Language.fromString("C++"));
        assertEquals(Language.CPP, Language.fromString(" cpp "));
        assertEquals(Language.PYTHON, Language.fromString("py"));
        assertEquals(Language.JAVASCRIPT, Language.fromString("js"));
        assertEquals(Language.TYPESCRIPT, Language.fromString("TypeScript"));
    }

    @Test
    @DisplayName("unrecognised names map to UNKNOWN rather than null")
    void unknownNames() {
        assertEquals(Language.UNKNOWN, Language.fromString(null));
        assertEquals(Language.UNKNOWN, Language.fromString("cobol"));
        assertFalse(Language.UNKNOWN.isKnown());
    }

    @Test
    void tagRoundTrips() {
        for (var language : Language.values()) {
            assertEquals(language, Language.fromString(language.tag()));
        }
    }

    @Test
    void separators() {
        assertEquals("::", Language.CPP.separator());
        assertEquals(".", Language.PYTHON.separator());
    }
}
