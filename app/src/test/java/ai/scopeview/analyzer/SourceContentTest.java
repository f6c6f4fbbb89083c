package ai.scopeview.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class SourceContentTest {

    @Test
    void multiByteOffsets() {
        var source = SourceContent.of("é = 1\nπ = 2\n");
        assertEquals(14, source.byteLength());
        assertEquals("é", source.substringFromBytes(0, 2));
        assertEquals("π = 2", source.substringFromBytes(7, 13));
        assertEquals(1, source.lineOf(7));
        assertEquals(0, source.columnOf(7));
    }

    @Test
    void outOfRangeRequestsAreClamped() {
        var source = SourceContent.of("abc");
        assertEquals("", source.substringFromBytes(-1, 2));
        assertEquals("", source.substringFromBytes(2, 1));
        assertEquals("bc", source.substringFromBytes(1, 10));
        assertEquals("", source.substringFromBytes(3, 3));
    }
}
