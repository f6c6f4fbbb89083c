package ai.scopeview.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class LanguageDetectorTest {

    @Test
    void extensions() {
        assertEquals(Language.C, LanguageDetector.detect(Path.of("src/main.c")));
        assertEquals(Language.CPP, LanguageDetector.detect(Path.of("src/main.cpp")));
        assertEquals(Language.CPP, LanguageDetector.detect(Path.of("src/main.cc")));
        assertEquals(Language.PYTHON, LanguageDetector.detect(Path.of("pkg/mod.py")));
        assertEquals(Language.JAVASCRIPT, LanguageDetector.detect(Path.of("web/app.mjs")));
        assertEquals(Language.TYPESCRIPT, LanguageDetector.detect(Path.of("web/app.tsx")));
        assertEquals(Language.UNKNOWN, LanguageDetector.detect(Path.of("README")));
    }

    @Test
    @DisplayName(".C is C++ while .c is C")
    void upperCaseC() {
        assertEquals(Language.CPP, LanguageDetector.fromExtension("C"));
        assertEquals(Language.C, LanguageDetector.fromExtension("c"));
        assertEquals(Language.PYTHON, LanguageDetector.fromExtension(".PY"));
    }

    @Test
    @DisplayName("headers default to C unless the content looks like C++")
    void headers() {
        assertEquals(Language.C, LanguageDetector.detect(Path.of("a.h"), "int f(void);\n"));
        assertEquals(Language.C, LanguageDetector.detect(Path.of("a.h"), null));
        assertEquals(
                Language.CPP,
                LanguageDetector.detect(Path.of("a.h"), "namespace util {\nclass Box { int v; };\n}\n"));
    }

    @Test
    @DisplayName("content fingerprints are used when the extension says nothing")
    void contentFingerprints() {
        assertEquals(Language.C, LanguageDetector.fromContent("#include <stdio.h>\nint main() { return 0; }\n"));
        assertEquals(
                Language.CPP,
                LanguageDetector.fromContent("#include <vector>\nint main() { std::vector<int> v; return 0; }\n"));
        assertEquals(Language.PYTHON, LanguageDetector.fromContent("def f(x):\n    return x\n"));
        assertEquals(Language.TYPESCRIPT, LanguageDetector.fromContent("interface Point { x: number }\n"));
        assertEquals(Language.JAVASCRIPT, LanguageDetector.fromContent("const add = (a, b) => a + b;\n"));
        assertEquals(Language.UNKNOWN, LanguageDetector.fromContent("just some prose"));
        assertEquals(Language.PYTHON, LanguageDetector.detect(Path.of("script"), "def main():\n    pass\n"));
    }
}
