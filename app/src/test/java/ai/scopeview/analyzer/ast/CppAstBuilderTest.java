package ai.scopeview.analyzer.ast;

import static ai.scopeview.analyzer.ast.AstTestSupport.node;
import static ai.scopeview.analyzer.ast.AstTestSupport.parse;
import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.ReferenceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class CppAstBuilderTest {
    private static final String SOURCE =
            """
            #include <string>

            namespace geo {
            /// A shape.
            class Shape {
            public:
                virtual double area() const = 0;
            private:
                int id;
            };

            class Circle : public Shape {
            public:
                double area() const override;
            };
            }

            double geo::Circle::area() const { return 3.14; }

            template <typename T>
            T maxOf(T a, T b) { return a > b ? a : b; }

            using namespace geo;
            """;

    @Test
    @DisplayName("classes inside a namespace are qualified with ::")
    void namespacesQualifyNames() {
        var result = parse(SOURCE, "shapes.cpp", Language.CPP);

        assertEquals(NodeType.NAMESPACE, node(result, "geo").type());
        var shape = node(result, "geo::Shape");
        assertEquals(NodeType.CLASS, shape.type());
        assertEquals("A shape.", shape.docstring());
    }

    @Test
    @DisplayName("members carry the access level in force where they are declared")
    void accessSpecifiers() {
        var result = parse(SOURCE, "shapes.cpp", Language.CPP);

        var area = node(result, "geo::Shape::area");
        assertEquals(NodeType.METHOD, area.type());
        assertEquals("public", area.attribute("access"));
        assertEquals("true", area.attribute("virtual"));

        var id = node(result, "geo::Shape::id");
        assertEquals(NodeType.PROPERTY, id.type());
        assertEquals("private", id.attribute("access"));
    }

    @Test
    void baseClasses() {
        var result = parse(SOURCE, "shapes.cpp", Language.CPP);

        var circle = node(result, "geo::Circle");
        assertEquals("Shape", circle.attribute("bases"));
        assertTrue(result.referenceSites().stream()
                .anyMatch(s -> s.kind() == ReferenceKind.INHERITANCE && s.name().equals("Shape")));
    }

    @Test
    @DisplayName("an out-of-line definition is a METHOD with its owner recorded")
    void outOfLineDefinition() {
        var result = parse(SOURCE, "shapes.cpp", Language.CPP);

        AstNode outOfLine = result.astRoot().children().stream()
                .filter(n -> n.type() == NodeType.METHOD)
                .findFirst()
                .orElseThrow();
        assertEquals("area", outOfLine.name());
        assertEquals("geo::Circle::area", outOfLine.qualifiedName());
        assertEquals("geo::Circle", outOfLine.attribute("owner"));
        assertEquals("true", outOfLine.attribute("definition"));
    }

    @Test
    @DisplayName("a template takes the range of the whole template declaration")
    void templates() {
        var result = parse(SOURCE, "shapes.cpp", Language.CPP);

        var maxOf = node(result, "maxOf");
        assertEquals(NodeType.FUNCTION, maxOf.type());
        assertEquals("<typename T>", maxOf.attribute("template"));
        assertTrue(maxOf.rawContent().startsWith("template"));
        assertEquals(2, maxOf.parameters().size());
    }

    @Test
    void usingNamespace() {
        var result = parse(SOURCE, "shapes.cpp", Language.CPP);

        var using = result.astRoot().children().stream()
                .filter(n -> n.type() == NodeType.USING)
                .findFirst()
                .orElseThrow();
        assertEquals("geo", using.name());
        assertEquals("true", using.attribute("namespace"));
    }
}
