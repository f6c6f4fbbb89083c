package ai.scopeview.analyzer.ast;

import static ai.scopeview.analyzer.ast.AstTestSupport.node;
import static ai.scopeview.analyzer.ast.AstTestSupport.parse;
import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.Parameter;
import ai.scopeview.analyzer.ReferenceKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class JsTsAstBuilderTest {
    private static final String JS =
            """
            import helper, { util as u } from './helper.js';
            import * as path from 'path';
            const fs = require('fs');

            // Adds numbers.
            export function add(a, b = 1) {
              return helper(a) + b;
            }

            export default class Counter extends Base {
              static create() { return new Counter(); }
              increment() { this.count += 1; }
            }

            const twice = (x) => add(x, x);
            let [first, second] = [1, 2];
            """;

    private static final String TS =
            """
            export interface Shape {
              area(): number;
              name?: string;
            }

            export type Id = string | number;

            enum Direction { Up = 1, Down }

            export abstract class Base<T> implements Shape {
              private readonly id: Id;
              abstract area(): number;
              describe(prefix?: string): string { return prefix + this.id; }
            }

            namespace Geometry {
              export const unit = 1;
            }
            """;

    @Test
    void javascriptImports() {
        var result = parse(JS, "src/app.js", Language.JAVASCRIPT);

        var imports = result.imports();
        assertEquals(3, imports.size());
        ImportDirective first = imports.get(0);
        assertEquals("./helper.js", first.target());
        assertEquals(
                List.of(new ImportDirective.ImportedName("default", "helper"), new ImportDirective.ImportedName("util", "u")),
                first.names());
        assertEquals("path", imports.get(1).moduleAlias());
        assertEquals("fs", imports.get(2).target());
        assertTrue(result.referenceSites().stream()
                .anyMatch(s -> s.kind() == ReferenceKind.IMPORT && s.name().equals("util") && s.source().equals("./helper.js")));
    }

    @Test
    @DisplayName("exported declarations take the export statement's range and are marked")
    void javascriptExports() {
        var result = parse(JS, "src/app.js", Language.JAVASCRIPT);

        var add = node(result, "add");
        assertEquals(NodeType.FUNCTION, add.type());
        assertEquals("true", add.attribute("exported"));
        assertEquals("Adds numbers.", add.docstring());
        assertTrue(add.rawContent().startsWith("export function add"));
        assertEquals(List.of(Parameter.named("a"), Parameter.of("b", "", "1")), add.parameters());

        var counter = node(result, "Counter");
        assertEquals(NodeType.CLASS, counter.type());
        assertEquals("true", counter.attribute("default"));
        assertEquals("Base", counter.attribute("bases"));

        var create = node(result, "Counter.create");
        assertEquals(NodeType.METHOD, create.type());
        assertEquals("true", create.attribute("static"));
    }

    @Test
    @DisplayName("arrow functions bound to a const become FUNCTION nodes")
    void arrowFunctions() {
        var result = parse(JS, "src/app.js", Language.JAVASCRIPT);

        var twice = node(result, "twice");
        assertEquals(NodeType.FUNCTION, twice.type());
        assertEquals("true", twice.attribute("arrow"));
        assertEquals("const", twice.attribute("kind"));
        assertEquals(NodeType.VARIABLE, node(result, "first").type());
        assertEquals(NodeType.VARIABLE, node(result, "second").type());
        assertEquals(NodeType.VARIABLE, node(result, "fs").type());
        assertTrue(result.referenceSites().stream()
                .anyMatch(s -> s.kind() == ReferenceKind.CALL && s.name().equals("add")
                        && s.enclosingNodeId() == twice.id()));
    }

    @Test
    void typescriptDeclarations() {
        var result = parse(TS, "src/shapes.ts", Language.TYPESCRIPT);

        var shape = node(result, "Shape");
        assertEquals(NodeType.INTERFACE, shape.type());
        assertEquals(NodeType.METHOD, node(result, "Shape.area").type());
        assertEquals(NodeType.PROPERTY, node(result, "Shape.name").type());

        var id = node(result, "Id");
        assertEquals(NodeType.TYPEDEF, id.type());
        assertEquals("string | number", id.attribute("type"));

        var direction = node(result, "Direction");
        assertEquals(NodeType.ENUM, direction.type());
        assertEquals(List.of("Up", "Down"), direction.children().stream().map(n -> n.name()).toList());

        assertEquals(NodeType.NAMESPACE, node(result, "Geometry").type());
        assertEquals("true", node(result, "Geometry.unit").attribute("exported"));
    }

    @Test
    void typescriptClassMembers() {
        var result = parse(TS, "src/shapes.ts", Language.TYPESCRIPT);

        var base = node(result, "Base");
        assertEquals(NodeType.CLASS, base.type());
        assertEquals("true", base.attribute("exported"));

        var id = node(result, "Base.id");
        assertEquals(NodeType.PROPERTY, id.type());
        assertEquals("private", id.attribute("access"));
        assertEquals("Id", id.attribute("type"));

        var describe = node(result, "Base.describe");
        assertEquals("string", describe.returnType());
        assertEquals(List.of(Parameter.of("prefix?", "string", "")), describe.parameters());
        assertTrue(result.referenceSites().stream()
                .anyMatch(s -> s.kind() == ReferenceKind.TYPE && s.name().equals("Id")));
    }
}
