package org.flutterjs.analyzer.frontend.parser;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.diagnostics.Diagnostic;
import org.flutterjs.analyzer.frontend.parser.ast.ClassNode;
import org.flutterjs.analyzer.frontend.parser.ast.ConstructorNode;
import org.flutterjs.analyzer.frontend.parser.ast.FieldNode;
import org.flutterjs.analyzer.frontend.parser.ast.ImportNode;
import org.flutterjs.analyzer.frontend.parser.ast.MethodNode;
import org.flutterjs.analyzer.frontend.parser.ast.VariableNode;
import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.expr.CollectionForExpr;
import org.flutterjs.analyzer.ir.expr.CollectionForLoopExpr;
import org.flutterjs.analyzer.ir.expr.ConditionalExpr;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.expr.IndexExpr;
import org.flutterjs.analyzer.ir.expr.ListLiteralExpr;
import org.flutterjs.analyzer.ir.stmt.VariableDeclStmt;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.flutterjs.analyzer.testutils.DartFixtures.file;

/**
 * Tests the default parser on typical Flutter sources and on broken input.
 */
@Tag("unit")
class DartSourceParserTest {

    private final SourceParser parser = new DartSourceParser();
    private final FileIdentity file = file("widget.dart");

    /**
     * Directives, classes and their members are parsed in source order.
     */
    @Test
    void parsesDirectivesAndClassMembers() throws ParseException {
        // Arrange
        String source = """
                import 'package:flutter/material.dart';
                import 'helpers.dart' deferred as helpers;

                class Badge extends StatelessWidget {
                  static const double size = 24.0;
                  final String label;
                  const Badge({super.key, required this.label});

                  @override
                  Widget build(BuildContext context) => Chip(label: Text(label));
                }
                """;

        // Act
        ParsedUnit unit = parser.parse(file, source);

        // Assert
        assertThat(unit.file()).isEqualTo(file);
        assertThat(unit.declarations()).hasSize(3);
        ImportNode deferred = (ImportNode) unit.declarations().get(1);
        assertThat(deferred.deferred()).isTrue();
        assertThat(deferred.prefix()).isEqualTo("helpers");

        ClassNode badge = (ClassNode) unit.declarations().get(2);
        assertThat(badge.name()).isEqualTo("Badge");
        assertThat(badge.superclass().name()).isEqualTo("StatelessWidget");
        assertThat(badge.members()).hasSize(4);
        assertThat(badge.members().get(0)).isInstanceOfSatisfying(FieldNode.class,
                f -> assertThat(f.modifiers()).contains(Modifier.STATIC, Modifier.CONST));
        assertThat(badge.members().get(2)).isInstanceOfSatisfying(ConstructorNode.class,
                c -> assertThat(c.parameters()).hasSize(2));
        assertThat(badge.members().get(3)).isInstanceOfSatisfying(MethodNode.class,
                m -> assertThat(m.modifiers()).contains(Modifier.OVERRIDE));
    }

    /**
     * A syntax error fails the whole file and carries the error diagnostics.
     */
    @Test
    void syntaxErrorFailsTheFile() {
        // Arrange
        String source = """
                class Broken extends StatelessWidget {
                  Widget build(BuildContext context) {
                    return Text('unterminated';
                  }
                }
                """;

        // Act & Assert
        assertThatThrownBy(() -> parser.parse(file, source))
                .isInstanceOfSatisfying(ParseException.class, e -> assertThat(e.getDiagnostics())
                        .isNotEmpty()
                        .allSatisfy(d -> assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR)));
    }

    /**
     * Collection-for elements accept both the for-in and the three-part loop form.
     */
    @Test
    void parsesBothCollectionForForms() throws ParseException {
        // Arrange
        String source = """
                final List<int> counted = [for (var i = 0; i < 3; i++) i];
                final List<String> named = [for (final String n in names) n];
                """;

        // Act
        ParsedUnit unit = parser.parse(file, source);

        // Assert
        assertThat(onlyElement(unit, 0)).isInstanceOfSatisfying(CollectionForLoopExpr.class, loop -> {
            assertThat(loop.initializers()).singleElement().isInstanceOfSatisfying(VariableDeclStmt.class,
                    v -> assertThat(v.name()).isEqualTo("i"));
            assertThat(loop.condition()).isNotNull();
            assertThat(loop.updaters()).hasSize(1);
        });
        assertThat(onlyElement(unit, 1)).isInstanceOfSatisfying(CollectionForExpr.class,
                loop -> assertThat(loop.variable()).isEqualTo("n"));
    }

    /**
     * {@code a?[i]} is a null-aware index, while a spaced {@code ? [} still starts a conditional.
     */
    @Test
    void distinguishesNullAwareIndexFromConditional() throws ParseException {
        // Arrange
        String source = """
                final int? first = items?[0];
                final List<int> picked = flag ? [1] : [2];
                """;

        // Act
        ParsedUnit unit = parser.parse(file, source);

        // Assert
        assertThat(initializer(unit, 0)).isInstanceOfSatisfying(IndexExpr.class,
                index -> assertThat(index.nullAware()).isTrue());
        assertThat(initializer(unit, 1)).isInstanceOf(ConditionalExpr.class);
    }

    /**
     * Pathologically deep nesting is reported as a syntax error instead of exhausting the stack.
     */
    @Test
    void deepNestingIsASyntaxError() throws ParseException {
        // Arrange
        String deep = "int f() => " + "(".repeat(20_000) + "1" + ")".repeat(20_000) + ";\n";
        String shallow = "int g() => " + "(".repeat(100) + "1" + ")".repeat(100) + ";\n";

        // Act & Assert
        assertThatThrownBy(() -> parser.parse(file, deep))
                .isInstanceOfSatisfying(ParseException.class, e -> assertThat(e.getDiagnostics())
                        .anySatisfy(d -> assertThat(d.message()).startsWith("Nesting deeper than")));
        assertThat(parser.parse(file, shallow).declarations()).hasSize(1);
    }

    private static ExpressionIR initializer(ParsedUnit unit, int index) {
        return ((VariableNode) unit.declarations().get(index)).initializer();
    }

    private static ExpressionIR onlyElement(ParsedUnit unit, int index) {
        ListLiteralExpr list = (ListLiteralExpr) initializer(unit, index);
        assertThat(list.elements()).hasSize(1);
        return list.elements().get(0);
    }
}
