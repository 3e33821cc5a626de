package org.flutterjs.analyzer.frontend.irgen;

import org.flutterjs.analyzer.diagnostics.DiagnosticsEngine;
import org.flutterjs.analyzer.frontend.semantics.SymbolRegistry;
import org.flutterjs.analyzer.testutils.DartFixtures;
import org.flutterjs.analyzer.ir.BuildDeclaration;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.ComponentKind;
import org.flutterjs.analyzer.ir.ComponentNode;
import org.flutterjs.analyzer.ir.ConditionalBranch;
import org.flutterjs.analyzer.ir.FileDeclaration;
import org.flutterjs.analyzer.ir.ImportDeclaration;
import org.flutterjs.analyzer.ir.LifecycleHook;
import org.flutterjs.analyzer.ir.PropertyDeclaration;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;
import org.flutterjs.analyzer.ir.TypeKind;
import org.flutterjs.analyzer.ir.expr.LiteralExpr;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.flutterjs.analyzer.testutils.DartFixtures.extract;
import static org.flutterjs.analyzer.testutils.DartFixtures.file;
import static org.flutterjs.analyzer.testutils.DartFixtures.parse;

/**
 * Tests the per-file IR produced by the {@link IrExtractor}.
 */
@Tag("unit")
class IrExtractorTest {

    private static final String APP = """
            import 'package:flutter/material.dart';
            import 'store.dart' as s show Store;

            const int maxItems = 10;

            void main() => runApp(Greeting(name: 'world'));

            enum Mode { light, dark }

            class Greeting extends StatelessWidget {
              final String name;
              final int count;
              const Greeting({super.key, required this.name, this.count = 1});

              @override
              Widget build(BuildContext context) {
                final title = Text('Hello $name');
                return Column(
                  children: [
                    title,
                    if (count > 1) Text('many') else Text('one'),
                    Padding(padding: EdgeInsets.all(8), child: Icon(Icons.star)),
                  ],
                );
              }
            }

            class Counter extends StatefulWidget {
              const Counter({super.key});

              @override
              State<Counter> createState() => _CounterState();
            }

            class _CounterState extends State<Counter> {
              int _count = 0;
              final TextEditingController _controller = TextEditingController();
              late AnimationController _animation;

              @override
              void initState() {
                super.initState();
              }

              @override
              void dispose() {
                _controller.dispose();
                super.dispose();
              }

              void _increment() {
                setState(() {
                  _count++;
                });
              }

              @override
              Widget build(BuildContext context) {
                if (_count > 10) {
                  return Text('done');
                }
                return ElevatedButton(onPressed: _increment, child: Text('$_count'));
              }
            }
            """;

    /**
     * Classes are classified by role and top-level declarations land in their own lists.
     */
    @Test
    void classifiesDeclarations() {
        // Act
        FileDeclaration declaration = extract("app.dart", APP);

        // Assert
        assertThat(declaration.components()).extracting(ComponentDeclaration::name)
                .containsExactly("Greeting", "Counter");
        assertThat(declaration.components()).extracting(ComponentDeclaration::kind)
                .containsExactly(ComponentKind.STATELESS, ComponentKind.STATEFUL);
        assertThat(declaration.stateHolders()).extracting(StateHolderDeclaration::name)
                .containsExactly("_CounterState");
        assertThat(declaration.plainTypes()).singleElement().satisfies(mode -> {
            assertThat(mode.kind()).isEqualTo(TypeKind.ENUM);
            assertThat(mode.enumValues()).containsExactly("light", "dark");
        });
        assertThat(declaration.functions()).extracting(f -> f.name()).containsExactly("main");
        assertThat(declaration.variables()).extracting(v -> v.name()).containsExactly("maxItems");
        assertThat(declaration.imports()).extracting(ImportDeclaration::uri)
                .containsExactly("package:flutter/material.dart", "store.dart");
        assertThat(declaration.imports().get(1).prefix()).isEqualTo("s");
        assertThat(declaration.imports().get(1).show()).containsExactly("Store");
    }

    /**
     * The state factory names the state holder and the holder names its component.
     */
    @Test
    void bindsStatefulComponentToStateHolder() {
        // Act
        FileDeclaration declaration = extract("app.dart", APP);

        // Assert
        ComponentDeclaration counter = declaration.components().get(1);
        StateHolderDeclaration state = declaration.stateHolders().get(0);
        assertThat(counter.stateHolderName()).isEqualTo("_CounterState");
        assertThat(counter.build()).isNull();
        assertThat(state.componentName()).isEqualTo("Counter");
        assertThat(state.lifecycleHooks()).containsOnlyKeys(LifecycleHook.INIT_STATE, LifecycleHook.DISPOSE);
        assertThat(state.controllerFields()).containsExactly("_controller");
        assertThat(state.methods()).extracting(m -> m.name()).containsExactly("_increment");
    }

    /**
     * Constructor parameters merge into the field-backed properties.
     */
    @Test
    void mergesFieldsAndConstructorParameters() {
        // Act
        ComponentDeclaration greeting = extract("app.dart", APP).components().get(0);

        // Assert
        assertThat(greeting.properties()).extracting(PropertyDeclaration::name).containsExactly("name", "count");
        PropertyDeclaration name = greeting.properties().get(0);
        PropertyDeclaration count = greeting.properties().get(1);
        assertThat(name.required()).isTrue();
        assertThat(name.readOnly()).isTrue();
        assertThat(name.defaultValue()).isNull();
        assertThat(count.required()).isFalse();
        assertThat(count.defaultValue()).isInstanceOfSatisfying(LiteralExpr.class,
                literal -> assertThat(literal.value()).isEqualTo("1"));
    }

    /**
     * Build trees resolve locals, keep list order and record collection-if branches.
     */
    @Test
    void reconstructsComponentTree() {
        // Act
        BuildDeclaration build = extract("app.dart", APP).components().get(0).build();

        // Assert
        ComponentNode column = build.tree();
        assertThat(column.type()).isEqualTo("Column");
        assertThat(column.children()).extracting(ComponentNode::type).containsExactly("Text", "Text", "Padding");
        assertThat(column.children()).allSatisfy(child -> assertThat(child.slot()).isEqualTo("children"));
        ComponentNode padding = column.children().get(2);
        assertThat(padding.properties()).containsKey("padding");
        assertThat(padding.children()).extracting(ComponentNode::type).containsExactly("Icon");
        assertThat(build.branches()).singleElement().satisfies(branch -> {
            assertThat(branch.thenTree().type()).isEqualTo("Text");
            assertThat(branch.elseTree().type()).isEqualTo("Text");
        });
    }

    /**
     * An early conditional return keeps both alternatives and uses the then-tree as primary.
     */
    @Test
    void conditionalReturnKeepsBothAlternatives() {
        // Act
        BuildDeclaration build = extract("app.dart", APP).stateHolders().get(0).build();

        // Assert
        assertThat(build.tree().type()).isEqualTo("Text");
        ConditionalBranch branch = build.branches().get(0);
        assertThat(branch.elseTree().type()).isEqualTo("ElevatedButton");
        assertThat(branch.elseTree().children()).extracting(ComponentNode::type).containsExactly("Text");
        assertThat(build.referencedTypes()).contains("Text", "ElevatedButton");
    }

    /**
     * Declaration ids depend only on file and name.
     */
    @Test
    void declarationIdsAreStable() {
        // Act
        FileDeclaration first = extract("app.dart", APP);
        FileDeclaration second = extract("app.dart", APP);
        FileDeclaration moved = extract("moved.dart", APP);

        // Assert
        assertThat(first).isEqualTo(second);
        assertThat(first.components().get(0).id()).hasSize(16).isEqualTo(second.components().get(0).id());
        assertThat(moved.components().get(0).id()).isNotEqualTo(first.components().get(0).id());
    }

    /**
     * The unit and the context must describe the same file.
     */
    @Test
    void rejectsMismatchedContext() {
        // Arrange
        AnalysisContext context = new AnalysisContext(file("other.dart"), new SymbolRegistry(), null);

        // Act & Assert
        assertThatThrownBy(() -> new IrExtractor().extract(parse(file("app.dart"), APP), context,
                new DiagnosticsEngine()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * A class extending a project base class is classified through the registry.
     */
    @Test
    void classifiesThroughRegisteredSupertypes() {
        // Arrange
        DartFixtures fixtures = new DartFixtures()
                .add("base.dart", "abstract class BasePage extends StatelessWidget {}\n");

        // Act
        fixtures.add("page.dart", """
                class HomePage extends BasePage {
                  Widget build(BuildContext context) => Scaffold(body: Text('home'));
                }
                """);

        // Assert
        assertThat(fixtures.declaration("page.dart").plainTypes()).isEmpty();
        assertThat(fixtures.declaration("page.dart").components()).singleElement()
                .satisfies(c -> assertThat(c.build().tree().children()).extracting(ComponentNode::slot)
                        .containsExactly("body"));
    }

    /**
     * A widget that also implements {@code PreferredSizeWidget} is still extracted as a component.
     */
    @Test
    void preferredSizeWidgetsStayComponents() {
        // Act
        FileDeclaration declaration = extract("bars.dart", """
                class MyBar extends StatelessWidget implements PreferredSizeWidget {
                  @override
                  Widget build(BuildContext context) => AppBar(title: Text('bar'));
                }

                class SearchBar extends StatefulWidget implements PreferredSizeWidget {
                  @override
                  State<SearchBar> createState() => _SearchBarState();
                }
                """);

        // Assert
        assertThat(declaration.plainTypes()).isEmpty();
        assertThat(declaration.components()).extracting(ComponentDeclaration::name, ComponentDeclaration::kind)
                .containsExactly(tuple("MyBar", ComponentKind.STATELESS), tuple("SearchBar", ComponentKind.STATEFUL));
        assertThat(declaration.components().get(0).build().tree().type()).isEqualTo("AppBar");
    }

    /**
     * Collection-for bodies and spread list literals contribute children to the tree.
     */
    @Test
    void collectionForAndSpreadContributeChildren() {
        // Act
        FileDeclaration declaration = extract("list.dart", """
                class Items extends StatelessWidget {
                  @override
                  Widget build(BuildContext context) {
                    return Column(children: [
                      for (final item in items) Tile(item),
                      for (var i = 0; i < 3; i++) Gap(i),
                      ...[Divider(), Footer()],
                    ]);
                  }
                }
                """);

        // Assert
        ComponentNode column = declaration.components().get(0).build().tree();
        assertThat(column.children()).extracting(ComponentNode::type)
                .containsExactly("Tile", "Gap", "Divider", "Footer");
    }
}
