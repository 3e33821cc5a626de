package org.flutterjs.analyzer.backend.link;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.backend.validate.ValidationError;
import org.flutterjs.analyzer.frontend.module.DependencyGraph;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.FileDeclaration;
import org.flutterjs.analyzer.ir.GraphEdge;
import org.flutterjs.analyzer.ir.GraphNode;
import org.flutterjs.analyzer.testutils.DartFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.flutterjs.analyzer.testutils.DartFixtures.extract;
import static org.flutterjs.analyzer.testutils.DartFixtures.file;

/**
 * Tests merging and graph derivation of the {@link DeclarationLinker}.
 */
@Tag("unit")
class DeclarationLinkerTest {

    private static final String COUNTER = """
            class Counter extends StatefulWidget {
              @override
              State<Counter> createState() => _CounterState();
            }
            """;

    private static final String COUNTER_STATE = """
            class _CounterState extends State<Counter> {
              @override
              Widget build(BuildContext context) => Text('0');
            }
            """;

    private static final String CART = """
            class CartStore extends ChangeNotifier {
              int items = 0;

              void add() {
                items++;
                notifyListeners();
              }
            }
            """;

    /**
     * A stateful component and its state holder in different files are joined by a has-state edge.
     */
    @Test
    void bindsStateAcrossFiles() {
        // Arrange
        DartFixtures fixtures = new DartFixtures()
                .add("counter.dart", COUNTER)
                .add("counter_state.dart", COUNTER_STATE);

        // Act
        ApplicationDeclaration application = fixtures.link();

        // Assert
        ComponentDeclaration counter = application.component("Counter").orElseThrow();
        assertThat(application.stateHolderOf(counter)).hasValueSatisfying(
                holder -> assertThat(holder.name()).isEqualTo("_CounterState"));
        assertThat(application.componentGraph().edgesOfKind(GraphEdge.Kind.HAS_STATE)).singleElement()
                .satisfies(edge -> {
                    assertThat(edge.from()).isEqualTo(counter.id());
                    assertThat(edge.to()).isEqualTo(application.stateHolder("_CounterState").orElseThrow().id());
                });
        assertThat(application.componentGraph().nodes()).extracting(GraphNode::kind)
                .containsExactly(GraphNode.Kind.COMPONENT, GraphNode.Kind.STATE_HOLDER);
    }

    /**
     * Without its state holder the component stays unbound and validation reports it.
     */
    @Test
    void missingStateHolderLeavesComponentUnbound() {
        // Arrange
        DartFixtures fixtures = new DartFixtures().add("counter.dart", COUNTER);

        // Act
        ApplicationDeclaration application = fixtures.link();

        // Assert
        assertThat(application.componentGraph().edges()).isEmpty();
        assertThat(application.component("Counter").orElseThrow().stateHolderName()).isEqualTo("_CounterState");
        assertThat(fixtures.validate().errorCount(ValidationError.Type.MISSING_STATE_CLASS)).isEqualTo(1);
    }

    /**
     * Classes notifying listeners are moved from the plain types to the observable states.
     */
    @Test
    void reclassifiesObservableState() {
        // Arrange
        DartFixtures fixtures = new DartFixtures()
                .add("cart.dart", CART)
                .add("theme.dart", "class ThemeModel with ChangeNotifier {}\nclass Palette {}\n");

        // Act
        ApplicationDeclaration application = fixtures.link();

        // Assert
        assertThat(application.observableStates()).extracting(o -> o.name())
                .containsExactly("CartStore", "ThemeModel");
        assertThat(application.plainTypes()).extracting(p -> p.name()).containsExactly("Palette");
        assertThat(application.fileStructure()).containsEntry("/app/lib/cart.dart", List.of("CartStore"));
    }

    /**
     * Rendering another project component yields a composes edge; framework components do not.
     */
    @Test
    void addsCompositionEdges() {
        // Arrange
        DartFixtures fixtures = new DartFixtures()
                .add("badge.dart", """
                        class Badge extends StatelessWidget {
                          Widget build(BuildContext context) => Text('1');
                        }
                        """)
                .add("page.dart", """
                        class Page extends StatelessWidget {
                          final bool compact;
                          Page(this.compact);
                          Widget build(BuildContext context) {
                            return Scaffold(body: compact ? SizedBox() : Badge());
                          }
                        }
                        """);

        // Act
        ApplicationDeclaration application = fixtures.link();

        // Assert
        String page = application.component("Page").orElseThrow().id();
        String badge = application.component("Badge").orElseThrow().id();
        assertThat(application.componentGraph().edgesFrom(page)).singleElement().satisfies(edge -> {
            assertThat(edge.kind()).isEqualTo(GraphEdge.Kind.COMPOSES);
            assertThat(edge.to()).isEqualTo(badge);
            assertThat(edge.label()).isEqualTo("Badge");
        });
    }

    /**
     * Reads of observable state through the context or a consumer add depends-on edges.
     */
    @Test
    void addsStateDependencyEdges() {
        // Arrange
        DartFixtures fixtures = new DartFixtures()
                .add("cart.dart", CART)
                .add("summary.dart", """
                        class Summary extends StatelessWidget {
                          Widget build(BuildContext context) {
                            final cart = context.watch<CartStore>();
                            return Text('${cart.items}');
                          }
                        }
                        class Total extends StatelessWidget {
                          Widget build(BuildContext context) {
                            return Consumer<CartStore>(builder: (context, cart, child) => Text('total'));
                          }
                        }
                        """);

        // Act
        ApplicationDeclaration application = fixtures.link();

        // Assert
        String store = application.observableStates().get(0).id();
        assertThat(application.componentGraph().edgesOfKind(GraphEdge.Kind.DEPENDS_ON))
                .extracting(GraphEdge::to, GraphEdge::label)
                .containsExactly(
                        tuple(store, "watch"),
                        tuple(store, "Consumer"));
    }

    /**
     * The result does not depend on the iteration order of the input map.
     */
    @Test
    void linkingIsDeterministic() {
        // Arrange
        FileIdentity counter = file("counter.dart");
        FileIdentity state = file("counter_state.dart");
        FileDeclaration counterDeclaration = extract("counter.dart", COUNTER);
        FileDeclaration stateDeclaration = extract("counter_state.dart", COUNTER_STATE);
        Map<FileIdentity, FileDeclaration> forward = new LinkedHashMap<>();
        forward.put(counter, counterDeclaration);
        forward.put(state, stateDeclaration);
        Map<FileIdentity, FileDeclaration> backward = new LinkedHashMap<>();
        backward.put(state, stateDeclaration);
        backward.put(counter, counterDeclaration);
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(state, counter);

        // Act
        DeclarationLinker linker = new DeclarationLinker();
        ApplicationDeclaration first = linker.link(forward, graph, null);
        ApplicationDeclaration second = linker.link(backward, graph, null);

        // Assert
        assertThat(first).isEqualTo(second);
        assertThat(first.files()).containsExactly(counter, state);
    }
}
