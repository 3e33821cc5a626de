package org.flutterjs.analyzer.backend.validate;

import org.flutterjs.analyzer.testutils.DartFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the structural checks of the {@link DeclarationValidator}.
 */
@Tag("unit")
class DeclarationValidatorTest {

    /**
     * A well-formed stateful component with its state holder produces no findings.
     */
    @Test
    void validApplicationHasNoFindings() {
        // Arrange
        DartFixtures fixtures = new DartFixtures().add("counter.dart", """
                class Counter extends StatefulWidget {
                  final String label;
                  const Counter({super.key, required this.label});
                  @override
                  State<Counter> createState() => _CounterState();
                }
                class _CounterState extends State<Counter> {
                  final TextEditingController _input = TextEditingController();
                  @override
                  void dispose() {
                    this._input.dispose();
                    super.dispose();
                  }
                  @override
                  Widget build(BuildContext context) => TextField(controller: _input);
                }
                """);

        // Act
        ValidationResult result = fixtures.validate();

        // Assert
        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    /**
     * Mutator-like methods of observable state must notify; adding the call clears the warning.
     */
    @Test
    void mutatorsMustNotifyListeners() {
        // Arrange
        String silent = """
                class CartStore extends ChangeNotifier {
                  int items = 0;
                  void add() {
                    items++;
                  }
                  int count() => items;
                  static void reset() {}
                }
                """;

        // Act
        ValidationResult withoutNotify = new DartFixtures().add("cart.dart", silent).validate();
        ValidationResult withNotify = new DartFixtures()
                .add("cart.dart", silent.replace("items++;", "items++;\n    notifyListeners();"))
                .validate();

        // Assert
        assertThat(withoutNotify.valid()).isTrue();
        assertThat(withoutNotify.warnings()).singleElement().satisfies(w -> {
            assertThat(w.type()).isEqualTo(ValidationWarning.Type.MISSING_NOTIFY_LISTENERS);
            assertThat(w.message()).contains("'add'");
        });
        assertThat(withNotify.warnings()).isEmpty();
    }

    /**
     * Assigning {@code value} counts as notifying.
     */
    @Test
    void valueAssignmentNotifies() {
        // Arrange
        DartFixtures fixtures = new DartFixtures().add("toggle.dart", """
                class Toggle extends ValueNotifier<bool> {
                  Toggle() : super(false);
                  void flip() {
                    value = !value;
                  }
                }
                """);

        // Act & Assert
        assertThat(fixtures.validate().warningCount(ValidationWarning.Type.MISSING_NOTIFY_LISTENERS)).isZero();
    }

    /**
     * Controllers need a dispose method that releases each of them.
     */
    @Test
    void controllersMustBeDisposed() {
        // Arrange
        String template = """
                class Search extends StatefulWidget {
                  State<Search> createState() => _SearchState();
                }
                class _SearchState extends State<Search> {
                  final TextEditingController _query = TextEditingController();
                  final ScrollController _scroll = ScrollController();
                  %s
                  Widget build(BuildContext context) => ListView(controller: _scroll);
                }
                """;

        // Act
        ValidationResult noDispose = new DartFixtures()
                .add("search.dart", String.format(template, ""))
                .validate();
        ValidationResult partialDispose = new DartFixtures()
                .add("search.dart", String.format(template, "void dispose() { _query.dispose(); super.dispose(); }"))
                .validate();

        // Assert
        assertThat(noDispose.warningCount(ValidationWarning.Type.MISSING_DISPOSE)).isEqualTo(1);
        assertThat(partialDispose.warningCount(ValidationWarning.Type.MISSING_DISPOSE)).isZero();
        assertThat(partialDispose.warnings()).singleElement().satisfies(w -> {
            assertThat(w.type()).isEqualTo(ValidationWarning.Type.UNDISPOSED_CONTROLLER);
            assertThat(w.message()).contains("_scroll");
        });
    }

    /**
     * Property checks flag required defaults and types nobody declares.
     */
    @Test
    void checksProperties() {
        // Arrange
        DartFixtures fixtures = new DartFixtures()
                .add("model.dart", "class Profile {}\n")
                .add("card.dart", """
                        class ProfileCard<T> extends StatelessWidget {
                          final Profile profile;
                          final T extra;
                          final Gadget gadget;
                          final int size;
                          ProfileCard({required this.profile, required this.extra, required this.gadget,
                              required this.size = 3});
                          Widget build(BuildContext context) => Text('card');
                        }
                        """);

        // Act
        ValidationResult result = fixtures.validate();

        // Assert
        assertThat(result.valid()).isTrue();
        assertThat(result.warningCount(ValidationWarning.Type.REDUNDANT_DEFAULT)).isEqualTo(1);
        assertThat(result.warnings()).filteredOn(w -> w.type() == ValidationWarning.Type.UNKNOWN_TYPE)
                .singleElement()
                .satisfies(w -> assertThat(w.message()).contains("'Gadget'"));
    }

    /**
     * The same component name in two files is an error; state holders without a component are warnings.
     */
    @Test
    void reportsDuplicatesAndOrphans() {
        // Arrange
        String header = """
                class Header extends StatelessWidget {
                  Widget build(BuildContext context) => Text('header');
                }
                """;
        DartFixtures fixtures = new DartFixtures()
                .add("header.dart", header)
                .add("header_copy.dart", header)
                .add("orphan.dart", """
                        class _LostState extends State<Lost> {
                          Widget build(BuildContext context) => Text('lost');
                        }
                        """);

        // Act
        ValidationResult result = fixtures.validate();

        // Assert
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(ValidationError.Type.DUPLICATE_DECLARATION);
            assertThat(e.message()).contains("header.dart");
            assertThat(e.file().fileName()).isEqualTo("header_copy.dart");
        });
        assertThat(result.warningCount(ValidationWarning.Type.ORPHANED_STATE_CLASS)).isEqualTo(1);
    }

    /**
     * Two components rendering each other form one reported cycle.
     */
    @Test
    void reportsComponentCycleOnce() {
        // Arrange
        DartFixtures fixtures = new DartFixtures().add("loop.dart", """
                class Ping extends StatelessWidget {
                  Widget build(BuildContext context) => Column(children: [Pong()]);
                }
                class Pong extends StatelessWidget {
                  Widget build(BuildContext context) => Center(child: Ping());
                }
                """);

        // Act
        ValidationResult result = fixtures.validate();

        // Assert
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(ValidationError.Type.CIRCULAR_DEPENDENCY);
            assertThat(e.message()).contains("Ping").contains("Pong");
        });
    }

    /**
     * Concrete stateless components need a build method; abstract ones do not.
     */
    @Test
    void requiresBuildMethod() {
        // Arrange
        DartFixtures fixtures = new DartFixtures().add("shapes.dart", """
                abstract class Shape extends StatelessWidget {}
                class Square extends Shape {}
                """);

        // Act
        ValidationResult result = fixtures.validate();

        // Assert
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(ValidationError.Type.MISSING_BUILD_METHOD);
            assertThat(e.declaration()).isEqualTo("Square");
        });
    }

    /**
     * Imports repeated with the same prefix and deferred imports are warned about.
     */
    @Test
    void checksImports() {
        // Arrange
        DartFixtures fixtures = new DartFixtures().add("main.dart", """
                import 'package:flutter/material.dart';
                import 'package:flutter/material.dart';
                import 'package:flutter/material.dart' as m;
                import 'heavy.dart' deferred as heavy;
                """);

        // Act
        ValidationResult result = fixtures.validate();

        // Assert
        assertThat(result.warningCount(ValidationWarning.Type.DUPLICATE_IMPORT)).isEqualTo(1);
        assertThat(result.warningCount(ValidationWarning.Type.DEFERRED_IMPORT)).isEqualTo(1);
        assertThat(result.valid()).isTrue();
    }
}
