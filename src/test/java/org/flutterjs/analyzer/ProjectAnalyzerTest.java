package org.flutterjs.analyzer;

import org.flutterjs.analyzer.api.AnalysisException;
import org.flutterjs.analyzer.api.AnalysisPhase;
import org.flutterjs.analyzer.api.AnalysisProgress;
import org.flutterjs.analyzer.api.AnalysisResult;
import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.config.AnalyzerOptions;
import org.flutterjs.analyzer.diagnostics.Diagnostic;
import org.flutterjs.analyzer.frontend.parser.DartSourceParser;
import org.flutterjs.analyzer.frontend.parser.SourceParser;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.GraphEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.flutterjs.analyzer.testutils.DartFixtures.project;
import static org.flutterjs.analyzer.testutils.DartFixtures.write;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * End-to-end runs of the {@link ProjectAnalyzer} over projects on disk.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ProjectAnalyzerTest {

    private static final String LABEL = """
            import 'package:flutter/material.dart';

            class Label extends StatelessWidget {
              final String text;
              const Label({super.key, required this.text});

              @override
              Widget build(BuildContext context) => Text(text);
            }
            """;

    private static final String PANEL = """
            import 'package:flutter/material.dart';
            import 'a.dart';

            class Panel extends StatefulWidget {
              const Panel({super.key});

              @override
              State<Panel> createState() => _PanelState();
            }

            class _PanelState extends State<Panel> {
              bool _open = false;

              @override
              Widget build(BuildContext context) {
                return Column(children: [Label(text: 'title'), if (_open) Text('body')]);
              }
            }
            """;

    private static final String HOME = """
            import 'package:flutter/material.dart';
            import 'package:demo/b.dart';

            class Home extends StatelessWidget {
              @override
              Widget build(BuildContext context) => Scaffold(body: Panel());
            }
            """;

    @TempDir
    Path root;

    @Mock
    private Consumer<AnalysisProgress> listener;

    private FileIdentity a;
    private FileIdentity b;
    private FileIdentity c;
    private AnalyzerOptions options;

    @BeforeEach
    void setUp() {
        project(root);
        a = write(root, "lib/a.dart", LABEL);
        b = write(root, "lib/b.dart", PANEL);
        c = write(root, "lib/c.dart", HOME);
        options = AnalyzerOptions.defaults();
    }

    /**
     * A first run analyzes every file in dependency order and links the whole project.
     */
    @Test
    void firstRunAnalyzesEverything() throws Exception {
        // Act
        AnalysisResult result;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            result = analyzer.analyze();
            assertThat(analyzer.phase()).isEqualTo(AnalysisPhase.COMPLETE);
        }

        // Assert
        assertThat(result.order()).containsExactly(a, b, c);
        assertThat(result.dirtyFiles()).containsExactlyInAnyOrder(a, b, c);
        assertThat(result.successful()).isTrue();
        assertThat(result.statistics().totalFiles()).isEqualTo(3);
        assertThat(result.statistics().processedFiles()).isEqualTo(3);
        assertThat(result.statistics().errorFiles()).isZero();
        assertThat(result.statistics().batches()).isEqualTo(3);
        assertThat(result.application().components()).extracting(ComponentDeclaration::name)
                .containsExactly("Label", "Panel", "Home");
        assertThat(result.application().component("Panel").orElseThrow().stateHolderName()).isEqualTo("_PanelState");
        assertThat(result.application().componentGraph().edgesOfKind(GraphEdge.Kind.COMPOSES))
                .extracting(GraphEdge::label)
                .containsExactlyInAnyOrder("Label", "Panel");
        assertThat(Files.exists(root.resolve(".flutter_js/cache/hash_index.json"))).isTrue();
    }

    /**
     * A stateful component and its state holder declared in an imported file are bound without errors.
     */
    @Test
    void bindsStatefulComponentInImportedFile() throws Exception {
        // Arrange
        Path other = project(root.resolve("other"));
        FileIdentity base = write(other, "lib/a.dart", "const String greeting = 'hi';\n");
        FileIdentity widget = write(other, "lib/b.dart", """
                import 'a.dart';

                class W extends StatefulWidget {
                  @override
                  State<W> createState() => _WState();
                }

                class _WState extends State<W> {
                  @override
                  Widget build(BuildContext context) => Text(greeting);
                }
                """);
        FileIdentity app = write(other, "lib/c.dart", "import 'b.dart';\n\nvoid main() => runApp(W());\n");

        // Act
        AnalysisResult result;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(other, options)) {
            result = analyzer.analyze();
        }

        // Assert
        assertThat(result.order()).containsExactly(base, widget, app);
        assertThat(result.dirtyFiles()).containsExactlyInAnyOrder(base, widget, app);
        assertThat(result.application().components()).singleElement().satisfies(w -> {
            assertThat(w.name()).isEqualTo("W");
            assertThat(w.stateHolderName()).isEqualTo("_WState");
        });
        assertThat(result.validation().errors()).isEmpty();
    }

    /**
     * Unchanged files are served from the cache, by the same instance and by a new one.
     */
    @Test
    void repeatedRunsReuseTheCache() throws Exception {
        // Arrange
        AnalysisResult first;
        AnalysisResult second;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            first = analyzer.analyze();

            // Act
            second = analyzer.analyze();
        }
        AnalysisResult restarted;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            restarted = analyzer.analyze();
        }

        // Assert
        assertThat(second.dirtyFiles()).isEmpty();
        assertThat(second.statistics().batches()).isZero();
        assertThat(second.application()).isEqualTo(first.application());
        assertThat(restarted.dirtyFiles()).isEmpty();
        assertThat(restarted.statistics().cachedFiles()).isEqualTo(3);
        assertThat(restarted.statistics().cacheHitRate()).isEqualTo(1.0);
        assertThat(restarted.application()).isEqualTo(first.application());
        assertThat(restarted.validation()).isEqualTo(first.validation());
    }

    /**
     * A change invalidates the file and everything that imports it, directly or not.
     */
    @Test
    void changesPropagateToDependents() throws Exception {
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            analyzer.analyze();

            // Act
            modify(a, LABEL.replace("Text(text)", "Text(text.toUpperCase())"));
            AnalysisResult afterBase = analyzer.analyze();
            modify(c, HOME + "\nclass Footer extends StatelessWidget {\n"
                    + "  Widget build(BuildContext context) => Text('footer');\n}\n");
            AnalysisResult afterLeaf = analyzer.analyze();

            // Assert
            assertThat(afterBase.dirtyFiles()).containsExactlyInAnyOrder(a, b, c);
            assertThat(afterLeaf.dirtyFiles()).containsExactly(c);
            assertThat(afterLeaf.statistics().cachedFiles()).isEqualTo(2);
            assertThat(afterLeaf.application().component("Footer")).isPresent();
        }
    }

    /**
     * Whitespace-only edits do not invalidate anything.
     */
    @Test
    void formattingChangesAreIgnored() throws Exception {
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            analyzer.analyze();

            // Act
            modify(a, LABEL.replace("\n", "   \r\n"));
            AnalysisResult result = analyzer.analyze();

            // Assert
            assertThat(result.dirtyFiles()).isEmpty();
        }
    }

    /**
     * A file that does not parse is reported and skipped; the rest of the project is analyzed.
     */
    @Test
    void brokenFileDoesNotStopTheRun() throws Exception {
        // Arrange
        FileIdentity broken = write(root, "lib/d.dart", "class Broken extends StatelessWidget {\n");

        // Act
        AnalysisResult result;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            result = analyzer.analyze();
        }

        // Assert
        assertThat(result.statistics().errorFiles()).isEqualTo(1);
        assertThat(result.statistics().processedFiles()).isEqualTo(3);
        assertThat(result.successful()).isFalse();
        assertThat(result.diagnostics().get(broken)).isNotEmpty()
                .allSatisfy(d -> assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR));
        assertThat(result.fileDeclarations()).doesNotContainKey(broken);
        assertThat(result.application().component("Home")).isPresent();
    }

    /**
     * A failed file is retried on the next run even though its content did not change.
     */
    @Test
    void failedFilesAreRetried() throws Exception {
        // Arrange
        write(root, "lib/d.dart", "class Broken extends StatelessWidget {\n");
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            analyzer.analyze();
        }

        // Act
        AnalysisResult result;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            result = analyzer.analyze();
        }

        // Assert
        assertThat(result.dirtyFiles()).extracting(FileIdentity::fileName).containsExactly("d.dart");
        assertThat(result.statistics().errorFiles()).isEqualTo(1);
    }

    /**
     * Circular imports abort the run.
     */
    @Test
    void circularImportsAreFatal() {
        // Arrange
        write(root, "lib/x.dart", "import 'y.dart';\nclass X {}\n");
        write(root, "lib/y.dart", "import 'x.dart';\nclass Y {}\n");

        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            // Act & Assert
            assertThatThrownBy(analyzer::analyze)
                    .isInstanceOf(AnalysisException.class)
                    .hasMessageContaining("Circular dependency");
            assertThat(analyzer.phase()).isEqualTo(AnalysisPhase.ERROR);
        }
    }

    /**
     * A project without a manifest cannot be analyzed.
     */
    @Test
    void missingManifestIsFatal() throws IOException {
        // Arrange
        Files.delete(root.resolve("pubspec.yaml"));

        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            // Act & Assert
            assertThatThrownBy(analyzer::analyze).isInstanceOf(AnalysisException.class);
        }
    }

    /**
     * Listeners see every phase and the per-file progress, in order.
     */
    @Test
    void reportsProgressToListeners() throws Exception {
        // Arrange
        List<AnalysisPhase> phases = Collections.synchronizedList(new ArrayList<>());

        // Act
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            analyzer.addProgressListener(listener);
            analyzer.addProgressListener(p -> phases.add(p.phase()));
            analyzer.addProgressListener(p -> {
                throw new IllegalStateException("listener failure");
            });
            analyzer.analyze();
        }

        // Assert
        verify(listener, atLeastOnce()).accept(argThat(p -> p.phase() == AnalysisPhase.IR_GENERATED
                && p.total() == 3 && p.current() <= p.total()));
        verify(listener).accept(argThat(p -> p.phase() == AnalysisPhase.COMPLETE));
        assertThat(phases).containsSubsequence(AnalysisPhase.GRAPH_BUILT, AnalysisPhase.CHANGES_DETECTED,
                AnalysisPhase.SYMBOLS_RESOLVED, AnalysisPhase.IR_GENERATED, AnalysisPhase.LINKED,
                AnalysisPhase.CACHE_PERSISTED, AnalysisPhase.COMPLETE);
    }

    /**
     * An unexpected parser failure marks only the affected file as failed.
     */
    @Test
    @MockitoSettings(strictness = Strictness.LENIENT)
    void unexpectedParserFailureIsContained() throws Exception {
        // Arrange
        SourceParser parser = spy(new DartSourceParser());
        doThrow(new IllegalStateException("parser crashed")).when(parser).parse(eq(b), anyString());

        // Act
        AnalysisResult result;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options, parser)) {
            result = analyzer.analyze();
        }

        // Assert
        assertThat(result.statistics().errorFiles()).isEqualTo(1);
        assertThat(result.diagnostics().get(b)).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("parser crashed"));
        assertThat(result.fileDeclarations()).containsOnlyKeys(a, c);
    }

    /**
     * A file nested too deeply to parse fails on its own and the run still completes.
     */
    @Test
    void deeplyNestedFileFailsAlone() throws Exception {
        // Arrange
        FileIdentity deep = write(root, "lib/deep.dart",
                "int f() => " + "(".repeat(20_000) + "1" + ")".repeat(20_000) + ";\n");

        // Act
        AnalysisResult result;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options.withParallel(false))) {
            result = analyzer.analyze();
            assertThat(analyzer.phase()).isEqualTo(AnalysisPhase.COMPLETE);
        }

        // Assert
        assertThat(result.statistics().errorFiles()).isEqualTo(1);
        assertThat(result.diagnostics().get(deep)).isNotEmpty();
        assertThat(result.fileDeclarations()).containsOnlyKeys(a, b, c);
    }

    /**
     * A stack overflow while processing one file is contained like any other per-file failure.
     */
    @Test
    @MockitoSettings(strictness = Strictness.LENIENT)
    void stackOverflowIsContained() throws Exception {
        // Arrange
        SourceParser parser = spy(new DartSourceParser());
        doThrow(new StackOverflowError()).when(parser).parse(eq(b), anyString());

        // Act
        AnalysisResult result;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options.withParallel(false), parser)) {
            result = analyzer.analyze();
            assertThat(analyzer.phase()).isEqualTo(AnalysisPhase.COMPLETE);
        }

        // Assert
        assertThat(result.statistics().errorFiles()).isEqualTo(1);
        assertThat(result.diagnostics().get(b)).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("StackOverflowError"));
        assertThat(result.fileDeclarations()).containsOnlyKeys(a, c);
    }

    /**
     * An {@link Error} escaping the pipeline still moves the analyzer into the error phase.
     */
    @Test
    void escapingErrorEndsInErrorPhase() {
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, options)) {
            // Arrange
            analyzer.addProgressListener(p -> {
                if (p.phase() == AnalysisPhase.GRAPH_BUILT) throw new AssertionError("listener crashed");
            });

            // Act & Assert
            assertThatThrownBy(analyzer::analyze)
                    .isInstanceOf(AssertionError.class)
                    .hasMessage("listener crashed");
            assertThat(analyzer.phase()).isEqualTo(AnalysisPhase.ERROR);
        }
    }

    /**
     * Sequential and parallel runs produce the same application.
     */
    @Test
    void parallelismDoesNotChangeTheResult() throws Exception {
        // Arrange
        write(root, "lib/d.dart", LABEL.replace("Label", "Caption"));
        write(root, "lib/e.dart", LABEL.replace("Label", "Hint"));
        AnalyzerOptions sequential = options.withParallel(false).withCacheEnabled(false);
        AnalyzerOptions parallel = options.withMaxParallelism(4).withCacheEnabled(false);

        // Act
        AnalysisResult one;
        AnalysisResult many;
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, sequential)) {
            one = analyzer.analyze();
        }
        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, parallel)) {
            many = analyzer.analyze();
        }

        // Assert
        assertThat(many.application()).isEqualTo(one.application());
        assertThat(one.statistics().batches()).isEqualTo(5);
        assertThat(many.statistics().batches()).isLessThan(5);
    }

    /**
     * With the cache disabled every run analyzes every file and nothing is written.
     */
    @Test
    void disabledCacheAnalyzesEverything() throws Exception {
        // Arrange
        AnalyzerOptions noCache = options.withCacheEnabled(false);

        try (ProjectAnalyzer analyzer = new ProjectAnalyzer(root, noCache)) {
            // Act
            analyzer.analyze();
            AnalysisResult second = analyzer.analyze();

            // Assert
            assertThat(second.dirtyFiles()).hasSize(3);
            assertThat(second.statistics().cachedFiles()).isZero();
        }
        assertThat(Files.exists(root.resolve(".flutter_js"))).isFalse();
    }

    private static void modify(FileIdentity file, String source) throws IOException {
        Path path = file.toPath();
        FileTime before = Files.getLastModifiedTime(path);
        Files.writeString(path, source, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(path, FileTime.fromMillis(before.toMillis() + 5_000));
    }
}
