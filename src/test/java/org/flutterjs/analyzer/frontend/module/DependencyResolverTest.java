package org.flutterjs.analyzer.frontend.module;

import org.flutterjs.analyzer.api.AnalysisException;
import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.config.AnalyzerOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.analyzer.testutils.DartFixtures.project;
import static org.flutterjs.analyzer.testutils.DartFixtures.write;

/**
 * Tests the lexical reference scan and the resolution of package and relative URIs.
 */
@Tag("unit")
class DependencyResolverTest {

    @TempDir
    Path root;

    private DependencyResolver resolver;

    @BeforeEach
    void setUp() throws AnalysisException {
        project(root);
        resolver = new DependencyResolver(ProjectLayout.open(root, AnalyzerOptions.defaults()));
    }

    /**
     * SDK imports and commented-out directives are not references; part directives are.
     */
    @Test
    void scanSkipsSdkImportsAndComments() {
        // Arrange
        String source = """
                import 'dart:async';
                import 'package:flutter/material.dart';
                // import 'old.dart';
                /* export 'gone.dart'; */
                import "models/user.dart" show User;
                export 'src/api.dart';
                part 'main.g.dart';
                part of 'library.dart';
                """;

        // Act
        List<String> references = resolver.scanReferences(source);

        // Assert
        assertThat(references).containsExactly(
                "package:flutter/material.dart", "models/user.dart", "src/api.dart", "main.g.dart");
    }

    /**
     * Own-package URIs resolve below the source root, relative URIs against the importing file,
     * and external or missing targets are dropped.
     */
    @Test
    void resolvesOwnPackageAndRelativeReferences() {
        // Arrange
        FileIdentity main = write(root, "lib/main.dart", "");
        FileIdentity user = write(root, "lib/models/user.dart", "");
        FileIdentity api = write(root, "lib/src/api.dart", "");

        // Act & Assert
        assertThat(resolver.resolve(main, "package:demo/models/user.dart")).contains(user);
        assertThat(resolver.resolve(main, "./src/api.dart")).contains(api);
        assertThat(resolver.resolve(main, "src/api.dart")).contains(api);
        assertThat(resolver.resolve(user, "../src/api.dart")).contains(api);
        assertThat(resolver.resolve(main, "package:flutter/material.dart")).isEmpty();
        assertThat(resolver.resolve(main, "missing.dart")).isEmpty();
    }

    /**
     * Resolutions are memoized until the cache is cleared, so a file created later is only
     * found after {@link DependencyResolver#clearCache()}.
     */
    @Test
    void clearCacheForgetsMemoizedResolutions() {
        // Arrange
        FileIdentity main = write(root, "lib/main.dart", "import 'late.dart';\n");
        assertThat(resolver.resolve(main, "late.dart")).isEmpty();
        FileIdentity late = write(root, "lib/late.dart", "class Late {}\n");

        // Act
        boolean foundBeforeClear = resolver.resolve(main, "late.dart").isPresent();
        resolver.clearCache();

        // Assert
        assertThat(foundBeforeClear).isFalse();
        assertThat(resolver.resolve(main, "late.dart")).contains(late);
    }

    /**
     * Excluded files never become edge targets even when they exist.
     */
    @Test
    void excludedTargetsAreDropped() {
        // Arrange
        FileIdentity model = write(root, "lib/model.dart", "part 'model.g.dart';\n");
        write(root, "lib/model.g.dart", "part of 'model.dart';\n");

        // Act & Assert
        assertThat(resolver.resolve(model, "model.g.dart")).isEmpty();
    }

    /**
     * Every file becomes a node and every resolvable reference an edge.
     */
    @Test
    void buildGraphAddsNodesAndEdges() throws AnalysisException {
        // Arrange
        FileIdentity a = write(root, "lib/a.dart", "class A {}\n");
        FileIdentity b = write(root, "lib/b.dart", "import 'a.dart';\nimport 'package:http/http.dart';\n");
        FileIdentity c = write(root, "lib/c.dart", "import 'package:demo/b.dart';\n");
        FileIdentity lonely = write(root, "lib/lonely.dart", "");

        // Act
        DependencyGraph graph = resolver.buildGraph(List.of(a, b, c, lonely));

        // Assert
        assertThat(graph.nodes()).containsExactlyInAnyOrder(a, b, c, lonely);
        assertThat(graph.dependenciesOf(b)).containsExactly(a);
        assertThat(graph.dependenciesOf(c)).containsExactly(b);
        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.topologicalSort()).containsSubsequence(a, b, c);
    }
}
