package org.flutterjs.analyzer.frontend.module;

import org.flutterjs.analyzer.api.AnalysisException;
import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.config.AnalyzerOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.flutterjs.analyzer.testutils.DartFixtures.project;
import static org.flutterjs.analyzer.testutils.DartFixtures.write;

/**
 * Tests opening a project and discovering its source files.
 */
@Tag("unit")
class ProjectLayoutTest {

    @TempDir
    Path root;

    /**
     * The package name comes from the manifest and generated or test files are skipped.
     */
    @Test
    void discoversSourcesAndSkipsExcludedFiles() throws AnalysisException {
        // Arrange
        project(root);
        FileIdentity main = write(root, "lib/main.dart", "");
        FileIdentity widget = write(root, "lib/ui/widget.dart", "");
        write(root, "lib/model.g.dart", "");
        write(root, "lib/model.freezed.dart", "");
        write(root, "lib/test/helper.dart", "");
        write(root, "lib/notes.txt", "");

        // Act
        ProjectLayout layout = ProjectLayout.open(root, AnalyzerOptions.defaults());
        List<FileIdentity> files = layout.discoverSourceFiles();

        // Assert
        assertThat(layout.packageName()).isEqualTo("demo");
        assertThat(files).containsExactly(main, widget);
    }

    /**
     * A project without a manifest cannot be analyzed.
     */
    @Test
    void missingManifestIsFatal() throws Exception {
        // Arrange
        Files.createDirectories(root.resolve("lib"));

        // Act & Assert
        assertThatThrownBy(() -> ProjectLayout.open(root, AnalyzerOptions.defaults()))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Manifest not found");
    }

    /**
     * A project without a source directory cannot be analyzed.
     */
    @Test
    void missingSourceDirectoryIsFatal() throws Exception {
        // Arrange
        Files.writeString(root.resolve("pubspec.yaml"), "name: demo\n", StandardCharsets.UTF_8);

        // Act & Assert
        assertThatThrownBy(() -> ProjectLayout.open(root, AnalyzerOptions.defaults()))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Source directory not found");
    }

    /**
     * A manifest without a package name is rejected.
     */
    @Test
    void manifestWithoutNameIsFatal() throws Exception {
        // Arrange
        Files.createDirectories(root.resolve("lib"));
        Files.writeString(root.resolve("pubspec.yaml"), "version: 1.0.0\n", StandardCharsets.UTF_8);

        // Act & Assert
        assertThatThrownBy(() -> ProjectLayout.open(root, AnalyzerOptions.defaults()))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("declares no package name");
    }

    /**
     * A missing project root is reported before anything else.
     */
    @Test
    void missingRootIsFatal() {
        // Act & Assert
        assertThatThrownBy(() -> ProjectLayout.open(root.resolve("nowhere"), AnalyzerOptions.defaults()))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Project directory not found");
    }
}
