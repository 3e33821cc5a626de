package org.flutterjs.analyzer.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.flutterjs.analyzer.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.analyzer.testutils.DartFixtures.project;
import static org.flutterjs.analyzer.testutils.DartFixtures.write;

/**
 * Runs the {@code analyze} subcommand the way the launcher does and checks exit codes and output.
 */
@Tag("unit")
class AnalyzeCommandTest {

    private static final String CARD = """
            class Card extends StatelessWidget {
              final String title;
              Card(this.title);
              Widget build(BuildContext context) => Text(title);
            }
            """;

    @TempDir
    Path root;

    private StringWriter out;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        project(root);
        out = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
    }

    /**
     * A valid project exits with 0 and prints the text report.
     */
    @Test
    void validProjectExitsWithZero() {
        // Arrange
        write(root, "lib/card.dart", CARD);

        // Act
        int exitCode = commandLine.execute("analyze", "-p", root.toString(), "--no-cache");

        // Assert
        assertThat(exitCode).isEqualTo(AnalyzeCommand.EXIT_OK);
        assertThat(out.toString()).contains("VALID (0 errors").contains("Card [STATELESS]").contains("card.dart");
    }

    /**
     * JSON output summarizes statistics, components and validation.
     */
    @Test
    void printsJson() throws Exception {
        // Arrange
        write(root, "lib/card.dart", CARD);

        // Act
        int exitCode = commandLine.execute("analyze", "--project", root.toString(), "--json", "--no-parallel");

        // Assert
        assertThat(exitCode).isEqualTo(AnalyzeCommand.EXIT_OK);
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.get("successful").asBoolean()).isTrue();
        assertThat(json.get("statistics").get("totalFiles").asInt()).isEqualTo(1);
        assertThat(json.get("components")).hasSize(1);
        assertThat(json.get("components").get(0).get("name").asText()).isEqualTo("Card");
        assertThat(json.get("validation").get("valid").asBoolean()).isTrue();
        assertThat(Files.isDirectory(root.resolve(".flutter_js/cache"))).isTrue();
    }

    /**
     * Structural errors exit with 1.
     */
    @Test
    void invalidProjectExitsWithOne() {
        // Arrange
        write(root, "lib/card.dart", CARD);
        write(root, "lib/copy.dart", CARD);

        // Act
        int exitCode = commandLine.execute("analyze", "-p", root.toString(), "--no-cache");

        // Assert
        assertThat(exitCode).isEqualTo(AnalyzeCommand.EXIT_INVALID);
        assertThat(out.toString()).contains("INVALID").contains("DUPLICATE_DECLARATION");
    }

    /**
     * Files that fail to parse exit with 1 and are listed with their diagnostics.
     */
    @Test
    void failedFilesExitWithOne() {
        // Arrange
        write(root, "lib/card.dart", CARD);
        write(root, "lib/broken.dart", "class Broken {\n");

        // Act
        int exitCode = commandLine.execute("analyze", "-p", root.toString(), "--no-cache");

        // Assert
        assertThat(exitCode).isEqualTo(AnalyzeCommand.EXIT_INVALID);
        assertThat(out.toString()).contains("Diagnostics:").contains("broken.dart");
    }

    /**
     * A project that cannot be opened exits with 2.
     */
    @Test
    void missingProjectExitsWithTwo() {
        // Act
        int exitCode = commandLine.execute("analyze", "-p", root.resolve("nowhere").toString());

        // Assert
        assertThat(exitCode).isEqualTo(AnalyzeCommand.EXIT_FATAL);
        assertThat(out.toString()).isEmpty();
    }

    /**
     * An explicitly named configuration file must exist, and its values must be valid.
     */
    @Test
    void badConfigurationExitsWithTwo() throws Exception {
        // Arrange
        Path invalid = root.resolve("invalid.conf");
        Files.writeString(invalid, "analyzer.max-parallelism = 0\n");

        // Act
        int missing = commandLine.execute("analyze", "-p", root.toString(), "-c", root.resolve("none.conf").toString());
        int rejected = commandLine.execute("analyze", "-p", root.toString(), "-c", invalid.toString());

        // Assert
        assertThat(missing).isEqualTo(AnalyzeCommand.EXIT_FATAL);
        assertThat(rejected).isEqualTo(AnalyzeCommand.EXIT_FATAL);
    }
}
