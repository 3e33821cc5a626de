package org.flutterjs.analyzer.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the layering of configuration sources and their mapping to {@link AnalyzerOptions}.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String PARALLELISM_PROPERTY = "analyzer.max-parallelism";

    @AfterEach
    void tearDown() {
        System.clearProperty(PARALLELISM_PROPERTY);
        ConfigFactory.invalidateCaches();
    }

    /**
     * Without a file the reference defaults apply.
     */
    @Test
    void defaultsComeFromReferenceConf() {
        // Act
        AnalyzerOptions options = AnalyzerOptions.defaults();

        // Assert
        assertThat(options.maxParallelism()).isEqualTo(4);
        assertThat(options.parallel()).isTrue();
        assertThat(options.cacheEnabled()).isTrue();
        assertThat(options.cacheDirectory()).isEqualTo(".flutter_js/cache");
        assertThat(options.sourceDirectory()).isEqualTo("lib");
        assertThat(options.manifest()).isEqualTo("pubspec.yaml");
        assertThat(options.excludes()).contains("**/*.g.dart");
        assertThat(options.verbose()).isFalse();
    }

    /**
     * Values from the file override the defaults and leave the rest untouched.
     */
    @Test
    void fileOverridesDefaults(@TempDir Path directory) throws Exception {
        // Arrange
        File file = directory.resolve("analyzer.conf").toFile();
        Files.writeString(file.toPath(), "analyzer { parallel = false, cache.directory = \"out/cache\" }\n",
                StandardCharsets.UTF_8);

        // Act
        AnalyzerOptions options = AnalyzerOptions.fromConfig(ConfigLoader.load(file));

        // Assert
        assertThat(options.parallel()).isFalse();
        assertThat(options.effectiveParallelism()).isEqualTo(1);
        assertThat(options.cacheDirectory()).isEqualTo("out/cache");
        assertThat(options.maxParallelism()).isEqualTo(4);
    }

    /**
     * System properties win over the file.
     */
    @Test
    void systemPropertiesOverrideFile(@TempDir Path directory) throws Exception {
        // Arrange
        File file = directory.resolve("analyzer.conf").toFile();
        Files.writeString(file.toPath(), "analyzer.max-parallelism = 2\n", StandardCharsets.UTF_8);
        System.setProperty(PARALLELISM_PROPERTY, "7");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertThat(AnalyzerOptions.fromConfig(config).maxParallelism()).isEqualTo(7);
    }

    /**
     * Invalid values are rejected and the copy methods change exactly one setting.
     */
    @Test
    void optionsValidateAndCopy() {
        // Arrange
        AnalyzerOptions defaults = AnalyzerOptions.defaults();

        // Act
        AnalyzerOptions changed = defaults.withMaxParallelism(1).withCacheEnabled(false).withCacheDirectory("c");

        // Assert
        assertThat(changed.maxParallelism()).isEqualTo(1);
        assertThat(changed.cacheEnabled()).isFalse();
        assertThat(changed.cacheDirectory()).isEqualTo("c");
        assertThat(changed.excludes()).isEqualTo(defaults.excludes());
        assertThat(defaults.withParallel(false).effectiveParallelism()).isEqualTo(1);
        assertThatThrownBy(() -> defaults.withMaxParallelism(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
