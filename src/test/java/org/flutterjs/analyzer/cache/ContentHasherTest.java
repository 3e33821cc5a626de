package org.flutterjs.analyzer.cache;

import org.flutterjs.analyzer.api.FileIdentity;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.analyzer.testutils.DartFixtures.write;

@Tag("unit")
class ContentHasherTest {

    /**
     * Line endings and trailing whitespace do not change the hash.
     */
    @Test
    void ignoresLineEndingsAndTrailingWhitespace() {
        // Arrange
        String unix = "class A {}\nclass B {}\n";
        String windows = "class A {}   \r\nclass B {}\t\r\n\r\n";

        // Act & Assert
        assertThat(ContentHasher.hash(windows)).isEqualTo(ContentHasher.hash(unix));
        assertThat(ContentHasher.hash(unix)).hasSize(32).matches("[0-9a-f]+");
    }

    /**
     * Any change to the code itself changes the hash.
     */
    @Test
    void detectsContentChanges() {
        assertThat(ContentHasher.hash("class A {}")).isNotEqualTo(ContentHasher.hash("class B {}"));
        assertThat(ContentHasher.hash("a\n  b")).isNotEqualTo(ContentHasher.hash("a\nb"));
    }

    /**
     * Hashing a file agrees with hashing its text.
     */
    @Test
    void hashesFiles(@TempDir Path root) throws Exception {
        // Arrange
        FileIdentity file = write(root, "lib/a.dart", "class A {}\r\n");

        // Act
        String hash = ContentHasher.hashFile(file);

        // Assert
        assertThat(hash).isEqualTo(ContentHasher.hash(Files.readString(file.toPath())))
                .isEqualTo(ContentHasher.hash("class A {}"));
    }
}
