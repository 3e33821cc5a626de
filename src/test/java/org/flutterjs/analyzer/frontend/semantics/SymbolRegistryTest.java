package org.flutterjs.analyzer.frontend.semantics;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.analyzer.testutils.DartFixtures.file;

/**
 * Tests registration, per-file replacement and visibility in the {@link SymbolRegistry}.
 */
@Tag("unit")
class SymbolRegistryTest {

    private final FileIdentity models = file("models.dart");
    private final FileIdentity screens = file("screens.dart");
    private final FileIdentity other = file("other.dart");

    private static TypeDescriptor type(String name, FileIdentity file) {
        return new TypeDescriptor(name, file.path() + "#" + name, TypeKind.CLASS, file, null, List.of(), List.of(),
                List.of(), TypeRoles.NONE, SourceLocation.UNKNOWN);
    }

    /**
     * Re-resolving a file removes the names it no longer declares.
     */
    @Test
    void replaceFileDropsRenamedTypes() {
        // Arrange
        SymbolRegistry registry = new SymbolRegistry();
        registry.replaceFile(models, List.of(type("User", models), type("Order", models)));

        // Act
        registry.replaceFile(models, List.of(type("Customer", models), type("Order", models)));

        // Assert
        assertThat(registry.lookup("User")).isEmpty();
        assertThat(registry.lookup("Customer")).isPresent();
        assertThat(registry.typesInFile(models)).extracting(TypeDescriptor::name)
                .containsExactlyInAnyOrder("Customer", "Order");
        assertThat(registry.size()).isEqualTo(2);
    }

    /**
     * Names are global: the last registration wins and the previous owner loses the name.
     */
    @Test
    void lastWriterWins() {
        // Arrange
        SymbolRegistry registry = new SymbolRegistry();
        registry.register(type("Item", models));

        // Act
        registry.register(type("Item", screens));
        registry.removeAllForFile(models);

        // Assert
        assertThat(registry.lookup("Item")).map(TypeDescriptor::file).contains(screens);
        assertThat(registry.hasTypesFor(models)).isFalse();
        assertThat(registry.hasTypesFor(screens)).isTrue();
    }

    /**
     * A type is visible in its own file and in files importing its owner.
     */
    @Test
    void availabilityFollowsImports() {
        // Arrange
        SymbolRegistry registry = new SymbolRegistry();
        registry.register(type("User", models));

        // Act & Assert
        assertThat(registry.isAvailableIn("User", models, Set.of())).isTrue();
        assertThat(registry.isAvailableIn("User", screens, Set.of(models))).isTrue();
        assertThat(registry.isAvailableIn("User", other, Set.of(screens))).isFalse();
        assertThat(registry.isAvailableIn("Missing", models, Set.of())).isFalse();
    }

    /**
     * Removing a file or clearing the registry leaves no stale entries.
     */
    @Test
    void removeAndClear() {
        // Arrange
        SymbolRegistry registry = new SymbolRegistry();
        registry.register(type("A", models));
        registry.register(type("B", screens));

        // Act
        registry.removeAllForFile(models);

        // Assert
        assertThat(registry.allTypes()).extracting(TypeDescriptor::name).containsExactly("B");

        // Act
        registry.clear();

        // Assert
        assertThat(registry.size()).isZero();
        assertThat(registry.hasTypesFor(screens)).isFalse();
    }
}
