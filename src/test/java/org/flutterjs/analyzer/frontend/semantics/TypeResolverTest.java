package org.flutterjs.analyzer.frontend.semantics;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.TypeKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.flutterjs.analyzer.testutils.DartFixtures.file;
import static org.flutterjs.analyzer.testutils.DartFixtures.parse;

/**
 * Tests the derivation of type descriptors and UI roles.
 */
@Tag("unit")
class TypeResolverTest {

    /**
     * Roles come from the supertype chain, within the file and across registered files.
     */
    @Test
    void classifiesRolesAcrossFiles() {
        // Arrange
        SymbolRegistry registry = new SymbolRegistry();
        FileIdentity base = file("base.dart");
        registry.replaceFile(base, new TypeResolver(registry).resolve(parse(base, """
                abstract class BaseScreen extends StatelessWidget {}
                class Store extends ChangeNotifier {}
                """)));
        FileIdentity screens = file("screens.dart");

        // Act
        List<TypeDescriptor> types = new TypeResolver(registry).resolve(parse(screens, """
                class HomeScreen extends BaseScreen {}
                class Counter extends StatefulWidget {}
                class _CounterState extends State<Counter> {}
                class CartStore extends Store {}
                class Theme with ChangeNotifier {}
                class Banner extends InheritedWidget {}
                class Plain {}
                mixin Logging on Object {}
                enum Mode { light, dark }
                """));

        // Assert
        assertThat(types).extracting(TypeDescriptor::name).containsExactly(
                "HomeScreen", "Counter", "_CounterState", "CartStore", "Theme", "Banner", "Plain", "Logging", "Mode");
        assertThat(types.get(0).isStatelessComponent()).isTrue();
        assertThat(types.get(1).isStatefulComponent()).isTrue();
        assertThat(types.get(2).isStateHolder()).isTrue();
        assertThat(types.get(3).isObservableState()).isTrue();
        assertThat(types.get(4).isObservableState()).isTrue();
        assertThat(types.get(5).isComponent()).isTrue();
        assertThat(types.get(5).isStatelessComponent()).isFalse();
        assertThat(types.get(6).roles()).isEqualTo(TypeRoles.NONE);
        assertThat(types.get(7).kind()).isEqualTo(TypeKind.MIXIN);
        assertThat(types.get(8).kind()).isEqualTo(TypeKind.ENUM);
        assertThat(registry.lookup("BaseScreen")).get().extracting(TypeDescriptor::isAbstract).isEqualTo(true);
    }

    /**
     * The superclass chain decides the role before implemented interfaces and mixins, so widgets
     * implementing {@code PreferredSizeWidget} keep their stateless or stateful kind.
     */
    @Test
    void superclassRootsWinOverInterfaces() {
        // Arrange
        SymbolRegistry registry = new SymbolRegistry();
        FileIdentity bars = file("bars.dart");

        // Act
        List<TypeDescriptor> types = new TypeResolver(registry).resolve(parse(bars, """
                class MyBar extends StatelessWidget implements PreferredSizeWidget {}
                class SearchBar extends StatefulWidget implements PreferredSizeWidget {}
                class _SearchBarState extends State<SearchBar> with ChangeNotifier {}
                class SizedBar implements PreferredSizeWidget {}
                """));

        // Assert
        assertThat(types.get(0).roles()).isEqualTo(TypeRoles.STATELESS);
        assertThat(types.get(1).roles()).isEqualTo(TypeRoles.STATEFUL);
        assertThat(types.get(2).roles()).isEqualTo(TypeRoles.STATE_HOLDER);
        assertThat(types.get(3).roles()).isEqualTo(TypeRoles.COMPONENT);
    }

    /**
     * A cyclic supertype chain ends without a role instead of looping.
     */
    @Test
    void cyclicSupertypeChainTerminates() {
        // Arrange
        SymbolRegistry registry = new SymbolRegistry();
        FileIdentity cyclic = file("cyclic.dart");

        // Act
        List<TypeDescriptor> types = new TypeResolver(registry).resolve(parse(cyclic, """
                class A extends B {}
                class B extends A {}
                """));

        // Assert
        assertThat(types).allSatisfy(t -> assertThat(t.roles()).isEqualTo(TypeRoles.NONE));
    }

    /**
     * Import prefixes are stripped from type names.
     */
    @Test
    void simpleNameStripsPrefix() {
        assertThat(TypeResolver.simpleName("ui.State")).isEqualTo("State");
        assertThat(TypeResolver.simpleName("State")).isEqualTo("State");
    }
}
