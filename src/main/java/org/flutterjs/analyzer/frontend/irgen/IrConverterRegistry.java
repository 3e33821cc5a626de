package org.flutterjs.analyzer.frontend.irgen;

import org.flutterjs.analyzer.frontend.irgen.converters.ClassNodeConverter;
import org.flutterjs.analyzer.frontend.irgen.converters.DirectiveConverters;
import org.flutterjs.analyzer.frontend.irgen.converters.EnumNodeConverter;
import org.flutterjs.analyzer.frontend.irgen.converters.ExtensionNodeConverter;
import org.flutterjs.analyzer.frontend.irgen.converters.FunctionNodeConverter;
import org.flutterjs.analyzer.frontend.irgen.converters.MixinNodeConverter;
import org.flutterjs.analyzer.frontend.irgen.converters.TypedefNodeConverter;
import org.flutterjs.analyzer.frontend.irgen.converters.VariableNodeConverter;
import org.flutterjs.analyzer.frontend.parser.ast.AstNode;
import org.flutterjs.analyzer.frontend.parser.ast.ClassNode;
import org.flutterjs.analyzer.frontend.parser.ast.EnumNode;
import org.flutterjs.analyzer.frontend.parser.ast.ExportNode;
import org.flutterjs.analyzer.frontend.parser.ast.ExtensionNode;
import org.flutterjs.analyzer.frontend.parser.ast.ImportNode;
import org.flutterjs.analyzer.frontend.parser.ast.LibraryNode;
import org.flutterjs.analyzer.frontend.parser.ast.MethodNode;
import org.flutterjs.analyzer.frontend.parser.ast.MixinNode;
import org.flutterjs.analyzer.frontend.parser.ast.PartNode;
import org.flutterjs.analyzer.frontend.parser.ast.PartOfNode;
import org.flutterjs.analyzer.frontend.parser.ast.TypedefNode;
import org.flutterjs.analyzer.frontend.parser.ast.VariableNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback. The {@link #resolve(AstNode)} method
 * walks the class hierarchy to find the nearest registered converter.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byClass = new HashMap<>();
	private final IAstNodeToIrConverter<AstNode> defaultConverter;

	private IrConverterRegistry(IAstNodeToIrConverter<AstNode> defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter for the given AST node class.
	 *
	 * @param nodeType  The concrete AST node class.
	 * @param converter The converter instance handling that class.
	 * @param <T>       Concrete AST type parameter.
	 */
	public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * Retrieves the converter registered for exactly the given class.
	 *
	 * @param nodeType The AST node class to look up.
	 * @return Optional converter if present.
	 */
	public Optional<IAstNodeToIrConverter<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
		return Optional.ofNullable(byClass.get(nodeType));
	}

	/**
	 * Resolves a converter for the given node by searching the node's concrete class,
	 * then walking up its superclasses and interfaces. Falls back to the default converter.
	 *
	 * @param node The AST node instance to resolve a converter for.
	 * @return A non-null converter to handle the node.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToIrConverter<AstNode> resolve(AstNode node) {
		Class<?> c = node.getClass();
		while (c != null && AstNode.class.isAssignableFrom(c)) {
			IAstNodeToIrConverter<?> found = byClass.get(c);
			if (found != null) return (IAstNodeToIrConverter<AstNode>) found;
			for (Class<?> i : c.getInterfaces()) {
				if (AstNode.class.isAssignableFrom(i)) {
					found = byClass.get(i.asSubclass(AstNode.class));
					if (found != null) return (IAstNodeToIrConverter<AstNode>) found;
				}
			}
			c = c.getSuperclass();
		}
		return defaultConverter;
	}

	/**
	 * @return The fallback converter used when no specific converter is registered.
	 */
	public IAstNodeToIrConverter<AstNode> defaultConverter() {
		return defaultConverter;
	}

	/**
	 * Creates an empty registry with the given default converter.
	 *
	 * @param defaultConverter The fallback converter used for unknown node types.
	 * @return A new registry instance.
	 */
	public static IrConverterRegistry initialize(IAstNodeToIrConverter<AstNode> defaultConverter) {
		return new IrConverterRegistry(defaultConverter);
	}

	/**
	 * Initializes a registry with the default converter and registers all built-in converters.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
		reg.register(LibraryNode.class, DirectiveConverters.LIBRARY);
		reg.register(PartOfNode.class, DirectiveConverters.PART_OF);
		reg.register(PartNode.class, DirectiveConverters.PART);
		reg.register(ImportNode.class, DirectiveConverters.IMPORT);
		reg.register(ExportNode.class, DirectiveConverters.EXPORT);
		reg.register(ClassNode.class, new ClassNodeConverter());
		reg.register(MixinNode.class, new MixinNodeConverter());
		reg.register(EnumNode.class, new EnumNodeConverter());
		reg.register(ExtensionNode.class, new ExtensionNodeConverter());
		reg.register(TypedefNode.class, new TypedefNodeConverter());
		reg.register(MethodNode.class, new FunctionNodeConverter());
		reg.register(VariableNode.class, new VariableNodeConverter());
		return reg;
	}
}
