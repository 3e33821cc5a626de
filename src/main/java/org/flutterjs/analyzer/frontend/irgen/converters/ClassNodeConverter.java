package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IAstNodeToIrConverter;
import org.flutterjs.analyzer.frontend.irgen.IrGenContext;
import org.flutterjs.analyzer.frontend.parser.ast.ClassNode;
import org.flutterjs.analyzer.frontend.semantics.TypeResolver;
import org.flutterjs.analyzer.frontend.semantics.TypeRoles;
import org.flutterjs.analyzer.ir.BuildDeclaration;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.ComponentKind;
import org.flutterjs.analyzer.ir.ConstructorDeclaration;
import org.flutterjs.analyzer.ir.FieldDeclaration;
import org.flutterjs.analyzer.ir.Instantiations;
import org.flutterjs.analyzer.ir.IrWalker;
import org.flutterjs.analyzer.ir.LifecycleHook;
import org.flutterjs.analyzer.ir.MethodDeclaration;
import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.ParameterDeclaration;
import org.flutterjs.analyzer.ir.PlainTypeDeclaration;
import org.flutterjs.analyzer.ir.PropertyDeclaration;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;
import org.flutterjs.analyzer.ir.TypeKind;
import org.flutterjs.analyzer.ir.TypeRef;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.stmt.BlockStmt;
import org.flutterjs.analyzer.ir.stmt.ReturnStmt;
import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts a {@link ClassNode} into a component, a state holder or a plain type, depending on
 * the UI role its supertype chain resolves to.
 * <ul>
 *     <li>{@code StatelessWidget} descendants become stateless components.</li>
 *     <li>{@code StatefulWidget} descendants become stateful components bound through {@code createState()}.</li>
 *     <li>{@code State<X>} descendants become state holders bound to {@code X}.</li>
 *     <li>Everything else, including other widget kinds, becomes a plain type.</li>
 * </ul>
 */
public final class ClassNodeConverter implements IAstNodeToIrConverter<ClassNode> {

	static final String BUILD_METHOD = "build";
	static final String STATE_FACTORY = "createState";

	@Override
	public void convert(ClassNode node, IrGenContext ctx) {
		String superclass = Members.superclassName(node.superclass());
		List<String> mixins = Members.names(node.mixins());
		List<String> interfaces = Members.names(node.interfaces());
		TypeRoles roles = ctx.rolesOf(node.name(), superclass, mixins, interfaces);

		if (roles.statelessComponent() || roles.statefulComponent()) {
			ctx.addComponent(component(node, ctx, roles.statefulComponent(), superclass, mixins, interfaces));
		} else if (roles.stateHolder()) {
			ctx.addStateHolder(stateHolder(node, ctx, mixins));
		} else {
			ctx.addPlainType(new PlainTypeDeclaration(
					ctx.declarationId(node.name()),
					node.name(),
					ctx.file(),
					node.abstractClass() ? TypeKind.ABSTRACT_CLASS : TypeKind.CLASS,
					superclass,
					node.typeParameters(),
					mixins,
					interfaces,
					List.of(),
					Members.fields(node.members()),
					Members.constructors(node.members()),
					Members.methods(ctx, node.name(), node.members()),
					List.of(),
					null,
					node.location()));
		}
	}

	private static ComponentDeclaration component(ClassNode node, IrGenContext ctx, boolean stateful, String superclass,
												  List<String> mixins, List<String> interfaces) {
		List<FieldDeclaration> fields = Members.fields(node.members());
		List<ConstructorDeclaration> constructors = Members.constructors(node.members());
		List<MethodDeclaration> methods = new ArrayList<>();
		BuildDeclaration build = null;
		String stateHolderName = null;
		for (MethodDeclaration method : Members.methods(ctx, node.name(), node.members())) {
			if (!stateful && BUILD_METHOD.equals(method.name()) && build == null) {
				build = ComponentTreeBuilder.build(method);
			} else {
				if (stateful && STATE_FACTORY.equals(method.name())) {
					stateHolderName = createdType(method.body()).orElse(null);
				}
				methods.add(method);
			}
		}
		return new ComponentDeclaration(
				ctx.declarationId(node.name()),
				node.name(),
				ctx.file(),
				stateful ? ComponentKind.STATEFUL : ComponentKind.STATELESS,
				superclass,
				node.typeParameters(),
				properties(fields, primaryConstructor(constructors)),
				fields,
				constructors,
				build,
				methods,
				mixins,
				interfaces,
				stateHolderName,
				node.location());
	}

	private static StateHolderDeclaration stateHolder(ClassNode node, IrGenContext ctx, List<String> mixins) {
		List<FieldDeclaration> fields = Members.fields(node.members());
		Map<LifecycleHook, MethodDeclaration> hooks = new EnumMap<>(LifecycleHook.class);
		List<MethodDeclaration> methods = new ArrayList<>();
		BuildDeclaration build = null;
		for (MethodDeclaration method : Members.methods(ctx, node.name(), node.members())) {
			Optional<LifecycleHook> hook = LifecycleHook.forMethod(method.name());
			if (hook.isPresent() && !hooks.containsKey(hook.get())) {
				hooks.put(hook.get(), method);
			} else if (BUILD_METHOD.equals(method.name()) && build == null) {
				build = ComponentTreeBuilder.build(method);
			} else {
				methods.add(method);
			}
		}
		List<String> controllers = new ArrayList<>();
		for (FieldDeclaration field : fields) {
			if (isController(field.type())) controllers.add(field.name());
		}
		return new StateHolderDeclaration(
				ctx.declarationId(node.name()),
				node.name(),
				ctx.file(),
				boundComponent(node.superclass()),
				fields,
				hooks,
				build,
				methods,
				controllers,
				mixins,
				node.location());
	}

	/**
	 * @return The {@code X} of {@code extends State<X>}, or an empty string when the binding is not written.
	 */
	private static String boundComponent(TypeRef superclass) {
		if (superclass == null || superclass.typeArguments().isEmpty()) return "";
		return TypeResolver.simpleName(superclass.typeArguments().get(0).name());
	}

	static boolean isController(TypeRef type) {
		if (type == null) return false;
		String name = type.displayName();
		return name.contains("Controller") && !name.startsWith("Animation");
	}

	/**
	 * Finds the first instance creation in a body that is a single expression or a single return.
	 */
	static Optional<String> createdType(StatementIR body) {
		ExpressionIR returned = null;
		if (body instanceof ReturnStmt r) {
			returned = r.value();
		} else if (body instanceof BlockStmt b && b.statements().size() == 1 && b.statements().get(0) instanceof ReturnStmt r) {
			returned = r.value();
		}
		if (returned == null) return Optional.empty();
		List<String> found = new ArrayList<>(1);
		IrWalker.walk(returned, e -> {
			if (found.isEmpty()) {
				Instantiations.asCreation(e).ifPresent(c -> found.add(TypeResolver.simpleName(c.type().name())));
			}
		});
		return found.stream().findFirst();
	}

	private static ConstructorDeclaration primaryConstructor(List<ConstructorDeclaration> constructors) {
		for (ConstructorDeclaration constructor : constructors) {
			if (constructor.name() == null && !constructor.modifiers().contains(Modifier.FACTORY)) return constructor;
		}
		return constructors.isEmpty() ? null : constructors.get(0);
	}

	/**
	 * Merges instance fields with the parameters of the primary constructor. A parameter's default
	 * wins over the field initializer; parameters without a field (other than {@code super.} formals)
	 * are properties of their own.
	 */
	static List<PropertyDeclaration> properties(List<FieldDeclaration> fields, ConstructorDeclaration constructor) {
		List<PropertyDeclaration> properties = new ArrayList<>();
		List<String> fieldNames = new ArrayList<>();
		for (FieldDeclaration field : fields) {
			if (field.has(Modifier.STATIC)) continue;
			fieldNames.add(field.name());
			Optional<ParameterDeclaration> parameter = constructor == null
					? Optional.empty() : constructor.parameter(field.name());
			boolean readOnly = field.has(Modifier.FINAL) || field.has(Modifier.CONST);
			properties.add(new PropertyDeclaration(
					field.name(),
					field.type(),
					readOnly,
					parameter.map(ParameterDeclaration::required).orElse(false),
					parameter.map(ParameterDeclaration::defaultValue).orElse(field.initializer()),
					field.location()));
		}
		if (constructor != null) {
			for (ParameterDeclaration parameter : constructor.parameters()) {
				if (parameter.superFormal() || fieldNames.contains(parameter.name())) continue;
				properties.add(new PropertyDeclaration(parameter.name(), parameter.type(), true, parameter.required(),
						parameter.defaultValue(), constructor.location()));
			}
		}
		return properties;
	}
}
