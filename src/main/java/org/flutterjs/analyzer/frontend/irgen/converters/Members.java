package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IrGenContext;
import org.flutterjs.analyzer.frontend.parser.ast.AstNode;
import org.flutterjs.analyzer.frontend.parser.ast.ConstructorNode;
import org.flutterjs.analyzer.frontend.parser.ast.FieldNode;
import org.flutterjs.analyzer.frontend.parser.ast.MethodNode;
import org.flutterjs.analyzer.frontend.semantics.TypeResolver;
import org.flutterjs.analyzer.ir.ConstructorDeclaration;
import org.flutterjs.analyzer.ir.FieldDeclaration;
import org.flutterjs.analyzer.ir.MethodDeclaration;
import org.flutterjs.analyzer.ir.MethodKind;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared conversion of type bodies.
 */
final class Members {

	private Members() {}

	static List<FieldDeclaration> fields(List<AstNode> members) {
		List<FieldDeclaration> fields = new ArrayList<>();
		for (AstNode member : members) {
			if (member instanceof FieldNode f) {
				fields.add(new FieldDeclaration(f.name(), f.type(), f.modifiers(), f.initializer(), f.location()));
			}
		}
		return fields;
	}

	static List<ConstructorDeclaration> constructors(List<AstNode> members) {
		List<ConstructorDeclaration> constructors = new ArrayList<>();
		for (AstNode member : members) {
			if (member instanceof ConstructorNode c) {
				constructors.add(new ConstructorDeclaration(c.name(), c.parameters(), c.modifiers(), c.initializers(),
						c.body(), c.location()));
			}
		}
		return constructors;
	}

	static List<MethodDeclaration> methods(IrGenContext ctx, String owner, List<AstNode> members) {
		List<MethodDeclaration> methods = new ArrayList<>();
		for (AstNode member : members) {
			if (member instanceof MethodNode m) {
				methods.add(method(ctx, owner, m));
			}
		}
		return methods;
	}

	static MethodDeclaration method(IrGenContext ctx, String owner, MethodNode m) {
		return new MethodDeclaration(ctx.memberId(owner, memberKey(m)), m.name(), m.returnType(), m.parameters(),
				m.body(), m.kind(), m.modifiers(), m.location());
	}

	/**
	 * @return The member name, with a trailing {@code =} for setters so a getter/setter pair gets two ids.
	 */
	static String memberKey(MethodNode m) {
		return m.kind() == MethodKind.SETTER ? m.name() + "=" : m.name();
	}

	static String superclassName(TypeRef superclass) {
		return superclass == null ? null : TypeResolver.simpleName(superclass.name());
	}

	static List<String> names(List<TypeRef> types) {
		List<String> names = new ArrayList<>(types.size());
		for (TypeRef type : types) {
			names.add(TypeResolver.simpleName(type.name()));
		}
		return names;
	}
}
