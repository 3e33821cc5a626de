package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.semantics.TypeResolver;
import org.flutterjs.analyzer.ir.BuildDeclaration;
import org.flutterjs.analyzer.ir.ComponentNode;
import org.flutterjs.analyzer.ir.ConditionalBranch;
import org.flutterjs.analyzer.ir.Instantiations;
import org.flutterjs.analyzer.ir.MethodDeclaration;
import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.expr.Argument;
import org.flutterjs.analyzer.ir.expr.CollectionForExpr;
import org.flutterjs.analyzer.ir.expr.CollectionForLoopExpr;
import org.flutterjs.analyzer.ir.expr.CollectionIfExpr;
import org.flutterjs.analyzer.ir.expr.ConditionalExpr;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.expr.FunctionExpr;
import org.flutterjs.analyzer.ir.expr.IdentifierExpr;
import org.flutterjs.analyzer.ir.expr.InstanceCreationExpr;
import org.flutterjs.analyzer.ir.expr.ListLiteralExpr;
import org.flutterjs.analyzer.ir.expr.SpreadExpr;
import org.flutterjs.analyzer.ir.stmt.BlockStmt;
import org.flutterjs.analyzer.ir.stmt.IfStmt;
import org.flutterjs.analyzer.ir.stmt.ReturnStmt;
import org.flutterjs.analyzer.ir.stmt.StatementIR;
import org.flutterjs.analyzer.ir.stmt.VariableDeclStmt;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconstructs the component tree returned by a {@code build} method.
 * <p>
 * Named arguments in {@link #CHILD_SLOTS} that hold instance creations become child nodes, list
 * values become ordered children and all other arguments stay as expression properties. Conditional
 * returns, conditional expressions and collection-if elements are recorded as branches carrying both
 * alternatives; the then-alternative is used in the primary tree. Conditions are never evaluated.
 * A collection-for element contributes its body once, and spread list literals are flattened.
 * <p>
 * One instance builds one tree and is not thread-safe.
 */
public final class ComponentTreeBuilder {

	/** Named arguments that hold nested components. */
	public static final Set<String> CHILD_SLOTS = Set.of("child", "children", "body", "home", "appBar", "title", "builder");

	private static final int MAX_DEPTH = 256;

	private final SourceLocation location;
	private final Map<String, ExpressionIR> locals = new HashMap<>();
	private final List<ConditionalBranch> branches = new ArrayList<>();

	private ComponentTreeBuilder(SourceLocation location) {
		this.location = location;
	}

	/**
	 * Wraps a build method into a {@link BuildDeclaration}.
	 *
	 * @param method The build method.
	 * @return The declaration; its tree is {@code null} when the method returns no recognizable component.
	 */
	public static BuildDeclaration build(MethodDeclaration method) {
		ComponentTreeBuilder builder = new ComponentTreeBuilder(method.location());
		ComponentNode tree = builder.fromBody(method.body());
		return new BuildDeclaration(method, tree, builder.branches);
	}

	private ComponentNode fromBody(StatementIR body) {
		if (body == null) return null;
		if (body instanceof ReturnStmt r) return tree(r.value(), null, 0);
		if (!(body instanceof BlockStmt block)) return null;

		ExpressionIR pendingCondition = null;
		ExpressionIR pendingThen = null;
		for (StatementIR statement : flatten(block)) {
			if (statement instanceof VariableDeclStmt v && v.initializer() != null) {
				locals.put(v.name(), v.initializer());
			} else if (statement instanceof IfStmt i && pendingCondition == null) {
				ExpressionIR thenValue = returnedValue(i.thenBranch());
				if (thenValue == null) continue;
				ExpressionIR elseValue = returnedValue(i.elseBranch());
				if (elseValue != null) {
					return branch(i.condition(), thenValue, elseValue);
				}
				pendingCondition = i.condition();
				pendingThen = thenValue;
			} else if (statement instanceof ReturnStmt r) {
				if (pendingCondition != null) {
					return branch(pendingCondition, pendingThen, r.value());
				}
				return tree(r.value(), null, 0);
			}
		}
		return pendingThen == null ? null : tree(pendingThen, null, 0);
	}

	private ComponentNode branch(ExpressionIR condition, ExpressionIR thenValue, ExpressionIR elseValue) {
		ComponentNode thenTree = tree(thenValue, null, 0);
		ComponentNode elseTree = tree(elseValue, null, 0);
		branches.add(new ConditionalBranch(condition, thenTree, elseTree));
		return thenTree;
	}

	private static List<StatementIR> flatten(BlockStmt block) {
		List<StatementIR> statements = new ArrayList<>();
		for (StatementIR statement : block.statements()) {
			// int a = 1, b = 2; is parsed as a nested block of declarations
			if (statement instanceof BlockStmt nested
					&& nested.statements().stream().allMatch(s -> s instanceof VariableDeclStmt)) {
				statements.addAll(nested.statements());
			} else {
				statements.add(statement);
			}
		}
		return statements;
	}

	private static ExpressionIR returnedValue(StatementIR statement) {
		if (statement instanceof ReturnStmt r) return r.value();
		if (statement instanceof BlockStmt b && !b.statements().isEmpty()
				&& b.statements().get(b.statements().size() - 1) instanceof ReturnStmt r) {
			return r.value();
		}
		return null;
	}

	private ComponentNode tree(ExpressionIR expression, String slot, int depth) {
		if (expression == null || depth > MAX_DEPTH) return null;
		if (expression instanceof IdentifierExpr id && locals.containsKey(id.name())) {
			ExpressionIR value = locals.remove(id.name());
			try {
				return tree(value, slot, depth + 1);
			} finally {
				locals.put(id.name(), value);
			}
		}
		if (expression instanceof ConditionalExpr c) {
			ComponentNode thenTree = tree(c.thenExpression(), slot, depth + 1);
			ComponentNode elseTree = tree(c.elseExpression(), slot, depth + 1);
			if (thenTree == null && elseTree == null) return null;
			branches.add(new ConditionalBranch(c.condition(), thenTree, elseTree));
			return thenTree != null ? thenTree : elseTree;
		}
		return Instantiations.asCreation(expression)
				.map(creation -> node(creation, slot, depth))
				.orElse(null);
	}

	private ComponentNode node(InstanceCreationExpr creation, String slot, int depth) {
		Map<String, ExpressionIR> properties = new LinkedHashMap<>();
		List<ComponentNode> children = new ArrayList<>();
		int position = 0;
		for (Argument argument : creation.arguments()) {
			if (argument.name() == null) {
				properties.put("$" + position++, argument.value());
				continue;
			}
			if (!CHILD_SLOTS.contains(argument.name()) || !addChildren(argument, children, depth)) {
				properties.put(argument.name(), argument.value());
			}
		}
		return new ComponentNode(TypeResolver.simpleName(creation.type().name()), creation.constructorName(), slot,
				properties, children, location);
	}

	private boolean addChildren(Argument argument, List<ComponentNode> children, int depth) {
		String slot = argument.name();
		ExpressionIR value = argument.value();
		if (value instanceof ListLiteralExpr list) {
			for (ExpressionIR element : list.elements()) {
				addElement(element, slot, children, depth);
			}
			return true;
		}
		if (value instanceof FunctionExpr function) {
			ComponentNode child = fromBody(function.body());
			if (child == null) return false;
			children.add(withSlot(child, slot));
			return true;
		}
		ComponentNode child = tree(value, slot, depth + 1);
		if (child == null) return false;
		children.add(child);
		return true;
	}

	private void addElement(ExpressionIR element, String slot, List<ComponentNode> children, int depth) {
		if (depth > MAX_DEPTH) return;
		if (element instanceof CollectionIfExpr c) {
			ComponentNode thenTree = tree(c.thenElement(), slot, depth + 1);
			ComponentNode elseTree = tree(c.elseElement(), slot, depth + 1);
			if (thenTree == null && elseTree == null) return;
			branches.add(new ConditionalBranch(c.condition(), thenTree, elseTree));
			children.add(thenTree != null ? thenTree : elseTree);
			return;
		}
		if (element instanceof CollectionForExpr loop) {
			addElement(loop.body(), slot, children, depth + 1);
			return;
		}
		if (element instanceof CollectionForLoopExpr loop) {
			addElement(loop.body(), slot, children, depth + 1);
			return;
		}
		if (element instanceof SpreadExpr spread) {
			if (spread.expression() instanceof ListLiteralExpr list) {
				list.elements().forEach(e -> addElement(e, slot, children, depth + 1));
				return;
			}
			element = spread.expression();
		}
		ComponentNode child = tree(element, slot, depth + 1);
		if (child != null) children.add(child);
	}

	private static ComponentNode withSlot(ComponentNode node, String slot) {
		return new ComponentNode(node.type(), node.constructorName(), slot, node.properties(), node.children(),
				node.location());
	}
}
