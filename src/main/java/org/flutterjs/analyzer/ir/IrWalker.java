package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.expr.Argument;
import org.flutterjs.analyzer.ir.expr.AssignmentExpr;
import org.flutterjs.analyzer.ir.expr.AwaitExpr;
import org.flutterjs.analyzer.ir.expr.BinaryExpr;
import org.flutterjs.analyzer.ir.expr.CascadeExpr;
import org.flutterjs.analyzer.ir.expr.CastExpr;
import org.flutterjs.analyzer.ir.expr.CollectionForExpr;
import org.flutterjs.analyzer.ir.expr.CollectionForLoopExpr;
import org.flutterjs.analyzer.ir.expr.CollectionIfExpr;
import org.flutterjs.analyzer.ir.expr.ConditionalExpr;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.expr.FunctionExpr;
import org.flutterjs.analyzer.ir.expr.IdentifierExpr;
import org.flutterjs.analyzer.ir.expr.IndexExpr;
import org.flutterjs.analyzer.ir.expr.InstanceCreationExpr;
import org.flutterjs.analyzer.ir.expr.InvocationExpr;
import org.flutterjs.analyzer.ir.expr.ListLiteralExpr;
import org.flutterjs.analyzer.ir.expr.LiteralExpr;
import org.flutterjs.analyzer.ir.expr.MapEntryExpr;
import org.flutterjs.analyzer.ir.expr.MapLiteralExpr;
import org.flutterjs.analyzer.ir.expr.MethodCallExpr;
import org.flutterjs.analyzer.ir.expr.PropertyAccessExpr;
import org.flutterjs.analyzer.ir.expr.SetLiteralExpr;
import org.flutterjs.analyzer.ir.expr.SpreadExpr;
import org.flutterjs.analyzer.ir.expr.StringTemplateExpr;
import org.flutterjs.analyzer.ir.expr.ThrowExpr;
import org.flutterjs.analyzer.ir.expr.TypeTestExpr;
import org.flutterjs.analyzer.ir.expr.UnaryExpr;
import org.flutterjs.analyzer.ir.stmt.AssertStmt;
import org.flutterjs.analyzer.ir.stmt.BlockStmt;
import org.flutterjs.analyzer.ir.stmt.BreakStmt;
import org.flutterjs.analyzer.ir.stmt.CatchClause;
import org.flutterjs.analyzer.ir.stmt.ContinueStmt;
import org.flutterjs.analyzer.ir.stmt.DoWhileStmt;
import org.flutterjs.analyzer.ir.stmt.ExpressionStmt;
import org.flutterjs.analyzer.ir.stmt.ForEachStmt;
import org.flutterjs.analyzer.ir.stmt.ForStmt;
import org.flutterjs.analyzer.ir.stmt.IfStmt;
import org.flutterjs.analyzer.ir.stmt.LocalFunctionStmt;
import org.flutterjs.analyzer.ir.stmt.ReturnStmt;
import org.flutterjs.analyzer.ir.stmt.StatementIR;
import org.flutterjs.analyzer.ir.stmt.SwitchCase;
import org.flutterjs.analyzer.ir.stmt.SwitchStmt;
import org.flutterjs.analyzer.ir.stmt.TryStmt;
import org.flutterjs.analyzer.ir.stmt.VariableDeclStmt;
import org.flutterjs.analyzer.ir.stmt.WhileStmt;
import org.flutterjs.analyzer.ir.stmt.YieldStmt;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal over statement and expression trees. Every expression reachable from
 * the root is passed to the visitor exactly once, including those inside function literals
 * and local functions.
 */
public final class IrWalker {

    private IrWalker() {}

    /**
     * Visits every expression inside a statement tree.
     *
     * @param statement The root, may be {@code null}.
     * @param visitor   Receives each expression.
     */
    public static void walk(StatementIR statement, Consumer<ExpressionIR> visitor) {
        if (statement == null) return;
        if (statement instanceof BlockStmt s) {
            s.statements().forEach(child -> walk(child, visitor));
        } else if (statement instanceof VariableDeclStmt s) {
            walk(s.initializer(), visitor);
        } else if (statement instanceof ExpressionStmt s) {
            walk(s.expression(), visitor);
        } else if (statement instanceof IfStmt s) {
            walk(s.condition(), visitor);
            walk(s.thenBranch(), visitor);
            walk(s.elseBranch(), visitor);
        } else if (statement instanceof ForStmt s) {
            s.initializers().forEach(child -> walk(child, visitor));
            walk(s.condition(), visitor);
            s.updaters().forEach(child -> walk(child, visitor));
            walk(s.body(), visitor);
        } else if (statement instanceof ForEachStmt s) {
            walk(s.iterable(), visitor);
            walk(s.body(), visitor);
        } else if (statement instanceof WhileStmt s) {
            walk(s.condition(), visitor);
            walk(s.body(), visitor);
        } else if (statement instanceof DoWhileStmt s) {
            walk(s.body(), visitor);
            walk(s.condition(), visitor);
        } else if (statement instanceof SwitchStmt s) {
            walk(s.subject(), visitor);
            for (SwitchCase switchCase : s.cases()) {
                switchCase.labels().forEach(label -> walk(label, visitor));
                switchCase.statements().forEach(child -> walk(child, visitor));
            }
        } else if (statement instanceof TryStmt s) {
            walk(s.body(), visitor);
            for (CatchClause clause : s.catchClauses()) {
                walk(clause.body(), visitor);
            }
            walk(s.finallyBlock(), visitor);
        } else if (statement instanceof ReturnStmt s) {
            walk(s.value(), visitor);
        } else if (statement instanceof YieldStmt s) {
            walk(s.value(), visitor);
        } else if (statement instanceof AssertStmt s) {
            walk(s.condition(), visitor);
            walk(s.message(), visitor);
        } else if (statement instanceof LocalFunctionStmt s) {
            walkParameters(s.function().parameters(), visitor);
            walk(s.function().body(), visitor);
        } else if (!(statement instanceof BreakStmt) && !(statement instanceof ContinueStmt)) {
            throw new IllegalStateException("Unhandled statement " + statement.getClass().getSimpleName());
        }
    }

    /**
     * Visits an expression and all of its sub-expressions.
     *
     * @param expression The root, may be {@code null}.
     * @param visitor    Receives each expression.
     */
    public static void walk(ExpressionIR expression, Consumer<ExpressionIR> visitor) {
        if (expression == null) return;
        visitor.accept(expression);
        if (expression instanceof FunctionExpr f) {
            walkParameters(f.parameters(), visitor);
            walk(f.body(), visitor);
            return;
        }
        if (expression instanceof CollectionForLoopExpr loop) {
            loop.initializers().forEach(initializer -> walk(initializer, visitor));
        }
        for (ExpressionIR child : children(expression)) {
            walk(child, visitor);
        }
    }

    /**
     * Collects all expressions of a statement tree in visiting order.
     *
     * @param statement The root.
     * @return The expressions.
     */
    public static List<ExpressionIR> expressions(StatementIR statement) {
        List<ExpressionIR> all = new ArrayList<>();
        walk(statement, all::add);
        return all;
    }

    private static void walkParameters(List<ParameterDeclaration> parameters, Consumer<ExpressionIR> visitor) {
        for (ParameterDeclaration parameter : parameters) {
            walk(parameter.defaultValue(), visitor);
        }
    }

    /**
     * Returns the direct sub-expressions of an expression. Function literal bodies and the
     * initializers of a collection-for loop are statements and therefore not included.
     *
     * @param expression The expression.
     * @return The children in source order; {@code null} entries are omitted.
     */
    public static List<ExpressionIR> children(ExpressionIR expression) {
        List<ExpressionIR> children = new ArrayList<>();
        if (expression instanceof BinaryExpr e) {
            add(children, e.left(), e.right());
        } else if (expression instanceof UnaryExpr e) {
            add(children, e.operand());
        } else if (expression instanceof AssignmentExpr e) {
            add(children, e.target(), e.value());
        } else if (expression instanceof ConditionalExpr e) {
            add(children, e.condition(), e.thenExpression(), e.elseExpression());
        } else if (expression instanceof MethodCallExpr e) {
            add(children, e.target());
            addArguments(children, e.arguments());
        } else if (expression instanceof InvocationExpr e) {
            add(children, e.function());
            addArguments(children, e.arguments());
        } else if (expression instanceof PropertyAccessExpr e) {
            add(children, e.target());
        } else if (expression instanceof IndexExpr e) {
            add(children, e.target(), e.index());
        } else if (expression instanceof InstanceCreationExpr e) {
            addArguments(children, e.arguments());
        } else if (expression instanceof ListLiteralExpr e) {
            children.addAll(e.elements());
        } else if (expression instanceof MapLiteralExpr e) {
            children.addAll(e.entries());
        } else if (expression instanceof SetLiteralExpr e) {
            children.addAll(e.elements());
        } else if (expression instanceof MapEntryExpr e) {
            add(children, e.key(), e.value());
        } else if (expression instanceof SpreadExpr e) {
            add(children, e.expression());
        } else if (expression instanceof CollectionIfExpr e) {
            add(children, e.condition(), e.thenElement(), e.elseElement());
        } else if (expression instanceof CollectionForExpr e) {
            add(children, e.iterable(), e.body());
        } else if (expression instanceof CollectionForLoopExpr e) {
            add(children, e.condition());
            children.addAll(e.updaters());
            add(children, e.body());
        } else if (expression instanceof StringTemplateExpr e) {
            children.addAll(e.parts());
        } else if (expression instanceof AwaitExpr e) {
            add(children, e.expression());
        } else if (expression instanceof TypeTestExpr e) {
            add(children, e.expression());
        } else if (expression instanceof CastExpr e) {
            add(children, e.expression());
        } else if (expression instanceof CascadeExpr e) {
            add(children, e.target());
            children.addAll(e.sections());
        } else if (expression instanceof ThrowExpr e) {
            add(children, e.expression());
        } else if (!(expression instanceof LiteralExpr) && !(expression instanceof IdentifierExpr)
                && !(expression instanceof FunctionExpr)) {
            throw new IllegalStateException("Unhandled expression " + expression.getClass().getSimpleName());
        }
        return children;
    }

    private static void add(List<ExpressionIR> children, ExpressionIR... candidates) {
        for (ExpressionIR candidate : candidates) {
            if (candidate != null) children.add(candidate);
        }
    }

    private static void addArguments(List<ExpressionIR> children, List<Argument> arguments) {
        for (Argument argument : arguments) {
            children.add(argument.value());
        }
    }
}
