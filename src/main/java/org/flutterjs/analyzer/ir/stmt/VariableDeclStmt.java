package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.TypeRef;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.Set;

/**
 * Declaration of one local variable. {@code var a = 1, b = 2;} yields two statements.
 *
 * @param name        The variable name.
 * @param type        The declared type, {@code null} when inferred.
 * @param initializer The initializer, {@code null} when absent.
 * @param modifiers   {@code final}, {@code const} or {@code late}.
 */
public record VariableDeclStmt(String name, TypeRef type, ExpressionIR initializer, Set<Modifier> modifiers)
        implements StatementIR {

    public VariableDeclStmt {
        modifiers = IrLists.copy(modifiers);
    }
}
