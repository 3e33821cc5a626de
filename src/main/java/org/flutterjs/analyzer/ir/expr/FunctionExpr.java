package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.ParameterDeclaration;
import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.List;

/**
 * A function literal. Arrow bodies are recorded as a single return statement.
 *
 * @param parameters The declared parameters.
 * @param body       The body.
 * @param arrow      Whether the literal used the {@code =>} form.
 * @param async      Whether the body is {@code async}.
 */
public record FunctionExpr(List<ParameterDeclaration> parameters, StatementIR body, boolean arrow, boolean async)
        implements ExpressionIR {

    public FunctionExpr {
        parameters = IrLists.copy(parameters);
    }
}
