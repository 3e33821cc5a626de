package org.flutterjs.analyzer.backend.validate.features;

import org.flutterjs.analyzer.backend.validate.IValidationRule;
import org.flutterjs.analyzer.backend.validate.ValidationContext;
import org.flutterjs.analyzer.backend.validate.ValidationWarning;
import org.flutterjs.analyzer.ir.IrWalker;
import org.flutterjs.analyzer.ir.MethodDeclaration;
import org.flutterjs.analyzer.ir.MethodKind;
import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.ObservableStateDeclaration;
import org.flutterjs.analyzer.ir.expr.AssignmentExpr;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.expr.IdentifierExpr;
import org.flutterjs.analyzer.ir.expr.MethodCallExpr;
import org.flutterjs.analyzer.ir.expr.PropertyAccessExpr;

/**
 * Flags observable-state methods that look like mutators but never notify. Any instance method
 * without parameters returning {@code void} is assumed to be a mutator; overrides are skipped.
 * Calling {@code notifyListeners()} or assigning {@code value} (which notifies in a
 * {@code ValueNotifier}) counts as notifying.
 */
public class NotifyListenersRule implements IValidationRule {

    @Override
    public void validate(ValidationContext context) {
        for (ObservableStateDeclaration observable : context.application().observableStates()) {
            for (MethodDeclaration method : observable.methods()) {
                if (!isAssumedMutator(method) || notifies(method)) continue;
                context.warning(ValidationWarning.Type.MISSING_NOTIFY_LISTENERS,
                        "Method '" + method.name() + "' of '" + observable.name()
                                + "' looks like a mutator but does not call notifyListeners()",
                        observable.name(), observable.file(), method.location());
            }
        }
    }

    static boolean isAssumedMutator(MethodDeclaration method) {
        return method.kind() == MethodKind.METHOD
                && method.parameters().isEmpty()
                && method.returnsVoid()
                && method.body() != null
                && !method.has(Modifier.STATIC)
                && !method.has(Modifier.OVERRIDE);
    }

    static boolean notifies(MethodDeclaration method) {
        boolean[] found = {false};
        IrWalker.walk(method.body(), e -> {
            if (isNotifyCall(e) || isValueAssignment(e)) found[0] = true;
        });
        return found[0];
    }

    private static boolean isNotifyCall(ExpressionIR e) {
        return e instanceof MethodCallExpr call && call.methodName().equals("notifyListeners")
                && (call.target() == null || isThis(call.target()));
    }

    private static boolean isValueAssignment(ExpressionIR e) {
        if (!(e instanceof AssignmentExpr assignment)) return false;
        ExpressionIR target = assignment.target();
        if (target instanceof IdentifierExpr id) return id.name().equals("value");
        return target instanceof PropertyAccessExpr access && isThis(access.target())
                && access.propertyName().equals("value");
    }

    private static boolean isThis(ExpressionIR e) {
        return e instanceof IdentifierExpr id && id.name().equals("this");
    }
}
