package org.flutterjs.analyzer.backend.validate.features;

import org.flutterjs.analyzer.backend.validate.IValidationRule;
import org.flutterjs.analyzer.backend.validate.ValidationContext;
import org.flutterjs.analyzer.backend.validate.ValidationWarning;
import org.flutterjs.analyzer.ir.IrWalker;
import org.flutterjs.analyzer.ir.LifecycleHook;
import org.flutterjs.analyzer.ir.MethodDeclaration;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.expr.IdentifierExpr;
import org.flutterjs.analyzer.ir.expr.MethodCallExpr;
import org.flutterjs.analyzer.ir.expr.PropertyAccessExpr;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * State holders owning controllers must release them in {@code dispose()}. A controller counts
 * as released when {@code dispose()} calls {@code field.dispose()}, {@code this.field.dispose()}
 * or {@code field?.dispose()}; no data flow is followed.
 */
public class DisposeRule implements IValidationRule {

    @Override
    public void validate(ValidationContext context) {
        for (StateHolderDeclaration holder : context.application().stateHolders()) {
            if (holder.controllerFields().isEmpty()) continue;
            Optional<MethodDeclaration> dispose = holder.hook(LifecycleHook.DISPOSE);
            if (dispose.isEmpty()) {
                context.warning(ValidationWarning.Type.MISSING_DISPOSE,
                        "State class '" + holder.name() + "' has controllers " + holder.controllerFields()
                                + " but no dispose() method",
                        holder.name(), holder.file(), holder.location());
                continue;
            }
            Set<String> disposed = disposedFields(dispose.get());
            for (String controller : holder.controllerFields()) {
                if (!disposed.contains(controller)) {
                    context.warning(ValidationWarning.Type.UNDISPOSED_CONTROLLER,
                            "Controller '" + controller + "' of '" + holder.name() + "' is not disposed",
                            holder.name(), holder.file(), dispose.get().location());
                }
            }
        }
    }

    static Set<String> disposedFields(MethodDeclaration dispose) {
        Set<String> disposed = new HashSet<>();
        IrWalker.walk(dispose.body(), e -> {
            if (e instanceof MethodCallExpr call && call.methodName().equals("dispose")) {
                fieldName(call.target()).ifPresent(disposed::add);
            }
        });
        return disposed;
    }

    private static Optional<String> fieldName(ExpressionIR target) {
        if (target instanceof IdentifierExpr id) return Optional.of(id.name());
        if (target instanceof PropertyAccessExpr access && access.target() instanceof IdentifierExpr owner
                && owner.name().equals("this")) {
            return Optional.of(access.propertyName());
        }
        return Optional.empty();
    }
}
