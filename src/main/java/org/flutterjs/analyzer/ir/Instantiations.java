package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.expr.IdentifierExpr;
import org.flutterjs.analyzer.ir.expr.InstanceCreationExpr;
import org.flutterjs.analyzer.ir.expr.MethodCallExpr;
import org.flutterjs.analyzer.ir.expr.PropertyAccessExpr;

import java.util.Optional;

/**
 * Recognizes instance creations written without {@code new} or {@code const}.
 * <p>
 * Without type information {@code Foo(1)} and {@code foo(1)} have the same syntax. A call whose
 * name starts with an upper-case letter (after leading underscores) is taken to be a constructor
 * call; {@code Foo.named(1)} and {@code prefix.Foo(1)} are handled the same way.
 */
public final class Instantiations {

    private Instantiations() {}

    /**
     * @param expression Any expression.
     * @return The expression as an instance creation, if it is one.
     */
    public static Optional<InstanceCreationExpr> asCreation(ExpressionIR expression) {
        if (expression instanceof InstanceCreationExpr creation) {
            return Optional.of(creation);
        }
        if (!(expression instanceof MethodCallExpr call)) {
            return Optional.empty();
        }
        if (call.target() == null) {
            if (!isTypeName(call.methodName())) return Optional.empty();
            return Optional.of(new InstanceCreationExpr(
                    new TypeRef(call.methodName(), call.typeArguments(), false), null, call.arguments(), false));
        }
        if (call.target() instanceof IdentifierExpr target) {
            if (isTypeName(target.name())) {
                // Foo.named(...)
                return Optional.of(new InstanceCreationExpr(
                        new TypeRef(target.name(), call.typeArguments(), false), call.methodName(), call.arguments(), false));
            }
            if (isTypeName(call.methodName())) {
                // prefix.Foo(...)
                return Optional.of(new InstanceCreationExpr(
                        new TypeRef(call.methodName(), call.typeArguments(), false), null, call.arguments(), false));
            }
            return Optional.empty();
        }
        if (call.target() instanceof PropertyAccessExpr access && access.target() instanceof IdentifierExpr
                && isTypeName(access.propertyName())) {
            // prefix.Foo.named(...)
            return Optional.of(new InstanceCreationExpr(
                    new TypeRef(access.propertyName(), call.typeArguments(), false), call.methodName(),
                    call.arguments(), false));
        }
        return Optional.empty();
    }

    /**
     * @param name An identifier.
     * @return {@code true} if it looks like a type name.
     */
    public static boolean isTypeName(String name) {
        int i = 0;
        while (i < name.length() && (name.charAt(i) == '_' || name.charAt(i) == '$')) i++;
        return i < name.length() && Character.isUpperCase(name.charAt(i));
    }
}
