package org.flutterjs.analyzer.backend.link.features;

import org.flutterjs.analyzer.backend.link.ILinkingRule;
import org.flutterjs.analyzer.backend.link.LinkingContext;
import org.flutterjs.analyzer.frontend.semantics.TypeResolver;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.Instantiations;
import org.flutterjs.analyzer.ir.IrWalker;
import org.flutterjs.analyzer.ir.MethodDeclaration;
import org.flutterjs.analyzer.ir.ObservableStateDeclaration;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;
import org.flutterjs.analyzer.ir.GraphEdge;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;
import org.flutterjs.analyzer.ir.expr.IdentifierExpr;
import org.flutterjs.analyzer.ir.expr.InstanceCreationExpr;
import org.flutterjs.analyzer.ir.expr.MethodCallExpr;
import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adds depends-on edges for reads of observable state. Recognized accesses, where {@code T}
 * is the observable's type:
 * <ul>
 *     <li>{@code context.watch<T>()}, {@code context.read<T>()}, {@code context.select<T, R>(...)}</li>
 *     <li>{@code Provider.of<T>(context)}</li>
 *     <li>{@code Consumer<T>(...)} and {@code Selector<T, R>(...)}</li>
 * </ul>
 * Build bodies, lifecycle hooks and other methods of components and state holders are scanned.
 */
public class StateDependencyLinkingRule implements ILinkingRule {

    private static final Set<String> CONTEXT_READS = Set.of("watch", "read", "select");
    private static final Set<String> CONSUMER_TYPES = Set.of("Consumer", "Selector");

    /** A recognized access: the observed type name and how it was accessed. */
    record StateRead(String typeName, String pattern) {
    }

    @Override
    public void apply(LinkingContext context) {
        Map<String, ObservableStateDeclaration> observables = new HashMap<>();
        for (ObservableStateDeclaration observable : context.observableStates()) {
            observables.putIfAbsent(observable.valueType(), observable);
        }
        if (observables.isEmpty()) return;

        for (ComponentDeclaration component : context.components()) {
            List<MethodDeclaration> methods = new ArrayList<>(component.methods());
            if (component.build() != null) methods.add(component.build().method());
            link(context, component.id(), methods, observables);
        }
        for (StateHolderDeclaration holder : context.stateHolders()) {
            List<MethodDeclaration> methods = new ArrayList<>(holder.methods());
            methods.addAll(holder.lifecycleHooks().values());
            if (holder.build() != null) methods.add(holder.build().method());
            link(context, holder.id(), methods, observables);
        }
    }

    private static void link(LinkingContext context, String fromId, List<MethodDeclaration> methods,
                             Map<String, ObservableStateDeclaration> observables) {
        for (MethodDeclaration method : methods) {
            for (StateRead read : reads(method.body())) {
                ObservableStateDeclaration target = observables.get(read.typeName());
                if (target != null) {
                    context.addEdge(fromId, target.id(), GraphEdge.Kind.DEPENDS_ON, read.pattern());
                }
            }
        }
    }

    /**
     * @param body A method body.
     * @return All recognized state reads in visiting order.
     */
    static List<StateRead> reads(StatementIR body) {
        List<StateRead> reads = new ArrayList<>();
        IrWalker.walk(body, e -> read(e).ifPresent(reads::add));
        return reads;
    }

    static Optional<StateRead> read(ExpressionIR expression) {
        if (expression instanceof MethodCallExpr call && !call.typeArguments().isEmpty()) {
            String typeName = TypeResolver.simpleName(call.typeArguments().get(0).name());
            if (call.target() != null && CONTEXT_READS.contains(call.methodName())) {
                return Optional.of(new StateRead(typeName, call.methodName()));
            }
            if (call.target() instanceof IdentifierExpr id && id.name().equals("Provider")
                    && call.methodName().equals("of")) {
                return Optional.of(new StateRead(typeName, "Provider.of"));
            }
        }
        Optional<InstanceCreationExpr> creation = Instantiations.asCreation(expression);
        if (creation.isPresent() && creation.get().constructorName() == null) {
            InstanceCreationExpr c = creation.get();
            String typeName = TypeResolver.simpleName(c.type().name());
            if (CONSUMER_TYPES.contains(typeName) && !c.type().typeArguments().isEmpty()) {
                return Optional.of(new StateRead(TypeResolver.simpleName(c.type().typeArguments().get(0).name()),
                        typeName));
            }
        }
        return Optional.empty();
    }
}
