package org.flutterjs.analyzer.backend.link.features;

import org.flutterjs.analyzer.backend.link.ILinkingRule;
import org.flutterjs.analyzer.backend.link.LinkingContext;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.GraphEdge;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;

import java.util.List;
import java.util.ListIterator;
import java.util.Optional;

/**
 * Binds each stateful component to the state holder declared as {@code State<Component>}.
 * A holder named by {@code createState()} that does not name its component is accepted as well.
 * Unbound components keep the name read from {@code createState()} and are left for validation.
 */
public class StateBindingLinkingRule implements ILinkingRule {

    @Override
    public void apply(LinkingContext context) {
        ListIterator<ComponentDeclaration> it = context.components().listIterator();
        while (it.hasNext()) {
            ComponentDeclaration component = it.next();
            if (!component.stateful()) continue;
            Optional<StateHolderDeclaration> holder = holderOf(component, context.stateHolders());
            if (holder.isEmpty()) continue;
            if (!holder.get().name().equals(component.stateHolderName())) {
                it.set(withHolder(component, holder.get().name()));
            }
            context.addEdge(component.id(), holder.get().id(), GraphEdge.Kind.HAS_STATE, "has-state");
        }
    }

    private static Optional<StateHolderDeclaration> holderOf(ComponentDeclaration component,
                                                             List<StateHolderDeclaration> holders) {
        Optional<StateHolderDeclaration> declared = holders.stream()
                .filter(h -> h.componentName().equals(component.name()))
                .findFirst();
        if (declared.isPresent() || component.stateHolderName() == null) return declared;
        return holders.stream()
                .filter(h -> h.componentName().isEmpty() && h.name().equals(component.stateHolderName()))
                .findFirst();
    }

    private static ComponentDeclaration withHolder(ComponentDeclaration c, String holderName) {
        return new ComponentDeclaration(c.id(), c.name(), c.file(), c.kind(), c.superclass(), c.typeParameters(),
                c.properties(), c.fields(), c.constructors(), c.build(), c.methods(), c.mixins(), c.interfaces(),
                holderName, c.location());
    }
}
