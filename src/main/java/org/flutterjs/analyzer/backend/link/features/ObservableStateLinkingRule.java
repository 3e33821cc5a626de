package org.flutterjs.analyzer.backend.link.features;

import org.flutterjs.analyzer.backend.link.ILinkingRule;
import org.flutterjs.analyzer.backend.link.LinkingContext;
import org.flutterjs.analyzer.frontend.semantics.TypeDescriptor;
import org.flutterjs.analyzer.frontend.semantics.TypeResolver;
import org.flutterjs.analyzer.ir.ObservableStateDeclaration;
import org.flutterjs.analyzer.ir.PlainTypeDeclaration;
import org.flutterjs.analyzer.ir.TypeKind;

import java.util.Iterator;

/**
 * Moves classes that broadcast change notifications out of the plain types. A class qualifies
 * when it extends or mixes in {@code ChangeNotifier} or {@code ValueNotifier}, directly or, when
 * the registry knows its chain, through a supertype.
 */
public class ObservableStateLinkingRule implements ILinkingRule {

    @Override
    public void apply(LinkingContext context) {
        Iterator<PlainTypeDeclaration> it = context.plainTypes().iterator();
        while (it.hasNext()) {
            PlainTypeDeclaration type = it.next();
            if (type.kind() != TypeKind.CLASS && type.kind() != TypeKind.ABSTRACT_CLASS) continue;
            if (!isObservable(type, context)) continue;
            it.remove();
            context.observableStates().add(new ObservableStateDeclaration(type.id(), type.name(), type.file(),
                    type.superclass(), type.mixins(), type.fields(), type.methods(), type.location()));
        }
    }

    private static boolean isObservable(PlainTypeDeclaration type, LinkingContext context) {
        if (type.superclass() != null && TypeResolver.OBSERVABLE_ROOTS.contains(type.superclass())) return true;
        if (type.mixins().stream().anyMatch(TypeResolver.OBSERVABLE_ROOTS::contains)) return true;
        return context.registry()
                .flatMap(r -> r.lookup(type.name()))
                .filter(d -> d.file().equals(type.file()))
                .map(TypeDescriptor::isObservableState)
                .orElse(false);
    }
}
