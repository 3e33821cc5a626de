package org.flutterjs.analyzer.backend.validate.features;

import org.flutterjs.analyzer.backend.validate.IValidationRule;
import org.flutterjs.analyzer.backend.validate.ValidationContext;
import org.flutterjs.analyzer.backend.validate.ValidationError;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;
import org.flutterjs.analyzer.ir.TypeKind;

import java.util.Optional;

/**
 * Every concrete component must be able to build. A stateless component needs its own
 * {@code build}; a stateful one builds through its bound state holder. Stateful components
 * without a holder are reported by {@link StateBindingRule} only.
 */
public class BuildMethodRule implements IValidationRule {

    @Override
    public void validate(ValidationContext context) {
        for (ComponentDeclaration component : context.application().components()) {
            if (isAbstract(component, context)) continue;
            if (!component.stateful()) {
                if (component.build() == null) {
                    context.error(ValidationError.Type.MISSING_BUILD_METHOD,
                            "Component '" + component.name() + "' has no build method",
                            component.name(), component.file(), component.location());
                }
                continue;
            }
            Optional<StateHolderDeclaration> holder = StateBindingRule.boundHolder(component, context.application());
            if (holder.isPresent() && holder.get().build() == null) {
                context.error(ValidationError.Type.MISSING_BUILD_METHOD,
                        "State class '" + holder.get().name() + "' of '" + component.name() + "' has no build method",
                        component.name(), holder.get().file(), holder.get().location());
            }
        }
    }

    private static boolean isAbstract(ComponentDeclaration component, ValidationContext context) {
        return context.registry()
                .flatMap(r -> r.lookup(component.name()))
                .filter(d -> d.file().equals(component.file()))
                .map(d -> d.kind() == TypeKind.ABSTRACT_CLASS)
                .orElse(false);
    }
}
