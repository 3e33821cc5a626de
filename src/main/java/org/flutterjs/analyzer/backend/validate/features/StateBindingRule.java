package org.flutterjs.analyzer.backend.validate.features;

import org.flutterjs.analyzer.backend.validate.IValidationRule;
import org.flutterjs.analyzer.backend.validate.ValidationContext;
import org.flutterjs.analyzer.backend.validate.ValidationError;
import org.flutterjs.analyzer.backend.validate.ValidationWarning;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the component/state-holder pairing: stateful components without a holder are errors,
 * holders that no component uses are warnings.
 */
public class StateBindingRule implements IValidationRule {

    @Override
    public void validate(ValidationContext context) {
        ApplicationDeclaration application = context.application();
        Set<String> bound = new HashSet<>();
        for (ComponentDeclaration component : application.components()) {
            if (!component.stateful()) continue;
            Optional<StateHolderDeclaration> holder = boundHolder(component, application);
            if (holder.isPresent()) {
                bound.add(holder.get().id());
                continue;
            }
            String detail = component.stateHolderName() == null
                    ? "createState() does not create a state class"
                    : "state class '" + component.stateHolderName() + "' is not declared";
            context.error(ValidationError.Type.MISSING_STATE_CLASS,
                    "Stateful component '" + component.name() + "' has no state class: " + detail,
                    component.name(), component.file(), component.location());
        }
        for (StateHolderDeclaration holder : application.stateHolders()) {
            if (bound.contains(holder.id())) continue;
            String target = holder.componentName().isEmpty() ? "no component" : "'" + holder.componentName() + "'";
            context.warning(ValidationWarning.Type.ORPHANED_STATE_CLASS,
                    "State class '" + holder.name() + "' is bound to " + target + ", which is not a stateful component",
                    holder.name(), holder.file(), holder.location());
        }
    }

    /**
     * @return The holder a stateful component was bound to during linking.
     */
    static Optional<StateHolderDeclaration> boundHolder(ComponentDeclaration component,
                                                        ApplicationDeclaration application) {
        if (component.stateHolderName() == null) return Optional.empty();
        return application.stateHolders().stream()
                .filter(h -> h.name().equals(component.stateHolderName()))
                .filter(h -> h.componentName().equals(component.name()) || h.componentName().isEmpty())
                .findFirst();
    }
}
