package org.flutterjs.analyzer.backend.validate;

import org.flutterjs.analyzer.backend.validate.features.BuildMethodRule;
import org.flutterjs.analyzer.backend.validate.features.ComponentCycleRule;
import org.flutterjs.analyzer.backend.validate.features.DisposeRule;
import org.flutterjs.analyzer.backend.validate.features.DuplicateDeclarationRule;
import org.flutterjs.analyzer.backend.validate.features.ImportRule;
import org.flutterjs.analyzer.backend.validate.features.NotifyListenersRule;
import org.flutterjs.analyzer.backend.validate.features.PropertyRule;
import org.flutterjs.analyzer.backend.validate.features.StateBindingRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for validation rules, which run in registration order.
 */
public class ValidationRegistry {

    private final List<IValidationRule> rules = new ArrayList<>();

    /**
     * Registers a new validation rule.
     * @param rule The rule to register.
     */
    public void register(IValidationRule rule) { rules.add(rule); }

    /**
     * @return The list of registered validation rules.
     */
    public List<IValidationRule> rules() { return rules; }

    /**
     * @return A new registry with all built-in checks.
     */
    public static ValidationRegistry initializeWithDefaults() {
        ValidationRegistry reg = new ValidationRegistry();
        reg.register(new DuplicateDeclarationRule());
        reg.register(new BuildMethodRule());
        reg.register(new StateBindingRule());
        reg.register(new PropertyRule());
        reg.register(new DisposeRule());
        reg.register(new NotifyListenersRule());
        reg.register(new ComponentCycleRule());
        reg.register(new ImportRule());
        return reg;
    }
}
