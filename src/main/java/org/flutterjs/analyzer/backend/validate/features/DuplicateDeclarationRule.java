package org.flutterjs.analyzer.backend.validate.features;

import org.flutterjs.analyzer.backend.validate.IValidationRule;
import org.flutterjs.analyzer.backend.validate.ValidationContext;
import org.flutterjs.analyzer.backend.validate.ValidationError;
import org.flutterjs.analyzer.ir.Declaration;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports names declared more than once among components, state holders and observable states.
 * Each category is checked on its own.
 */
public class DuplicateDeclarationRule implements IValidationRule {

    @Override
    public void validate(ValidationContext context) {
        check(context, "component", context.application().components());
        check(context, "state class", context.application().stateHolders());
        check(context, "observable state", context.application().observableStates());
    }

    private static void check(ValidationContext context, String category, List<? extends Declaration> declarations) {
        Map<String, Declaration> first = new HashMap<>();
        for (Declaration declaration : declarations) {
            Declaration previous = first.putIfAbsent(declaration.name(), declaration);
            if (previous != null) {
                context.error(ValidationError.Type.DUPLICATE_DECLARATION,
                        "Duplicate " + category + " '" + declaration.name() + "', first declared in "
                                + previous.file().fileName(),
                        declaration.name(), declaration.file(), declaration.location());
            }
        }
    }
}
