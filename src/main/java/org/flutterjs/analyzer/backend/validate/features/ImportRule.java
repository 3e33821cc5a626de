package org.flutterjs.analyzer.backend.validate.features;

import org.flutterjs.analyzer.backend.validate.IValidationRule;
import org.flutterjs.analyzer.backend.validate.ValidationContext;
import org.flutterjs.analyzer.backend.validate.ValidationWarning;
import org.flutterjs.analyzer.ir.ImportDeclaration;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Warns about a URI imported twice with the same prefix in one file, and about deferred imports.
 */
public class ImportRule implements IValidationRule {

    @Override
    public void validate(ValidationContext context) {
        Set<String> seen = new HashSet<>();
        for (ImportDeclaration declaration : context.application().imports()) {
            String key = declaration.file().path() + "|" + declaration.uri() + "|"
                    + Objects.toString(declaration.prefix(), "");
            if (!seen.add(key)) {
                context.warning(ValidationWarning.Type.DUPLICATE_IMPORT,
                        "Duplicate import of '" + declaration.uri() + "'",
                        declaration.uri(), declaration.file(), declaration.location());
            }
            if (declaration.deferred()) {
                context.warning(ValidationWarning.Type.DEFERRED_IMPORT,
                        "Deferred import of '" + declaration.uri() + "' is loaded eagerly",
                        declaration.uri(), declaration.file(), declaration.location());
            }
        }
    }
}
