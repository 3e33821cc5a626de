package org.flutterjs.analyzer.backend.validate;

import org.flutterjs.analyzer.frontend.semantics.SymbolRegistry;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the registered structural checks over a linked application.
 */
public final class DeclarationValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DeclarationValidator.class);

    private final ValidationRegistry registry;

    public DeclarationValidator() { this(ValidationRegistry.initializeWithDefaults()); }

    public DeclarationValidator(ValidationRegistry registry) { this.registry = registry; }

    /**
     * Validates an application.
     *
     * @param application The linked application.
     * @param symbols     The symbol registry used for type lookups, may be {@code null}.
     * @return The accumulated findings.
     */
    public ValidationResult validate(ApplicationDeclaration application, SymbolRegistry symbols) {
        ValidationContext context = new ValidationContext(application, symbols);
        for (IValidationRule rule : registry.rules()) {
            rule.validate(context);
        }
        ValidationResult result = context.result();
        if (result.valid()) {
            LOG.debug("Validation passed with {} warnings", result.warnings().size());
        } else {
            LOG.debug("Validation failed with {} errors and {} warnings", result.errors().size(),
                    result.warnings().size());
        }
        return result;
    }
}
