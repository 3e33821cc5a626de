package org.flutterjs.analyzer.backend.validate;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.frontend.semantics.SymbolRegistry;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects the findings of one validation pass.
 */
public final class ValidationContext {

    private final ApplicationDeclaration application;
    private final SymbolRegistry registry;
    private final List<ValidationError> errors = new ArrayList<>();
    private final List<ValidationWarning> warnings = new ArrayList<>();

    /**
     * @param application The linked application.
     * @param registry    The symbol registry, may be {@code null}.
     */
    public ValidationContext(ApplicationDeclaration application, SymbolRegistry registry) {
        this.application = application;
        this.registry = registry;
    }

    public ApplicationDeclaration application() { return application; }

    public Optional<SymbolRegistry> registry() { return Optional.ofNullable(registry); }

    public void error(ValidationError.Type type, String message, String declaration, FileIdentity file,
                      SourceLocation location) {
        errors.add(new ValidationError(type, message, declaration, file, location));
    }

    public void warning(ValidationWarning.Type type, String message, String declaration, FileIdentity file,
                        SourceLocation location) {
        warnings.add(new ValidationWarning(type, message, declaration, file, location));
    }

    public ValidationResult result() {
        return ValidationResult.of(errors, warnings);
    }
}
