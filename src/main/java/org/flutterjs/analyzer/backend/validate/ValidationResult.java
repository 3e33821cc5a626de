package org.flutterjs.analyzer.backend.validate;

import java.util.List;

/**
 * Outcome of validating a linked application.
 *
 * @param valid    {@code true} if there are no errors.
 * @param errors   Errors in the order the checks found them.
 * @param warnings Warnings in the order the checks found them.
 */
public record ValidationResult(boolean valid, List<ValidationError> errors, List<ValidationWarning> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<ValidationError> errors, List<ValidationWarning> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public long errorCount(ValidationError.Type type) {
        return errors.stream().filter(e -> e.type() == type).count();
    }

    public long warningCount(ValidationWarning.Type type) {
        return warnings.stream().filter(w -> w.type() == type).count();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(valid ? "VALID" : "INVALID")
                .append(" (").append(errors.size()).append(" errors, ")
                .append(warnings.size()).append(" warnings)");
        for (ValidationError error : errors) {
            sb.append(System.lineSeparator()).append("  error   ").append(error);
        }
        for (ValidationWarning warning : warnings) {
            sb.append(System.lineSeparator()).append("  warning ").append(warning);
        }
        return sb.toString();
    }
}
