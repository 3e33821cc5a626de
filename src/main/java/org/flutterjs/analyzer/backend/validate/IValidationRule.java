package org.flutterjs.analyzer.backend.validate;

/**
 * One independent structural check over a linked application.
 */
public interface IValidationRule {

	/**
	 * Runs the check and reports findings to the context.
	 *
	 * @param context The application under validation and the finding sink.
	 */
	void validate(ValidationContext context);
}
