package org.flutterjs.analyzer.backend.link;

/**
 * One step of application linking. Rules run in registration order and may read
 * everything earlier rules produced.
 */
public interface ILinkingRule {

	/**
	 * Applies the rule to the application being linked.
	 *
	 * @param context The mutable linking state.
	 */
	void apply(LinkingContext context);
}
