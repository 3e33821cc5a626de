package org.flutterjs.analyzer.backend.link;

import org.flutterjs.analyzer.backend.link.features.CompositionLinkingRule;
import org.flutterjs.analyzer.backend.link.features.ObservableStateLinkingRule;
import org.flutterjs.analyzer.backend.link.features.StateBindingLinkingRule;
import org.flutterjs.analyzer.backend.link.features.StateDependencyLinkingRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for linking rules, which are applied in order to the merged application.
 */
public class LinkingRegistry {

    private final List<ILinkingRule> rules = new ArrayList<>();

    /**
     * Registers a new linking rule.
     * @param rule The rule to register.
     */
    public void register(ILinkingRule rule) { rules.add(rule); }

    /**
     * @return The list of registered linking rules.
     */
    public List<ILinkingRule> rules() { return rules; }

    /**
     * Initializes a new linking registry with the default rules: observable reclassification,
     * state binding, composition edges and state-dependency edges.
     * @return A new registry with default rules.
     */
    public static LinkingRegistry initializeWithDefaults() {
        LinkingRegistry reg = new LinkingRegistry();
        reg.register(new ObservableStateLinkingRule());
        reg.register(new StateBindingLinkingRule());
        reg.register(new CompositionLinkingRule());
        reg.register(new StateDependencyLinkingRule());
        return reg;
    }
}
