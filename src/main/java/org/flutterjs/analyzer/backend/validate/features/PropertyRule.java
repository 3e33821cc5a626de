package org.flutterjs.analyzer.backend.validate.features;

import org.flutterjs.analyzer.backend.validate.IValidationRule;
import org.flutterjs.analyzer.backend.validate.ValidationContext;
import org.flutterjs.analyzer.backend.validate.ValidationWarning;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.Declaration;
import org.flutterjs.analyzer.ir.PropertyDeclaration;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Checks component properties: a required property with a default value is contradictory,
 * and a property type should be a built-in type, a type parameter or a project type.
 */
public class PropertyRule implements IValidationRule {

    /** Dart core and common Flutter types accepted without a declaration. */
    static final Set<String> BUILT_IN_TYPES = Set.of(
            // Dart core types
            "int", "double", "num", "String", "bool", "dynamic", "void", "Object",
            "List", "Map", "Set", "Iterable", "Future", "Stream", "Function",
            // Flutter common types
            "Widget", "BuildContext", "Key", "Color", "TextStyle", "EdgeInsets",
            "BoxDecoration", "Border", "BorderRadius", "Alignment", "MainAxisAlignment",
            "CrossAxisAlignment", "MainAxisSize", "Axis", "TextAlign", "FontWeight",
            "Curve", "Duration", "Size", "Offset", "Rect", "VoidCallback",
            "ValueChanged", "AsyncCallback", "AnimationController", "Animation",
            "TextEditingController", "ScrollController", "PageController",
            "FocusNode", "GlobalKey", "NavigatorState", "ScaffoldState");

    @Override
    public void validate(ValidationContext context) {
        Set<String> projectTypes = projectTypes(context.application());
        for (ComponentDeclaration component : context.application().components()) {
            for (PropertyDeclaration property : component.properties()) {
                if (property.required() && property.defaultValue() != null) {
                    context.warning(ValidationWarning.Type.REDUNDANT_DEFAULT,
                            "Property '" + property.name() + "' of '" + component.name()
                                    + "' is required but also has a default value",
                            component.name(), component.file(), property.location());
                }
                if (property.type() == null) continue;
                String type = cleanTypeName(property.type().displayName());
                if (!isKnown(type, component, projectTypes, context)) {
                    context.warning(ValidationWarning.Type.UNKNOWN_TYPE,
                            "Property '" + property.name() + "' of '" + component.name() + "' has unknown type '"
                                    + type + "'",
                            component.name(), component.file(), property.location());
                }
            }
        }
    }

    /**
     * @param type A type as written, e.g. {@code List<String>?}.
     * @return The bare type name, e.g. {@code List}.
     */
    static String cleanTypeName(String type) {
        return type.replace("?", "").replaceAll("<.*>", "").trim();
    }

    private static boolean isKnown(String type, ComponentDeclaration component, Set<String> projectTypes,
                                   ValidationContext context) {
        if (BUILT_IN_TYPES.contains(type) || projectTypes.contains(type)) return true;
        if (component.typeParameters().contains(type)) return true;
        return context.registry().flatMap(r -> r.lookup(type)).isPresent();
    }

    private static Set<String> projectTypes(ApplicationDeclaration application) {
        Set<String> names = new HashSet<>();
        Stream.of(application.components(), application.stateHolders(), application.observableStates(),
                        application.plainTypes())
                .flatMap(list -> list.stream().map(Declaration::name))
                .forEach(names::add);
        return names;
    }
}
