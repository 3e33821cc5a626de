package org.flutterjs.analyzer.ir.expr;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed hierarchy of expression nodes used inside function, method and build bodies.
 * Consumers switch over the permitted records; a new expression kind has to be handled
 * by every one of them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@expr")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LiteralExpr.class, name = "literal"),
        @JsonSubTypes.Type(value = IdentifierExpr.class, name = "identifier"),
        @JsonSubTypes.Type(value = BinaryExpr.class, name = "binary"),
        @JsonSubTypes.Type(value = UnaryExpr.class, name = "unary"),
        @JsonSubTypes.Type(value = AssignmentExpr.class, name = "assignment"),
        @JsonSubTypes.Type(value = ConditionalExpr.class, name = "conditional"),
        @JsonSubTypes.Type(value = MethodCallExpr.class, name = "methodCall"),
        @JsonSubTypes.Type(value = InvocationExpr.class, name = "invocation"),
        @JsonSubTypes.Type(value = PropertyAccessExpr.class, name = "propertyAccess"),
        @JsonSubTypes.Type(value = IndexExpr.class, name = "index"),
        @JsonSubTypes.Type(value = InstanceCreationExpr.class, name = "instanceCreation"),
        @JsonSubTypes.Type(value = ListLiteralExpr.class, name = "list"),
        @JsonSubTypes.Type(value = MapLiteralExpr.class, name = "map"),
        @JsonSubTypes.Type(value = SetLiteralExpr.class, name = "set"),
        @JsonSubTypes.Type(value = MapEntryExpr.class, name = "mapEntry"),
        @JsonSubTypes.Type(value = SpreadExpr.class, name = "spread"),
        @JsonSubTypes.Type(value = CollectionIfExpr.class, name = "collectionIf"),
        @JsonSubTypes.Type(value = CollectionForExpr.class, name = "collectionFor"),
        @JsonSubTypes.Type(value = CollectionForLoopExpr.class, name = "collectionForLoop"),
        @JsonSubTypes.Type(value = StringTemplateExpr.class, name = "stringTemplate"),
        @JsonSubTypes.Type(value = AwaitExpr.class, name = "await"),
        @JsonSubTypes.Type(value = TypeTestExpr.class, name = "typeTest"),
        @JsonSubTypes.Type(value = CastExpr.class, name = "cast"),
        @JsonSubTypes.Type(value = FunctionExpr.class, name = "function"),
        @JsonSubTypes.Type(value = CascadeExpr.class, name = "cascade"),
        @JsonSubTypes.Type(value = ThrowExpr.class, name = "throw")
})
public sealed interface ExpressionIR permits
        LiteralExpr, IdentifierExpr, BinaryExpr, UnaryExpr, AssignmentExpr, ConditionalExpr,
        MethodCallExpr, InvocationExpr, PropertyAccessExpr, IndexExpr, InstanceCreationExpr,
        ListLiteralExpr, MapLiteralExpr, SetLiteralExpr, MapEntryExpr, SpreadExpr, CollectionIfExpr,
        CollectionForExpr, CollectionForLoopExpr, StringTemplateExpr, AwaitExpr, TypeTestExpr, CastExpr, FunctionExpr,
        CascadeExpr, ThrowExpr {
}
