package org.flutterjs.analyzer.ir.stmt;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed hierarchy of statement nodes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@stmt")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BlockStmt.class, name = "block"),
        @JsonSubTypes.Type(value = VariableDeclStmt.class, name = "variable"),
        @JsonSubTypes.Type(value = ExpressionStmt.class, name = "expression"),
        @JsonSubTypes.Type(value = IfStmt.class, name = "if"),
        @JsonSubTypes.Type(value = ForStmt.class, name = "for"),
        @JsonSubTypes.Type(value = ForEachStmt.class, name = "forEach"),
        @JsonSubTypes.Type(value = WhileStmt.class, name = "while"),
        @JsonSubTypes.Type(value = DoWhileStmt.class, name = "doWhile"),
        @JsonSubTypes.Type(value = SwitchStmt.class, name = "switch"),
        @JsonSubTypes.Type(value = TryStmt.class, name = "try"),
        @JsonSubTypes.Type(value = ReturnStmt.class, name = "return"),
        @JsonSubTypes.Type(value = BreakStmt.class, name = "break"),
        @JsonSubTypes.Type(value = ContinueStmt.class, name = "continue"),
        @JsonSubTypes.Type(value = YieldStmt.class, name = "yield"),
        @JsonSubTypes.Type(value = AssertStmt.class, name = "assert"),
        @JsonSubTypes.Type(value = LocalFunctionStmt.class, name = "localFunction")
})
public sealed interface StatementIR permits
        BlockStmt, VariableDeclStmt, ExpressionStmt, IfStmt, ForStmt, ForEachStmt, WhileStmt, DoWhileStmt,
        SwitchStmt, TryStmt, ReturnStmt, BreakStmt, ContinueStmt, YieldStmt, AssertStmt, LocalFunctionStmt {
}
