package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.TypeRef;

/**
 * An {@code on Type catch (e, s)} clause. Every part except the body is optional.
 */
public record CatchClause(TypeRef exceptionType, String exceptionVariable, String stackTraceVariable, BlockStmt body) {
}
