package org.flutterjs.analyzer.ir;

/**
 * A position inside a source file.
 *
 * @param line   1-based line, 0 if unknown.
 * @param column 1-based column, 0 if unknown.
 */
public record SourceLocation(int line, int column) {

    /** Used where no position is available. */
    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
