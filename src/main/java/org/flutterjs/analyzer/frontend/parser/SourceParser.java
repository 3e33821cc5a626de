package org.flutterjs.analyzer.frontend.parser;

import org.flutterjs.analyzer.api.FileIdentity;

/**
 * Turns the text of one source file into a syntax tree. Implementations must be safe to
 * call from several worker threads at once.
 */
public interface SourceParser {

    /**
     * Parses a source file.
     *
     * @param file   The file the text belongs to, used for diagnostics.
     * @param source The file content.
     * @return The syntax tree.
     * @throws ParseException if the text contains syntax errors.
     */
    ParsedUnit parse(FileIdentity file, String source) throws ParseException;
}
