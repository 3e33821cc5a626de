package org.flutterjs.analyzer.frontend.parser;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.diagnostics.DiagnosticsEngine;
import org.flutterjs.analyzer.frontend.lexer.Lexer;
import org.flutterjs.analyzer.frontend.lexer.Token;
import org.flutterjs.analyzer.frontend.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The default {@link SourceParser}: runs the {@link Lexer} and the {@link Parser} on a fresh
 * {@link DiagnosticsEngine} per call, so one instance can be shared by all workers.
 */
public class DartSourceParser implements SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(DartSourceParser.class);

    @Override
    public ParsedUnit parse(FileIdentity file, String source) throws ParseException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String fileName = file.path();

        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw failure(file, diagnostics);
        }
        List<AstNode> declarations = new Parser(tokens, diagnostics).parse();
        if (diagnostics.hasErrors()) {
            throw failure(file, diagnostics);
        }
        LOG.debug("Parsed {} into {} top-level nodes", file.fileName(), declarations.size());
        return new ParsedUnit(file, declarations);
    }

    private ParseException failure(FileIdentity file, DiagnosticsEngine diagnostics) {
        return new ParseException("Syntax errors in " + file + ":\n" + diagnostics.summary(),
                diagnostics.getDiagnostics());
    }
}
