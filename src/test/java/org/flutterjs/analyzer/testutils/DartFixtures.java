package org.flutterjs.analyzer.testutils;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.backend.link.DeclarationLinker;
import org.flutterjs.analyzer.backend.validate.DeclarationValidator;
import org.flutterjs.analyzer.backend.validate.ValidationResult;
import org.flutterjs.analyzer.diagnostics.DiagnosticsEngine;
import org.flutterjs.analyzer.frontend.irgen.AnalysisContext;
import org.flutterjs.analyzer.frontend.irgen.IrExtractor;
import org.flutterjs.analyzer.frontend.parser.DartSourceParser;
import org.flutterjs.analyzer.frontend.parser.ParseException;
import org.flutterjs.analyzer.frontend.parser.ParsedUnit;
import org.flutterjs.analyzer.frontend.semantics.SymbolRegistry;
import org.flutterjs.analyzer.frontend.semantics.TypeResolver;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.FileDeclaration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for tests that need Dart sources: on disk as a project, or in memory run through
 * parsing, symbol resolution and extraction in the order files are added.
 */
public final class DartFixtures {

    public static final String PACKAGE = "demo";

    private final SymbolRegistry registry = new SymbolRegistry();
    private final Map<FileIdentity, FileDeclaration> declarations = new LinkedHashMap<>();

    /**
     * @return The virtual identity of a file below {@code /app/lib}.
     */
    public static FileIdentity file(String name) {
        return FileIdentity.parse("/app/lib/" + name);
    }

    /**
     * Creates the manifest and the {@code lib} directory of a project.
     */
    public static Path project(Path root) {
        try {
            Files.createDirectories(root.resolve("lib"));
            Files.writeString(root.resolve("pubspec.yaml"), "name: " + PACKAGE + "\nversion: 1.0.0\n",
                    StandardCharsets.UTF_8);
            return root;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes a source file below the project root and returns its identity.
     */
    public static FileIdentity write(Path root, String relative, String source) {
        try {
            Path target = root.resolve(relative);
            Files.createDirectories(target.getParent());
            Files.writeString(target, source, StandardCharsets.UTF_8);
            return FileIdentity.of(target);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ParsedUnit parse(FileIdentity file, String source) {
        try {
            return new DartSourceParser().parse(file, source);
        } catch (ParseException e) {
            throw new AssertionError(e.getMessage(), e);
        }
    }

    /**
     * Parses, registers and extracts one file. Dependencies must be added first.
     */
    public DartFixtures add(String name, String source) {
        FileIdentity file = file(name);
        ParsedUnit unit = parse(file, source);
        registry.replaceFile(file, new TypeResolver(registry).resolve(unit));
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        declarations.put(file, new IrExtractor().extract(unit, new AnalysisContext(file, registry, null), diagnostics));
        return this;
    }

    public FileDeclaration declaration(String name) {
        return declarations.get(file(name));
    }

    public SymbolRegistry registry() {
        return registry;
    }

    public ApplicationDeclaration link() {
        return new DeclarationLinker().link(declarations, null, registry);
    }

    public ValidationResult validate() {
        return new DeclarationValidator().validate(link(), registry);
    }

    /**
     * Extracts a single file against an empty registry.
     */
    public static FileDeclaration extract(String name, String source) {
        return new DartFixtures().add(name, source).declaration(name);
    }
}
