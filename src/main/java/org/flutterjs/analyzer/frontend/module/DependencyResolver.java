package org.flutterjs.analyzer.frontend.module;

import org.flutterjs.analyzer.api.AnalysisException;
import org.flutterjs.analyzer.api.FileIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@link DependencyGraph} of a project from a lexical scan of each file's
 * {@code import}, {@code export} and {@code part} directives.
 * <p>
 * No parse is needed to order files. References to the SDK ({@code dart:}) and to other
 * packages are external and silently dropped, as are references to files that do not exist
 * or are excluded.
 */
public class DependencyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyResolver.class);

    private static final Pattern DIRECTIVE = Pattern.compile(
            "^\\s*(?:import|export|part)\\s+(['\"])([^'\"]+)\\1", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("//[^\\n]*");

    private static final String PACKAGE_SCHEME = "package:";
    private static final String SDK_SCHEME = "dart:";

    private final ProjectLayout layout;
    private final Map<String, Optional<FileIdentity>> resolutionCache = new ConcurrentHashMap<>();

    /**
     * @param layout The project whose package name and source root drive resolution.
     */
    public DependencyResolver(ProjectLayout layout) {
        this.layout = layout;
    }

    /**
     * Creates a graph node for every file and an edge for every reference that resolves
     * to a project file.
     *
     * @param files The files to scan.
     * @return The populated graph.
     * @throws AnalysisException if a file cannot be read.
     */
    public DependencyGraph buildGraph(List<FileIdentity> files) throws AnalysisException {
        DependencyGraph graph = new DependencyGraph();
        for (FileIdentity file : files) {
            graph.addNode(file);
        }
        for (FileIdentity file : files) {
            String content;
            try {
                content = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new AnalysisException("Failed to read " + file + " while building the dependency graph", e);
            }
            for (String uri : scanReferences(content)) {
                resolve(file, uri).ifPresent(target -> graph.addEdge(file, target));
            }
        }
        LOG.debug("Built dependency graph with {} files and {} edges", graph.size(), graph.edgeCount());
        return graph;
    }

    /**
     * Extracts the quoted URIs of all import, export and part directives, skipping SDK imports
     * and commented-out directives.
     *
     * @param content The file text.
     * @return The referenced URIs in source order.
     */
    public List<String> scanReferences(String content) {
        String code = LINE_COMMENT.matcher(BLOCK_COMMENT.matcher(content).replaceAll(" ")).replaceAll("");
        List<String> uris = new ArrayList<>();
        Matcher m = DIRECTIVE.matcher(code);
        while (m.find()) {
            String uri = m.group(2).trim();
            if (!uri.startsWith(SDK_SCHEME)) {
                uris.add(uri);
            }
        }
        return uris;
    }

    /**
     * Resolves one reference of {@code from}. Results are memoized per (file, uri).
     *
     * @param from The referencing file.
     * @param uri  The URI as written in the directive.
     * @return The referenced project file, or empty for external, missing or excluded targets.
     */
    public Optional<FileIdentity> resolve(FileIdentity from, String uri) {
        return resolutionCache.computeIfAbsent(from.path() + "|" + uri, k -> doResolve(from, uri));
    }

    private Optional<FileIdentity> doResolve(FileIdentity from, String uri) {
        Path target;
        if (uri.startsWith(PACKAGE_SCHEME)) {
            String rest = uri.substring(PACKAGE_SCHEME.length());
            int slash = rest.indexOf('/');
            if (slash <= 0 || !rest.substring(0, slash).equals(layout.packageName())) {
                return Optional.empty();
            }
            target = layout.sourceRoot().resolve(rest.substring(slash + 1));
        } else if (uri.contains(":")) {
            return Optional.empty();
        } else {
            Path dir = from.toPath().getParent();
            if (dir == null) return Optional.empty();
            target = dir.resolve(uri);
        }
        target = target.normalize();
        if (!Files.isRegularFile(target) || layout.isExcluded(target)) {
            LOG.trace("Dropping unresolvable reference '{}' from {}", uri, from);
            return Optional.empty();
        }
        return Optional.of(FileIdentity.of(target));
    }

    /**
     * Forgets all memoized resolutions, e.g. after files were added or removed.
     */
    public void clearCache() {
        resolutionCache.clear();
    }
}
