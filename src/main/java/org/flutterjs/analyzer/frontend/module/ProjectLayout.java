package org.flutterjs.analyzer.frontend.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.flutterjs.analyzer.api.AnalysisException;
import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.config.AnalyzerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The on-disk shape of an analyzable project: a root directory with a manifest
 * ({@code pubspec.yaml}) and a source directory ({@code lib}).
 */
public final class ProjectLayout {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectLayout.class);
    private static final String SOURCE_EXTENSION = ".dart";

    private final Path root;
    private final Path sourceRoot;
    private final Path manifest;
    private final String packageName;
    private final List<PathMatcher> excludes;

    private ProjectLayout(Path root, Path sourceRoot, Path manifest, String packageName, List<PathMatcher> excludes) {
        this.root = root;
        this.sourceRoot = sourceRoot;
        this.manifest = manifest;
        this.packageName = packageName;
        this.excludes = excludes;
    }

    /**
     * Validates the project root and reads the package name from its manifest.
     *
     * @param projectRoot The project root directory.
     * @param options     Analyzer options naming the source directory, manifest and excludes.
     * @return The layout.
     * @throws AnalysisException if the root, the source directory or the manifest is missing,
     *                           or the manifest declares no package name.
     */
    public static ProjectLayout open(Path projectRoot, AnalyzerOptions options) throws AnalysisException {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new AnalysisException("Project directory not found: " + root);
        }
        Path sourceRoot = root.resolve(options.sourceDirectory());
        if (!Files.isDirectory(sourceRoot)) {
            throw new AnalysisException("Source directory not found: " + sourceRoot);
        }
        Path manifest = root.resolve(options.manifest());
        if (!Files.isRegularFile(manifest)) {
            throw new AnalysisException("Manifest not found: " + manifest);
        }
        String packageName = readPackageName(manifest);
        List<PathMatcher> matchers = options.excludes().stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .collect(Collectors.toList());
        LOG.debug("Opened project '{}' at {}", packageName, root);
        return new ProjectLayout(root, sourceRoot, manifest, packageName, matchers);
    }

    private static String readPackageName(Path manifest) throws AnalysisException {
        try {
            JsonNode node = new YAMLMapper().readTree(manifest.toFile());
            JsonNode name = node == null ? null : node.get("name");
            if (name == null || name.asText().isBlank()) {
                throw new AnalysisException("Manifest " + manifest + " declares no package name");
            }
            return name.asText().trim();
        } catch (IOException e) {
            throw new AnalysisException("Failed to read manifest " + manifest, e);
        }
    }

    /**
     * Lists all source files below the source root that are not excluded, sorted by path.
     *
     * @return The discovered files.
     * @throws AnalysisException if the source tree cannot be walked.
     */
    public List<FileIdentity> discoverSourceFiles() throws AnalysisException {
        try (Stream<Path> paths = Files.walk(sourceRoot)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                    .filter(p -> !isExcluded(p))
                    .map(FileIdentity::of)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | java.io.UncheckedIOException e) {
            throw new AnalysisException("Failed to scan source directory " + sourceRoot, e);
        }
    }

    /**
     * @param file An absolute path inside the project.
     * @return {@code true} if one of the exclude globs matches the root-relative path.
     */
    public boolean isExcluded(Path file) {
        Path relative = root.relativize(file.toAbsolutePath().normalize());
        return excludes.stream().anyMatch(m -> m.matches(relative));
    }

    public Path root() {
        return root;
    }

    public Path sourceRoot() {
        return sourceRoot;
    }

    public Path manifest() {
        return manifest;
    }

    /**
     * @return The package name declared in the manifest; {@code package:<name>/} imports refer to this project.
     */
    public String packageName() {
        return packageName;
    }
}
