package org.flutterjs.analyzer.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Canonical identity of a source file: its absolute, normalized path with forward slashes.
 * <p>
 * This is the unit of dependency tracking, caching and invalidation. Two identities created
 * from different spellings of the same path compare equal.
 *
 * @param path The canonical path string.
 */
public record FileIdentity(String path) implements Comparable<FileIdentity> {

    public FileIdentity {
        Objects.requireNonNull(path, "path");
    }

    /**
     * Creates the identity of the given path, resolving it against the working directory if relative.
     *
     * @param file The file path.
     * @return The canonical identity.
     */
    public static FileIdentity of(Path file) {
        return new FileIdentity(file.toAbsolutePath().normalize().toString().replace('\\', '/'));
    }

    /**
     * Recreates an identity from its serialized form.
     *
     * @param path A path string previously produced by {@link #path()}.
     * @return The identity.
     */
    @JsonCreator
    public static FileIdentity parse(String path) {
        return of(Path.of(path));
    }

    /**
     * @return The identity as a filesystem path.
     */
    public Path toPath() {
        return Path.of(path);
    }

    /**
     * @return The last path segment, e.g. {@code main.dart}.
     */
    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    @JsonValue
    @Override
    public String path() {
        return path;
    }

    @Override
    public int compareTo(FileIdentity other) {
        return path.compareTo(other.path);
    }

    @Override
    public String toString() {
        return path;
    }
}
