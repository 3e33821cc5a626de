package org.flutterjs.analyzer.cache;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.DeclarationIds;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.StringJoiner;

/**
 * Computes content hashes that ignore line-ending style and trailing whitespace, so that
 * re-saving a file in another editor does not invalidate it.
 */
public final class ContentHasher {

    private ContentHasher() {}

    /**
     * @param content Source text.
     * @return The lowercase hex MD5 of the normalized text.
     */
    public static String hash(String content) {
        return DeclarationIds.md5Hex(normalize(content));
    }

    /**
     * Reads and hashes a file.
     *
     * @param file The file.
     * @return Its content hash.
     * @throws IOException if the file cannot be read.
     */
    public static String hashFile(FileIdentity file) throws IOException {
        return hash(Files.readString(file.toPath(), StandardCharsets.UTF_8));
    }

    static String normalize(String content) {
        String unified = content.replace("\r\n", "\n").replace('\r', '\n');
        StringJoiner joiner = new StringJoiner("\n");
        for (String line : unified.split("\n", -1)) {
            joiner.add(line.stripTrailing());
        }
        return joiner.toString().strip();
    }
}
