package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives declaration ids from the declaring file and the declaration name. Ids depend on
 * nothing else, so re-analyzing an unchanged file reproduces them exactly.
 */
public final class DeclarationIds {

    private static final int ID_LENGTH = 16;

    private DeclarationIds() {}

    /**
     * @param file The declaring file.
     * @param name The declaration name, or {@code Type.member} for members.
     * @return A 16 character hex id.
     */
    public static String of(FileIdentity file, String name) {
        return md5Hex(file.path() + "#" + name).substring(0, ID_LENGTH);
    }

    /**
     * @param text Any text.
     * @return The lowercase hex MD5 digest of the UTF-8 bytes.
     */
    public static String md5Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }
}
