package com.sendanywhere.chunk;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers. Every digest in a manifest is lowercase hex.
 */
public final class Digests {

    private static final HexFormat HEX = HexFormat.of();

    private Digests() {}

    public static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256Hex(byte[] data) {
        return sha256Hex(data, 0, data.length);
    }

    public static String sha256Hex(byte[] data, int offset, int length) {
        MessageDigest md = newSha256();
        md.update(data, offset, length);
        return hex(md.digest());
    }

    /**
     * Digest of a whole file, read start to end.
     */
    public static String sha256Hex(Path file) throws IOException {
        MessageDigest md = newSha256();
        byte[] buffer = new byte[8192];
        try (InputStream is = Files.newInputStream(file)) {
            int n;
            while ((n = is.read(buffer)) != -1) {
                md.update(buffer, 0, n);
            }
        }
        return hex(md.digest());
    }

    public static String hex(byte[] digest) {
        return HEX.formatHex(digest);
    }
}
