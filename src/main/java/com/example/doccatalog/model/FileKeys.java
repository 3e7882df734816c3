package com.example.doccatalog.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility for generating stable record keys.
 * A key is the SHA-1 of the absolute path followed by the content checksum, so the same
 * path with different content and the same content at different paths never collide.
 */
public final class FileKeys {

    private FileKeys() {
        // Utility class
    }

    public static String keyFor(String absolutePath, String checksum) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            digest.update(absolutePath.getBytes(StandardCharsets.UTF_8));
            if (checksum != null) {
                digest.update(checksum.getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
