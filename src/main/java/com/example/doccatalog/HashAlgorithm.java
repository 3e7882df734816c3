package com.example.doccatalog;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public enum HashAlgorithm {
    MD5("MD5"),
    SHA1("SHA-1"),
    SHA256("SHA-256"),
    SHA512("SHA-512");

    public final String jcaName;

    HashAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    public static HashAlgorithm of(String s) {
        return switch (s.trim().toUpperCase(Locale.ROOT)) {
            case "MD5" -> MD5;
            case "SHA-1", "SHA1" -> SHA1;
            case "SHA-256", "SHA256" -> SHA256;
            case "SHA-512", "SHA512" -> SHA512;
            default -> throw new IllegalArgumentException("unsupported hash algorithm: " + s);
        };
    }

    public MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(jcaName + " not available", e);
        }
    }

    /**
     * True if the given identifier (as persisted next to a checksum) names this algorithm.
     */
    public boolean matches(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return false;
        }
        try {
            return of(identifier) == this;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
