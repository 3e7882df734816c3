package com.example.doccatalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Streams a file through a digest one chunk at a time. Read failures come back as an
 * {@link IoSkip} instead of an exception.
 */
public class IdentityResolver {
    public static final int DEFAULT_BUFFER_SIZE = 65536;

    private final HashAlgorithm algorithm;
    private final int bufferSize;

    public IdentityResolver(HashAlgorithm algorithm, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        this.algorithm = algorithm;
        this.bufferSize = bufferSize;
    }

    public IdentityResult resolve(Path path) {
        return resolve(path, algorithm, bufferSize);
    }

    public static IdentityResult resolve(Path path, HashAlgorithm algorithm, int bufferSize) {
        MessageDigest digest = algorithm.newDigest();
        long size = 0L;
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[bufferSize];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
                size += read;
            }
        } catch (IOException ex) {
            return IdentityResult.skipped(IoSkip.from(path, ex));
        }
        return IdentityResult.success(new FileIdentity(size, HexFormat.of().formatHex(digest.digest())));
    }

    public HashAlgorithm algorithm() {
        return algorithm;
    }
}
