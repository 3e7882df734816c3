package com.example.doccatalog.model;

import com.example.doccatalog.HashAlgorithm;
import com.example.doccatalog.IdentityResolver;
import com.example.doccatalog.IdentityResult;
import com.example.doccatalog.IoSkip;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One catalog entry. Walked, imported and stored files share this type and differ only in
 * how they are constructed and in their {@link Origin}.
 * <p>
 * Size and checksum are resolved lazily and at most once; after that the record only
 * changes through {@link #markDuplicate(boolean)}.
 */
public final class FileRecord {

    public enum Origin {
        EXISTING,
        NEW
    }

    private final Path absolutePath;
    private final Path baseDirectory;
    private final String relativePath;
    private final String name;
    private final String extension;
    private final Origin origin;
    private final List<ExtraAttribute> extras;

    private Long size;
    private String checksum;
    private String hashAlgorithm;
    private boolean identityResolved;
    private IoSkip identitySkip;
    private boolean duplicate;

    private FileRecord(Path absolutePath,
                       Path baseDirectory,
                       String relativePath,
                       String name,
                       String extension,
                       Origin origin,
                       List<ExtraAttribute> extras) {
        this.absolutePath = absolutePath;
        this.baseDirectory = baseDirectory;
        this.relativePath = relativePath;
        this.name = name;
        this.extension = extension;
        this.origin = origin;
        this.extras = List.copyOf(extras);
    }

    /**
     * A file discovered by the current walk. Nothing is read from disk until
     * {@link #resolveIdentity(IdentityResolver)} is called.
     */
    public static FileRecord fromWalk(Path file, Path baseDirectory) {
        Path absolute = file.toAbsolutePath().normalize();
        String name = fileName(absolute);
        return new FileRecord(absolute, baseDirectory, relativize(baseDirectory, absolute),
                name, extensionOf(name), Origin.NEW, List.of());
    }

    /**
     * A row of a tabular import. A present checksum is trusted as is unless its algorithm is
     * known to differ from the configured one.
     */
    public static FileRecord fromImportRow(Path file,
                                           Path baseDirectory,
                                           Long size,
                                           String checksum,
                                           String hashAlgorithm,
                                           boolean duplicate,
                                           List<ExtraAttribute> extras) {
        Path absolute = file.toAbsolutePath().normalize();
        String name = fileName(absolute);
        FileRecord record = new FileRecord(absolute, baseDirectory, relativize(baseDirectory, absolute),
                name, extensionOf(name), Origin.EXISTING, extras);
        record.size = size;
        record.duplicate = duplicate;
        record.adoptChecksum(checksum, hashAlgorithm);
        return record;
    }

    /**
     * A row of a previously persisted store, relative to the base directory of its session.
     */
    public static FileRecord fromStoreRow(Path baseDirectory,
                                          String relativePath,
                                          String name,
                                          String extension,
                                          Long size,
                                          String checksum,
                                          String hashAlgorithm) {
        Path absolute = baseDirectory.resolve(relativePath).toAbsolutePath().normalize();
        FileRecord record = new FileRecord(absolute, baseDirectory, relativePath,
                name, extension == null ? "" : extension, Origin.EXISTING, List.of());
        record.size = size;
        record.adoptChecksum(checksum, hashAlgorithm);
        return record;
    }

    private void adoptChecksum(String checksum, String hashAlgorithm) {
        if (checksum == null || checksum.isBlank()) {
            return;
        }
        this.checksum = checksum.trim();
        this.hashAlgorithm = hashAlgorithm;
        this.identityResolved = true;
    }

    /**
     * Drops a checksum computed by another algorithm so the next resolution recomputes it.
     *
     * @return true if the checksum was discarded
     */
    public synchronized boolean invalidateChecksumUnless(HashAlgorithm expected) {
        if (checksum == null || hashAlgorithm == null || expected.matches(hashAlgorithm)) {
            return false;
        }
        checksum = null;
        hashAlgorithm = null;
        identityResolved = false;
        return true;
    }

    /**
     * Computes size and checksum on first use. Later calls return the memoized outcome.
     *
     * @return the skip recorded when the file could not be read
     */
    public synchronized Optional<IoSkip> resolveIdentity(IdentityResolver resolver) {
        if (!identityResolved) {
            identityResolved = true;
            IdentityResult result = resolver.resolve(absolutePath);
            if (result.isSuccess()) {
                size = result.getIdentity().size();
                checksum = result.getIdentity().checksum();
                hashAlgorithm = resolver.algorithm().jcaName;
            } else {
                identitySkip = result.getSkip();
            }
        }
        return Optional.ofNullable(identitySkip);
    }

    public synchronized boolean isIdentityResolved() {
        return identityResolved;
    }

    /**
     * Stable for a given (absolute path, checksum) pair.
     */
    public synchronized String key() {
        return FileKeys.keyFor(absolutePath.toString(), checksum);
    }

    public synchronized String checksum() {
        return checksum;
    }

    public synchronized Long size() {
        return size;
    }

    public synchronized String hashAlgorithm() {
        return hashAlgorithm;
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    public void markDuplicate(boolean duplicate) {
        this.duplicate = duplicate;
    }

    public Path absolutePath() {
        return absolutePath;
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    public String relativePath() {
        return relativePath;
    }

    public String name() {
        return name;
    }

    public String extension() {
        return extension;
    }

    public Origin origin() {
        return origin;
    }

    public List<ExtraAttribute> extras() {
        return extras;
    }

    /**
     * Directory names between the base directory and the file, outermost first.
     */
    public List<String> subdirectories() {
        Path parent = Path.of(relativePath).getParent();
        if (parent == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>(parent.getNameCount());
        for (Path element : parent) {
            names.add(element.toString());
        }
        return names;
    }

    @Override
    public String toString() {
        return name;
    }

    private static String relativize(Path baseDirectory, Path absolute) {
        if (baseDirectory == null) {
            return absolute.toString();
        }
        try {
            return baseDirectory.toAbsolutePath().normalize().relativize(absolute).toString();
        } catch (IllegalArgumentException ex) {
            // Different roots (e.g. another drive) cannot be relativized.
            return absolute.toString();
        }
    }

    private static String fileName(Path absolute) {
        Path fileName = absolute.getFileName();
        return fileName == null ? absolute.toString() : fileName.toString();
    }

    private static String extensionOf(String name) {
        String extension = FilenameUtils.getExtension(name);
        return extension.isEmpty() ? "" : "." + extension;
    }
}
