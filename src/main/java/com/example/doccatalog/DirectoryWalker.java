package com.example.doccatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Lazy depth-first enumeration of candidate files under a set of roots.
 * <p>
 * Only one directory listing is held in memory at a time. Entries are visited in
 * lexicographic name order, the files of a directory before its subdirectories, so two
 * walks of an unchanged tree yield the same sequence. Subdirectories whose name is
 * excluded are never entered, at any depth. Unreadable entries are counted in
 * {@link WalkStats} and skipped. The iterator cannot be restarted.
 */
public final class DirectoryWalker implements Iterator<Path> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryWalker.class);

    private final Set<String> excludedDirectories;
    private final Set<String> excludedFiles;
    private final boolean followLinks;
    private final BooleanSupplier stopRequested;
    private final WalkStats stats;
    private final Deque<Path> pendingDirectories = new ArrayDeque<>();
    private final Deque<Path> pendingFiles = new ArrayDeque<>();
    private final Set<Path> visitedRealPaths = new HashSet<>();
    private boolean stopped;

    public DirectoryWalker(List<Path> roots, Collection<String> excludedDirectories) {
        this(roots, excludedDirectories, List.of(), false, () -> false, new WalkStats());
    }

    public DirectoryWalker(List<Path> roots,
                           Collection<String> excludedDirectories,
                           Collection<String> excludedFiles,
                           boolean followLinks,
                           BooleanSupplier stopRequested,
                           WalkStats stats) {
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        this.excludedFiles = Set.copyOf(excludedFiles);
        this.followLinks = followLinks;
        this.stopRequested = stopRequested;
        this.stats = stats;
        roots.forEach(pendingDirectories::addLast);
    }

    @Override
    public boolean hasNext() {
        while (pendingFiles.isEmpty()) {
            if (stopped || pendingDirectories.isEmpty()) {
                return false;
            }
            // Stop is only honored between directories.
            if (stopRequested.getAsBoolean()) {
                LOGGER.info("Walk stopped with {} directories still pending.", pendingDirectories.size());
                stopped = true;
                pendingDirectories.clear();
                return false;
            }
            scan(pendingDirectories.removeFirst());
        }
        return true;
    }

    @Override
    public Path next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pendingFiles.removeFirst();
    }

    public boolean wasStopped() {
        return stopped;
    }

    private void scan(Path directory) {
        if (!enterOnce(directory)) {
            return;
        }
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to list directory {}", directory, ex);
            stats.entrySkipped();
            return;
        }
        stats.directoryVisited();
        entries.sort(Comparator.comparing(entry -> entry.getFileName().toString()));

        List<Path> subdirectories = new ArrayList<>();
        for (Path entry : entries) {
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(entry, BasicFileAttributes.class, linkOptions());
            } catch (IOException ex) {
                LOGGER.warn("Failed to read attributes for {}", entry, ex);
                stats.entrySkipped();
                continue;
            }
            String name = entry.getFileName().toString();
            if (attrs.isSymbolicLink()) {
                LOGGER.debug("Skipping symbolic link {}", entry);
            } else if (attrs.isDirectory()) {
                if (excludedDirectories.contains(name)) {
                    LOGGER.debug("Excluding directory {}", entry);
                    stats.directoryExcluded();
                } else {
                    subdirectories.add(entry);
                }
            } else if (attrs.isRegularFile() && !excludedFiles.contains(name)) {
                stats.fileFound();
                pendingFiles.addLast(entry);
            }
        }
        // Push in reverse so the first subdirectory is scanned next (depth-first).
        for (int i = subdirectories.size() - 1; i >= 0; i--) {
            pendingDirectories.addFirst(subdirectories.get(i));
        }
    }

    private boolean enterOnce(Path directory) {
        if (!followLinks) {
            return true;
        }
        try {
            if (!visitedRealPaths.add(directory.toRealPath())) {
                LOGGER.debug("Already visited {} through another link", directory);
                return false;
            }
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Failed to resolve {}", directory, ex);
            stats.entrySkipped();
            return false;
        }
    }

    private LinkOption[] linkOptions() {
        return followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }
}
