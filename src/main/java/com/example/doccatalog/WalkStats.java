package com.example.doccatalog;

import java.util.concurrent.atomic.AtomicLong;

public final class WalkStats {
    private final AtomicLong directoriesVisited = new AtomicLong();
    private final AtomicLong filesFound = new AtomicLong();
    private final AtomicLong excludedDirectories = new AtomicLong();
    private final AtomicLong skippedEntries = new AtomicLong();

    public void directoryVisited() {
        directoriesVisited.incrementAndGet();
    }

    public void fileFound() {
        filesFound.incrementAndGet();
    }

    public void directoryExcluded() {
        excludedDirectories.incrementAndGet();
    }

    public void entrySkipped() {
        skippedEntries.incrementAndGet();
    }

    public long directoriesVisited() {
        return directoriesVisited.get();
    }

    public long filesFound() {
        return filesFound.get();
    }

    public long excludedDirectories() {
        return excludedDirectories.get();
    }

    public long skippedEntries() {
        return skippedEntries.get();
    }
}
