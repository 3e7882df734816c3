package com.example.doccatalog;

public interface ProcessingLimiter {
    /**
     * Returns true if the walk should stop given the number of new records admitted so far.
     * Consulted before each directory is opened and after each store flush.
     */
    boolean shouldStop(long admittedNewCount);

    /**
     * Default limiter used in production runs (never stops early).
     */
    ProcessingLimiter NO_LIMIT = admittedNewCount -> false;
}
