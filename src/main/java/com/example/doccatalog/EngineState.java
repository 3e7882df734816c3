package com.example.doccatalog;

/**
 * Lifecycle of a {@link CatalogEngine} run. Any state may move to {@link #FAILED}.
 */
public enum EngineState {
    INIT,
    LOADING_EXISTING,
    WALKING,
    DEDUPLICATING,
    FLUSHING,
    EXPORTING,
    DONE,
    CANCELLED,
    FAILED
}
