package com.example.doccatalog.store;

import java.util.List;

/**
 * Receives one buffered batch. Implementations write the whole batch or throw.
 */
@FunctionalInterface
public interface BatchWriter<T> {
    void write(List<T> batch);

    static <T> BatchWriter<T> noop() {
        return batch -> {
        };
    }
}
