package com.example.doccatalog.export;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Receives the final, column-normalized catalog at the end of a successful run.
 */
@FunctionalInterface
public interface ExportSink {
    void export(CatalogProperties properties, List<String> columns, List<Map<String, String>> rows) throws IOException;

    /**
     * Sink used when no export destination is configured.
     */
    ExportSink NONE = (properties, columns, rows) -> {
    };
}
