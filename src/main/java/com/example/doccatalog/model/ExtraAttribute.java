package com.example.doccatalog.model;

/**
 * An imported column the catalog carries through to the export without interpreting it.
 */
public record ExtraAttribute(
        String name,
        String value
) {
}
