package com.example.doccatalog;

import java.util.Locale;

/**
 * What to do when the destination store already exists.
 */
public enum StorePolicy {
    APPEND,
    OVERWRITE,
    ERROR;

    public static StorePolicy of(String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
