package com.example.doccatalog;

/**
 * Size and content checksum of a file, as computed by {@link IdentityResolver}.
 */
public record FileIdentity(
        long size,
        String checksum
) {
}
