package com.example.doccatalog;

public class IdentityResult {
    private final FileIdentity identity;
    private final IoSkip skip;

    private IdentityResult(FileIdentity identity, IoSkip skip) {
        this.identity = identity;
        this.skip = skip;
    }

    public static IdentityResult success(FileIdentity identity) {
        return new IdentityResult(identity, null);
    }

    public static IdentityResult skipped(IoSkip skip) {
        return new IdentityResult(null, skip);
    }

    public boolean isSuccess() {
        return identity != null;
    }

    public FileIdentity getIdentity() {
        return identity;
    }

    public IoSkip getSkip() {
        return skip;
    }
}
