package com.example.doccatalog;

public enum SkipReason {
    PERMISSION_DENIED,
    NOT_FOUND,
    IO_ERROR
}
