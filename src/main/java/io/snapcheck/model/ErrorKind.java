package io.snapcheck.model;

public enum ErrorKind {
    SKIPPED,
    REJECTED,
    FILE_CHANGED,
    FAILED,
    ABORTED
}
