package io.snapcheck.model;

public enum Stage {
    NEW,
    UPDATE
}
