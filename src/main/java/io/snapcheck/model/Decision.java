package io.snapcheck.model;

public enum Decision {
    ACCEPT,
    REJECT,
    SKIP,
    NEXT,
    PREVIOUS;

    public boolean endsRound() {
        return this == ACCEPT || this == REJECT || this == SKIP;
    }
}
