package com.scipatom.atomizer.resolve;

public enum EdgeKind {
    CALLS("calls"),
    IMPLEMENTS("implements"),
    EXTERNAL("external"),
    UNRESOLVED("unresolved");

    private final String wireName;

    EdgeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
