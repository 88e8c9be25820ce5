package com.hcltech.multiway;

public enum GraphKind {
    MULTIWAY("multiway"),
    CAUSAL("causal");

    private final String prefix;

    GraphKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
