package com.example.recipematch.model;

public enum MatchReason {
    PRE_MAPPED("Pre-mapped product"),
    EXACT_NAME("Exact name match"),
    NAME_SIMILARITY("Name similarity match");

    private final String label;
    MatchReason(String label) { this.label = label; }
    public String label() { return label; }
}
