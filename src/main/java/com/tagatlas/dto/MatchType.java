package com.tagatlas.dto;

/**
 * Retrieval strategy that produced a search hit, in tier order.
 */
public enum MatchType {
    EXACT("exact"),
    PREFIX("prefix"),
    FTS("fts");

    private final String label;

    MatchType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
