package com.tagatlas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked search result with its best cached path for display context
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    private Long nodeId;
    private String slug;
    private String text;
    private boolean tag;

    /**
     * Exact 100, prefix 80, full-text normalised into (0, ceiling]
     */
    private double score;

    private MatchType matchType;

    /**
     * Shortest cached path, null when the path index has no entry for the node
     */
    private String bestPath;
}
