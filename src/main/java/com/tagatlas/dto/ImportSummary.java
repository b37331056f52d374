package com.tagatlas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a bulk import run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummary {

    /**
     * True when the import marker was already set and nothing ran
     */
    private boolean skipped;

    private int rows;

    private int nodesCreated;

    private int edgesAdded;

    /**
     * Consecutive segments that resolved to the same node
     */
    private int selfLoopsSkipped;

    /**
     * Edges refused by the cycle guard
     */
    private int edgesRejected;

    /**
     * Category segments that received a parent-prefixed slug
     */
    private int disambiguatedSlugs;

    /**
     * Segments dropped for having no letters or digits, or for exceeding the label length
     */
    private int segmentsSkipped;

    private int pathsIndexed;

    private int documentsIndexed;

    public static ImportSummary skippedRun() {
        return ImportSummary.builder().skipped(true).build();
    }
}
