package com.tagatlas.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine tuning knobs, bound from the "tagatlas" prefix.
 */
@Data
@ConfigurationProperties(prefix = "tagatlas")
public class TagAtlasProperties {

    private Graph graph = new Graph();
    private Paths paths = new Paths();
    private Search search = new Search();
    private Import importer = new Import();
    private Lookups lookups = new Lookups();

    @Data
    public static class Graph {
        /** Ancestor levels walked before an edge insert */
        private int cycleCheckDepth = 20;
        private int maxBreadcrumbDepth = 50;
        private int maxSubtreeDepth = 50;
    }

    @Data
    public static class Paths {
        private int maxPerNode = 8;
        private String separator = "/";
    }

    @Data
    public static class Search {
        private int defaultLimit = 50;
        private int ftsCandidateFactor = 4;
        private double bm25K1 = 1.2;
        private double bm25B = 0.75;
        /** Upper bound of normalised full-text scores; stays below the prefix tier */
        private double ftsScoreCeiling = 60.0;
    }

    @Data
    public static class Import {
        private boolean enabled = false;
        private String source;
        private boolean force = false;
        private boolean rebuildPaths = true;
        private int flushEvery = 200; // rows between persistence context flush/clear
    }

    @Data
    public static class Lookups {
        private String config = "config/lookup-paths.yaml";
    }
}
