package com.tagatlas.init;

import com.tagatlas.config.TagAtlasProperties;
import com.tagatlas.dto.GraphStats;
import com.tagatlas.dto.ImportSummary;
import com.tagatlas.dto.LookupValidationReport;
import com.tagatlas.service.LookupPathService;
import com.tagatlas.service.TagGraphService;
import com.tagatlas.service.TagImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Imports the tag CSV once at startup, then checks the configured lookup paths against
 * the imported graph. Only runs when tagatlas.importer.enabled=true;
 * tagatlas.importer.force=true wipes and re-imports.
 */
@Component
@ConditionalOnProperty(prefix = "tagatlas.importer", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class TagDataImporter implements CommandLineRunner {

    private final TagImportService importService;
    private final TagGraphService graphService;
    private final LookupPathService lookupPathService;
    private final TagAtlasProperties properties;

    @Override
    public void run(String... args) {
        TagAtlasProperties.Import config = properties.getImporter();
        if (config.getSource() == null || config.getSource().isBlank()) {
            log.warn("Tag import enabled but tagatlas.importer.source is not set, skipping");
            return;
        }

        Path source = Path.of(config.getSource());
        if (!Files.isReadable(source)) {
            log.warn("Tag source {} is not readable, skipping import", source);
            return;
        }

        ImportSummary summary = config.isForce()
                ? importService.forceReimport(source)
                : importService.importIfNeeded(source);

        GraphStats stats = graphService.getStats();
        if (summary.isSkipped()) {
            log.info("Database already has tag data: {} nodes, {} edges, {} tags",
                    stats.getNodes(), stats.getEdges(), stats.getTags());
        } else {
            log.info("Imported tag data: {} nodes, {} edges, {} tags",
                    stats.getNodes(), stats.getEdges(), stats.getTags());
        }

        LookupValidationReport report = lookupPathService.validateConfigured();
        log.info("Lookup paths validated: {}", report.getResolvedCounts());
    }
}
