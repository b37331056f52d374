package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import com.tagatlas.dto.EdgeMutationResult;
import com.tagatlas.dto.ImportSummary;
import com.tagatlas.entity.MetaEntry;
import com.tagatlas.entity.TagNode;
import com.tagatlas.entity.TagEdgeId;
import com.tagatlas.exception.TagImportException;
import com.tagatlas.repository.*;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Two-pass bulk ingestion of hierarchical tag rows.
 *
 * Each row is an ordered list of segments; the last one is a usable tag, the ones
 * before it are categories. Pass one collects every tag slug and, per category slug,
 * the distinct category paths it appears under. Pass two upserts and links the
 * segments, giving a category a parent-prefixed slug when its plain slug belongs to
 * a tag or appears under more than one path.
 *
 * A persistent marker makes the import run once; a forced re-import wipes the store first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TagImportService {

    static final String IMPORT_MARKER = "csv_imported";
    private static final String PATH_JOINER = "/";

    private final TagGraphService graphService;
    private final PathIndexService pathIndexService;
    private final SearchIndexService searchIndexService;
    private final GraphWriteExecutor writer;
    private final TagNodeRepository nodeRepository;
    private final TagEdgeRepository edgeRepository;
    private final TagAliasRepository aliasRepository;
    private final TagPathRepository pathRepository;
    private final SearchDocumentRepository documentRepository;
    private final SearchPostingRepository postingRepository;
    private final MetaEntryRepository metaRepository;
    private final TagAtlasProperties properties;

    @PersistenceContext
    private EntityManager entityManager;

    public boolean isImported() {
        return metaRepository.findById(IMPORT_MARKER)
                .map(entry -> "true".equals(entry.getValue()))
                .orElse(false);
    }

    /**
     * Import the CSV at source unless the store is already marked as imported
     */
    public ImportSummary importIfNeeded(Path source) {
        if (isImported()) {
            log.info("Tag data already imported, skipping {}", source);
            return ImportSummary.skippedRun();
        }
        return importFile(source);
    }

    /**
     * Wipe every record, clear the marker and import again. Not undoable: the wipe
     * commits on its own before ingestion starts.
     */
    public ImportSummary forceReimport(Path source) {
        log.warn("Forced re-import requested, wiping tag store");
        wipeAll();
        return importFile(source);
    }

    public ImportSummary importIfNeeded(List<List<String>> rows) {
        if (isImported()) {
            log.info("Tag data already imported, skipping {} rows", rows.size());
            return ImportSummary.skippedRun();
        }
        return importAndMark(rows);
    }

    /**
     * Delete nodes, edges, aliases, paths, the search index and the import marker
     * in one transaction
     */
    public void wipeAll() {
        writer.run(() -> {
            postingRepository.deleteAllInBatch();
            documentRepository.deleteAllInBatch();
            pathRepository.deleteAllInBatch();
            aliasRepository.deleteAllInBatch();
            edgeRepository.deleteAllInBatch();
            nodeRepository.deleteAllInBatch();
            metaRepository.save(new MetaEntry(IMPORT_MARKER, "false"));
        });
        log.info("Tag store wiped");
    }

    private ImportSummary importFile(Path source) {
        List<List<String>> rows;
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            rows = CsvRowParser.parse(reader);
        } catch (IOException e) {
            throw new TagImportException(String.valueOf(source), "Could not read tag source", e);
        }
        log.info("Read {} rows from {}", rows.size(), source);
        return importAndMark(rows);
    }

    private ImportSummary importAndMark(List<List<String>> rows) {
        ImportSummary summary = importRows(rows);
        writer.run(() -> metaRepository.save(new MetaEntry(IMPORT_MARKER, "true")));
        return summary;
    }

    /**
     * Ingest rows and rebuild the derived indexes. Does not look at or set the marker.
     */
    public ImportSummary importRows(List<List<String>> rows) {
        long started = System.currentTimeMillis();
        ImportPlan plan = collect(rows);
        ImportSummary summary = writer.write(status -> ingest(rows, plan));

        if (properties.getImporter().isRebuildPaths()) {
            summary.setPathsIndexed(pathIndexService.rebuildPathIndex());
        }
        summary.setDocumentsIndexed(searchIndexService.rebuildIndex());

        log.info("Imported {} rows in {} ms: {} nodes created, {} edges added, {} self-loops skipped, "
                        + "{} edges rejected, {} disambiguated slugs",
                summary.getRows(), System.currentTimeMillis() - started, summary.getNodesCreated(),
                summary.getEdgesAdded(), summary.getSelfLoopsSkipped(), summary.getEdgesRejected(),
                summary.getDisambiguatedSlugs());
        return summary;
    }

    /**
     * Pass one: tag slugs and the distinct category paths behind each category slug
     */
    ImportPlan collect(List<List<String>> rows) {
        ImportPlan plan = new ImportPlan();
        for (List<String> row : rows) {
            if (row.isEmpty()) {
                continue;
            }
            plan.tagSlugs.add(Slugifier.slugify(row.get(row.size() - 1)));
            for (int i = 0; i < row.size() - 1; i++) {
                String fullPath = String.join(PATH_JOINER, row.subList(0, i + 1));
                plan.categoryPaths
                        .computeIfAbsent(Slugifier.slugify(row.get(i)), k -> new LinkedHashSet<>())
                        .add(fullPath);
            }
        }
        return plan;
    }

    /**
     * Slug a segment is stored under, given its row position
     */
    String effectiveSlug(List<String> row, int index, ImportPlan plan) {
        String baseSlug = Slugifier.slugify(row.get(index));
        boolean isTag = index == row.size() - 1;
        if (isTag || !plan.isConflicted(baseSlug)) {
            return baseSlug;
        }

        String parentPrefix = row.subList(0, index).stream()
                .map(Slugifier::slugify)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining("_"));
        return parentPrefix.isEmpty() ? baseSlug : parentPrefix + "_" + baseSlug;
    }

    /**
     * Pass two, inside the caller's write transaction. Node ids are tracked in memory,
     * and the persistence context is flushed and cleared every few rows so Hibernate's
     * dirty checking stays bounded however large the import is.
     */
    private ImportSummary ingest(List<List<String>> rows, ImportPlan plan) {
        ImportSummary summary = ImportSummary.builder().rows(rows.size()).build();
        long nodesBefore = nodeRepository.count();
        Map<String, Long> idBySlug = new HashMap<>();
        Set<String> promoted = new HashSet<>();
        Set<TagEdgeId> linked = new HashSet<>();
        int flushEvery = Math.max(1, properties.getImporter().getFlushEvery());
        int rowsSinceClear = 0;

        for (List<String> row : rows) {
            Long previousId = null;

            for (int i = 0; i < row.size(); i++) {
                String text = row.get(i);
                boolean isTag = i == row.size() - 1;
                String slug = effectiveSlug(row, i, plan);
                if (slug.isEmpty()) {
                    log.warn("Skipping segment '{}' without letters or digits", text);
                    summary.setSegmentsSkipped(summary.getSegmentsSkipped() + 1);
                    continue;
                }
                if (text.length() > TagNode.MAX_TEXT_LENGTH || slug.length() > TagNode.MAX_TEXT_LENGTH) {
                    log.warn("Skipping segment of {} characters, limit is {}", text.length(), TagNode.MAX_TEXT_LENGTH);
                    summary.setSegmentsSkipped(summary.getSegmentsSkipped() + 1);
                    continue;
                }
                if (!slug.equals(Slugifier.slugify(text))) {
                    summary.setDisambiguatedSlugs(summary.getDisambiguatedSlugs() + 1);
                }

                Long nodeId = idBySlug.get(slug);
                if (nodeId == null || (isTag && promoted.add(slug))) {
                    TagNode node = graphService.upsertBySlug(slug, text, isTag);
                    nodeId = node.getId();
                    idBySlug.put(slug, nodeId);
                }

                if (previousId != null) {
                    if (previousId.equals(nodeId)) {
                        log.warn("Prevented self-loop for node {} ('{}')", nodeId, text);
                        summary.setSelfLoopsSkipped(summary.getSelfLoopsSkipped() + 1);
                    } else if (linked.add(new TagEdgeId(previousId, nodeId))) {
                        EdgeMutationResult result = graphService.linkGuarded(previousId, nodeId);
                        if (result == EdgeMutationResult.ADDED) {
                            summary.setEdgesAdded(summary.getEdgesAdded() + 1);
                        } else if (result.isRejected()) {
                            summary.setEdgesRejected(summary.getEdgesRejected() + 1);
                        }
                    }
                }
                previousId = nodeId;
            }

            if (++rowsSinceClear >= flushEvery) {
                entityManager.flush();
                entityManager.clear();
                rowsSinceClear = 0;
            }
        }
        summary.setNodesCreated((int) (nodeRepository.count() - nodesBefore));
        return summary;
    }

    static class ImportPlan {
        final Set<String> tagSlugs = new HashSet<>();
        final Map<String, Set<String>> categoryPaths = new HashMap<>();

        boolean isConflicted(String categorySlug) {
            Set<String> paths = categoryPaths.get(categorySlug);
            return tagSlugs.contains(categorySlug) || (paths != null && paths.size() > 1);
        }
    }
}
