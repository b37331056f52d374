package com.tagatlas.service;

import com.tagatlas.dto.GraphStats;
import com.tagatlas.dto.ImportSummary;
import com.tagatlas.dto.SearchHit;
import com.tagatlas.entity.TagNode;
import com.tagatlas.exception.TagImportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TagImportServiceTest extends TagStoreTestSupport {

    @Autowired
    private TagTraversalService traversalService;

    @Autowired
    private TagSearchService searchService;

    @TempDir
    Path tempDir;

    private Path fixture() throws Exception {
        Path target = tempDir.resolve("tags.csv");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/tags.csv")) {
            Files.copy(in, target);
        }
        return target;
    }

    private TagNode node(String slug) {
        return graphService.getNodeBySlug(slug).orElseThrow();
    }

    @Test
    void testWeaponsAndArmorRowsEndToEnd() {
        ImportSummary summary = importService.importIfNeeded(List.of(
                List.of("weapons", "swords", "katana"),
                List.of("armor", "helmet", "samurai_helmet")));

        assertEquals(6, summary.getNodesCreated());
        assertEquals(4, summary.getEdgesAdded());
        assertEquals(6, graphService.getStats().getNodes());
        assertEquals(4, graphService.getStats().getEdges());
        assertTrue(node("katana").isTag());
        assertFalse(node("weapons").isTag());

        List<SearchHit> hits = searchService.search("katana", 10);
        assertEquals(1, hits.size());
        assertEquals(100.0, hits.get(0).getScore());
        assertEquals("weapons/swords/katana", hits.get(0).getBestPath());
    }

    @Test
    void testImportsFixtureOnce() throws Exception {
        Path source = fixture();
        assertFalse(importService.isImported());

        ImportSummary first = importService.importIfNeeded(source);

        assertFalse(first.isSkipped());
        assertEquals(6, first.getRows());
        assertEquals(15, first.getNodesCreated());
        assertEquals(11, first.getEdgesAdded());
        assertEquals(0, first.getDisambiguatedSlugs());
        assertEquals(15, first.getDocumentsIndexed());
        assertTrue(importService.isImported());

        GraphStats afterFirst = graphService.getStats();
        ImportSummary second = importService.importIfNeeded(source);
        assertTrue(second.isSkipped());

        GraphStats stats = graphService.getStats();
        assertEquals(afterFirst, stats);
        assertEquals(15, stats.getNodes());
        assertEquals(11, stats.getEdges());
        assertEquals(6, stats.getTags());
        assertEquals(0, stats.getAliases());
        assertEquals(15, stats.getPaths());
    }

    @Test
    void testImportedRowsAreNavigableAndSearchable() throws Exception {
        importService.importIfNeeded(fixture());

        TagNode hairColor = node("hair_color");
        assertEquals(List.of("black, glossy", "blonde"), texts(traversalService.getChildren(hairColor.getId())));
        assertTrue(node("say_cheese_shirt").isTag());
        assertFalse(node("hair").isTag());

        List<SearchHit> hits = searchService.search("blonde", 10);
        assertEquals("blonde", hits.get(0).getText());
        assertEquals("body/hair/hair color/blonde", hits.get(0).getBestPath());
    }

    @Test
    void testForceReimportWipesAndReloads() throws Exception {
        Path source = fixture();
        importService.importIfNeeded(source);
        tag("stray");

        ImportSummary summary = importService.forceReimport(source);

        assertFalse(summary.isSkipped());
        assertEquals(15, summary.getNodesCreated());
        assertTrue(graphService.getNodeBySlug("stray").isEmpty());
        assertTrue(importService.isImported());
    }

    @Test
    void testMissingSourceFails() {
        Path missing = tempDir.resolve("absent.csv");

        TagImportException e = assertThrows(TagImportException.class, () -> importService.importIfNeeded(missing));
        assertEquals(missing.toString(), e.getSource());
        assertFalse(importService.isImported());
    }

    @Test
    void testCategoryUnderSeveralPathsGetsParentPrefix() {
        ImportSummary summary = importService.importIfNeeded(List.of(
                List.of("colors", "hair colors", "red"),
                List.of("hair", "hair colors", "blonde")));

        assertEquals(2, summary.getDisambiguatedSlugs());
        assertTrue(graphService.getNodeBySlug("hair_colors").isEmpty());

        TagNode underColors = node("colors_hair_colors");
        TagNode underHair = node("hair_hair_colors");
        assertEquals("hair colors", underColors.getText());
        assertEquals(List.of("red"), texts(traversalService.getChildren(underColors.getId())));
        assertEquals(List.of("blonde"), texts(traversalService.getChildren(underHair.getId())));
    }

    @Test
    void testCategoryNamedLikeTagGetsParentPrefix() {
        importService.importIfNeeded(List.of(
                List.of("body", "hair", "long"),
                List.of("hair")));

        TagNode category = node("body_hair");
        TagNode tag = node("hair");
        assertEquals("hair", category.getText());
        assertFalse(category.isTag());
        assertTrue(tag.isTag());
        assertEquals(List.of("long"), texts(traversalService.getChildren(category.getId())));
        assertTrue(traversalService.getParents(tag.getId()).isEmpty());
    }

    @Test
    void testSelfLoopsAndCyclesAreSkipped() {
        ImportSummary summary = importService.importIfNeeded(List.of(
                List.of("red", "red"),
                List.of("a", "b"),
                List.of("b", "a")));

        assertEquals(1, summary.getSelfLoopsSkipped());
        assertEquals(1, summary.getEdgesAdded());
        assertEquals(1, summary.getEdgesRejected());
        assertEquals(1, graphService.getStats().getEdges());
        assertEquals(List.of("b"), texts(traversalService.getChildren(node("a").getId())));
    }

    @Test
    void testWipeClearsMarker() {
        importService.importIfNeeded(List.of(List.of("weapons", "katana")));
        assertTrue(importService.isImported());

        importService.wipeAll();

        assertFalse(importService.isImported());
        assertEquals(0, graphService.getStats().getNodes());
    }

    @Test
    void testOversizedSegmentIsSkipped() {
        ImportSummary summary = importService.importIfNeeded(List.of(
                List.of("weapons", "x".repeat(TagNode.MAX_TEXT_LENGTH + 1), "katana")));

        assertEquals(1, summary.getSegmentsSkipped());
        assertEquals(2, summary.getNodesCreated());
        assertEquals(List.of("katana"), texts(traversalService.getChildren(node("weapons").getId())));
        assertTrue(importService.isImported());
    }

    @Test
    void testLargeImportStaysFast() {
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < 3000; i++) {
            int family = i % 200;
            rows.add(List.of("group " + (family % 20), "family " + family, "item " + i));
        }

        ImportSummary summary = assertTimeout(Duration.ofSeconds(60), () -> importService.importRows(rows));

        assertEquals(3220, summary.getNodesCreated());
        assertEquals(3200, summary.getEdgesAdded());
        assertEquals(0, summary.getDisambiguatedSlugs());
        assertEquals(3200, graphService.getStats().getEdges());
    }
}
