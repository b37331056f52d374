package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import com.tagatlas.entity.TagNode;
import com.tagatlas.entity.TagPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathIndexServiceTest extends TagStoreTestSupport {

    @Autowired
    private PathIndexService pathIndexService;

    @Autowired
    private TagAtlasProperties properties;

    @Test
    void testEmptyBeforeRebuild() {
        TagNode katana = tag("katana");
        assertTrue(pathIndexService.getBestPath(katana.getId()).isEmpty());
        assertTrue(pathIndexService.getAllPaths(katana.getId()).isEmpty());
    }

    @Test
    void testRebuildWritesRootToNodePaths() {
        TagNode weapons = category("weapons");
        TagNode swords = category("swords");
        TagNode katana = tag("katana");
        link(weapons, swords);
        link(swords, katana);

        assertEquals(3, pathIndexService.rebuildPathIndex());

        assertEquals("weapons/swords/katana", pathIndexService.getBestPath(katana.getId()).orElseThrow());
        assertEquals("weapons", pathIndexService.getBestPath(weapons.getId()).orElseThrow());
    }

    @Test
    void testMultipleParentsGiveMultiplePathsShortestFirst() {
        TagNode japan = category("japan");
        TagNode weapons = category("weapons");
        TagNode swords = category("swords");
        TagNode katana = tag("katana");
        link(weapons, swords);
        link(swords, katana);
        link(japan, katana);

        pathIndexService.rebuildPathIndex();

        List<String> paths = pathIndexService.getAllPaths(katana.getId());
        assertEquals(List.of("japan/katana", "weapons/swords/katana"), paths);
        assertEquals("japan/katana", pathIndexService.getBestPath(katana.getId()).orElseThrow());
    }

    @Test
    void testCacheIsStaleUntilRebuilt() {
        TagNode weapons = category("weapons");
        TagNode katana = tag("katana");
        pathIndexService.rebuildPathIndex();
        link(weapons, katana);

        assertEquals("katana", pathIndexService.getBestPath(katana.getId()).orElseThrow());

        pathIndexService.rebuildPathIndex();
        assertEquals("weapons/katana", pathIndexService.getBestPath(katana.getId()).orElseThrow());
    }

    @Test
    void testDepthBoundDoesNotLeakIntoShallowerNodes() {
        // created leaf first so the deepest node is expanded first
        TagNode d = tag("d");
        TagNode c = category("c");
        TagNode b = category("b");
        TagNode a = category("a");
        link(a, b);
        link(b, c);
        link(c, d);

        int previous = properties.getGraph().getMaxBreadcrumbDepth();
        properties.getGraph().setMaxBreadcrumbDepth(2);
        try {
            pathIndexService.rebuildPathIndex();
        } finally {
            properties.getGraph().setMaxBreadcrumbDepth(previous);
        }

        assertEquals("b/c/d", pathIndexService.getBestPath(d.getId()).orElseThrow());
        assertEquals("a/b/c", pathIndexService.getBestPath(c.getId()).orElseThrow());
        assertEquals("a/b", pathIndexService.getBestPath(b.getId()).orElseThrow());
    }

    @Test
    void testOverlongPathsAreDropped() {
        TagNode previous = null;
        for (char letter = 'a'; letter <= 'e'; letter++) {
            TagNode node = category(String.valueOf(letter).repeat(500));
            if (previous != null) {
                link(previous, node);
            }
            previous = node;
        }

        assertEquals(5, pathIndexService.rebuildPathIndex());

        String deepest = pathIndexService.getBestPath(previous.getId()).orElseThrow();
        assertTrue(deepest.length() <= TagPath.MAX_PATH_LENGTH);
        assertEquals("e".repeat(500), deepest);
    }
}
