package com.tagatlas.service;

import com.tagatlas.entity.TagNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TagTraversalServiceTest extends TagStoreTestSupport {

    @Autowired
    private TagTraversalService traversalService;

    private TagNode body;
    private TagNode hair;
    private TagNode colors;
    private TagNode hairColors;
    private TagNode blonde;
    private TagNode black;
    private TagNode longHair;
    private TagNode eyes;
    private TagNode blueEyes;

    /**
     * body → hair → hair colors → {blonde, black}
     * colors → hair colors (diamond via two parents)
     * hair → long hair
     * body → eyes → blue eyes
     */
    @BeforeEach
    void buildGraph() {
        body = category("body");
        hair = category("hair");
        colors = category("colors");
        hairColors = category("hair colors");
        blonde = tag("blonde");
        black = tag("black");
        longHair = tag("long hair");
        eyes = category("eyes");
        blueEyes = tag("blue eyes");

        link(body, hair);
        link(hair, hairColors);
        link(colors, hairColors);
        link(hairColors, blonde);
        link(hairColors, black);
        link(hair, longHair);
        link(body, eyes);
        link(eyes, blueEyes);
    }

    @Test
    void testRootsAreNodesWithoutParents() {
        assertEquals(List.of("body", "colors"), texts(traversalService.getRoots(200)));
        assertEquals(List.of("body"), texts(traversalService.getRoots(1)));
    }

    @Test
    void testChildrenAndParentsOrderedByText() {
        assertEquals(List.of("black", "blonde"), texts(traversalService.getChildren(hairColors.getId())));
        assertEquals(List.of("colors", "hair"), texts(traversalService.getParents(hairColors.getId())));
    }

    @Test
    void testSiblingsExcludeSelf() {
        assertEquals(List.of("long hair"), texts(traversalService.getSiblings(hairColors.getId())));
        assertEquals(List.of("black"), texts(traversalService.getSiblings(blonde.getId())));
        assertTrue(traversalService.getSiblings(body.getId()).isEmpty());
    }

    @Test
    void testBreadcrumbIsRootFirstChainWithoutDuplicates() {
        List<TagNode> crumb = traversalService.getBreadcrumb(blonde.getId());

        // parent "colors" sorts before "hair", so the diamond resolves through colors
        assertEquals(List.of("colors", "hair colors", "blonde"), texts(crumb));
        Set<Long> ids = crumb.stream().map(TagNode::getId).collect(Collectors.toSet());
        assertEquals(crumb.size(), ids.size());
    }

    @Test
    void testBreadcrumbOfRootIsItself() {
        assertEquals(List.of("body"), texts(traversalService.getBreadcrumb(body.getId())));
    }

    @Test
    void testSubtreeDeduplicatesDiamondDescendants() {
        List<TagNode> subtree = traversalService.getSubtree(body.getId());

        assertEquals(List.of("black", "blonde", "blue eyes", "eyes", "hair", "hair colors", "long hair"),
                texts(subtree));
        assertEquals(subtree.size(), new HashSet<>(subtree).size());
    }

    @Test
    void testSubtreeDepthBound() {
        assertEquals(List.of("eyes", "hair"), texts(traversalService.getSubtree(body.getId(), 1)));
        assertEquals(List.of("blue eyes", "eyes", "hair", "hair colors", "long hair"),
                texts(traversalService.getSubtree(body.getId(), 2)));
        assertTrue(traversalService.getSubtree(body.getId(), 0).isEmpty());
    }

    @Test
    void testRelatedSimpleIncludesSiblingsAndCousins() {
        List<TagNode> related = traversalService.getRelatedSimple(blonde.getId(), 40);

        // sibling black, plus children of grandparents hair and colors
        assertEquals(List.of("black", "hair colors", "long hair"), texts(related));
        assertEquals(List.of("black"), texts(traversalService.getRelatedSimple(blonde.getId(), 1)));
    }

    @Test
    void testRandomTagsOnlyReturnsTags() {
        List<TagNode> sample = traversalService.getRandomTags(10);

        assertEquals(4, sample.size());
        assertTrue(sample.stream().allMatch(TagNode::isTag));
        assertEquals(2, traversalService.getRandomTags(2).size());
    }

    @Test
    void testUnknownStartIdGivesEmptyResults() {
        long unknown = 987654L;
        assertTrue(traversalService.getChildren(unknown).isEmpty());
        assertTrue(traversalService.getParents(unknown).isEmpty());
        assertTrue(traversalService.getSiblings(unknown).isEmpty());
        assertTrue(traversalService.getBreadcrumb(unknown).isEmpty());
        assertTrue(traversalService.getSubtree(unknown, 5).isEmpty());
        assertTrue(traversalService.getRelatedSimple(unknown, 10).isEmpty());
    }
}
