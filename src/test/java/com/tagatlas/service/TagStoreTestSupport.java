package com.tagatlas.service;

import com.tagatlas.entity.TagNode;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared context for engine tests: in-memory H2, store wiped before each test.
 */
@SpringBootTest
@ActiveProfiles("test")
abstract class TagStoreTestSupport {

    @Autowired
    protected TagGraphService graphService;

    @Autowired
    protected TagImportService importService;

    @BeforeEach
    void resetStore() {
        importService.wipeAll();
    }

    protected TagNode category(String text) {
        return graphService.upsertNode(text, false);
    }

    protected TagNode tag(String text) {
        return graphService.upsertNode(text, true);
    }

    protected void link(TagNode parent, TagNode child) {
        graphService.addEdge(parent.getId(), child.getId());
    }

    protected static List<String> texts(List<TagNode> nodes) {
        return nodes.stream().map(TagNode::getText).collect(Collectors.toList());
    }
}
