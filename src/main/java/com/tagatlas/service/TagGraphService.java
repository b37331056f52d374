package com.tagatlas.service;

import com.tagatlas.dto.EdgeMutationResult;
import com.tagatlas.dto.GraphStats;
import com.tagatlas.entity.TagAlias;
import com.tagatlas.entity.TagEdge;
import com.tagatlas.entity.TagEdgeId;
import com.tagatlas.entity.TagNode;
import com.tagatlas.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Optional;

/**
 * Graph store: owns nodes, edges and aliases.
 * All mutations go through the single graph writer; reads hit the repositories directly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TagGraphService {

    private final TagNodeRepository nodeRepository;
    private final TagEdgeRepository edgeRepository;
    private final TagAliasRepository aliasRepository;
    private final TagPathRepository pathRepository;
    private final SearchDocumentRepository documentRepository;
    private final SearchPostingRepository postingRepository;
    private final CycleGuard cycleGuard;
    private final GraphWriteExecutor writer;
    private final DataSource dataSource;

    // ---- lookups ----

    public Optional<TagNode> getNodeById(long id) {
        return nodeRepository.findById(id);
    }

    public Optional<TagNode> getNodeBySlug(String slug) {
        if (slug == null || slug.isBlank()) {
            return Optional.empty();
        }
        return nodeRepository.findBySlug(slug);
    }

    // ---- mutations ----

    /**
     * Create or update the node keyed by the slug of text.
     * Updates the display text, promotes the tag flag but never demotes it.
     */
    public TagNode upsertNode(String text, boolean isTag) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Node text cannot be empty");
        }
        String slug = Slugifier.slugify(text);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Node text has no letters or digits: " + text);
        }
        String label = text.trim().toLowerCase(Locale.ROOT);
        if (label.length() > TagNode.MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("Node text longer than " + TagNode.MAX_TEXT_LENGTH + " characters");
        }

        return writer.write(status -> {
            TagNode node = nodeRepository.findBySlug(slug)
                    .orElseGet(() -> TagNode.builder().slug(slug).build());
            node.setText(label);
            if (isTag) {
                node.promoteToTag();
            }
            return nodeRepository.save(node);
        });
    }

    /**
     * Import-side upsert under an already computed slug. Keeps the existing text of
     * a known node and only promotes the tag flag.
     */
    TagNode upsertBySlug(String slug, String text, boolean isTag) {
        return writer.write(status -> {
            Optional<TagNode> existing = nodeRepository.findBySlug(slug);
            if (existing.isPresent()) {
                TagNode node = existing.get();
                if (isTag && !node.isTag()) {
                    node.promoteToTag();
                    return nodeRepository.save(node);
                }
                return node;
            }
            return nodeRepository.save(TagNode.builder().slug(slug).text(text).tag(isTag).build());
        });
    }

    /**
     * Add parent → child unless it is a self-loop or would close a cycle.
     * Duplicates are ignored. Rejections never touch the edge set.
     */
    public EdgeMutationResult addEdge(long parentId, long childId) {
        if (parentId == childId) {
            log.warn("Rejected self-loop on node {}", parentId);
            return EdgeMutationResult.SELF_LOOP_REJECTED;
        }
        return writer.write(status -> {
            if (!nodeRepository.existsById(parentId) || !nodeRepository.existsById(childId)) {
                return EdgeMutationResult.UNKNOWN_NODE;
            }
            return linkGuarded(parentId, childId);
        });
    }

    /**
     * Guarded insert for callers that already hold the writer and know both ids exist
     */
    EdgeMutationResult linkGuarded(long parentId, long childId) {
        if (parentId == childId) {
            return EdgeMutationResult.SELF_LOOP_REJECTED;
        }
        return writer.write(status -> {
            // guard first: an existing edge never closes a cycle in an acyclic graph
            switch (cycleGuard.check(parentId, childId)) {
                case CYCLE:
                    log.warn("Skipping edge {} -> {}: would create cycle", parentId, childId);
                    return EdgeMutationResult.CYCLE_REJECTED;
                case CHECK_FAILED:
                    return EdgeMutationResult.GUARD_FAILED;
                default:
                    break;
            }
            if (edgeRepository.existsById(new TagEdgeId(parentId, childId))) {
                return EdgeMutationResult.ALREADY_PRESENT;
            }
            // flushed so the guard's JDBC walk sees it within this transaction
            edgeRepository.saveAndFlush(new TagEdge(parentId, childId));
            return EdgeMutationResult.ADDED;
        });
    }

    public boolean removeEdge(long parentId, long childId) {
        TagEdgeId id = new TagEdgeId(parentId, childId);
        return writer.write(status -> {
            if (!edgeRepository.existsById(id)) {
                return false;
            }
            edgeRepository.deleteById(id);
            edgeRepository.flush();
            return true;
        });
    }

    /**
     * Bind an alternate spelling to a node. Idempotent on the alias slug: an alias slug
     * already bound (to this or another node) is left alone.
     */
    public boolean addAlias(long nodeId, String aliasText) {
        String aliasSlug = Slugifier.slugify(aliasText);
        if (aliasSlug.isEmpty() || aliasText.trim().length() > TagNode.MAX_TEXT_LENGTH) {
            return false;
        }
        return writer.write(status -> {
            if (!nodeRepository.existsById(nodeId) || aliasRepository.existsById(aliasSlug)) {
                return false;
            }
            aliasRepository.save(TagAlias.builder()
                    .aliasSlug(aliasSlug)
                    .nodeId(nodeId)
                    .aliasText(aliasText.trim().toLowerCase(Locale.ROOT))
                    .build());
            return true;
        });
    }

    /**
     * Administrative delete. Cascades to edges in both directions, aliases,
     * cached paths and the node's search document.
     */
    public boolean deleteNode(long nodeId) {
        return writer.write(status -> {
            if (!nodeRepository.existsById(nodeId)) {
                return false;
            }
            int edges = edgeRepository.deleteTouching(nodeId);
            aliasRepository.deleteByNode(nodeId);
            pathRepository.deleteByNode(nodeId);
            postingRepository.deleteByNode(nodeId);
            documentRepository.findById(nodeId).ifPresent(documentRepository::delete);
            nodeRepository.deleteById(nodeId);
            log.info("Deleted node {} and {} edges", nodeId, edges);
            return true;
        });
    }

    // ---- stats & health ----

    public GraphStats getStats() {
        return GraphStats.builder()
                .nodes(nodeRepository.count())
                .edges(edgeRepository.count())
                .tags(nodeRepository.countByTagTrue())
                .aliases(aliasRepository.count())
                .paths(pathRepository.count())
                .build();
    }

    /**
     * Probe the store's catalog for a table, case-insensitively
     */
    public boolean tableExists(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            return false;
        }
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            for (String candidate : new String[]{tableName, tableName.toUpperCase(Locale.ROOT),
                    tableName.toLowerCase(Locale.ROOT)}) {
                try (ResultSet tables = metaData.getTables(null, null, candidate, new String[]{"TABLE"})) {
                    if (tables.next()) {
                        return true;
                    }
                }
            }
            return false;
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Could not read table metadata", e);
        }
    }
}
