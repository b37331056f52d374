package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import com.tagatlas.entity.TagNode;
import com.tagatlas.repository.TagEdgeRepository;
import com.tagatlas.repository.TagNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Navigation over the tag DAG: one-hop neighbours, ascent and descent with
 * depth bounds and visited sets, proximity suggestions and random sampling.
 *
 * Unknown start ids yield empty results, never exceptions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TagTraversalService {

    private final TagNodeRepository nodeRepository;
    private final TagEdgeRepository edgeRepository;
    private final TagAtlasProperties properties;

    public List<TagNode> getRoots(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return nodeRepository.findRoots(PageRequest.of(0, limit));
    }

    public List<TagNode> getChildren(long nodeId) {
        return nodeRepository.findChildren(nodeId);
    }

    public List<TagNode> getParents(long nodeId) {
        return nodeRepository.findParents(nodeId);
    }

    public List<TagNode> getSiblings(long nodeId) {
        return nodeRepository.findSiblings(nodeId);
    }

    /**
     * One root-to-node chain, root first. At each step the first parent by text that
     * is not already on the chain is followed, so diamonds and stray cycles terminate.
     */
    public List<TagNode> getBreadcrumb(long nodeId) {
        Optional<TagNode> start = nodeRepository.findById(nodeId);
        if (start.isEmpty()) {
            return List.of();
        }

        int maxDepth = properties.getGraph().getMaxBreadcrumbDepth();
        LinkedList<TagNode> chain = new LinkedList<>();
        Set<Long> onChain = new HashSet<>();
        TagNode current = start.get();
        chain.addFirst(current);
        onChain.add(current.getId());

        for (int depth = 0; depth < maxDepth; depth++) {
            TagNode next = null;
            for (TagNode parent : nodeRepository.findParents(current.getId())) {
                if (!onChain.contains(parent.getId())) {
                    next = parent;
                    break;
                }
            }
            if (next == null) {
                return chain;
            }
            chain.addFirst(next);
            onChain.add(next.getId());
            current = next;
        }

        log.debug("Breadcrumb for node {} truncated at depth {}", nodeId, maxDepth);
        return chain;
    }

    public List<TagNode> getSubtree(long nodeId) {
        return getSubtree(nodeId, null);
    }

    /**
     * Descendants within maxDepth hops (default bound when null), each once, ordered by text.
     * The start node itself is not part of its subtree.
     */
    public List<TagNode> getSubtree(long nodeId, Integer maxDepth) {
        int bound = maxDepth != null ? maxDepth : properties.getGraph().getMaxSubtreeDepth();
        if (bound <= 0 || !nodeRepository.existsById(nodeId)) {
            return List.of();
        }

        Set<Long> seen = new HashSet<>();
        seen.add(nodeId);
        Set<Long> descendants = new HashSet<>();
        Collection<Long> frontier = List.of(nodeId);

        for (int depth = 0; depth < bound && !frontier.isEmpty(); depth++) {
            List<Long> next = new ArrayList<>();
            for (Long child : edgeRepository.findChildIdsOf(frontier)) {
                if (seen.add(child)) {
                    descendants.add(child);
                    next.add(child);
                }
            }
            frontier = next;
        }

        return loadOrdered(descendants);
    }

    /**
     * Siblings plus children of grandparents, without the node itself, ordered by text
     */
    public List<TagNode> getRelatedSimple(long nodeId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Long> parents = edgeRepository.findParentIdsOf(List.of(nodeId));
        if (parents.isEmpty()) {
            return List.of();
        }

        Set<Long> related = new HashSet<>(edgeRepository.findChildIdsOf(parents));
        List<Long> grandparents = edgeRepository.findParentIdsOf(parents);
        if (!grandparents.isEmpty()) {
            related.addAll(edgeRepository.findChildIdsOf(grandparents));
        }
        related.remove(nodeId);

        List<TagNode> ordered = loadOrdered(related);
        return ordered.size() > limit ? ordered.subList(0, limit) : ordered;
    }

    /**
     * Uniform sample of usable tags
     */
    public List<TagNode> getRandomTags(int count) {
        if (count <= 0) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>(nodeRepository.findAllTagIds());
        int take = Math.min(count, ids.size());
        ThreadLocalRandom random = ThreadLocalRandom.current();

        // partial Fisher-Yates
        for (int i = 0; i < take; i++) {
            int j = i + random.nextInt(ids.size() - i);
            Collections.swap(ids, i, j);
        }
        return nodeRepository.findAllById(ids.subList(0, take));
    }

    private List<TagNode> loadOrdered(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return nodeRepository.findByIdInOrderByTextAsc(ids);
    }
}
