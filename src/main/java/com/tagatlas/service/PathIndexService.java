package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import com.tagatlas.entity.TagEdge;
import com.tagatlas.entity.TagNode;
import com.tagatlas.entity.TagPath;
import com.tagatlas.repository.TagEdgeRepository;
import com.tagatlas.repository.TagNodeRepository;
import com.tagatlas.repository.TagPathRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Cache of root-to-node path strings for display ("weapons/swords/katana").
 * Readers must treat it as possibly stale; {@link #rebuildPathIndex()} is the only writer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PathIndexService {

    private static final int SAVE_BATCH = 1000;

    private final TagNodeRepository nodeRepository;
    private final TagEdgeRepository edgeRepository;
    private final TagPathRepository pathRepository;
    private final GraphWriteExecutor writer;
    private final TagAtlasProperties properties;

    public Optional<String> getBestPath(long nodeId) {
        return pathRepository.findPathTexts(nodeId, PageRequest.of(0, 1)).stream().findFirst();
    }

    public List<String> getAllPaths(long nodeId) {
        return pathRepository.findPathTexts(nodeId, Pageable.unpaged());
    }

    /**
     * Recompute every node's paths from the live edge set and replace the cache.
     *
     * @return number of path rows written
     */
    public int rebuildPathIndex() {
        return writer.write(status -> {
            Map<Long, String> textById = new LinkedHashMap<>();
            for (TagNode node : nodeRepository.findAll(Sort.by("id"))) {
                textById.put(node.getId(), node.getText());
            }

            Map<Long, List<Long>> parentsByChild = new HashMap<>();
            for (TagEdge edge : edgeRepository.findAll()) {
                parentsByChild.computeIfAbsent(edge.getChildId(), k -> new ArrayList<>()).add(edge.getParentId());
            }
            // deterministic parent order: by display text
            parentsByChild.values().forEach(parents -> parents.sort(
                    Comparator.comparing((Long id) -> textById.getOrDefault(id, "")).thenComparing(id -> id)));

            PathBuilder builder = new PathBuilder(textById, parentsByChild);

            pathRepository.deleteAllInBatch();
            List<TagPath> batch = new ArrayList<>(SAVE_BATCH);
            int written = 0;
            for (Long nodeId : textById.keySet()) {
                for (String path : builder.pathsOf(nodeId)) {
                    batch.add(new TagPath(nodeId, path));
                    if (batch.size() >= SAVE_BATCH) {
                        pathRepository.saveAll(batch);
                        written += batch.size();
                        batch.clear();
                    }
                }
            }
            pathRepository.saveAll(batch);
            written += batch.size();

            log.info("Rebuilt path index: {} paths for {} nodes", written, textById.size());
            return written;
        });
    }

    /**
     * Memoised upward expansion. Paths per node are capped; a parent already on the
     * current ascent is skipped, ascent stops at the breadcrumb depth bound, and a path
     * longer than the column allows is dropped.
     *
     * Only complete expansions are memoised: one cut short by the ascent guard or the
     * depth bound, directly or anywhere above, depends on where the ascent started.
     */
    private class PathBuilder {
        private final Map<Long, String> textById;
        private final Map<Long, List<Long>> parentsByChild;
        private final Map<Long, List<String>> memo = new HashMap<>();
        private final Set<Long> ascending = new HashSet<>();
        private final int maxPerNode = properties.getPaths().getMaxPerNode();
        private final int maxDepth = properties.getGraph().getMaxBreadcrumbDepth();
        private final String separator = properties.getPaths().getSeparator();

        PathBuilder(Map<Long, String> textById, Map<Long, List<Long>> parentsByChild) {
            this.textById = textById;
            this.parentsByChild = parentsByChild;
        }

        List<String> pathsOf(Long nodeId) {
            return expand(nodeId, 0).paths;
        }

        private Expansion expand(Long nodeId, int depth) {
            List<String> cached = memo.get(nodeId);
            if (cached != null) {
                return new Expansion(cached, true);
            }
            String text = textById.get(nodeId);
            if (text == null) {
                return new Expansion(List.of(), true);
            }

            Set<String> paths = new LinkedHashSet<>();
            List<Long> parents = parentsByChild.getOrDefault(nodeId, List.of());
            boolean complete = true;

            if (!parents.isEmpty() && depth < maxDepth) {
                ascending.add(nodeId);
                for (Long parent : parents) {
                    if (ascending.contains(parent)) {
                        complete = false;
                        continue;
                    }
                    Expansion above = expand(parent, depth + 1);
                    complete &= above.complete;
                    for (String prefix : above.paths) {
                        if (paths.size() >= maxPerNode) {
                            break;
                        }
                        String path = prefix + separator + text;
                        if (path.length() <= TagPath.MAX_PATH_LENGTH) {
                            paths.add(path);
                        }
                    }
                }
                ascending.remove(nodeId);
            } else if (!parents.isEmpty()) {
                complete = false;
            }

            if (paths.isEmpty()) {
                paths.add(text);
            }
            List<String> result = new ArrayList<>(paths);
            if (complete) {
                memo.put(nodeId, result);
            }
            return new Expansion(result, complete);
        }
    }

    private static class Expansion {
        final List<String> paths;
        final boolean complete;

        Expansion(List<String> paths, boolean complete) {
            this.paths = paths;
            this.complete = complete;
        }
    }
}
