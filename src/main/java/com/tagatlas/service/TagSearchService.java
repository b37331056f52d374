package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import com.tagatlas.dto.MatchType;
import com.tagatlas.dto.SearchHit;
import com.tagatlas.entity.TagNode;
import com.tagatlas.repository.TagNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ranked tag search.
 *
 * Three strategies run against the same query and are merged per node, keeping the
 * highest score:
 * 1. exact slug or text match, score 100
 * 2. slug prefix match, score 80
 * 3. full-text BM25, normalised into (0, ceiling] with ceiling below 80
 *
 * Because full-text scores are rescaled under the prefix tier, tiers never interleave:
 * every exact hit outranks every prefix hit, which outranks every full-text-only hit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TagSearchService {

    public static final double EXACT_SCORE = 100.0;
    public static final double PREFIX_SCORE = 80.0;

    private final TagNodeRepository nodeRepository;
    private final SearchIndexService searchIndexService;
    private final PathIndexService pathIndexService;
    private final TagAtlasProperties properties;

    /**
     * Fast slug-prefix lookup for as-you-type suggestions, ordered by text
     */
    public List<TagNode> typeahead(String prefix, int limit) {
        if (prefix == null || prefix.isBlank() || limit <= 0) {
            return List.of();
        }
        return nodeRepository.findBySlugStartingWithOrderByTextAsc(
                prefix.trim().toLowerCase(Locale.ROOT), PageRequest.of(0, limit));
    }

    public List<SearchHit> search(String query) {
        return search(query, properties.getSearch().getDefaultLimit());
    }

    public List<SearchHit> search(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        String querySlug = Slugifier.slugify(query);
        String queryText = query.trim().toLowerCase(Locale.ROOT);

        List<SearchHit> hits = new ArrayList<>();

        List<TagNode> exact = nodeRepository.findBySlugOrTextOrderByTextAsc(
                querySlug, queryText, PageRequest.of(0, limit));
        exact.forEach(node -> hits.add(toHit(node, EXACT_SCORE, MatchType.EXACT)));

        int prefixCount = 0;
        if (!querySlug.isEmpty()) {
            List<TagNode> prefixed = nodeRepository.findBySlugStartingWithOrderByTextAsc(
                    querySlug, PageRequest.of(0, limit));
            prefixed.forEach(node -> hits.add(toHit(node, PREFIX_SCORE, MatchType.PREFIX)));
            prefixCount = prefixed.size();
        }

        int ftsCount = 0;
        if (searchIndexService.isIndexAvailable()) {
            long candidates = (long) limit * properties.getSearch().getFtsCandidateFactor();
            List<SearchHit> fullText = fullTextHits(query, (int) Math.min(candidates, Integer.MAX_VALUE));
            hits.addAll(fullText);
            ftsCount = fullText.size();
        }

        log.debug("Search '{}': {} exact, {} prefix, {} fts", query, exact.size(), prefixCount, ftsCount);

        return merge(hits, limit).stream()
                .map(hit -> hit.toBuilder()
                        .bestPath(pathIndexService.getBestPath(hit.getNodeId()).orElse(null))
                        .build())
                .collect(Collectors.toList());
    }

    private List<SearchHit> fullTextHits(String query, int candidates) {
        List<SearchIndexService.ScoredNode> scored = searchIndexService.search(query, candidates);
        if (scored.isEmpty()) {
            return List.of();
        }

        double best = scored.get(0).getScore();
        double ceiling = properties.getSearch().getFtsScoreCeiling();
        Map<Long, TagNode> nodes = nodeRepository.findAllById(
                        scored.stream().map(SearchIndexService.ScoredNode::getNodeId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(TagNode::getId, Function.identity()));

        List<SearchHit> hits = new ArrayList<>();
        for (SearchIndexService.ScoredNode s : scored) {
            TagNode node = nodes.get(s.getNodeId());
            if (node == null) {
                continue; // index older than a node deletion
            }
            double normalised = best > 0 ? ceiling * s.getScore() / best : ceiling;
            hits.add(toHit(node, normalised, MatchType.FTS));
        }
        return hits;
    }

    /**
     * Group by node keeping the maximum score, then sort by score descending and
     * display text, and truncate
     */
    static List<SearchHit> merge(List<SearchHit> hits, int limit) {
        Map<Long, SearchHit> byNode = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            byNode.merge(hit.getNodeId(), hit, (prev, next) -> next.getScore() > prev.getScore() ? next : prev);
        }
        return byNode.values().stream()
                .sorted(Comparator.comparingDouble(SearchHit::getScore).reversed()
                        .thenComparing(SearchHit::getText))
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static SearchHit toHit(TagNode node, double score, MatchType matchType) {
        return SearchHit.builder()
                .nodeId(node.getId())
                .slug(node.getSlug())
                .text(node.getText())
                .tag(node.isTag())
                .score(score)
                .matchType(matchType)
                .build();
    }
}
