package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import com.tagatlas.entity.*;
import com.tagatlas.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Derived full-text index over node text, alias text and cached path text.
 *
 * The index is a posting table (token → node, term frequency) plus one document row
 * per node holding its token count. It is only ever regenerated as a whole.
 * Ranking is Okapi BM25 over the combined document; larger is more relevant.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SearchIndexService {

    static final String POSTING_TABLE = "search_posting";
    private static final int SAVE_BATCH = 2000;

    private final TagNodeRepository nodeRepository;
    private final TagAliasRepository aliasRepository;
    private final TagPathRepository pathRepository;
    private final SearchDocumentRepository documentRepository;
    private final SearchPostingRepository postingRepository;
    private final TagGraphService graphService;
    private final GraphWriteExecutor writer;
    private final TagAtlasProperties properties;

    @Value
    public static class ScoredNode {
        long nodeId;
        double score;
    }

    /**
     * Index is usable when its table exists and has been built with at least one document
     */
    public boolean isIndexAvailable() {
        return graphService.tableExists(POSTING_TABLE) && documentRepository.count() > 0;
    }

    /**
     * Drop and regenerate every document and posting.
     *
     * @return number of documents indexed
     */
    public int rebuildIndex() {
        return writer.write(status -> {
            postingRepository.deleteAllInBatch();
            documentRepository.deleteAllInBatch();

            Map<Long, List<String>> aliasesByNode = new HashMap<>();
            for (TagAlias alias : aliasRepository.findAll()) {
                aliasesByNode.computeIfAbsent(alias.getNodeId(), k -> new ArrayList<>()).add(alias.getAliasText());
            }
            Map<Long, List<String>> pathsByNode = new HashMap<>();
            for (TagPath path : pathRepository.findAll()) {
                pathsByNode.computeIfAbsent(path.getNodeId(), k -> new ArrayList<>()).add(path.getPathText());
            }

            List<SearchDocument> documents = new ArrayList<>(SAVE_BATCH);
            List<SearchPosting> postings = new ArrayList<>(SAVE_BATCH);
            int indexed = 0;

            for (TagNode node : nodeRepository.findAll()) {
                List<String> tokens = new ArrayList<>(SearchTokenizer.tokenize(node.getText()));
                aliasesByNode.getOrDefault(node.getId(), List.of())
                        .forEach(a -> tokens.addAll(SearchTokenizer.tokenize(a)));
                pathsByNode.getOrDefault(node.getId(), List.of())
                        .forEach(p -> tokens.addAll(SearchTokenizer.tokenize(p)));

                Map<String, Integer> frequencies = new HashMap<>();
                tokens.forEach(t -> frequencies.merge(t, 1, Integer::sum));

                documents.add(new SearchDocument(node.getId(), tokens.size()));
                frequencies.forEach((token, tf) -> postings.add(new SearchPosting(token, node.getId(), tf)));
                indexed++;

                if (postings.size() >= SAVE_BATCH || documents.size() >= SAVE_BATCH) {
                    flush(documents, postings);
                }
            }
            flush(documents, postings);

            log.info("Rebuilt search index: {} documents", indexed);
            return indexed;
        });
    }

    private void flush(List<SearchDocument> documents, List<SearchPosting> postings) {
        documentRepository.saveAll(documents);
        postingRepository.saveAll(postings);
        documents.clear();
        postings.clear();
    }

    /**
     * Documents containing every token of the query, best BM25 first.
     */
    public List<ScoredNode> search(String query, int limit) {
        Set<String> terms = new LinkedHashSet<>(SearchTokenizer.tokenize(query));
        if (terms.isEmpty() || limit <= 0) {
            return List.of();
        }

        Map<String, List<SearchPosting>> postingsByTerm = postingRepository.findByTokenIn(terms).stream()
                .collect(Collectors.groupingBy(SearchPosting::getToken));
        if (postingsByTerm.size() < terms.size()) {
            return List.of();
        }

        Set<Long> candidates = null;
        for (List<SearchPosting> postings : postingsByTerm.values()) {
            Set<Long> ids = postings.stream().map(SearchPosting::getNodeId).collect(Collectors.toSet());
            if (candidates == null) {
                candidates = ids;
            } else {
                candidates.retainAll(ids);
            }
        }
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        long documentCount = documentRepository.count();
        Double average = documentRepository.averageTokenCount();
        double avgLength = average == null || average <= 0 ? 1.0 : average;
        Map<Long, Integer> lengths = new HashMap<>();
        for (SearchDocument doc : documentRepository.findAllById(candidates)) {
            lengths.put(doc.getNodeId(), doc.getTokenCount());
        }

        double k1 = properties.getSearch().getBm25K1();
        double b = properties.getSearch().getBm25B();
        Map<Long, Double> scores = new HashMap<>();

        for (List<SearchPosting> postings : postingsByTerm.values()) {
            int df = postings.size();
            double idf = Math.log(1.0 + (documentCount - df + 0.5) / (df + 0.5));
            for (SearchPosting posting : postings) {
                if (!candidates.contains(posting.getNodeId())) {
                    continue;
                }
                double tf = posting.getTermFrequency();
                double length = lengths.getOrDefault(posting.getNodeId(), 0);
                double norm = tf + k1 * (1 - b + b * length / avgLength);
                scores.merge(posting.getNodeId(), idf * tf * (k1 + 1) / norm, Double::sum);
            }
        }

        return scores.entrySet().stream()
                .sorted(Map.Entry.<Long, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<Long, Double>comparingByKey()))
                .limit(limit)
                .map(e -> new ScoredNode(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }
}
