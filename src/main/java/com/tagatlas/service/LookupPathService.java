package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import com.tagatlas.dto.LookupDeclaration;
import com.tagatlas.dto.LookupValidationReport;
import com.tagatlas.dto.SearchHit;
import com.tagatlas.entity.TagNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Resolves consumer-declared label paths (e.g. ["body", "hair", "hair_color"]) to the
 * usable tags directly under the category they lead to, and validates sets of such
 * declarations, reporting every problem at once.
 *
 * Declarations load from YAML:
 * <pre>
 * lookups:
 *   - key: hair_color
 *     path: [body, hair, hair_color]
 * </pre>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LookupPathService {

    private static final int ROOT_CANDIDATES = 100;

    private final TagSearchService searchService;
    private final TagTraversalService traversalService;
    private final TagGraphService graphService;
    private final TagAtlasProperties properties;

    /**
     * Tag children of the node the path leads to; empty when any segment is unmatched
     */
    public List<TagNode> resolve(List<String> path) {
        Optional<TagNode> target = resolveNode(path);
        if (target.isEmpty()) {
            return List.of();
        }
        return traversalService.getChildren(target.get().getId()).stream()
                .filter(TagNode::isTag)
                .collect(Collectors.toList());
    }

    /**
     * Walk from a matching top segment through matching children. Among several
     * equally named candidates the first one that has children wins.
     */
    public Optional<TagNode> resolveNode(List<String> path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }

        TagNode current = null;
        for (String segment : path) {
            List<TagNode> candidates;
            if (current == null) {
                candidates = new ArrayList<>();
                for (SearchHit hit : searchService.search(segment, ROOT_CANDIDATES)) {
                    if (labelsMatch(hit.getText(), segment)) {
                        graphService.getNodeById(hit.getNodeId()).ifPresent(candidates::add);
                    }
                }
            } else {
                candidates = traversalService.getChildren(current.getId()).stream()
                        .filter(child -> labelsMatch(child.getText(), segment))
                        .collect(Collectors.toList());
            }

            Optional<TagNode> chosen = selectBest(candidates);
            if (chosen.isEmpty()) {
                log.debug("Lookup path {} unmatched at '{}'", path, segment);
                return Optional.empty();
            }
            current = chosen.get();
        }
        return Optional.of(current);
    }

    /**
     * Validate declarations: duplicate keys, empty paths and failing lookups are errors,
     * a path that resolves to no tags is a warning
     */
    public LookupValidationReport validate(List<LookupDeclaration> declarations) {
        LookupValidationReport report = new LookupValidationReport();
        Set<String> seenKeys = new HashSet<>();

        for (LookupDeclaration declaration : declarations) {
            String key = declaration.getKey();
            if (key == null || key.isBlank()) {
                report.error("Lookup declaration without key: " + declaration.getPath());
                continue;
            }
            if (!seenKeys.add(key)) {
                report.error("Duplicate lookup key: " + key);
                continue;
            }
            List<String> path = declaration.getPath();
            if (path == null || path.isEmpty()) {
                report.error("Empty path in lookup " + key);
                continue;
            }

            try {
                int count = resolve(path).size();
                report.resolved(key, count);
                if (count == 0) {
                    report.warn("Lookup " + key + " returned zero results for path: " + String.join("/", path));
                }
            } catch (DataAccessException e) {
                report.error("Lookup " + key + " failed: " + e.getMessage());
            }
        }

        if (!report.getWarnings().isEmpty()) {
            log.warn("Lookup validation warnings:\n{}", String.join("\n", report.getWarnings()));
        }
        return report;
    }

    /**
     * Validate the configured declaration file and fail with every error listed
     */
    public LookupValidationReport validateConfigured() {
        LookupValidationReport report = validate(loadDeclarations(properties.getLookups().getConfig()));
        if (!report.isValid()) {
            throw new IllegalStateException("Lookup configuration validation failed:\n" + report.describe());
        }
        return report;
    }

    @SuppressWarnings("unchecked")
    public List<LookupDeclaration> loadDeclarations(String classpathLocation) {
        ClassPathResource resource = new ClassPathResource(classpathLocation);
        if (!resource.exists()) {
            throw new IllegalStateException("Lookup config not found: " + classpathLocation);
        }

        Map<String, Object> config;
        try (InputStream inputStream = resource.getInputStream()) {
            config = new Yaml().load(inputStream);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read lookup config: " + classpathLocation, e);
        }

        List<LookupDeclaration> declarations = new ArrayList<>();
        if (config == null || !(config.get("lookups") instanceof List)) {
            log.warn("Lookup config {} has no 'lookups' list", classpathLocation);
            return declarations;
        }

        for (Object item : (List<Object>) config.get("lookups")) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<String, Object> entry = (Map<String, Object>) item;
            List<String> path = new ArrayList<>();
            if (entry.get("path") instanceof List) {
                for (Object segment : (List<Object>) entry.get("path")) {
                    path.add(String.valueOf(segment));
                }
            }
            Object key = entry.get("key");
            declarations.add(new LookupDeclaration(key == null ? null : String.valueOf(key), path));
        }
        log.info("Loaded {} lookup declarations from {}", declarations.size(), classpathLocation);
        return declarations;
    }

    private Optional<TagNode> selectBest(List<TagNode> candidates) {
        if (candidates.size() <= 1) {
            return candidates.stream().findFirst();
        }
        for (TagNode candidate : candidates) {
            if (!traversalService.getChildren(candidate.getId()).isEmpty()) {
                return Optional.of(candidate);
            }
        }
        return Optional.of(candidates.get(0));
    }

    /**
     * Case-insensitive equality that treats spaces and underscores alike
     */
    static boolean labelsMatch(String nodeText, String segment) {
        if (nodeText == null || segment == null) {
            return false;
        }
        String a = nodeText.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        String b = segment.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        return a.equals(b);
    }
}
