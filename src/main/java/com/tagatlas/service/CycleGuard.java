package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether inserting parent → child would close a cycle.
 *
 * Walks the ancestors of the prospective parent, level by level, up to the configured
 * depth. If the prospective child shows up among them, the edge is refused.
 * A storage fault during the walk fails closed.
 *
 * The walk reads tag_edge over plain JDBC on the writer's bound connection. It sees the
 * writer's flushed edges, and a failed query leaves the JPA transaction committable.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CycleGuard {

    static final String PARENTS_OF =
            "SELECT DISTINCT parent_id FROM tag_edge WHERE child_id IN (:ids)";

    public enum Verdict {
        SAFE,
        CYCLE,
        CHECK_FAILED
    }

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TagAtlasProperties properties;

    public Verdict check(long parentId, long childId) {
        if (parentId == childId) {
            return Verdict.CYCLE;
        }
        try {
            return isAncestor(childId, parentId) ? Verdict.CYCLE : Verdict.SAFE;
        } catch (DataAccessException e) {
            log.warn("Ancestor walk failed for edge {} -> {}, refusing edge: {}",
                    parentId, childId, e.getMessage());
            return Verdict.CHECK_FAILED;
        }
    }

    /**
     * True when candidate is reachable by walking up from start
     */
    boolean isAncestor(long candidate, long start) {
        int maxDepth = properties.getGraph().getCycleCheckDepth();
        Set<Long> visited = new HashSet<>();
        visited.add(start);
        Set<Long> frontier = Set.of(start);

        for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
            List<Long> parents = jdbcTemplate.queryForList(PARENTS_OF, Map.of("ids", frontier), Long.class);
            if (parents.contains(candidate)) {
                return true;
            }
            Set<Long> next = new HashSet<>();
            for (Long parent : parents) {
                if (visited.add(parent)) {
                    next.add(parent);
                }
            }
            frontier = next;
        }
        return false;
    }
}
