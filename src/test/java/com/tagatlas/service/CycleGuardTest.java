package com.tagatlas.service;

import com.tagatlas.config.TagAtlasProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CycleGuardTest {

    private NamedParameterJdbcTemplate jdbcTemplate;
    private TagAtlasProperties properties;
    private CycleGuard guard;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(NamedParameterJdbcTemplate.class);
        properties = new TagAtlasProperties();
        guard = new CycleGuard(jdbcTemplate, properties);
    }

    private void parentsOf(long child, Long... parents) {
        when(jdbcTemplate.queryForList(eq(CycleGuard.PARENTS_OF), eq(Map.of("ids", Set.of(child))), eq(Long.class)))
                .thenReturn(List.of(parents));
    }

    @Test
    void testSelfEdgeIsCycle() {
        assertEquals(CycleGuard.Verdict.CYCLE, guard.check(1L, 1L));
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void testChildAmongAncestorsIsCycle() {
        // 3 -> 2 -> 1, proposing 1 -> 3
        parentsOf(1L, 2L);
        parentsOf(2L, 3L);

        assertEquals(CycleGuard.Verdict.CYCLE, guard.check(1L, 3L));
    }

    @Test
    void testUnrelatedNodesAreSafe() {
        when(jdbcTemplate.queryForList(anyString(), anyMap(), eq(Long.class))).thenReturn(List.of());

        assertEquals(CycleGuard.Verdict.SAFE, guard.check(1L, 2L));
    }

    @Test
    void testWalkStopsAtDepthBound() {
        properties.getGraph().setCycleCheckDepth(1);
        parentsOf(1L, 2L);
        parentsOf(2L, 3L);

        assertEquals(CycleGuard.Verdict.SAFE, guard.check(1L, 3L));
    }

    @Test
    void testStorageFaultFailsClosed() {
        when(jdbcTemplate.queryForList(anyString(), anyMap(), eq(Long.class)))
                .thenThrow(new DataAccessResourceFailureException("disk gone"));

        assertEquals(CycleGuard.Verdict.CHECK_FAILED, guard.check(1L, 2L));
    }
}
