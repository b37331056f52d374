package com.tagatlas.repository;

import com.tagatlas.entity.TagPath;
import com.tagatlas.entity.TagPathId;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TagPathRepository extends JpaRepository<TagPath, TagPathId> {

    /**
     * Cached paths of a node, shortest (by character length) first
     */
    @Query("SELECT p.pathText FROM TagPath p WHERE p.nodeId = :nodeId " +
           "ORDER BY LENGTH(p.pathText), p.pathText")
    List<String> findPathTexts(@Param("nodeId") Long nodeId, Pageable pageable);

    @Modifying
    @Query("DELETE FROM TagPath p WHERE p.nodeId = :nodeId")
    int deleteByNode(@Param("nodeId") Long nodeId);
}
