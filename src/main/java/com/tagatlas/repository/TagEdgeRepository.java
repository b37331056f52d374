package com.tagatlas.repository;

import com.tagatlas.entity.TagEdge;
import com.tagatlas.entity.TagEdgeId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TagEdgeRepository extends JpaRepository<TagEdge, TagEdgeId> {

    @Query("SELECT DISTINCT e.parentId FROM TagEdge e WHERE e.childId IN :childIds")
    List<Long> findParentIdsOf(@Param("childIds") Collection<Long> childIds);

    @Query("SELECT DISTINCT e.childId FROM TagEdge e WHERE e.parentId IN :parentIds")
    List<Long> findChildIdsOf(@Param("parentIds") Collection<Long> parentIds);

    /**
     * Remove every edge touching the node, in either direction
     */
    @Modifying
    @Query("DELETE FROM TagEdge e WHERE e.parentId = :nodeId OR e.childId = :nodeId")
    int deleteTouching(@Param("nodeId") Long nodeId);
}
