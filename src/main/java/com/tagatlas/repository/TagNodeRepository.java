package com.tagatlas.repository;

import com.tagatlas.entity.TagNode;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TagNodeRepository extends JpaRepository<TagNode, Long> {

    Optional<TagNode> findBySlug(String slug);

    /**
     * Exact match on slug or on display text
     */
    List<TagNode> findBySlugOrTextOrderByTextAsc(String slug, String text, Pageable pageable);

    /**
     * Slug prefix match; LIKE wildcards in the prefix are escaped
     */
    List<TagNode> findBySlugStartingWithOrderByTextAsc(String prefix, Pageable pageable);

    List<TagNode> findByIdInOrderByTextAsc(Collection<Long> ids);

    long countByTagTrue();

    @Query("SELECT n.id FROM TagNode n WHERE n.tag = true")
    List<Long> findAllTagIds();

    /**
     * Nodes without any incoming edge (top-level categories)
     */
    @Query("SELECT n FROM TagNode n WHERE NOT EXISTS " +
           "(SELECT e FROM TagEdge e WHERE e.childId = n.id) ORDER BY n.text")
    List<TagNode> findRoots(Pageable pageable);

    @Query("SELECT n FROM TagEdge e, TagNode n WHERE e.childId = n.id " +
           "AND e.parentId = :parentId ORDER BY n.text")
    List<TagNode> findChildren(@Param("parentId") Long parentId);

    @Query("SELECT n FROM TagEdge e, TagNode n WHERE e.parentId = n.id " +
           "AND e.childId = :childId ORDER BY n.text")
    List<TagNode> findParents(@Param("childId") Long childId);

    /**
     * Other children of any parent of the given node
     */
    @Query("SELECT DISTINCT n FROM TagEdge e, TagNode n WHERE e.childId = n.id " +
           "AND n.id <> :nodeId " +
           "AND e.parentId IN (SELECT p.parentId FROM TagEdge p WHERE p.childId = :nodeId) " +
           "ORDER BY n.text")
    List<TagNode> findSiblings(@Param("nodeId") Long nodeId);
}
