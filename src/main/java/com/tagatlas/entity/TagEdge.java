package com.tagatlas.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.domain.Persistable;

/**
 * Directed parent → child relation.
 * The composite key keeps the pair unique; self-loops and cycles are refused
 * before an edge ever reaches this table.
 */
@Entity
@Table(name = "tag_edge",
       indexes = {
           @Index(name = "idx_edge_parent", columnList = "parent_id"),
           @Index(name = "idx_edge_child", columnList = "child_id")
       })
@IdClass(TagEdgeId.class)
@Data
@NoArgsConstructor
public class TagEdge implements Persistable<TagEdgeId> {

    @Id
    @Column(name = "parent_id", nullable = false)
    private Long parentId;

    @Id
    @Column(name = "child_id", nullable = false)
    private Long childId;

    // Rows are only ever inserted or deleted, so save() can persist without a lookup
    @Transient
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private boolean fresh = true;

    public TagEdge(Long parentId, Long childId) {
        this.parentId = parentId;
        this.childId = childId;
    }

    @Override
    public TagEdgeId getId() {
        return new TagEdgeId(parentId, childId);
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        fresh = false;
    }
}
