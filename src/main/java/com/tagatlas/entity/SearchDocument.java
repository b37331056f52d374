package com.tagatlas.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.domain.Persistable;

/**
 * One full-text document per node: node text, alias text and path text combined.
 * Token count feeds BM25 length normalisation.
 */
@Entity
@Table(name = "search_document")
@Data
@NoArgsConstructor
public class SearchDocument implements Persistable<Long> {

    @Id
    @Column(name = "node_id")
    private Long nodeId;

    @Column(name = "token_count", nullable = false)
    private int tokenCount;

    // Rows are only ever inserted or deleted, so save() can persist without a lookup
    @Transient
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private boolean fresh = true;

    public SearchDocument(Long nodeId, int tokenCount) {
        this.nodeId = nodeId;
        this.tokenCount = tokenCount;
    }

    @Override
    public Long getId() {
        return nodeId;
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
