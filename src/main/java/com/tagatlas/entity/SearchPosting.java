package com.tagatlas.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.domain.Persistable;

@Entity
@Table(name = "search_posting",
       indexes = @Index(name = "idx_posting_node", columnList = "node_id"))
@IdClass(SearchPostingId.class)
@Data
@NoArgsConstructor
public class SearchPosting implements Persistable<SearchPostingId> {

    @Id
    @Column(nullable = false, length = 255)
    private String token;

    @Id
    @Column(name = "node_id", nullable = false)
    private Long nodeId;

    @Column(name = "term_frequency", nullable = false)
    private int termFrequency;

    // Rows are only ever inserted or deleted, so save() can persist without a lookup
    @Transient
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private boolean fresh = true;

    public SearchPosting(String token, Long nodeId, int termFrequency) {
        this.token = token;
        this.nodeId = nodeId;
        this.termFrequency = termFrequency;
    }

    @Override
    public SearchPostingId getId() {
        return new SearchPostingId(token, nodeId);
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
