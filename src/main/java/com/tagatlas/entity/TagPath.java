package com.tagatlas.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.domain.Persistable;

/**
 * Cached root-to-node path string, e.g. "weapons/swords/katana".
 * Only written by the path index rebuild; may be stale between rebuilds.
 */
@Entity
@Table(name = "tag_path")
@IdClass(TagPathId.class)
@Data
@NoArgsConstructor
public class TagPath implements Persistable<TagPathId> {

    public static final int MAX_PATH_LENGTH = 2048;

    @Id
    @Column(name = "node_id", nullable = false)
    private Long nodeId;

    @Id
    @Column(name = "path_text", nullable = false, length = MAX_PATH_LENGTH)
    private String pathText;

    // Rows are only ever inserted or deleted, so save() can persist without a lookup
    @Transient
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private boolean fresh = true;

    public TagPath(Long nodeId, String pathText) {
        this.nodeId = nodeId;
        this.pathText = pathText;
    }

    @Override
    public TagPathId getId() {
        return new TagPathId(nodeId, pathText);
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
