package com.tagatlas.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A category or a usable tag in the tag graph.
 * A node can be both: a selectable tag that also parents other nodes.
 *
 * Slug is the natural upsert key and is globally unique.
 * The tag flag is monotonic: once true, upserts never reset it.
 */
@Entity
@Table(name = "tag_node",
       indexes = {
           @Index(name = "idx_tag_node_text", columnList = "text"),
           @Index(name = "idx_tag_node_is_tag", columnList = "is_tag")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagNode {

    public static final int MAX_TEXT_LENGTH = 512;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = MAX_TEXT_LENGTH)
    private String slug;

    @Column(nullable = false, length = MAX_TEXT_LENGTH)
    private String text; // lowercase display label

    @Column(name = "is_tag", nullable = false)
    @Builder.Default
    private boolean tag = false;

    // Free-form JSON payload owned by collaborators, never interpreted by the engine
    @Column(name = "extra_json", length = 4000)
    private String extraJson;

    /**
     * Promote to a usable tag. There is no demotion.
     */
    public void promoteToTag() {
        this.tag = true;
    }
}
