package com.tagatlas.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Alternate spelling bound to one node, only used to widen full-text recall.
 */
@Entity
@Table(name = "tag_alias",
       indexes = @Index(name = "idx_alias_node", columnList = "node_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagAlias {

    @Id
    @Column(name = "alias_slug", length = TagNode.MAX_TEXT_LENGTH)
    private String aliasSlug;

    @Column(name = "node_id", nullable = false)
    private Long nodeId;

    @Column(name = "alias_text", nullable = false, length = TagNode.MAX_TEXT_LENGTH)
    private String aliasText;
}
