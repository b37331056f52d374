package com.tagatlas.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Key/value store for engine markers such as the "already imported" flag.
 */
@Entity
@Table(name = "meta_entry")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetaEntry {

    @Id
    @Column(name = "meta_key", length = 128)
    private String key;

    @Column(name = "meta_value", length = 512)
    private String value;
}
