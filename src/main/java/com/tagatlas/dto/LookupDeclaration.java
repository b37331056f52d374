package com.tagatlas.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A consumer-declared lookup: a key plus the label path leading to a category
 * whose tag children the consumer offers for selection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LookupDeclaration {
    private String key;
    private List<String> path = new ArrayList<>();
}
