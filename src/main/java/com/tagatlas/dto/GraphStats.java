package com.tagatlas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStats {
    private long nodes;
    private long edges;
    private long tags;
    private long aliases;
    private long paths;
}
