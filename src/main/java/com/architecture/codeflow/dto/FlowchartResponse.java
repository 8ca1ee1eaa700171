package com.architecture.codeflow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowchartResponse {
    private String flowchart;
    private String field;
    private int nodeCount;
    private int connectionCount;
    private LocalDateTime generatedAt;
    private String error;
}
