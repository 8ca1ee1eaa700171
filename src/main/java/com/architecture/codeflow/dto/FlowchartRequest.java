package com.architecture.codeflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowchartRequest {

    @NotBlank(message = "Source code is required")
    private String code;

    private String field;       // Dotted path, e.g. "Bar.buzz"; blank for the whole source
    private Boolean inner;      // Parse the body of the field instead of the field itself
    private Boolean simplify;
    private Boolean alignConsecutiveConditions;
}
