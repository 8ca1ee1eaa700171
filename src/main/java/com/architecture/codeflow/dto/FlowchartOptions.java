package com.architecture.codeflow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for one flowchart build.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FlowchartOptions {

    // Collapse one-line if/loop bodies into their condition
    @Builder.Default
    private boolean simplify = true;

    // Add align-next=no to an else-less if directly followed by another one
    @Builder.Default
    private boolean alignConsecutiveConditions = false;
}
