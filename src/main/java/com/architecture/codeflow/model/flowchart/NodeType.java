package com.architecture.codeflow.model.flowchart;

import lombok.Getter;

/**
 * flowchart.js node types, with the prefix used to derive node names.
 * See https://github.com/adrai/flowchart.js#node-syntax
 */
@Getter
public enum NodeType {
    START("start", "st"),
    END("end", "e"),
    OPERATION("operation", "op"),
    INPUT_OUTPUT("inputoutput", "io"),
    SUBROUTINE("subroutine", "sub"),
    CONDITION("condition", "cond"),
    TRANSPARENT("", "");

    private final String dslName;
    private final String namePrefix;

    NodeType(String dslName, String namePrefix) {
        this.dslName = dslName;
        this.namePrefix = namePrefix;
    }
}
