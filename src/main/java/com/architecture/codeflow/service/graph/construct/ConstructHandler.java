package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.service.graph.StatementParser;
import spoon.reflect.declaration.CtElement;

/**
 * Builds the flowchart fragment of one statement kind. The returned node is fully
 * wired inside; the caller connects predecessors to it and it to its successor.
 */
@FunctionalInterface
public interface ConstructHandler {

    Node handle(CtElement element, StatementParser parser);
}
