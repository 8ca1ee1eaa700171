package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.service.graph.StatementParser;
import spoon.reflect.declaration.CtElement;

/**
 * Any statement without control flow of its own: one operation box with its source text.
 */
public class OperationHandler implements ConstructHandler {

    @Override
    public Node handle(CtElement element, StatementParser parser) {
        return parser.getFactory().operation(parser.label(element));
    }
}
