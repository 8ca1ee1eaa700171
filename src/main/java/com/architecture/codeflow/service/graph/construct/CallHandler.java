package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.service.graph.StatementParser;
import spoon.reflect.declaration.CtElement;

/**
 * Method and constructor calls used as statements become subroutine boxes.
 */
public class CallHandler implements ConstructHandler {

    @Override
    public Node handle(CtElement element, StatementParser parser) {
        return parser.getFactory().subroutine(parser.text(element));
    }
}
