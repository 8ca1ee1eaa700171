package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.service.graph.StatementParser;
import spoon.reflect.declaration.CtElement;

/**
 * {@code break}, {@code continue} and {@code throw}: a subroutine box that nothing
 * follows. The jump target itself is not drawn.
 */
public class JumpHandler implements ConstructHandler {

    @Override
    public Node handle(CtElement element, StatementParser parser) {
        return parser.getFactory().terminalSubroutine(parser.text(element));
    }
}
