package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodesGroup;
import com.architecture.codeflow.service.graph.StatementKind;
import lombok.Getter;
import spoon.reflect.declaration.CtElement;

/**
 * The nodes built for one source construct, tagged with what they were built from.
 */
@Getter
public class ConstructGroup extends NodesGroup {

    private final StatementKind kind;
    private final CtElement source;

    public ConstructGroup(long id, Node head, StatementKind kind, CtElement source, boolean terminal) {
        super(id, head, terminal);
        this.kind = kind;
        this.source = source;
    }

    public ConstructGroup(long id, Node head, StatementKind kind, CtElement source) {
        this(id, head, kind, source, false);
    }

    @Override
    public String toString() {
        return kind + " group " + getName() + " with " + getTails().size() + " tail(s)";
    }
}
