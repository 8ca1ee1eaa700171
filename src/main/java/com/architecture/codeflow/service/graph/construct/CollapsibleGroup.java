package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.ConditionNode;
import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.service.graph.StatementKind;
import lombok.Getter;
import spoon.reflect.declaration.CtElement;

import java.util.List;

/**
 * A construct around a condition node that can be replaced by one merged operation.
 */
@Getter
public abstract class CollapsibleGroup extends ConstructGroup {

    private final ConditionNode condition;
    private boolean simplified;

    protected CollapsibleGroup(long id, Node head, ConditionNode condition, StatementKind kind, CtElement source) {
        super(id, head, kind, source);
        this.condition = condition;
    }

    /**
     * Replace the whole construct by {@code merged}, which becomes both head and only tail.
     */
    public void collapseTo(Node merged) {
        if (simplified) {
            throw new IllegalStateException("Group " + getName() + " is already simplified");
        }
        if (merged == null) {
            throw new IllegalStateException("Cannot collapse group " + getName() + " into nothing");
        }
        setHead(merged);
        replaceTails(List.of(merged));
        simplified = true;
    }
}
