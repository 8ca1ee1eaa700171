package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.ConditionNode;
import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.service.graph.StatementKind;
import lombok.Getter;
import spoon.reflect.code.CtLoop;

/**
 * A loop: its condition, the header shown after the keyword, and whether the
 * condition is tested after the body (do-while).
 */
@Getter
public class LoopGroup extends CollapsibleGroup {

    private final String keyword;
    private final String headerText;
    private final boolean postTest;

    public LoopGroup(long id, Node head, ConditionNode condition, CtLoop source,
                     String keyword, String headerText, boolean postTest) {
        super(id, head, condition, StatementKind.LOOP, source);
        this.keyword = keyword;
        this.headerText = headerText;
        this.postTest = postTest;
    }
}
