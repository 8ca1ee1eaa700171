package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.ConditionNode;
import com.architecture.codeflow.service.graph.StatementKind;
import lombok.Getter;
import spoon.reflect.code.CtIf;

@Getter
public class ConditionalGroup extends CollapsibleGroup {

    private final String conditionText;
    private final boolean elsePresent;

    public ConditionalGroup(long id, ConditionNode condition, CtIf source, String conditionText, boolean elsePresent) {
        super(id, condition, condition, StatementKind.CONDITIONAL, source);
        this.conditionText = conditionText;
        this.elsePresent = elsePresent;
    }

    /**
     * Whether this group may take part in consecutive-condition alignment.
     */
    public boolean isAlignable() {
        return !elsePresent && !isSimplified();
    }

    public void align() {
        getCondition().noAlignNext();
    }
}
