package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.ConditionNode;
import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodeFactory;
import com.architecture.codeflow.model.flowchart.TransparentNode;
import com.architecture.codeflow.service.graph.ParseResult;
import com.architecture.codeflow.service.graph.StatementParser;
import lombok.extern.slf4j.Slf4j;
import spoon.reflect.code.CtIf;
import spoon.reflect.declaration.CtElement;

/**
 * {@code if (c) A else B}: a condition with A on "yes" and B on "no". A missing
 * branch gets a transparent placeholder so the successor can still be reached.
 * {@code else if} chains nest through the else branch.
 */
@Slf4j
public class ConditionalHandler implements ConstructHandler {

    @Override
    public Node handle(CtElement element, StatementParser parser) {
        CtIf ifStatement = (CtIf) element;
        NodeFactory factory = parser.getFactory();

        String conditionText = parser.text(ifStatement.getCondition());
        ConditionNode condition = factory.condition("if " + conditionText);
        boolean elsePresent = ifStatement.getElseStatement() != null;
        ConditionalGroup group = new ConditionalGroup(factory.nextId(), condition, ifStatement, conditionText, elsePresent);

        ParseResult yes = parser.parse(StatementParser.bodyOf(ifStatement.getThenStatement()));
        if (yes.isEmpty()) {
            TransparentNode placeholder = factory.transparent();
            condition.connectYes(placeholder);
            group.appendTail(placeholder);
        } else {
            condition.connectYes(yes.getHead());
            group.extendTails(yes.getTails());
        }

        ParseResult no = parser.parse(StatementParser.bodyOf(ifStatement.getElseStatement()));
        if (no.isEmpty()) {
            TransparentNode placeholder = factory.transparent();
            condition.connectNo(placeholder);
            group.appendTail(placeholder);
        } else {
            condition.connectNo(no.getHead());
            group.extendTails(no.getTails());
        }

        if (parser.getOptions().isSimplify()) {
            parser.getSimplifier().simplify(group);
        }
        log.debug("Built conditional {} '{}'", group.getName(), group.getText());
        return group;
    }
}
