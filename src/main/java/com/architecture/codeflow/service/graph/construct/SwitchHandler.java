package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.ConditionNode;
import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodeFactory;
import com.architecture.codeflow.model.flowchart.TransparentNode;
import com.architecture.codeflow.service.graph.ParseResult;
import com.architecture.codeflow.service.graph.StatementKind;
import com.architecture.codeflow.service.graph.StatementParser;
import lombok.extern.slf4j.Slf4j;
import spoon.reflect.code.CaseKind;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtBreak;
import spoon.reflect.code.CtCase;
import spoon.reflect.code.CtContinue;
import spoon.reflect.code.CtReturn;
import spoon.reflect.code.CtStatement;
import spoon.reflect.code.CtSwitch;
import spoon.reflect.code.CtThrow;
import spoon.reflect.code.CtYieldStatement;
import spoon.reflect.declaration.CtElement;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A {@code switch} statement as a chain of case tests:
 *
 * <pre>
 * if x match case 1 --yes--&gt; body 1
 *        |no
 * if x match case 2, 3 --yes--&gt; body 2
 *        |no
 * if x match case default --yes--&gt; default body
 *        |no
 *      (exit)
 * </pre>
 *
 * A colon case ending in an unlabeled {@code break} leaves the switch there and the
 * break is not drawn. A colon case that does not end in a jump falls through into
 * the next non-empty case body, and empty colon cases share the next body. Arrow
 * cases never fall through.
 */
@Slf4j
public class SwitchHandler implements ConstructHandler {

    static final String DEFAULT_LABEL = "default";

    @Override
    public Node handle(CtElement element, StatementParser parser) {
        CtSwitch<?> switchStatement = (CtSwitch<?>) element;
        NodeFactory factory = parser.getFactory();
        List<? extends CtCase<?>> cases = switchStatement.getCases();
        if (cases.isEmpty()) {
            return factory.operation(parser.label(element));
        }

        String selector = parser.text(switchStatement.getSelector());
        List<Node> tails = new ArrayList<>();
        List<ConditionNode> waitingForBody = new ArrayList<>();
        List<Node> fallingThrough = new ArrayList<>();
        ConditionNode head = null;
        ConditionNode previous = null;

        for (CtCase<?> caseStatement : cases) {
            ConditionNode condition = factory.condition("if " + selector + " match case " + labelsOf(caseStatement, parser));
            if (previous == null) {
                head = condition;
            } else {
                previous.connectNo(condition);
            }
            previous = condition;

            List<CtStatement> statements = explicitStatements(caseStatement);
            boolean exits = caseStatement.getCaseKind() == CaseKind.ARROW;
            if (!exits && !statements.isEmpty()) {
                CtStatement last = statements.get(statements.size() - 1);
                if (last instanceof CtBreak && ((CtBreak) last).getTargetLabel() == null) {
                    statements.remove(statements.size() - 1);
                    exits = true;
                } else {
                    exits = isJump(last);
                }
            }

            ParseResult body = parser.parse(statements);
            if (body.isEmpty() && !exits) {
                waitingForBody.add(condition);
                continue;
            }

            Node target;
            if (body.isEmpty()) {
                target = factory.transparent();
                tails.add(target);
            } else {
                target = body.getHead();
            }
            condition.connectYes(target);
            waitingForBody.forEach(waiting -> waiting.connectYes(target));
            waitingForBody.clear();
            fallingThrough.forEach(tail -> tail.connect(target));
            fallingThrough.clear();

            if (exits) {
                tails.addAll(body.getTails());
            } else {
                fallingThrough.addAll(body.getTails());
            }
        }

        TransparentNode exit = factory.transparent();
        previous.connectNo(exit);
        waitingForBody.forEach(waiting -> waiting.connectYes(exit));
        tails.add(exit);
        tails.addAll(fallingThrough);

        ConstructGroup group = new ConstructGroup(factory.nextId(), head, StatementKind.SWITCH, element);
        group.extendTails(tails);
        log.debug("Built switch {} over '{}' with {} case(s)", group.getName(), selector, cases.size());
        return group;
    }

    private static String labelsOf(CtCase<?> caseStatement, StatementParser parser) {
        if (caseStatement.getCaseExpressions().isEmpty()) {
            return DEFAULT_LABEL;
        }
        return caseStatement.getCaseExpressions().stream()
                .map(parser::text)
                .collect(Collectors.joining(", "));
    }

    /**
     * Statements of a case with a trailing block opened up, so that
     * {@code case 1: { x(); break; }} exits like {@code case 1: x(); break;}.
     */
    private static List<CtStatement> explicitStatements(CtCase<?> caseStatement) {
        List<CtStatement> statements = explicit(caseStatement.getStatements());
        while (!statements.isEmpty() && statements.get(statements.size() - 1) instanceof CtBlock) {
            CtBlock<?> block = (CtBlock<?>) statements.remove(statements.size() - 1);
            statements.addAll(explicit(block.getStatements()));
        }
        return statements;
    }

    private static List<CtStatement> explicit(List<CtStatement> candidates) {
        List<CtStatement> statements = new ArrayList<>();
        for (CtStatement statement : candidates) {
            if (!statement.isImplicit() || statement instanceof CtBlock) {
                statements.add(statement);
            }
        }
        return statements;
    }

    private static boolean isJump(CtStatement statement) {
        return statement instanceof CtBreak
                || statement instanceof CtContinue
                || statement instanceof CtReturn
                || statement instanceof CtThrow
                || statement instanceof CtYieldStatement;
    }
}
