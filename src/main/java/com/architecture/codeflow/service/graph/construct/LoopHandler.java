package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.ConditionNode;
import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodeFactory;
import com.architecture.codeflow.model.flowchart.TransparentNode;
import com.architecture.codeflow.service.graph.ParseResult;
import com.architecture.codeflow.service.graph.StatementParser;
import lombok.extern.slf4j.Slf4j;
import spoon.reflect.code.CtDo;
import spoon.reflect.code.CtFor;
import spoon.reflect.code.CtForEach;
import spoon.reflect.code.CtLoop;
import spoon.reflect.code.CtWhile;
import spoon.reflect.declaration.CtElement;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code while}, {@code for}, enhanced {@code for} and {@code do}/{@code while}.
 *
 * Pre-test loops start at the condition: the body hangs off "yes" and loops back
 * to the condition from the left, "no" leaves the loop. A do-while starts at its
 * body and only reaches the condition afterwards. An empty body is drawn as a
 * {@code no-op} subroutine.
 */
@Slf4j
public class LoopHandler implements ConstructHandler {

    static final String WHILE = "while";
    static final String FOR = "for";
    static final String NO_OP = "no-op";

    @Override
    public Node handle(CtElement element, StatementParser parser) {
        CtLoop loop = (CtLoop) element;
        NodeFactory factory = parser.getFactory();
        boolean postTest = loop instanceof CtDo;

        String keyword = keywordOf(loop);
        String header = headerOf(loop, parser);
        ConditionNode condition = factory.condition(keyword + " " + header);

        ParseResult body = parser.parse(StatementParser.bodyOf(loop.getBody()));
        if (body.isEmpty()) {
            Node noOp = factory.subroutine(NO_OP);
            body = new ParseResult(noOp, List.of(noOp));
        }

        TransparentNode exit = factory.transparent();
        LoopGroup group;
        if (postTest) {
            body.connectTails(condition);
            condition.connectYes(body.getHead(), Node.LEFT);
            condition.connectNo(exit);
            group = new LoopGroup(factory.nextId(), body.getHead(), condition, loop, keyword, header, true);
        } else {
            condition.connectYes(body.getHead());
            body.connectTails(condition, Node.LEFT);
            condition.connectNo(exit);
            group = new LoopGroup(factory.nextId(), condition, condition, loop, keyword, header, false);
        }
        group.appendTail(exit);

        if (parser.getOptions().isSimplify() && !postTest) {
            parser.getSimplifier().simplify(group);
        }
        log.debug("Built loop {} '{}'", group.getName(), group.getText());
        return group;
    }

    private static String keywordOf(CtLoop loop) {
        return loop instanceof CtFor || loop instanceof CtForEach ? FOR : WHILE;
    }

    static String headerOf(CtLoop loop, StatementParser parser) {
        if (loop instanceof CtWhile) {
            return parser.text(((CtWhile) loop).getLoopingExpression());
        }
        if (loop instanceof CtDo) {
            return parser.text(((CtDo) loop).getLoopingExpression());
        }
        if (loop instanceof CtFor || loop instanceof CtForEach) {
            String header = parser.getSourceText().headerOf(loop);
            if (header != null) {
                return header;
            }
        }
        if (loop instanceof CtForEach) {
            CtForEach forEach = (CtForEach) loop;
            return "(" + parser.text(forEach.getVariable()) + " : " + parser.text(forEach.getExpression()) + ")";
        }
        if (loop instanceof CtFor) {
            CtFor forLoop = (CtFor) loop;
            String init = forLoop.getForInit().stream().map(parser::text).collect(Collectors.joining(", "));
            String test = forLoop.getExpression() == null ? "" : parser.text(forLoop.getExpression());
            String update = forLoop.getForUpdate().stream().map(parser::text).collect(Collectors.joining(", "));
            return "(" + init + "; " + test + "; " + update + ")";
        }
        return parser.text(loop);
    }
}
