package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodeFactory;
import com.architecture.codeflow.service.JavaSourceParser;
import com.architecture.codeflow.service.graph.StatementKind;
import com.architecture.codeflow.service.graph.StatementParser;
import lombok.extern.slf4j.Slf4j;
import spoon.reflect.code.CtExpression;
import spoon.reflect.code.CtLambda;
import spoon.reflect.code.CtReturn;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtType;

/**
 * {@code return [value]}: an optional {@code output: value} box followed by the end
 * of the enclosing method. Nothing is connected after a return.
 */
@Slf4j
public class ReturnHandler implements ConstructHandler {

    static final String ANONYMOUS_FUNCTION = "function return";

    @Override
    public Node handle(CtElement element, StatementParser parser) {
        CtReturn<?> returnStatement = (CtReturn<?>) element;
        NodeFactory factory = parser.getFactory();

        Node end = factory.end(enclosingName(returnStatement));
        Node head = end;

        CtExpression<?> value = returnStatement.getReturnedExpression();
        if (value != null) {
            head = factory.output(parser.text(value));
            head.connect(end);
        }

        ConstructGroup group = new ConstructGroup(factory.nextId(), head, StatementKind.RETURN, element, true);
        group.appendTail(end);
        log.debug("Built return {} ending {}", group.getName(), end.getText());
        return group;
    }

    static String enclosingName(CtReturn<?> returnStatement) {
        CtExecutable<?> executable = returnStatement.getParent(CtExecutable.class);
        if (executable == null || executable instanceof CtLambda) {
            return ANONYMOUS_FUNCTION;
        }
        if (executable instanceof CtMethod) {
            CtMethod<?> method = (CtMethod<?>) executable;
            return JavaSourceParser.isSnippetMethod(method) ? ANONYMOUS_FUNCTION : method.getSimpleName();
        }
        if (executable instanceof CtConstructor) {
            CtType<?> owner = ((CtConstructor<?>) executable).getDeclaringType();
            return owner == null ? ANONYMOUS_FUNCTION : owner.getSimpleName();
        }
        return ANONYMOUS_FUNCTION;
    }
}
