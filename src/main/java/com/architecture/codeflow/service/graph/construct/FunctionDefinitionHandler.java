package com.architecture.codeflow.service.graph.construct;

import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodeFactory;
import com.architecture.codeflow.service.graph.ParseResult;
import com.architecture.codeflow.service.graph.StatementKind;
import com.architecture.codeflow.service.graph.StatementParser;
import lombok.extern.slf4j.Slf4j;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtStatement;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtParameter;
import spoon.reflect.declaration.CtType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A method or constructor:
 *
 * <pre>
 * start name -&gt; input: params -&gt; body... -&gt; end name
 * </pre>
 */
@Slf4j
public class FunctionDefinitionHandler implements ConstructHandler {

    @Override
    public Node handle(CtElement element, StatementParser parser) {
        CtExecutable<?> executable = (CtExecutable<?>) element;
        NodeFactory factory = parser.getFactory();
        String name = nameOf(executable);

        Node start = factory.start(name);
        Node input = factory.input(parameters(executable));
        start.connect(input);

        ParseResult body = parser.parse(statements(executable));
        Node end = factory.end(name);
        if (body.isEmpty()) {
            input.connect(end);
        } else {
            input.connect(body.getHead());
            body.connectTails(end);
        }

        ConstructGroup group = new ConstructGroup(factory.nextId(), start, StatementKind.FUNCTION_DEFINITION, element);
        group.appendTail(end);
        log.debug("Built function definition {} for {}", group.getName(), name);
        return group;
    }

    private static String nameOf(CtExecutable<?> executable) {
        if (executable instanceof CtConstructor) {
            CtType<?> owner = ((CtConstructor<?>) executable).getDeclaringType();
            if (owner != null) {
                return owner.getSimpleName();
            }
        }
        return executable.getSimpleName();
    }

    private static String parameters(CtExecutable<?> executable) {
        return executable.getParameters().stream()
                .map(CtParameter::getSimpleName)
                .collect(Collectors.joining(", "));
    }

    private static List<CtStatement> statements(CtExecutable<?> executable) {
        CtBlock<?> body = executable.getBody();
        return body == null ? List.of() : body.getStatements();
    }
}
