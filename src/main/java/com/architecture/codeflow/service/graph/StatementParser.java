package com.architecture.codeflow.service.graph;

import com.architecture.codeflow.dto.FlowchartOptions;
import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodeFactory;
import com.architecture.codeflow.service.graph.construct.CallHandler;
import com.architecture.codeflow.service.graph.construct.ConditionalGroup;
import com.architecture.codeflow.service.graph.construct.ConditionalHandler;
import com.architecture.codeflow.service.graph.construct.ConstructHandler;
import com.architecture.codeflow.service.graph.construct.FunctionDefinitionHandler;
import com.architecture.codeflow.service.graph.construct.JumpHandler;
import com.architecture.codeflow.service.graph.construct.LoopHandler;
import com.architecture.codeflow.service.graph.construct.OperationHandler;
import com.architecture.codeflow.service.graph.construct.ReturnHandler;
import com.architecture.codeflow.service.graph.construct.SwitchHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtLocalVariable;
import spoon.reflect.code.CtStatement;
import spoon.reflect.code.CtSynchronized;
import spoon.reflect.code.CtTry;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtField;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Chains a statement list into one flowchart fragment.
 *
 * Each statement is dispatched on its {@link StatementKind} to a
 * {@link ConstructHandler}; the tail of every statement is connected to the head of
 * the next one. Blocks, {@code synchronized} bodies and {@code try} bodies (with
 * their {@code finally}) are inlined into the surrounding sequence.
 *
 * One parser per build: it owns the {@link NodeFactory} all handlers create nodes with.
 */
@Slf4j
@Getter
public class StatementParser {

    private static final Map<StatementKind, ConstructHandler> HANDLERS = new EnumMap<>(StatementKind.class);
    private static final ConstructHandler DEFAULT_HANDLER = new OperationHandler();

    static {
        HANDLERS.put(StatementKind.FUNCTION_DEFINITION, new FunctionDefinitionHandler());
        HANDLERS.put(StatementKind.CONDITIONAL, new ConditionalHandler());
        HANDLERS.put(StatementKind.LOOP, new LoopHandler());
        HANDLERS.put(StatementKind.SWITCH, new SwitchHandler());
        HANDLERS.put(StatementKind.RETURN, new ReturnHandler());
        HANDLERS.put(StatementKind.JUMP, new JumpHandler());
        HANDLERS.put(StatementKind.CALL, new CallHandler());
        HANDLERS.put(StatementKind.OPERATION, DEFAULT_HANDLER);
    }

    private final SourceText sourceText;
    private final FlowchartOptions options;
    private final NodeFactory factory;
    private final FlowSimplifier simplifier;

    public StatementParser(SourceText sourceText, FlowchartOptions options) {
        this.sourceText = sourceText;
        this.options = options == null ? FlowchartOptions.builder().build() : options;
        this.factory = new NodeFactory();
        this.simplifier = new FlowSimplifier(factory);
    }

    /**
     * Build and chain {@code elements}.
     *
     * @return head and tails of the chain, empty when there is nothing to draw
     */
    public ParseResult parse(List<? extends CtElement> elements) {
        Node head = null;
        Node previous = null;

        for (List<CtElement> statement : groupDeclarators(flatten(elements))) {
            Node node = statement.size() == 1
                    ? build(statement.get(0))
                    : factory.operation(sourceText.ofSpan(statement));
            if (head == null) {
                head = node;
            } else {
                alignIfConsecutive(previous, node);
                previous.connect(node);
            }
            previous = node;
        }

        if (head == null) {
            return ParseResult.empty();
        }
        return new ParseResult(head, List.of(previous));
    }

    /**
     * Build the fragment of a single element, falling back to a plain operation
     * node when its handler cannot cope with it.
     */
    public Node build(CtElement element) {
        StatementKind kind = StatementKind.of(element);
        ConstructHandler handler = HANDLERS.getOrDefault(kind, DEFAULT_HANDLER);
        try {
            return handler.handle(element, this);
        } catch (RuntimeException e) {
            log.warn("Failed to build {} construct at {}, drawing it as an operation: {}",
                    kind, element.getPosition(), e.getMessage());
            return factory.operation(sourceText.labelOf(element));
        }
    }

    public String text(CtElement element) {
        return sourceText.of(element);
    }

    public String label(CtElement element) {
        return sourceText.labelOf(element);
    }

    /**
     * Statements of a branch or loop body. A missing body has none; an unbraced body
     * is a single statement.
     */
    public static List<CtStatement> bodyOf(CtStatement body) {
        if (body == null) {
            return List.of();
        }
        if (body instanceof CtBlock) {
            return ((CtBlock<?>) body).getStatements();
        }
        return List.of(body);
    }

    private void alignIfConsecutive(Node previous, Node next) {
        if (!options.isAlignConsecutiveConditions()) {
            return;
        }
        if (previous instanceof ConditionalGroup && next instanceof ConditionalGroup) {
            ConditionalGroup first = (ConditionalGroup) previous;
            ConditionalGroup second = (ConditionalGroup) next;
            if (first.isAlignable() && second.isAlignable()) {
                first.align();
            }
        }
    }

    /**
     * Spoon splits {@code int x = 1, y = 2;} into one variable per declarator, all
     * starting at the same source offset. Those runs are drawn as one statement.
     */
    private static List<List<CtElement>> groupDeclarators(List<CtElement> elements) {
        List<List<CtElement>> groups = new ArrayList<>();
        List<CtElement> current = null;
        int currentStart = -1;
        for (CtElement element : elements) {
            int start = declarationStart(element);
            if (current != null && start >= 0 && start == currentStart) {
                current.add(element);
                continue;
            }
            current = new ArrayList<>();
            current.add(element);
            currentStart = start;
            groups.add(current);
        }
        return groups;
    }

    private static int declarationStart(CtElement element) {
        if (!(element instanceof CtLocalVariable) && !(element instanceof CtField)) {
            return -1;
        }
        SourcePosition position = element.getPosition();
        return position != null && position.isValidPosition() ? position.getSourceStart() : -1;
    }

    private static List<CtElement> flatten(List<? extends CtElement> elements) {
        List<CtElement> flat = new ArrayList<>();
        for (CtElement element : elements) {
            collect(element, flat);
        }
        return flat;
    }

    private static void collect(CtElement element, List<CtElement> flat) {
        if (element == null) {
            return;
        }
        if (element instanceof CtBlock) {
            ((CtBlock<?>) element).getStatements().forEach(statement -> collect(statement, flat));
        } else if (element instanceof CtSynchronized) {
            collect(((CtSynchronized) element).getBlock(), flat);
        } else if (element instanceof CtTry) {
            CtTry tryStatement = (CtTry) element;
            collect(tryStatement.getBody(), flat);
            collect(tryStatement.getFinalizer(), flat);
        } else if (!element.isImplicit()) {
            flat.add(element);
        }
    }
}
