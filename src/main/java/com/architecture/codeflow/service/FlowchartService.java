package com.architecture.codeflow.service;

import com.architecture.codeflow.dto.FlowchartOptions;
import com.architecture.codeflow.dto.FlowchartRequest;
import com.architecture.codeflow.dto.FlowchartResponse;
import com.architecture.codeflow.model.flowchart.Flowchart;
import com.architecture.codeflow.service.graph.FlowchartSerializer;
import com.architecture.codeflow.service.graph.FlowchartSerializer.RenderedFlowchart;
import com.architecture.codeflow.service.graph.ParseResult;
import com.architecture.codeflow.service.graph.SourceText;
import com.architecture.codeflow.service.graph.StatementParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtNamedElement;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Source text in, flowchart.js DSL out.
 *
 * Parses the source, selects the requested declaration, builds its node graph and
 * serializes it. Every call builds its own graph, so the service is stateless.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowchartService {

    private final JavaSourceParser javaSourceParser;
    private final FieldResolver fieldResolver;
    private final FlowchartSerializer flowchartSerializer;
    private final FlowchartOptions defaultFlowchartOptions;

    public FlowchartResponse generate(FlowchartRequest request) {
        FlowchartOptions options = defaultFlowchartOptions.toBuilder()
                .simplify(request.getSimplify() != null
                        ? request.getSimplify() : defaultFlowchartOptions.isSimplify())
                .alignConsecutiveConditions(request.getAlignConsecutiveConditions() != null
                        ? request.getAlignConsecutiveConditions() : defaultFlowchartOptions.isAlignConsecutiveConditions())
                .build();
        boolean inner = request.getInner() == null || request.getInner();

        log.info("Generating flowchart for field '{}' (inner: {}, options: {})", request.getField(), inner, options);
        Flowchart flowchart = buildFlowchart(request.getCode(), request.getField(), inner, options);
        RenderedFlowchart rendered = flowchartSerializer.serialize(flowchart);

        return FlowchartResponse.builder()
                .flowchart(rendered.toText())
                .field(request.getField())
                .nodeCount(rendered.getDefinitions().size())
                .connectionCount(rendered.getConnections().size())
                .generatedAt(LocalDateTime.now())
                .build();
    }

    /**
     * Render {@code code} as flowchart.js DSL, see {@link #buildFlowchart}.
     */
    public String render(String code, String field, boolean inner, FlowchartOptions options) {
        return flowchartSerializer.render(buildFlowchart(code, field, inner, options));
    }

    /**
     * Build the node graph of {@code field} in {@code code}.
     *
     * @param field dotted path such as {@code Bar.buzz}; blank selects the whole source
     * @param inner draw the body of the selected declaration rather than the declaration itself
     * @return the graph, empty when the field does not exist or has nothing to draw
     */
    public Flowchart buildFlowchart(String code, String field, boolean inner, FlowchartOptions options) {
        ParsedSource source = javaSourceParser.parse(code);
        List<? extends CtElement> body = selectBody(source, field, inner);

        StatementParser parser = new StatementParser(new SourceText(source.getCode()), options);
        ParseResult result = parser.parse(body);
        if (result.isEmpty()) {
            log.info("Nothing to draw for field '{}'", field);
            return Flowchart.empty();
        }
        log.debug("Built flowchart for field '{}' starting at {}", field, result.getHead().getName());
        return new Flowchart(result.getHead());
    }

    private List<? extends CtElement> selectBody(ParsedSource source, String field, boolean inner) {
        if (field == null || field.isBlank()) {
            return source.getRootBody();
        }
        Optional<CtNamedElement> declaration = fieldResolver.resolve(source, field.strip());
        if (declaration.isEmpty()) {
            return List.of();
        }
        return inner ? fieldResolver.bodyOf(declaration.get()) : List.of(declaration.get());
    }
}
