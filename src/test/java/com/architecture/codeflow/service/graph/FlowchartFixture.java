package com.architecture.codeflow.service.graph;

import com.architecture.codeflow.dto.FlowchartOptions;
import com.architecture.codeflow.model.flowchart.Flowchart;
import com.architecture.codeflow.service.JavaSourceParser;
import com.architecture.codeflow.service.ParsedSource;
import spoon.reflect.declaration.CtMethod;

/**
 * Renders statements placed in the body of {@code Demo.run(int a, int b, int n)}.
 */
public final class FlowchartFixture {

    public static final FlowchartOptions SIMPLIFIED = FlowchartOptions.builder().simplify(true).build();
    public static final FlowchartOptions UNSIMPLIFIED = FlowchartOptions.builder().simplify(false).build();

    private static final JavaSourceParser SOURCE_PARSER = new JavaSourceParser(17);
    private static final FlowchartSerializer SERIALIZER = new FlowchartSerializer();

    private FlowchartFixture() {
    }

    public static String render(String body, FlowchartOptions options) {
        String code = "class Demo {\n"
                + "    void run(int a, int b, int n) {\n"
                + body + "\n"
                + "    }\n"
                + "}\n";
        ParsedSource source = SOURCE_PARSER.parse(code);
        CtMethod<?> method = source.getTypes().get(0).getMethodsByName("run").get(0);

        StatementParser parser = new StatementParser(new SourceText(source.getCode()), options);
        ParseResult result = parser.parse(method.getBody().getStatements());
        return SERIALIZER.render(result.isEmpty() ? Flowchart.empty() : new Flowchart(result.getHead()));
    }
}
