package com.architecture.codeflow.service.graph;

import com.architecture.codeflow.model.flowchart.Flowchart;
import com.architecture.codeflow.model.flowchart.Node;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link Flowchart} into flowchart.js DSL: node definitions, a blank line,
 * node connections. Both blocks come from a single traversal from the head.
 */
@Component
@Slf4j
public class FlowchartSerializer {

    public String render(Flowchart flowchart) {
        return serialize(flowchart).toText();
    }

    public RenderedFlowchart serialize(Flowchart flowchart) {
        List<String> definitions = new ArrayList<>();
        List<String> connections = new ArrayList<>();

        if (flowchart != null && !flowchart.isEmpty()) {
            GraphTraversal.traverse(flowchart.getHead(), node -> collect(node, definitions, connections));
        }

        log.debug("Serialized flowchart: {} definitions, {} connections", definitions.size(), connections.size());
        return RenderedFlowchart.builder()
                .definitions(definitions)
                .connections(connections)
                .build();
    }

    private void collect(Node node, List<String> definitions, List<String> connections) {
        String definition = node.renderDefinition();
        if (!definition.isEmpty()) {
            definitions.add(definition);
        }
        connections.addAll(node.renderConnections());
    }

    @Getter
    @Builder
    public static class RenderedFlowchart {
        private final List<String> definitions;
        private final List<String> connections;

        public String toText() {
            if (definitions.isEmpty() && connections.isEmpty()) {
                return "";
            }
            return String.join("\n", definitions) + "\n\n" + String.join("\n", connections);
        }
    }
}
