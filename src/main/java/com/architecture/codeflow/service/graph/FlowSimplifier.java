package com.architecture.codeflow.service.graph;

import com.architecture.codeflow.model.flowchart.ConditionNode;
import com.architecture.codeflow.model.flowchart.Connection;
import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodeFactory;
import com.architecture.codeflow.model.flowchart.NodesGroup;
import com.architecture.codeflow.model.flowchart.TransparentNode;
import com.architecture.codeflow.service.graph.construct.ConditionalGroup;
import com.architecture.codeflow.service.graph.construct.LoopGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Collapses a condition and its one-line body into a single operation node.
 *
 * <pre>
 * if (a == 1) { print(a); }     =&gt;  print(a) if a == 1
 * while (i &lt; n) { i++; }       =&gt;  i++ while i &lt; n
 * </pre>
 *
 * A construct that cannot be collapsed is left as it is.
 */
@Slf4j
@RequiredArgsConstructor
public class FlowSimplifier {

    private final NodeFactory factory;

    /**
     * Simplify an {@code if} without {@code else} whose then-body is one leaf node.
     *
     * @return whether the group was collapsed
     */
    public boolean simplify(ConditionalGroup group) {
        try {
            if (group.isElsePresent()) {
                return false;
            }
            ConditionNode condition = group.getCondition();
            Node body = condition.getYesTarget();
            if (!isLeaf(body) || !body.getConnections().isEmpty()) {
                return false;
            }

            Node merged = factory.merge(condition, body.getText() + " if " + group.getConditionText());
            group.collapseTo(merged);
            log.debug("Simplified conditional {} into '{}'", merged.getName(), merged.getText());
            return true;
        } catch (IllegalStateException e) {
            log.warn("Leaving conditional {} unsimplified: {}", group.getName(), e.getMessage());
            return false;
        }
    }

    /**
     * Simplify a pre-test loop whose body is one leaf node looping straight back.
     *
     * @return whether the group was collapsed
     */
    public boolean simplify(LoopGroup group) {
        try {
            if (group.isPostTest()) {
                return false;
            }
            ConditionNode condition = group.getCondition();
            Node body = condition.getYesTarget();
            if (!isLeaf(body)) {
                return false;
            }
            List<Connection> connections = body.getConnections();
            if (connections.size() != 1 || connections.get(0).getTarget() != condition) {
                return false;
            }

            Node merged = factory.merge(condition, body.getText() + " while " + group.getHeaderText());
            group.collapseTo(merged);
            log.debug("Simplified loop {} into '{}'", merged.getName(), merged.getText());
            return true;
        } catch (IllegalStateException e) {
            log.warn("Leaving loop {} unsimplified: {}", group.getName(), e.getMessage());
            return false;
        }
    }

    static boolean isLeaf(Node node) {
        return node != null
                && !(node instanceof NodesGroup)
                && !(node instanceof ConditionNode)
                && !(node instanceof TransparentNode)
                && !node.isTerminal();
    }
}
