package com.architecture.codeflow.service.graph;

import com.architecture.codeflow.model.flowchart.ConditionNode;
import com.architecture.codeflow.model.flowchart.Node;
import com.architecture.codeflow.model.flowchart.NodeFactory;
import com.architecture.codeflow.model.flowchart.NodesGroup;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GraphTraversalTest {

    private final NodeFactory factory = new NodeFactory();

    @Test
    void visitsInDepthFirstPreOrder() {
        ConditionNode condition = factory.condition("if a");
        Node yes = factory.operation("x");
        Node no = factory.operation("y");
        Node after = factory.operation("z");
        condition.connectYes(yes);
        condition.connectNo(no);
        yes.connect(after);
        no.connect(after);

        assertThat(visitedNames(condition)).containsExactly("cond0", "op1", "op3", "op2");
    }

    @Test
    void terminatesOnBackEdgeAndVisitsEachNodeOnce() {
        ConditionNode loop = factory.condition("while a");
        Node body = factory.operation("a--");
        Node exit = factory.operation("done");
        loop.connectYes(body);
        body.connect(loop, Node.LEFT);
        loop.connectNo(exit);

        assertThat(visitedNames(loop)).containsExactly("cond0", "op1", "op2");
    }

    @Test
    void unwrapsGroupsToTheirHead() {
        Node head = factory.operation("inside");
        NodesGroup group = new NodesGroup(factory.nextId(), head);
        group.appendTail(head);

        assertThat(visitedNames(group)).containsExactly("op0");
    }

    @Test
    void everyTraversalStartsFresh() {
        Node first = factory.operation("a");
        first.connect(factory.operation("b"));

        assertThat(visitedNames(first)).containsExactly("op0", "op1");
        assertThat(visitedNames(first)).containsExactly("op0", "op1");
    }

    @Test
    void handlesLongChainsWithoutRecursion() {
        Node head = factory.operation("s0");
        Node previous = head;
        for (int i = 1; i < 20_000; i++) {
            Node next = factory.operation("s" + i);
            previous.connect(next);
            previous = next;
        }

        assertThat(visitedNames(head)).hasSize(20_000);
    }

    @Test
    void ignoresNullRoot() {
        List<Node> visited = new ArrayList<>();
        GraphTraversal.traverse(null, visited::add);

        assertThat(visited).isEmpty();
    }

    private static List<String> visitedNames(Node root) {
        List<String> names = new ArrayList<>();
        GraphTraversal.traverse(root, node -> names.add(node.getName()));
        return names;
    }
}
