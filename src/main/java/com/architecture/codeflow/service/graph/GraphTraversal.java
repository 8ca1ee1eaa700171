package com.architecture.codeflow.service.graph;

import com.architecture.codeflow.model.flowchart.Connection;
import com.architecture.codeflow.model.flowchart.Node;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Depth-first, pre-order walk over node connections.
 *
 * Every call starts with a fresh visited set, so a graph can be walked again after
 * it was mutated. Loop bodies connect back to their condition; the visited set is
 * what stops the walk there. An explicit stack keeps long statement chains off the
 * call stack while producing the same order as the recursive definition.
 */
public final class GraphTraversal {

    private GraphTraversal() {
    }

    /**
     * Visit each node reachable from {@code root} exactly once. Groups are never
     * visited themselves, only the nodes they contain.
     */
    public static void traverse(Node root, Consumer<Node> visitor) {
        if (root == null) {
            return;
        }

        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            Node node = stack.pop().entry();
            if (node == null || !visited.add(node)) {
                continue;
            }

            visitor.accept(node);

            List<Connection> connections = node.getConnections();
            for (int i = connections.size() - 1; i >= 0; i--) {
                Node target = connections.get(i).getTarget();
                if (target != null) {
                    stack.push(target);
                }
            }
        }
    }
}
