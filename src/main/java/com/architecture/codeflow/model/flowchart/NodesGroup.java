package com.architecture.codeflow.model.flowchart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of nodes that looks and behaves like a single node.
 *
 * Predecessors reach the group's head; {@link #connect(Node, String)} attaches
 * the successor to every tail. The group itself never renders, its name is its
 * head's name.
 */
public class NodesGroup extends Node {

    private Node head;
    private final List<Node> tails = new ArrayList<>();

    public NodesGroup(long id, Node head, boolean terminal) {
        super(id, "", null, "", terminal);
        this.head = head;
    }

    public NodesGroup(long id, Node head) {
        this(id, head, false);
    }

    public Node getHead() {
        return head;
    }

    public void setHead(Node head) {
        if (head != null) {
            this.head = head;
        }
    }

    public List<Node> getTails() {
        return Collections.unmodifiableList(tails);
    }

    public void appendTail(Node tail) {
        if (tail != null) {
            tails.add(tail);
        }
    }

    public void extendTails(List<? extends Node> tailNodes) {
        tailNodes.forEach(this::appendTail);
    }

    protected void replaceTails(List<? extends Node> tailNodes) {
        tails.clear();
        extendTails(tailNodes);
    }

    @Override
    public String getName() {
        return head == null ? "" : head.getName();
    }

    @Override
    public NodeType getType() {
        return head == null ? NodeType.TRANSPARENT : head.getType();
    }

    @Override
    public String getText() {
        return head == null ? "" : head.getText();
    }

    @Override
    public Node entry() {
        return head == null ? null : head.entry();
    }

    @Override
    public void connect(Node target, String direction) {
        if (target == null || isTerminal()) {
            return;
        }
        for (Node tail : tails) {
            tail.connect(target, direction);
        }
    }

    @Override
    public void connect(Node target) {
        if (target == null || isTerminal()) {
            return;
        }
        for (Node tail : tails) {
            tail.connect(target);
        }
    }

    @Override
    public String renderDefinition() {
        return "";
    }

    @Override
    public List<String> renderConnections() {
        return List.of();
    }
}
