package com.architecture.codeflow.model.flowchart;

/**
 * Creates every node of one flowchart build and owns the id sequence.
 *
 * One factory per build: ids (and so names) are unique within the build and
 * deterministic across builds of the same source. Not thread-safe, a build
 * runs on a single thread.
 */
public class NodeFactory {

    public static final String INPUT = "input";
    public static final String OUTPUT = "output";

    private long nextId;

    public long nextId() {
        return nextId++;
    }

    public Node start(String name) {
        return create(NodeType.START, "start " + name, false);
    }

    public Node end(String name) {
        return create(NodeType.END, "end " + name, false);
    }

    public Node operation(String operation) {
        return create(NodeType.OPERATION, operation, false);
    }

    public Node input(String content) {
        return create(NodeType.INPUT_OUTPUT, INPUT + ": " + content, false);
    }

    public Node output(String content) {
        return create(NodeType.INPUT_OUTPUT, OUTPUT + ": " + content, false);
    }

    public Node subroutine(String subroutine) {
        return create(NodeType.SUBROUTINE, subroutine, false);
    }

    /**
     * A subroutine that accepts no outgoing connections (break, continue, throw).
     */
    public Node terminalSubroutine(String subroutine) {
        return create(NodeType.SUBROUTINE, subroutine, true);
    }

    public ConditionNode condition(String condition) {
        long id = nextId();
        return new ConditionNode(id, NodeType.CONDITION.getNamePrefix() + id, condition);
    }

    public TransparentNode transparent() {
        return new TransparentNode(nextId());
    }

    /**
     * An operation node that takes over the identity of {@code replaced}, used when a
     * condition and its one-line body collapse into a single box.
     */
    public Node merge(Node replaced, String operation) {
        return new Node(replaced.getId(), replaced.getName(), NodeType.OPERATION, operation, false);
    }

    private Node create(NodeType type, String text, boolean terminal) {
        long id = nextId();
        return new Node(id, type.getNamePrefix() + id, type, text, terminal);
    }
}
