package com.architecture.codeflow.model.flowchart;

/**
 * flowchart.js {@code condition} node with its two labeled branches.
 */
public class ConditionNode extends Node {

    public static final String YES = "yes";
    public static final String NO = "no";

    private Connection yes;
    private Connection no;

    protected ConditionNode(long id, String name, String text) {
        super(id, name, NodeType.CONDITION, text, false);
    }

    public void connectYes(Node target) {
        connectYes(target, null);
    }

    public void connectYes(Node target, String direction) {
        if (yes != null) {
            throw new IllegalStateException("Condition " + getName() + " already has a yes branch");
        }
        yes = new Connection(target, YES, direction);
        addConnection(yes);
    }

    public void connectNo(Node target) {
        connectNo(target, null);
    }

    public void connectNo(Node target, String direction) {
        if (no != null) {
            throw new IllegalStateException("Condition " + getName() + " already has a no branch");
        }
        no = new Connection(target, NO, direction);
        addConnection(no);
    }

    public Node getYesTarget() {
        return yes == null ? null : yes.getTarget();
    }

    public Node getNoTarget() {
        return no == null ? null : no.getTarget();
    }

    /**
     * Set {@code align-next=no} so the renderer does not line up the next node
     * on this condition's auto edge.
     */
    public void noAlignNext() {
        setParam("align-next", "no");
    }
}
