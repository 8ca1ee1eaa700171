package com.architecture.codeflow.model.flowchart;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * A relay with no definition of its own. It gives an empty branch (an {@code if}
 * without {@code else}, a loop exit) something to connect to: an edge into a
 * transparent node renders as an edge into its child.
 */
@Slf4j
public class TransparentNode extends Node {

    protected TransparentNode(long id) {
        super(id, "", NodeType.TRANSPARENT, "", false);
    }

    @Override
    public void connect(Node target, String direction) {
        if (target == null) {
            return;
        }
        if (getRelay() != null) {
            log.warn("Transparent node #{} already relays to {}, ignoring {}",
                    getId(), getRelay().getTarget().getName(), target.getName());
            return;
        }
        addConnection(new Connection(target, direction));
    }

    /**
     * The single outgoing connection, or {@code null} while nothing follows this branch.
     */
    public Connection getRelay() {
        List<Connection> connections = getConnections();
        return connections.isEmpty() ? null : connections.get(0);
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
