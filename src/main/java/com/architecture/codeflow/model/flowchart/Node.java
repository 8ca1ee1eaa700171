package com.architecture.codeflow.model.flowchart;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One flowchart box.
 *
 * A node renders only itself: one definition line
 * {@code name(param=value,...)=>type: text} and one line per outgoing connection.
 * Nodes are created by {@link NodeFactory}; id and name never change afterwards.
 */
@Slf4j
@Getter
public class Node {

    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String TOP = "top";
    public static final String BOTTOM = "bottom";

    private final long id;
    private final String name;
    private final NodeType type;
    private final boolean terminal;
    private String text;
    private String connectDirection;

    private final List<Connection> connections = new ArrayList<>();
    private final Map<String, String> params = new LinkedHashMap<>();

    protected Node(long id, String name, NodeType type, String text, boolean terminal) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.text = text == null ? "" : text;
        this.terminal = terminal;
    }

    /**
     * Connect this node to {@code target}, leaving in the preferred exit direction if one is set.
     */
    public void connect(Node target) {
        connect(target, connectDirection);
    }

    public void connect(Node target, String direction) {
        if (target == null) {
            return;
        }
        if (terminal) {
            log.trace("Terminal node {} ignores connection to {}", getName(), target.getName());
            return;
        }
        connections.add(new Connection(target, direction));
    }

    /**
     * The node a predecessor actually reaches. Groups answer their head's entry.
     */
    public Node entry() {
        return this;
    }

    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    protected void addConnection(Connection connection) {
        connections.add(connection);
    }

    public Map<String, String> getParams() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * Set a {@code (key=value)} render parameter, see flowchart.js issue #115.
     * Blank keys or values are ignored.
     */
    public void setParam(String key, String value) {
        if (key != null && !key.isBlank() && value != null && !value.isBlank()) {
            params.put(key, value);
        }
    }

    /**
     * Preferred direction ({@link #LEFT}, {@link #RIGHT}, {@link #TOP}, {@link #BOTTOM}) for
     * connections made without an explicit one. {@code null} lets the renderer decide.
     */
    public void setConnectDirection(String connectDirection) {
        this.connectDirection = connectDirection;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    public String renderDefinition() {
        String paramBlock = "";
        if (!params.isEmpty()) {
            paramBlock = params.entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining(",", "(", ")"));
        }
        return getName() + paramBlock + "=>" + getType().getDslName() + ": " + getText();
    }

    public List<String> renderConnections() {
        List<String> lines = new ArrayList<>();
        for (Connection connection : connections) {
            String line = connection.render(this);
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    @Override
    public String toString() {
        return getName() + "[" + getType() + "]: " + getText();
    }
}
