package com.architecture.codeflow.model.flowchart;

import lombok.Getter;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A directed edge to another node, with the flowchart.js connection parameters
 * ("yes", "no", "left", ...) in insertion order.
 */
@Getter
public class Connection {

    private final Node target;
    private final Set<String> params = new LinkedHashSet<>();

    public Connection(Node target, String... params) {
        this.target = target;
        for (String param : params) {
            addParam(param);
        }
    }

    public void addParam(String param) {
        if (param != null && !param.isBlank()) {
            params.add(param.trim());
        }
    }

    /**
     * Render as {@code source(p1,p2)->target}. Transparent relays on the way are
     * skipped and their own parameters appended. Returns an empty string when the
     * resolved target has no name.
     */
    public String render(Node source) {
        Set<String> merged = new LinkedHashSet<>(params);
        Node destination = target == null ? null : target.entry();

        Set<Node> relays = Collections.newSetFromMap(new IdentityHashMap<>());
        while (destination instanceof TransparentNode && relays.add(destination)) {
            Connection relay = ((TransparentNode) destination).getRelay();
            if (relay == null) {
                return "";
            }
            merged.addAll(relay.getParams());
            destination = relay.getTarget().entry();
        }

        if (destination == null || destination instanceof TransparentNode
                || destination.getName() == null || destination.getName().isEmpty()) {
            return "";
        }

        String paramBlock = merged.isEmpty() ? "" : "(" + String.join(",", merged) + ")";
        return source.getName() + paramBlock + "->" + destination.getName();
    }
}
