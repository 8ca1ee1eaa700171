package com.architecture.codeflow.service.graph;

import com.architecture.codeflow.model.flowchart.Node;
import lombok.Getter;

import java.util.List;

/**
 * Entry and exits of a parsed statement list. An empty list has no head and no tails.
 */
@Getter
public class ParseResult {

    private static final ParseResult EMPTY = new ParseResult(null, List.of());

    private final Node head;
    private final List<Node> tails;

    public ParseResult(Node head, List<Node> tails) {
        this.head = head;
        this.tails = List.copyOf(tails);
    }

    public static ParseResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return head == null;
    }

    public void connectTails(Node target) {
        tails.forEach(tail -> tail.connect(target));
    }

    public void connectTails(Node target, String direction) {
        tails.forEach(tail -> tail.connect(target, direction));
    }
}
