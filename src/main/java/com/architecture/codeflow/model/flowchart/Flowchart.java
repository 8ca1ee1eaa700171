package com.architecture.codeflow.model.flowchart;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A built node graph ready for serialization. An empty flowchart has no head.
 */
@Getter
@RequiredArgsConstructor
public class Flowchart {

    private final Node head;

    public static Flowchart empty() {
        return new Flowchart(null);
    }

    public boolean isEmpty() {
        return head == null || head.entry() == null;
    }
}
