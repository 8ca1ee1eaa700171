package com.architecture.codeflow.model.flowchart;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionTest {

    private NodeFactory factory;

    @BeforeEach
    void setUp() {
        factory = new NodeFactory();
    }

    @Test
    void rendersParamsInInsertionOrderWithoutDuplicatesOrBlanks() {
        Node source = factory.operation("a");
        Node target = factory.operation("b");

        Connection connection = new Connection(target, "yes", "", null, "left", "yes");

        assertThat(connection.getParams()).containsExactly("yes", "left");
        assertThat(connection.render(source)).isEqualTo("op0(yes,left)->op1");
    }

    @Test
    void rendersThroughTransparentRelayAndAppendsItsParams() {
        ConditionNode condition = factory.condition("if a");
        TransparentNode placeholder = factory.transparent();
        Node next = factory.operation("next");

        condition.connectNo(placeholder);
        placeholder.connect(next, Node.LEFT);

        assertThat(condition.renderConnections()).containsExactly("cond0(no,left)->op2");
        assertThat(placeholder.renderDefinition()).isEmpty();
        assertThat(placeholder.renderConnections()).isEmpty();
    }

    @Test
    void rendersNothingForDanglingPlaceholder() {
        ConditionNode condition = factory.condition("if a");
        condition.connectNo(factory.transparent());

        assertThat(condition.renderConnections()).isEmpty();
    }

    @Test
    void transparentNodeKeepsFirstRelay() {
        TransparentNode placeholder = factory.transparent();
        Node first = factory.operation("first");
        placeholder.connect(first);
        placeholder.connect(factory.operation("second"));

        assertThat(placeholder.getConnections()).hasSize(1);
        assertThat(placeholder.getRelay().getTarget()).isSameAs(first);
    }

    @Test
    void stopsOnRelayCycle() {
        Node source = factory.operation("a");
        TransparentNode first = factory.transparent();
        TransparentNode second = factory.transparent();
        first.connect(second);
        second.connect(first);

        assertThat(new Connection(first).render(source)).isEmpty();
    }
}
