package com.architecture.codeflow.model.flowchart;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    private NodeFactory factory;

    @BeforeEach
    void setUp() {
        factory = new NodeFactory();
    }

    @Test
    void namesNodesByTypePrefixAndBuildId() {
        Node start = factory.start("main");
        Node operation = factory.operation("x = 1");
        ConditionNode condition = factory.condition("if x > 0");
        Node end = factory.end("main");

        assertThat(start.getName()).isEqualTo("st0");
        assertThat(operation.getName()).isEqualTo("op1");
        assertThat(condition.getName()).isEqualTo("cond2");
        assertThat(end.getName()).isEqualTo("e3");
    }

    @Test
    void rendersDefinitionWithParams() {
        ConditionNode condition = factory.condition("if a > 0");
        assertThat(condition.renderDefinition()).isEqualTo("cond0=>condition: if a > 0");

        condition.noAlignNext();
        condition.setParam("", "ignored");
        condition.setParam("blank", " ");

        assertThat(condition.renderDefinition()).isEqualTo("cond0(align-next=no)=>condition: if a > 0");
    }

    @Test
    void inputAndOutputAreInputOutputNodes() {
        assertThat(factory.input("a, b").renderDefinition()).isEqualTo("io0=>inputoutput: input: a, b");
        assertThat(factory.output("a + b").renderDefinition()).isEqualTo("io1=>inputoutput: output: a + b");
    }

    @Test
    void usesPreferredDirectionWhenNoneIsGiven() {
        Node first = factory.operation("a");
        Node second = factory.operation("b");
        Node third = factory.operation("c");

        first.setConnectDirection(Node.RIGHT);
        first.connect(second);
        first.connect(third, Node.BOTTOM);

        assertThat(first.renderConnections()).containsExactly("op0(right)->op1", "op0(bottom)->op2");
    }

    @Test
    void terminalNodeRefusesConnections() {
        Node jump = factory.terminalSubroutine("break");
        jump.connect(factory.operation("unreachable"));

        assertThat(jump.getConnections()).isEmpty();
        assertThat(jump.renderConnections()).isEmpty();
    }

    @Test
    void conditionBranchesCanOnlyBeSetOnce() {
        ConditionNode condition = factory.condition("if ready");
        Node yes = factory.operation("go");
        condition.connectYes(yes);

        assertThat(condition.getYesTarget()).isSameAs(yes);
        assertThat(condition.getNoTarget()).isNull();
        assertThatThrownBy(() -> condition.connectYes(factory.operation("again")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cond0");
    }

    @Test
    void groupUsesHeadNameAndConnectsEveryTail() {
        ConditionNode condition = factory.condition("if a");
        Node left = factory.operation("x()");
        Node right = factory.operation("y()");
        condition.connectYes(left);
        condition.connectNo(right);

        NodesGroup group = new NodesGroup(factory.nextId(), condition);
        group.extendTails(List.of(left, right));
        Node next = factory.operation("z()");
        group.connect(next);

        assertThat(group.getName()).isEqualTo("cond0");
        assertThat(group.entry()).isSameAs(condition);
        assertThat(group.renderDefinition()).isEmpty();
        assertThat(left.renderConnections()).containsExactly("op1->op4");
        assertThat(right.renderConnections()).containsExactly("op2->op4");
    }

    @Test
    void terminalGroupIgnoresSuccessor() {
        Node output = factory.output("x");
        Node end = factory.end("f");
        output.connect(end);
        NodesGroup group = new NodesGroup(factory.nextId(), output, true);
        group.appendTail(end);

        group.connect(factory.operation("after"));

        assertThat(end.getConnections()).isEmpty();
    }

    @Test
    void connectionToGroupRendersAsConnectionToItsHead() {
        Node before = factory.operation("before");
        Node head = factory.subroutine("call()");
        NodesGroup group = new NodesGroup(factory.nextId(), head);
        before.connect(group);

        assertThat(before.renderConnections()).containsExactly("op0->sub1");
    }

    @Test
    void mergedNodeKeepsIdentityOfReplacedNode() {
        ConditionNode condition = factory.condition("if a == 1");
        Node merged = factory.merge(condition, "print(a) if a == 1");

        assertThat(merged.getId()).isEqualTo(condition.getId());
        assertThat(merged.renderDefinition()).isEqualTo("cond0=>operation: print(a) if a == 1");
    }
}
