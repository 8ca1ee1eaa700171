package com.architecture.codeflow.service.graph;

import com.architecture.codeflow.dto.FlowchartOptions;
import org.junit.jupiter.api.Test;

import static com.architecture.codeflow.service.graph.FlowchartFixture.SIMPLIFIED;
import static com.architecture.codeflow.service.graph.FlowchartFixture.UNSIMPLIFIED;
import static com.architecture.codeflow.service.graph.FlowchartFixture.render;
import static org.assertj.core.api.Assertions.assertThat;

class StatementParserTest {

    @Test
    void chainsStatementsInOrder() {
        String text = render("x();\nint c = 1;\nprint(c);", SIMPLIFIED);

        assertThat(text).isEqualTo("sub0=>subroutine: x()\n"
                + "op1=>operation: int c = 1\n"
                + "sub2=>subroutine: print(c)\n"
                + "\n"
                + "sub0->op1\n"
                + "op1->sub2");
    }

    @Test
    void bothBranchesOfIfElseReachTheSuccessor() {
        String text = render("if (a > 0) {\n    x();\n} else {\n    y();\n}\nz();", SIMPLIFIED);

        assertThat(text).isEqualTo("cond0=>condition: if a > 0\n"
                + "sub2=>subroutine: x()\n"
                + "sub4=>subroutine: z()\n"
                + "sub3=>subroutine: y()\n"
                + "\n"
                + "cond0(yes)->sub2\n"
                + "cond0(no)->sub3\n"
                + "sub2->sub4\n"
                + "sub3->sub4");
    }

    @Test
    void ifWithoutElseGoesStraightToTheSuccessorOnNo() {
        String text = render("if (a > 0) {\n    x();\n}\nz();", UNSIMPLIFIED);

        assertThat(text).isEqualTo("cond0=>condition: if a > 0\n"
                + "sub2=>subroutine: x()\n"
                + "sub4=>subroutine: z()\n"
                + "\n"
                + "cond0(yes)->sub2\n"
                + "cond0(no)->sub4\n"
                + "sub2->sub4");
    }

    @Test
    void mergesOneLineIfBodyIntoItsCondition() {
        String body = "if (a==1) {\n    print(a);\n}";

        assertThat(render(body, SIMPLIFIED)).isEqualTo("cond0=>operation: print(a) if a==1\n\n");
        assertThat(render(body, UNSIMPLIFIED)).isEqualTo("cond0=>condition: if a==1\n"
                + "sub2=>subroutine: print(a)\n"
                + "\n"
                + "cond0(yes)->sub2");
    }

    @Test
    void simplifiedConditionKeepsItsNameForPredecessors() {
        String text = render("x();\nif (a==1) {\n    print(a);\n}\nz();", SIMPLIFIED);

        assertThat(text).isEqualTo("sub0=>subroutine: x()\n"
                + "cond1=>operation: print(a) if a==1\n"
                + "sub5=>subroutine: z()\n"
                + "\n"
                + "sub0->cond1\n"
                + "cond1->sub5");
    }

    @Test
    void elseIfChainsNestThroughTheNoBranch() {
        String text = render("if (a > 0) {\n    x();\n} else if (a < 0) {\n    y();\n} else {\n    z();\n}", SIMPLIFIED);

        assertThat(text).isEqualTo("cond0=>condition: if a > 0\n"
                + "sub2=>subroutine: x()\n"
                + "cond3=>condition: if a < 0\n"
                + "sub5=>subroutine: y()\n"
                + "sub6=>subroutine: z()\n"
                + "\n"
                + "cond0(yes)->sub2\n"
                + "cond0(no)->cond3\n"
                + "cond3(yes)->sub5\n"
                + "cond3(no)->sub6");
    }

    @Test
    void returnEndsTheMethodAndIsNotContinued() {
        String text = render("if (a > 0) {\n    return;\n}\nx();", SIMPLIFIED);

        assertThat(text).isEqualTo("cond0=>condition: if a > 0\n"
                + "e2=>end: end run\n"
                + "sub5=>subroutine: x()\n"
                + "\n"
                + "cond0(yes)->e2\n"
                + "cond0(no)->sub5");
    }

    @Test
    void throwIsATerminalSubroutine() {
        String text = render("if (a < 0) {\n    throw new IllegalArgumentException(\"a\");\n}\nx();", SIMPLIFIED);

        assertThat(text).isEqualTo("cond0=>condition: if a < 0\n"
                + "sub2=>subroutine: throw new IllegalArgumentException(\"a\")\n"
                + "sub4=>subroutine: x()\n"
                + "\n"
                + "cond0(yes)->sub2\n"
                + "cond0(no)->sub4");
    }

    @Test
    void inlinesTryBodyAndFinallyBlock() {
        String text = render("try {\n    x();\n} catch (RuntimeException e) {\n    y();\n} finally {\n    z();\n}", SIMPLIFIED);

        assertThat(text).isEqualTo("sub0=>subroutine: x()\n"
                + "sub1=>subroutine: z()\n"
                + "\n"
                + "sub0->sub1");
    }

    @Test
    void inlinesNestedAndSynchronizedBlocks() {
        String text = render("{\n    x();\n}\nsynchronized (this) {\n    y();\n}", SIMPLIFIED);

        assertThat(text).isEqualTo("sub0=>subroutine: x()\n"
                + "sub1=>subroutine: y()\n"
                + "\n"
                + "sub0->sub1");
    }

    @Test
    void labelsLocalTypesByTheirHeader() {
        String text = render("class Local {\n    int value;\n}\nx();", SIMPLIFIED);

        assertThat(text).startsWith("op0=>operation: class Local\n");
    }

    @Test
    void collapsesMultiLineStatementsToOneLine() {
        String text = render("int total = a\n        + b;", SIMPLIFIED);

        assertThat(text).isEqualTo("op0=>operation: int total = a + b\n\n");
    }

    @Test
    void drawsMultiDeclaratorDeclarationAsOneStatement() {
        String text = render("int x = 1, y = 2;\nf(x, y);", SIMPLIFIED);

        assertThat(text).isEqualTo("op0=>operation: int x = 1, y = 2\n"
                + "sub1=>subroutine: f(x, y)\n"
                + "\n"
                + "op0->sub1");
    }

    @Test
    void alignsConsecutiveUnsimplifiedConditions() {
        FlowchartOptions options = FlowchartOptions.builder()
                .simplify(false)
                .alignConsecutiveConditions(true)
                .build();

        String text = render("if (a > 0) {\n    x();\n}\nif (b > 0) {\n    y();\n}", options);

        assertThat(text).isEqualTo("cond0(align-next=no)=>condition: if a > 0\n"
                + "sub2=>subroutine: x()\n"
                + "cond4=>condition: if b > 0\n"
                + "sub6=>subroutine: y()\n"
                + "\n"
                + "cond0(yes)->sub2\n"
                + "cond0(no)->cond4\n"
                + "sub2->cond4\n"
                + "cond4(yes)->sub6");
    }

    @Test
    void doesNotAlignSimplifiedConditions() {
        FlowchartOptions options = FlowchartOptions.builder()
                .simplify(true)
                .alignConsecutiveConditions(true)
                .build();

        String text = render("if (a > 0) {\n    x();\n}\nif (b > 0) {\n    y();\n}", options);

        assertThat(text).doesNotContain("align-next");
    }

    @Test
    void emptyBodyRendersNothing() {
        assertThat(render("", SIMPLIFIED)).isEmpty();
    }
}
