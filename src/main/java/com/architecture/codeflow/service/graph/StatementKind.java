package com.architecture.codeflow.service.graph;

import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtBreak;
import spoon.reflect.code.CtConstructorCall;
import spoon.reflect.code.CtContinue;
import spoon.reflect.code.CtDo;
import spoon.reflect.code.CtFor;
import spoon.reflect.code.CtForEach;
import spoon.reflect.code.CtIf;
import spoon.reflect.code.CtInvocation;
import spoon.reflect.code.CtReturn;
import spoon.reflect.code.CtSwitch;
import spoon.reflect.code.CtSynchronized;
import spoon.reflect.code.CtThrow;
import spoon.reflect.code.CtTry;
import spoon.reflect.code.CtWhile;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtMethod;

/**
 * The statement kinds the flowchart builder tells apart. Everything without a
 * dedicated kind is an {@link #OPERATION}.
 */
public enum StatementKind {
    FUNCTION_DEFINITION,
    CONDITIONAL,
    LOOP,
    SWITCH,
    RETURN,
    JUMP,
    CALL,
    // Inlined into the surrounding sequence, never dispatched
    BLOCK,
    OPERATION;

    public static StatementKind of(CtElement element) {
        if (element instanceof CtMethod || element instanceof CtConstructor) {
            return FUNCTION_DEFINITION;
        }
        if (element instanceof CtIf) {
            return CONDITIONAL;
        }
        if (element instanceof CtWhile || element instanceof CtFor
                || element instanceof CtForEach || element instanceof CtDo) {
            return LOOP;
        }
        if (element instanceof CtSwitch) {
            return SWITCH;
        }
        if (element instanceof CtReturn) {
            return RETURN;
        }
        if (element instanceof CtBreak || element instanceof CtContinue || element instanceof CtThrow) {
            return JUMP;
        }
        if (element instanceof CtInvocation || element instanceof CtConstructorCall) {
            return CALL;
        }
        if (element instanceof CtBlock || element instanceof CtSynchronized || element instanceof CtTry) {
            return BLOCK;
        }
        return OPERATION;
    }
}
