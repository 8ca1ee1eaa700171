package com.architecture.codeflow.service;

import lombok.Builder;
import lombok.Getter;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtStatement;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtType;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of parsing submitted source: either a compilation unit with its top-level
 * types, or a statement snippet wrapped in a synthetic method.
 */
@Getter
@Builder
public class ParsedSource {

    // Text Spoon actually parsed; source positions point into it
    private final String code;
    private final boolean snippet;
    private final List<CtType<?>> types;
    private final CtMethod<?> snippetMethod;

    /**
     * Statements (snippet) or top-level types (compilation unit) of the whole source.
     */
    public List<CtElement> getRootBody() {
        if (!snippet) {
            return new ArrayList<>(types);
        }
        return new ArrayList<>(snippetStatements());
    }

    /**
     * Named declarations a field path starts from.
     */
    public List<CtType<?>> getRootDeclarations() {
        if (!snippet) {
            return types;
        }
        List<CtType<?>> localTypes = new ArrayList<>();
        for (CtStatement statement : snippetStatements()) {
            if (statement instanceof CtType) {
                localTypes.add((CtType<?>) statement);
            }
        }
        return localTypes;
    }

    private List<CtStatement> snippetStatements() {
        if (snippetMethod == null) {
            return List.of();
        }
        CtBlock<?> body = snippetMethod.getBody();
        return body == null ? List.of() : body.getStatements();
    }
}
