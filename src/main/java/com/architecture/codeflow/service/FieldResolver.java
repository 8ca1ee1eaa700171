package com.architecture.codeflow.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtStatement;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtField;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtNamedElement;
import spoon.reflect.declaration.CtType;
import spoon.reflect.declaration.CtTypeMember;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a dotted field path ({@code Outer.Inner.method}) to a declaration and
 * lists the body a declaration contributes to a flowchart.
 *
 * Types contain nested types, methods and constructors (named after their type).
 * Methods contain the local types declared directly in their body. The first
 * declaration with a matching simple name wins.
 */
@Component
@Slf4j
public class FieldResolver {

    public Optional<CtNamedElement> resolve(ParsedSource source, String field) {
        if (field == null || field.isBlank()) {
            return Optional.empty();
        }

        List<? extends CtNamedElement> candidates = source.getRootDeclarations();
        CtNamedElement current = null;

        for (String segment : field.split("\\.", -1)) {
            if (segment.isBlank()) {
                log.warn("Field path '{}' has an empty segment", field);
                return Optional.empty();
            }
            current = candidates.stream()
                    .filter(candidate -> segment.equals(nameOf(candidate)))
                    .findFirst()
                    .orElse(null);
            if (current == null) {
                log.warn("Field path '{}' not found: no declaration named '{}'", field, segment);
                return Optional.empty();
            }
            candidates = childrenOf(current);
        }

        return Optional.ofNullable(current);
    }

    /**
     * Members of a type, or statements of a method/constructor body. Other
     * declarations have no body.
     */
    public List<CtElement> bodyOf(CtElement declaration) {
        List<CtElement> body = new ArrayList<>();
        if (declaration instanceof CtType) {
            for (CtTypeMember member : ((CtType<?>) declaration).getTypeMembers()) {
                if (member.isImplicit()) {
                    continue;
                }
                if (member instanceof CtMethod || member instanceof CtConstructor
                        || member instanceof CtField || member instanceof CtType) {
                    body.add(member);
                }
            }
        } else if (declaration instanceof CtExecutable) {
            body.addAll(statementsOf((CtExecutable<?>) declaration));
        }
        return body;
    }

    private List<CtNamedElement> childrenOf(CtNamedElement declaration) {
        List<CtNamedElement> children = new ArrayList<>();
        if (declaration instanceof CtType) {
            for (CtTypeMember member : ((CtType<?>) declaration).getTypeMembers()) {
                if (!member.isImplicit() && (member instanceof CtType
                        || member instanceof CtMethod || member instanceof CtConstructor)) {
                    children.add((CtNamedElement) member);
                }
            }
        } else if (declaration instanceof CtExecutable) {
            for (CtStatement statement : statementsOf((CtExecutable<?>) declaration)) {
                if (statement instanceof CtType) {
                    children.add((CtType<?>) statement);
                }
            }
        }
        return children;
    }

    private static List<CtStatement> statementsOf(CtExecutable<?> executable) {
        CtBlock<?> body = executable.getBody();
        return body == null ? List.of() : body.getStatements();
    }

    static String nameOf(CtNamedElement declaration) {
        if (declaration instanceof CtConstructor) {
            CtType<?> owner = ((CtConstructor<?>) declaration).getDeclaringType();
            return owner == null ? declaration.getSimpleName() : owner.getSimpleName();
        }
        return declaration.getSimpleName();
    }
}
