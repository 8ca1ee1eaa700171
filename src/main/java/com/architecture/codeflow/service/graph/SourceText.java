package com.architecture.codeflow.service.graph;

import spoon.reflect.cu.SourcePosition;
import spoon.reflect.declaration.CtAnnotationType;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtEnum;
import spoon.reflect.declaration.CtInterface;
import spoon.reflect.declaration.CtRecord;
import spoon.reflect.declaration.CtType;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reconstructs node labels from the source characters an element was parsed from.
 * Labels are single-line: the flowchart DSL is line oriented.
 */
public class SourceText {

    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\R\\s*");

    private final String code;

    public SourceText(String code) {
        this.code = code == null ? "" : code;
    }

    /**
     * Source text of {@code element}, or Spoon's printed form when it has no position.
     */
    public String of(CtElement element) {
        if (element == null) {
            return "";
        }
        String text = original(element);
        if (text == null) {
            text = element.toString();
        }
        return normalize(text);
    }

    /**
     * Like {@link #of(CtElement)}, except type declarations are shown by their header.
     */
    public String labelOf(CtElement element) {
        if (element instanceof CtType) {
            CtType<?> type = (CtType<?>) element;
            return keyword(type) + " " + type.getSimpleName();
        }
        return of(element);
    }

    /**
     * One label for several elements written as a single declaration, such as the
     * declarators of {@code int x = 1, y = 2;}. Spoon gives each declarator its own
     * range, so the label spans from the first start to the furthest end.
     */
    public String ofSpan(List<? extends CtElement> elements) {
        int start = Integer.MAX_VALUE;
        int end = -1;
        for (CtElement element : elements) {
            SourcePosition position = element.getPosition();
            if (position == null || !position.isValidPosition()) {
                return elements.stream().map(this::of).collect(Collectors.joining(", "));
            }
            start = Math.min(start, position.getSourceStart());
            end = Math.max(end, position.getSourceEnd());
        }
        if (start < 0 || end < start || end >= code.length()) {
            return elements.stream().map(this::of).collect(Collectors.joining(", "));
        }
        return normalize(code.substring(start, end + 1));
    }

    /**
     * The first parenthesized group of {@code element}'s source, parentheses
     * included, e.g. the header of a {@code for} statement. {@code null} when the
     * element has no position or no balanced group.
     */
    public String headerOf(CtElement element) {
        String text = original(element);
        if (text == null) {
            return null;
        }
        int open = text.indexOf('(');
        if (open < 0) {
            return null;
        }
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return "(" + collapse(text.substring(open + 1, i)) + ")";
            }
        }
        return null;
    }

    static String normalize(String text) {
        String label = collapse(text);
        while (label.endsWith(";") || label.endsWith(",")) {
            label = label.substring(0, label.length() - 1).stripTrailing();
        }
        return label;
    }

    private static String collapse(String text) {
        return LINE_BREAK.matcher(text.strip()).replaceAll(" ");
    }

    private String original(CtElement element) {
        SourcePosition position = element.getPosition();
        if (position == null || !position.isValidPosition()) {
            return null;
        }
        int start = position.getSourceStart();
        int end = position.getSourceEnd();
        if (start < 0 || end < start || end >= code.length()) {
            return null;
        }
        return code.substring(start, end + 1);
    }

    private static String keyword(CtType<?> type) {
        if (type instanceof CtAnnotationType) {
            return "@interface";
        }
        if (type instanceof CtInterface) {
            return "interface";
        }
        if (type instanceof CtEnum) {
            return "enum";
        }
        if (type instanceof CtRecord) {
            return "record";
        }
        return "class";
    }
}
