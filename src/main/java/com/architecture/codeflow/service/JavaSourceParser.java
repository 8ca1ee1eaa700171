package com.architecture.codeflow.service;

import com.architecture.codeflow.exception.SourceParseException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jdt.core.compiler.CategorizedProblem;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtType;
import spoon.support.compiler.VirtualFile;
import spoon.support.compiler.jdt.JDTBasedSpoonCompiler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Spoon front end for submitted source text.
 *
 * Text that starts with a package, an import or a type declaration is parsed as a
 * compilation unit. Anything else is treated as a list of statements and wrapped in
 * a synthetic method of a synthetic class before parsing. Text that starts with a
 * type declaration but only parses as statements (a local class followed by more
 * code) falls back to a snippet. Syntax errors raise {@link SourceParseException}.
 */
@Component
@Slf4j
public class JavaSourceParser {

    public static final String SNIPPET_TYPE = "CodeflowSnippet";
    public static final String SNIPPET_METHOD = "snippet";

    private static final String DEFAULT_FILE_NAME = "CodeflowSource";
    private static final int SNIPPET_HEADER_LINES = 2;

    private static final Pattern LEADING_TRIVIA = Pattern.compile(
            "\\A(?:\\s+|//[^\\n]*|/\\*.*?\\*/)*", Pattern.DOTALL);

    private static final Pattern TYPE_DECLARATION_START = Pattern.compile(
            "(?:@[\\w.]+(?:\\s*\\([^)]*\\))?\\s+)*"
                    + "(?:(?:public|protected|private|abstract|static|final|sealed|non-sealed|strictfp)\\s+)*"
                    + "(?:class|interface|enum|record|@interface)\\s+\\w+");

    private static final Pattern PUBLIC_TYPE_NAME = Pattern.compile(
            "\\bpublic\\s+(?:(?:abstract|final|sealed|non-sealed|strictfp|static)\\s+)*"
                    + "(?:class|interface|enum|record|@interface)\\s+(\\w+)");

    private final int complianceLevel;

    public JavaSourceParser(@Value("${flowchart.parser.compliance-level:17}") int complianceLevel) {
        this.complianceLevel = complianceLevel;
    }

    public ParsedSource parse(String code) {
        String source = code == null ? "" : code;
        if (!isCompilationUnit(source)) {
            return parseSnippet(source);
        }

        try {
            return parseCompilationUnit(source);
        } catch (SourceParseException e) {
            if (startsWithPackageOrImport(source)) {
                throw e;
            }
            // e.g. a local class followed by statements
            log.debug("Source is not a valid compilation unit ({}), retrying as statement snippet", e.getMessage());
            try {
                return parseSnippet(source);
            } catch (SourceParseException snippetError) {
                log.debug("Source is not a valid statement snippet either: {}", snippetError.getMessage());
                throw e;
            }
        }
    }

    private ParsedSource parseCompilationUnit(String source) {
        String fileName = publicTypeName(source);
        log.debug("Parsing source as compilation unit {}.java", fileName);
        CtModel model = buildModel(source, fileName, 0);
        List<CtType<?>> types = model.getAllTypes().stream()
                .sorted(Comparator.comparingInt(JavaSourceParser::sourceStart))
                .collect(Collectors.toList());
        log.info("Parsed compilation unit with {} top-level type(s)", types.size());
        return ParsedSource.builder()
                .code(source)
                .snippet(false)
                .types(types)
                .build();
    }

    private ParsedSource parseSnippet(String source) {
        String wrapped = wrapSnippet(source);
        log.debug("Parsing source as statement snippet");
        CtModel model = buildModel(wrapped, SNIPPET_TYPE, SNIPPET_HEADER_LINES);
        CtMethod<?> snippetMethod = model.getAllTypes().stream()
                .filter(type -> SNIPPET_TYPE.equals(type.getSimpleName()))
                .flatMap(type -> type.getMethodsByName(SNIPPET_METHOD).stream())
                .findFirst()
                .orElse(null);
        if (snippetMethod == null) {
            log.warn("Snippet method not found in parsed model, treating source as empty");
        }
        return ParsedSource.builder()
                .code(wrapped)
                .snippet(true)
                .types(List.copyOf(model.getAllTypes()))
                .snippetMethod(snippetMethod)
                .build();
    }

    /**
     * Whether the synthetic snippet wrapper declared {@code method}.
     */
    public static boolean isSnippetMethod(CtMethod<?> method) {
        return method != null
                && SNIPPET_METHOD.equals(method.getSimpleName())
                && method.getDeclaringType() != null
                && SNIPPET_TYPE.equals(method.getDeclaringType().getSimpleName());
    }

    boolean isCompilationUnit(String source) {
        if (startsWithPackageOrImport(source)) {
            return true;
        }
        return TYPE_DECLARATION_START.matcher(stripLeadingTrivia(source)).lookingAt();
    }

    /**
     * Build the Spoon model of one virtual file. No-classpath mode recovers from
     * syntax errors instead of failing, so those are collected from the compiler and
     * rejected here.
     *
     * @param lineOffset lines added in front of the submitted text, subtracted in messages
     */
    private CtModel buildModel(String source, String fileName, int lineOffset) {
        Launcher launcher = new Launcher();
        launcher.addInputResource(new VirtualFile(source, fileName + ".java"));
        launcher.getEnvironment().setNoClasspath(true);
        launcher.getEnvironment().setComplianceLevel(complianceLevel);
        launcher.getEnvironment().setIgnoreDuplicateDeclarations(true);
        launcher.getEnvironment().setCommentEnabled(false);

        CtModel model;
        try {
            model = launcher.buildModel();
        } catch (RuntimeException e) {
            log.warn("Spoon failed to build model for {}.java: {}", fileName, e.getMessage());
            throw new SourceParseException("Failed to parse source: " + e.getMessage(), e);
        }

        List<String> syntaxErrors = syntaxErrors(launcher, lineOffset);
        if (!syntaxErrors.isEmpty()) {
            log.debug("Syntax errors in {}.java: {}", fileName, syntaxErrors);
            throw new SourceParseException("Syntax error in source: " + String.join("; ", syntaxErrors));
        }
        return model;
    }

    private static List<String> syntaxErrors(Launcher launcher, int lineOffset) {
        if (!(launcher.getModelBuilder() instanceof JDTBasedSpoonCompiler)) {
            return List.of();
        }
        List<String> errors = new ArrayList<>();
        for (CategorizedProblem problem : ((JDTBasedSpoonCompiler) launcher.getModelBuilder()).getProblems()) {
            if (problem.isError() && problem.getCategoryID() == CategorizedProblem.CAT_SYNTAX) {
                errors.add("line " + Math.max(1, problem.getSourceLineNumber() - lineOffset) + ": " + problem.getMessage());
            }
        }
        return errors;
    }

    private static boolean startsWithPackageOrImport(String source) {
        String code = stripLeadingTrivia(source);
        return code.startsWith("package ") || code.startsWith("import ");
    }

    private static String stripLeadingTrivia(String source) {
        Matcher trivia = LEADING_TRIVIA.matcher(source);
        return trivia.lookingAt() ? source.substring(trivia.end()) : source;
    }

    private static String wrapSnippet(String code) {
        return "class " + SNIPPET_TYPE + " {\n"
                + "    void " + SNIPPET_METHOD + "() {\n"
                + code + "\n"
                + "    }\n"
                + "}\n";
    }

    private static String publicTypeName(String source) {
        Matcher matcher = PUBLIC_TYPE_NAME.matcher(source);
        return matcher.find() ? matcher.group(1) : DEFAULT_FILE_NAME;
    }

    private static int sourceStart(CtType<?> type) {
        SourcePosition position = type.getPosition();
        return position != null && position.isValidPosition() ? position.getSourceStart() : Integer.MAX_VALUE;
    }
}
