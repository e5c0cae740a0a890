package com.arbiter.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects coarse code patterns in source text.
 * <p>
 * The same vocabulary is used for the patterns an action exhibits and the
 * patterns already present in the workspace, so the two can be compared for
 * consistency. Detection is heuristic and language-agnostic: it recognizes
 * Python-, Java- and JavaScript-style constructs.
 */
public final class CodePatterns {

    public static final String TYPE_ANNOTATIONS = "type_annotations";
    public static final String DOC_COMMENTS = "doc_comments";
    public static final String ERROR_HANDLING = "error_handling";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTIONAL_STYLE = "functional_style";
    public static final String ASYNC = "async";
    public static final String DATA_CLASS = "data_class";
    public static final String LOGGING = "logging";

    /** Return-type arrows, annotated parameters, or Java-style typed method headers. */
    private static final Pattern TYPE_ANNOTATION_PATTERN = Pattern.compile(
            "->|:\\s*(int|str|float|bool|bytes|list|dict|List|Dict|Optional|Any|number|string|boolean)\\b"
                    + "|\\b(public|private|protected)\\s+[\\w<>\\[\\], ?]+\\s+\\w+\\s*\\(");

    /** Python docstrings or Javadoc/JSDoc blocks. */
    private static final Pattern DOC_COMMENT_PATTERN = Pattern.compile("\"\"\"|'''|/\\*\\*");

    private static final Pattern ERROR_HANDLING_PATTERN = Pattern.compile(
            "\\b(try|except|catch|raise|throw|throws)\\b");

    private static final Pattern CLASS_PATTERN = Pattern.compile("\\bclass\\s+\\w+");

    private static final Pattern FUNCTION_PATTERN = Pattern.compile("\\b(def|function|fn)\\s+\\w+|=>|\\blambda\\b");

    private static final Pattern ASYNC_PATTERN = Pattern.compile("\\basync\\b|\\bawait\\b|CompletableFuture");

    private static final Pattern DATA_CLASS_PATTERN = Pattern.compile("@dataclass|\\brecord\\s+\\w+\\s*\\(");

    private static final Pattern LOGGING_PATTERN = Pattern.compile(
            "\\blog(ger)?\\.(debug|info|warn|warning|error)\\s*\\(|\\blogging\\.");

    private CodePatterns() {} // utility class

    /**
     * Returns the pattern tags found in the given source text, in a fixed order.
     *
     * @param code source text, may be null or blank
     * @return detected pattern tags, empty when there is no code
     */
    public static List<String> detect(String code) {
        if (code == null || code.isBlank()) {
            return List.of();
        }
        var found = new ArrayList<String>();
        if (hasTypeAnnotations(code)) found.add(TYPE_ANNOTATIONS);
        if (hasDocComments(code)) found.add(DOC_COMMENTS);
        if (hasErrorHandling(code)) found.add(ERROR_HANDLING);
        if (CLASS_PATTERN.matcher(code).find()) found.add(CLASS_DEFINITION);
        if (FUNCTION_PATTERN.matcher(code).find()) found.add(FUNCTIONAL_STYLE);
        if (ASYNC_PATTERN.matcher(code).find()) found.add(ASYNC);
        if (DATA_CLASS_PATTERN.matcher(code).find()) found.add(DATA_CLASS);
        if (LOGGING_PATTERN.matcher(code).find()) found.add(LOGGING);
        return List.copyOf(found);
    }

    public static boolean hasTypeAnnotations(String code) {
        return code != null && TYPE_ANNOTATION_PATTERN.matcher(code).find();
    }

    public static boolean hasDocComments(String code) {
        return code != null && DOC_COMMENT_PATTERN.matcher(code).find();
    }

    public static boolean hasErrorHandling(String code) {
        return code != null && ERROR_HANDLING_PATTERN.matcher(code).find();
    }

    /** Number of class definitions in the text. */
    public static int countClasses(String code) {
        if (code == null) return 0;
        var matcher = CLASS_PATTERN.matcher(code);
        int count = 0;
        while (matcher.find()) count++;
        return count;
    }
}
