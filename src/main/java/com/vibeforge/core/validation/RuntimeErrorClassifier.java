package com.vibeforge.core.validation;

import java.util.regex.Pattern;

/**
 * Decides whether an issue string looks like an error the JS engine produced.
 */
public final class RuntimeErrorClassifier {

    private static final Pattern SYNTAX    = Pattern.compile("\\bSyntaxError\\b|Unexpected (?:token|end of input)");
    private static final Pattern REFERENCE = Pattern.compile("\\bReferenceError\\b|is not defined");
    private static final Pattern TYPE      = Pattern.compile(
            "\\bTypeError\\b|is not a function|Cannot read propert(?:y|ies) of|is not iterable");
    private static final Pattern RANGE     = Pattern.compile("\\bRangeError\\b|Maximum call stack");
    private static final Pattern MODULE    = Pattern.compile(
            "Failed to (?:fetch dynamically imported module|resolve module)|does not provide an export named");
    private static final Pattern GENERIC   = Pattern.compile(
            "^(?:Uncaught\\s+)?(?:[A-Z][A-Za-z]*)?Error:|\\bat line \\d+|\\bUncaught\\b");

    private RuntimeErrorClassifier() {}

    public static RuntimeErrorType classify(String message) {
        if (message == null || message.isBlank()) return RuntimeErrorType.NONE;
        String m = message.trim();
        if (MODULE.matcher(m).find())    return RuntimeErrorType.MODULE_ERROR;
        if (SYNTAX.matcher(m).find())    return RuntimeErrorType.SYNTAX_ERROR;
        if (REFERENCE.matcher(m).find()) return RuntimeErrorType.REFERENCE_ERROR;
        if (TYPE.matcher(m).find())      return RuntimeErrorType.TYPE_ERROR;
        if (RANGE.matcher(m).find())     return RuntimeErrorType.RANGE_ERROR;
        if (GENERIC.matcher(m).find())   return RuntimeErrorType.GENERIC_ERROR;
        return RuntimeErrorType.NONE;
    }

    public static boolean isRuntimeShaped(String message) {
        return classify(message) != RuntimeErrorType.NONE;
    }
}
