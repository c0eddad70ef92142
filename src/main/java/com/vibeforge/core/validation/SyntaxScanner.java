package com.vibeforge.core.validation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.Set;

/**
 * SyntaxScanner: lexical load-time check for JavaScript modules.
 *
 * Catches the gross failures a browser reports before anything runs:
 * unbalanced brackets, unterminated strings, template literals, comments and
 * regex literals, and leftover Markdown fences. It is not a parser; the
 * regex-vs-division decision uses the previous significant character, or the
 * previous word when that word is a keyword an expression may follow.
 *
 * Reports the first fault only, in the engine's message style
 * ("SyntaxError: ... (line N)").
 */
final class SyntaxScanner {

    private static final String REGEX_PRECEDERS = "(,=:[!&|?{};+-*%<>~^";

    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "return", "typeof", "instanceof", "in", "of", "new", "delete", "void",
            "throw", "case", "do", "else", "yield", "await");

    private final String src;
    private int  pos  = 0;
    private int  line = 1;
    private char lastSignificant = 0;
    private String lastWord = null;

    private SyntaxScanner(String src) {
        this.src = src;
    }

    static Optional<String> firstFault(String code) {
        if (code == null || code.isBlank()) {
            return Optional.of("SyntaxError: Empty module (line 1)");
        }
        int fence = code.indexOf("```");
        if (fence >= 0) {
            return Optional.of("SyntaxError: Unexpected token '`' - leftover Markdown fence (line "
                    + lineOf(code, fence) + ")");
        }
        try {
            new SyntaxScanner(code).scanCode(false);
            return Optional.empty();
        } catch (Fault f) {
            return Optional.of(f.getMessage());
        }
    }

    // =========================================================================
    // Modes
    // =========================================================================

    /**
     * Scan code until end of input, or, when {@code insideTemplate}, until the
     * '}' that closes the current ${...} substitution.
     */
    private void scanCode(boolean insideTemplate) {
        Deque<int[]> open = new ArrayDeque<>(); // {char, line}

        while (pos < src.length()) {
            char c    = src.charAt(pos);
            char next = pos + 1 < src.length() ? src.charAt(pos + 1) : 0;

            if (c == '\n') { line++; pos++; continue; }
            if (Character.isWhitespace(c)) { pos++; continue; }

            if (c == '/' && next == '/') { skipLineComment(); continue; }
            if (c == '/' && next == '*') { skipBlockComment(); continue; }

            if (c == '"' || c == '\'') { scanString(c); markOperand(); continue; }
            if (c == '`')              { pos++; scanTemplate(); markOperand(); continue; }

            if (c == '/' && regexAllowed()) {
                scanRegex();
                markOperand();
                continue;
            }

            if (isWordChar(c)) {
                int start = pos;
                while (pos < src.length() && isWordChar(src.charAt(pos))) pos++;
                lastSignificant = 'a';
                lastWord = src.substring(start, pos);
                continue;
            }

            if (c == '(' || c == '[' || c == '{') {
                open.push(new int[]{c, line});
            } else if (c == ')' || c == ']' || c == '}') {
                if (open.isEmpty()) {
                    if (insideTemplate && c == '}') {
                        pos++;
                        return;
                    }
                    throw new Fault("SyntaxError: Unexpected token '" + c + "' (line " + line + ")");
                }
                int[] top = open.pop();
                if (!matches((char) top[0], c)) {
                    throw new Fault("SyntaxError: Unexpected token '" + c + "' (line " + line
                            + "), expected closing for '" + (char) top[0] + "' opened at line " + top[1]);
                }
            }

            lastSignificant = c;
            lastWord = null;
            pos++;
        }

        if (insideTemplate) {
            throw new Fault("SyntaxError: Unterminated template literal (line " + line + ")");
        }
        if (!open.isEmpty()) {
            int[] top = open.pop();
            throw new Fault("SyntaxError: Unexpected end of input - '" + (char) top[0]
                    + "' opened at line " + top[1] + " is never closed");
        }
    }

    private void scanTemplate() {
        int startLine = line;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\') { pos += 2; continue; }
            if (c == '\n') { line++; pos++; continue; }
            if (c == '`')  { pos++; return; }
            if (c == '$' && pos + 1 < src.length() && src.charAt(pos + 1) == '{') {
                pos += 2;
                lastSignificant = '{';
                lastWord = null;
                scanCode(true);
                continue;
            }
            pos++;
        }
        throw new Fault("SyntaxError: Unterminated template literal (line " + startLine + ")");
    }

    private void scanString(char quote) {
        int startLine = line;
        pos++;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') line++;
                pos += 2;
                continue;
            }
            if (c == '\n') break;
            if (c == quote) { pos++; return; }
            pos++;
        }
        throw new Fault("SyntaxError: Unterminated string constant (line " + startLine + ")");
    }

    private void scanRegex() {
        int startLine = line;
        boolean inClass = false;
        pos++;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\') { pos += 2; continue; }
            if (c == '\n') break;
            if (c == '[') inClass = true;
            else if (c == ']') inClass = false;
            else if (c == '/' && !inClass) { pos++; return; }
            pos++;
        }
        throw new Fault("SyntaxError: Invalid regular expression: missing / (line " + startLine + ")");
    }

    private void skipLineComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') pos++;
    }

    private void skipBlockComment() {
        int startLine = line;
        int end = src.indexOf("*/", pos + 2);
        if (end < 0) {
            throw new Fault("SyntaxError: Unterminated comment (line " + startLine + ")");
        }
        for (int i = pos; i < end; i++) {
            if (src.charAt(i) == '\n') line++;
        }
        pos = end + 2;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private boolean regexAllowed() {
        if (lastSignificant == 0 || REGEX_PRECEDERS.indexOf(lastSignificant) >= 0) return true;
        return lastWord != null && EXPRESSION_KEYWORDS.contains(lastWord);
    }

    private void markOperand() {
        lastSignificant = 'a';
        lastWord = null;
    }

    private static boolean matches(char open, char close) {
        return (open == '(' && close == ')')
            || (open == '[' && close == ']')
            || (open == '{' && close == '}');
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static int lineOf(String text, int index) {
        int n = 1;
        for (int i = 0; i < index; i++) if (text.charAt(i) == '\n') n++;
        return n;
    }

    private static final class Fault extends RuntimeException {
        Fault(String message) { super(message, null, false, false); }
    }
}
