package com.axiom.gateway.domain.certificate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reduces source code to a language-agnostic token stream so that the AST hash survives
 * formatting and comment changes but not changes to names, literals or structure.
 *
 * <p>Line comments ({@code //}, {@code #}), block comments and whitespace inside a line are
 * dropped. Remaining tokens are emitted as {@code ID:}, {@code NUM:}, {@code STR:} or
 * {@code SYM:} entries. Each logical line ends with {@code NL}; lines inside open parentheses
 * or brackets continue the current logical line. A change in leading indentation between
 * logical lines emits {@code INDENT} or one {@code DEDENT} per closed level.
 */
public final class StructuralCanonicalizer {

    static final String NL = "NL";
    static final String INDENT = "INDENT";
    static final String DEDENT = "DEDENT";

    private static final int TAB_WIDTH = 4;

    private StructuralCanonicalizer() {
    }

    /** Canonical form of {@code code}: one token per line. */
    public static String canonicalize(String code) {
        return String.join("\n", tokenize(code));
    }

    static List<String> tokenize(String code) {
        return new Scanner(code == null ? "" : code).scan();
    }

    private static final class Scanner {

        private final String src;
        private final List<String> out = new ArrayList<>();
        private final Deque<Integer> indents = new ArrayDeque<>();
        private int pos;
        private int depth;
        private Integer pendingIndent;
        private boolean lineHasTokens;

        Scanner(String src) {
            this.src = src;
            this.indents.push(0);
        }

        List<String> scan() {
            pendingIndent = measureIndent();
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '\n') {
                    pos++;
                    endOfLine();
                } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                    pos++;
                } else if (c == '#' || startsWith("//")) {
                    skipToEndOfLine();
                } else if (startsWith("/*")) {
                    skipBlockComment();
                } else if (c == '"' || c == '\'' || c == '`') {
                    emit("STR:" + readString(c));
                } else if (Character.isJavaIdentifierStart(c)) {
                    emit("ID:" + readWhile(true));
                } else if (Character.isDigit(c)) {
                    emit("NUM:" + readWhile(false));
                } else {
                    pos++;
                    if (c == '(' || c == '[') {
                        depth++;
                    } else if ((c == ')' || c == ']') && depth > 0) {
                        depth--;
                    }
                    emit("SYM:" + c);
                }
            }
            if (lineHasTokens) {
                out.add(NL);
            }
            while (indents.size() > 1) {
                indents.pop();
                out.add(DEDENT);
            }
            return out;
        }

        private void endOfLine() {
            if (depth > 0) {
                return;
            }
            if (lineHasTokens) {
                out.add(NL);
                lineHasTokens = false;
            }
            pendingIndent = measureIndent();
        }

        private int measureIndent() {
            int width = 0;
            int i = pos;
            while (i < src.length() && (src.charAt(i) == ' ' || src.charAt(i) == '\t')) {
                width += src.charAt(i) == '\t' ? TAB_WIDTH : 1;
                i++;
            }
            pos = i;
            return width;
        }

        private void emit(String token) {
            if (!lineHasTokens && pendingIndent != null) {
                applyIndent(pendingIndent);
                pendingIndent = null;
            }
            lineHasTokens = true;
            out.add(token);
        }

        private void applyIndent(int width) {
            if (width > indents.peek()) {
                indents.push(width);
                out.add(INDENT);
                return;
            }
            while (width < indents.peek()) {
                indents.pop();
                out.add(DEDENT);
            }
            if (width > indents.peek()) {
                indents.push(width);
                out.add(INDENT);
            }
        }

        private boolean startsWith(String prefix) {
            return src.startsWith(prefix, pos);
        }

        private void skipToEndOfLine() {
            while (pos < src.length() && src.charAt(pos) != '\n') {
                pos++;
            }
        }

        private void skipBlockComment() {
            int end = src.indexOf("*/", pos + 2);
            pos = end < 0 ? src.length() : end + 2;
        }

        private String readString(char quote) {
            String triple = String.valueOf(quote).repeat(3);
            String closing = startsWith(triple) ? triple : String.valueOf(quote);
            int start = pos;
            pos += closing.length();
            while (pos < src.length()) {
                if (src.charAt(pos) == '\\') {
                    pos += 2;
                } else if (startsWith(closing)) {
                    pos += closing.length();
                    return src.substring(start, pos);
                } else {
                    pos++;
                }
            }
            pos = src.length();
            return src.substring(start);
        }

        private String readWhile(boolean identifier) {
            int start = pos;
            while (pos < src.length()) {
                char c = src.charAt(pos);
                boolean part = identifier
                        ? Character.isJavaIdentifierPart(c)
                        : Character.isLetterOrDigit(c) || c == '.' || c == '_';
                if (!part) {
                    break;
                }
                pos++;
            }
            return src.substring(start, pos);
        }
    }
}
