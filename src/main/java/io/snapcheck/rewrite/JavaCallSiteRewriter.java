package io.snapcheck.rewrite;

import io.snapcheck.model.Target;

/**
 * Rewrites {@code AutoAssert.that(expr)} and {@code AutoAssert.that(expr).matches("...")} call sites.
 *
 * <p>Only the call chain is replaced; whatever precedes it on the first line (indentation, an
 * assignment) and whatever follows it (the semicolon, a trailing comment) is kept verbatim.
 * Multi-line expectations are written as text blocks indented one continuation step deeper
 * than the call site.
 */
public final class JavaCallSiteRewriter implements CallSiteRewriter {
    static final String ENTRY = "AutoAssert.that(";
    static final String MATCHES = ".matches(";
    private static final String TEXT_BLOCK = "\"\"\"";
    private static final String CONTINUATION_INDENT = "        ";

    @Override
    public CallSite parse(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Empty call site");
        }
        int start = code.indexOf(ENTRY);
        if (start < 0) {
            throw new IllegalArgumentException("No " + ENTRY + "...) call in: " + code.strip());
        }
        int open = start + ENTRY.length() - 1;
        int close = matchingParen(code, open);
        String expression = code.substring(open + 1, close).strip();
        if (expression.isEmpty()) {
            throw new IllegalArgumentException("Empty value expression in: " + code.strip());
        }
        int end = close + 1;
        String expected = null;
        int cursor = skipWhitespace(code, end);
        if (code.startsWith(MATCHES, cursor)) {
            int argStart = skipWhitespace(code, cursor + MATCHES.length());
            Literal literal = readLiteral(code, argStart);
            int after = skipWhitespace(code, literal.end());
            if (after >= code.length() || code.charAt(after) != ')') {
                throw new IllegalArgumentException("Unterminated matches(...) in: " + code.strip());
            }
            expected = literal.value();
            end = after + 1;
        }
        return new CallSite(code.substring(0, start), expression, expected, code.substring(end));
    }

    @Override
    public String rewrite(String code, String pattern, Target target) {
        CallSite site = parse(code);
        String literal = literal(pattern, site.indent() + CONTINUATION_INDENT);
        String chain = switch (target) {
            case AUTO_ASSERT -> ENTRY + site.valueExpression() + ")" + MATCHES + literal + ")";
            case ASSERT -> "assertEquals(" + literal + ", AutoAssert.json(" + site.valueExpression() + "))";
        };
        return site.prefix() + chain + site.suffix();
    }

    static String literal(String pattern, String continuationIndent) {
        if (pattern.indexOf('\n') < 0) {
            return "\"" + escapeString(pattern) + "\"";
        }
        StringBuilder sb = new StringBuilder(pattern.length() + 64);
        sb.append(TEXT_BLOCK).append('\n');
        for (String line : pattern.split("\n", -1)) {
            if (!line.isEmpty()) {
                sb.append(continuationIndent).append(escapeTextBlock(line));
            }
            sb.append('\n');
        }
        sb.append(continuationIndent).append(TEXT_BLOCK);
        return sb.toString();
    }

    private static String escapeString(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            switch (ch) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        sb.append(String.format("\\u%04x", (int) ch));
                    } else {
                        sb.append(ch);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static String escapeTextBlock(String line) {
        return line.replace("\\", "\\\\").replace(TEXT_BLOCK, "\"\"\\\"");
    }

    private static int matchingParen(String code, int open) {
        int depth = 0;
        int i = open;
        while (i < code.length()) {
            char ch = code.charAt(i);
            if (ch == '"') {
                i = skipString(code, i);
                continue;
            }
            if (ch == '\'') {
                i = skipCharLiteral(code, i);
                continue;
            }
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        throw new IllegalArgumentException("Unbalanced parentheses in: " + code.strip());
    }

    /**
     * Returns the index just past the string literal or text block starting at {@code start}.
     */
    private static int skipString(String code, int start) {
        if (code.startsWith(TEXT_BLOCK, start)) {
            int j = start + TEXT_BLOCK.length();
            while (j < code.length()) {
                char ch = code.charAt(j);
                if (ch == '\\') {
                    j += 2;
                } else if (code.startsWith(TEXT_BLOCK, j)) {
                    return j + TEXT_BLOCK.length();
                } else {
                    j++;
                }
            }
            throw new IllegalArgumentException("Unterminated text block");
        }
        int j = start + 1;
        while (j < code.length()) {
            char ch = code.charAt(j);
            if (ch == '\\') {
                j += 2;
            } else if (ch == '"') {
                return j + 1;
            } else if (ch == '\n') {
                break;
            } else {
                j++;
            }
        }
        throw new IllegalArgumentException("Unterminated string literal");
    }

    private static int skipCharLiteral(String code, int start) {
        int j = start + 1;
        while (j < code.length()) {
            char ch = code.charAt(j);
            if (ch == '\\') {
                j += 2;
            } else if (ch == '\'') {
                return j + 1;
            } else {
                j++;
            }
        }
        throw new IllegalArgumentException("Unterminated character literal");
    }

    private static int skipWhitespace(String code, int from) {
        int i = from;
        while (i < code.length() && Character.isWhitespace(code.charAt(i))) {
            i++;
        }
        return i;
    }

    private static Literal readLiteral(String code, int pos) {
        if (code.startsWith(TEXT_BLOCK, pos)) {
            int end = skipString(code, pos);
            String raw = code.substring(pos + TEXT_BLOCK.length(), end - TEXT_BLOCK.length());
            int newline = raw.indexOf('\n');
            if (newline < 0 || !raw.substring(0, newline).isBlank()) {
                throw new IllegalArgumentException("Text block must start on a new line");
            }
            return new Literal(unescape(stripIndent(raw.substring(newline + 1))), end);
        }
        if (pos < code.length() && code.charAt(pos) == '"') {
            int end = skipString(code, pos);
            return new Literal(unescape(code.substring(pos + 1, end - 1)), end);
        }
        throw new IllegalArgumentException("Expected a string literal at: " + code.substring(pos).strip());
    }

    // Same incidental-whitespace rule the compiler applies: the closing delimiter line always counts.
    private static String stripIndent(String body) {
        String[] lines = body.replace("\r\n", "\n").split("\n", -1);
        int min = Integer.MAX_VALUE;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            boolean last = i == lines.length - 1;
            if (line.isBlank() && !last) {
                continue;
            }
            min = Math.min(min, leadingWhitespace(line));
        }
        if (min == Integer.MAX_VALUE) {
            min = 0;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String stripped = line.length() >= min ? line.substring(min) : "";
            sb.append(stripped.stripTrailing());
            if (i < lines.length - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    static String unescape(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char ch = raw.charAt(i);
            if (ch != '\\' || i + 1 >= raw.length()) {
                sb.append(ch);
                i++;
                continue;
            }
            char next = raw.charAt(i + 1);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 's' -> sb.append(' ');
                case '"' -> sb.append('"');
                case '\'' -> sb.append('\'');
                case '\\' -> sb.append('\\');
                case '\n' -> {
                    // line continuation inside a text block
                }
                case 'u' -> {
                    if (i + 6 > raw.length()) {
                        throw new IllegalArgumentException("Truncated unicode escape");
                    }
                    sb.append((char) Integer.parseInt(raw.substring(i + 2, i + 6), 16));
                    i += 4;
                }
                default -> throw new IllegalArgumentException("Unsupported escape: \\" + next);
            }
            i += 2;
        }
        return sb.toString();
    }

    private record Literal(String value, int end) {
    }
}
