package eu.virtualparadox.knowledgebase.ingest.chunker.code;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declaration finder for curly-brace languages.
 * <p>
 * The region is first masked: comments and string literals are blanked out (line feeds
 * kept), so braces and keywords inside them do not count. Lines that start at brace depth
 * zero are then matched against the language's declaration patterns. A match whose body
 * opens with {@code {} extends to the matching {@code }}; an expression body ({@code =} or
 * {@code =>}) extends to the end of its statement. Comment and annotation lines directly
 * above a declaration belong to it.
 */
public final class BraceLanguageParser implements StructuralParser {

    private static final String MODIFIERS =
            "(?:(?:public|private|protected|internal|fileprivate|open|abstract|final|static|sealed|non-sealed|"
                    + "export|default|data|inner|partial|readonly|declare|async|unsafe|pub(?:\\([^)]*\\))?)\\s+)*";

    private static final Pattern CONTAINER = Pattern.compile(
            "^\\s*(?:@\\w+(?:\\([^)]*\\))?\\s+)*" + MODIFIERS
                    + "(?<kind>class|interface|enum|struct|trait|record|object|protocol|extension|union|namespace|impl|mod)\\b"
                    + "\\s*(?:<[^>]*>\\s*)?(?<name>[A-Za-z_$][\\w$]*)");
    private static final Pattern GO_TYPE = Pattern.compile(
            "^type\\s+(?<name>\\w+)\\s+(?<kind>struct|interface)\\b");

    private static final Pattern C_FUNCTION = Pattern.compile(
            "^\\s*(?:@\\w+(?:\\([^)]*\\))?\\s+)*(?<prefix>(?:[\\w$<>\\[\\],.?*&:~]+\\s+)+)"
                    + "[*&]*(?<name>[A-Za-z_$~][\\w$:~]*)\\s*\\(");
    private static final Pattern JS_FUNCTION = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(?<name>[A-Za-z_$][\\w$]*)");
    private static final Pattern JS_ARROW = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:const|let|var)\\s+(?<name>[A-Za-z_$][\\w$]*)"
                    + "(?=\\s*(?::[^=]+)?=\\s*(?:async\\s+)?(?:function\\b|\\([^)]*\\)\\s*(?::\\s*[^=]+)?=>|[A-Za-z_$][\\w$]*\\s*=>))");
    private static final Pattern JS_METHOD = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|static|async|readonly|override|abstract|get|set)\\s+)*"
                    + "\\*?(?<name>[A-Za-z_$#][\\w$]*)\\s*(?:<[^>]*>)?\\s*\\(");
    private static final Pattern GO_FUNCTION = Pattern.compile(
            "^func\\s+(?:\\((?<receiver>[^)]*)\\)\\s*)?(?<name>\\w+)");
    private static final Pattern RUST_FUNCTION = Pattern.compile(
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:default\\s+)?(?:const\\s+)?(?:async\\s+)?(?:unsafe\\s+)?"
                    + "(?:extern\\s+\"[^\"]*\"\\s+)?fn\\s+(?<name>\\w+)");
    private static final Pattern KOTLIN_FUNCTION = Pattern.compile(
            "^\\s*(?:@\\w+(?:\\([^)]*\\))?\\s+)*(?:(?:public|private|protected|internal|override|open|abstract|final|"
                    + "suspend|inline|operator|infix|tailrec|external)\\s+)*fun\\s+(?:<[^>]*>\\s*)?(?:[\\w.]+\\.)?(?<name>\\w+)");
    private static final Pattern SWIFT_FUNCTION = Pattern.compile(
            "^\\s*(?:@\\w+\\s+)*(?:(?:public|private|fileprivate|internal|open|override|static|class|mutating|final)\\s+)*"
                    + "func\\s+(?<name>\\w+)");
    private static final Pattern SCALA_FUNCTION = Pattern.compile(
            "^\\s*(?:(?:override|private|protected|final|implicit|inline)\\s+)*def\\s+(?<name>\\w+)");
    private static final Pattern PHP_FUNCTION = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|static|abstract|final)\\s+)*function\\s+&?(?<name>\\w+)");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "new", "else", "do", "try", "synchronized",
            "throw", "case", "sizeof", "using", "foreach", "lock", "fixed", "when", "match", "loop", "function");
    private static final Set<String> STATEMENT_WORDS = Set.of(
            "return", "new", "throw", "else", "case", "goto", "await", "yield", "delete", "if", "while", "for", "switch");
    private static final Set<String> SIGNATURE_CONTINUATIONS = Set.of(
            "throws", "extends", "implements", "where", "with", "const", "noexcept", "override", "final", "requires");

    private record Declaration(Pattern pattern, boolean memberOnly, boolean container) {
    }

    private final List<Declaration> declarations;
    private final boolean singleQuoteStrings;
    private final boolean backtickStrings;
    private final boolean tripleQuoteStrings;
    private final boolean hashComments;

    private BraceLanguageParser(final List<Declaration> declarations,
                                final boolean singleQuoteStrings,
                                final boolean backtickStrings,
                                final boolean tripleQuoteStrings,
                                final boolean hashComments) {
        this.declarations = declarations;
        this.singleQuoteStrings = singleQuoteStrings;
        this.backtickStrings = backtickStrings;
        this.tripleQuoteStrings = tripleQuoteStrings;
        this.hashComments = hashComments;
    }

    public static BraceLanguageParser forLanguage(final String language) {
        final Declaration containers = new Declaration(CONTAINER, false, true);
        return switch (language.toLowerCase(Locale.ROOT)) {
            case "javascript", "typescript" -> new BraceLanguageParser(List.of(containers,
                    new Declaration(JS_FUNCTION, false, false),
                    new Declaration(JS_ARROW, false, false),
                    new Declaration(JS_METHOD, true, false)), true, true, false, false);
            case "go" -> new BraceLanguageParser(List.of(
                    new Declaration(GO_TYPE, false, true),
                    new Declaration(GO_FUNCTION, false, false)), false, true, false, false);
            case "rust" -> new BraceLanguageParser(List.of(containers,
                    new Declaration(RUST_FUNCTION, false, false)), false, false, false, false);
            case "kotlin" -> new BraceLanguageParser(List.of(containers,
                    new Declaration(KOTLIN_FUNCTION, false, false)), false, false, true, false);
            case "swift" -> new BraceLanguageParser(List.of(containers,
                    new Declaration(SWIFT_FUNCTION, false, false)), false, false, true, false);
            case "scala" -> new BraceLanguageParser(List.of(containers,
                    new Declaration(SCALA_FUNCTION, false, false)), false, false, true, false);
            case "php" -> new BraceLanguageParser(List.of(containers,
                    new Declaration(PHP_FUNCTION, false, false)), true, false, false, true);
            case "java", "csharp" -> new BraceLanguageParser(List.of(containers,
                    new Declaration(C_FUNCTION, false, false)), false, false, true, false);
            case "c", "cpp" -> new BraceLanguageParser(List.of(containers,
                    new Declaration(C_FUNCTION, false, false)), false, false, false, false);
            default -> throw new IllegalArgumentException("no brace parser for " + language);
        };
    }

    @Override
    public List<CodeUnit> parse(final String source, final int start, final int end, final CodeUnit container) {
        final char[] masked = mask(source, start, end);
        final List<CodeUnit> units = new ArrayList<>();
        int depth = 0;
        int lastUnitEnd = start;
        int p = start;
        while (p < end) {
            final int lineEnd = lineEnd(source, p, end);
            if (depth == 0) {
                final CodeUnit unit = declarationAt(source, masked, p, lineEnd, end, lastUnitEnd, container);
                if (unit != null) {
                    units.add(unit);
                    lastUnitEnd = unit.end();
                    p = unit.end();
                    continue;
                }
            }
            for (int k = p; k < lineEnd; k++) {
                if (masked[k] == '{') {
                    depth++;
                } else if (masked[k] == '}') {
                    depth--;
                    if (depth < 0) {
                        throw new CodeParseException("unbalanced braces: unexpected '}' at offset " + k);
                    }
                }
            }
            p = lineEnd;
        }
        if (depth != 0) {
            throw new CodeParseException("unbalanced braces: " + depth + " unclosed block(s)");
        }
        return units;
    }

    private CodeUnit declarationAt(final String source,
                                   final char[] masked,
                                   final int lineStart,
                                   final int lineEnd,
                                   final int end,
                                   final int floor,
                                   final CodeUnit container) {
        final String line = new String(masked, lineStart, lineEnd - lineStart);
        for (final Declaration declaration : declarations) {
            if (declaration.memberOnly() && container == null) {
                continue;
            }
            final Matcher m = declaration.pattern().matcher(line);
            if (!m.find() || !acceptable(m, declaration)) {
                continue;
            }
            final int[] extent = extent(source, masked, lineStart, lineStart + m.end(), end, !declaration.container());
            if (extent == null) {
                continue;
            }
            final String kind = kindOf(m, declaration, container);
            final int unitStart = leadingComments(source, masked, lineStart, floor);
            return new CodeUnit(kind, m.group("name"), unitStart, extent[2], extent[0], extent[1]);
        }
        return null;
    }

    private static boolean acceptable(final Matcher m, final Declaration declaration) {
        if (KEYWORDS.contains(m.group("name"))) {
            return false;
        }
        if (declaration.pattern() == C_FUNCTION) {
            for (final String word : m.group("prefix").trim().split("\\s+")) {
                if (STATEMENT_WORDS.contains(word)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static String kindOf(final Matcher m, final Declaration declaration, final CodeUnit container) {
        if (declaration.container()) {
            final String kind = m.group("kind");
            return "mod".equals(kind) ? "module" : kind;
        }
        if (declaration.pattern() == GO_FUNCTION && m.group("receiver") != null) {
            return "method";
        }
        return container == null ? "function" : "method";
    }

    /**
     * Finds where a declaration ends, scanning from the end of its name.
     *
     * @return {@code [bodyStart, bodyEnd, unitEnd]}, or {@code null} for a declaration without
     * a body (prototype, abstract method, forward declaration)
     */
    private static int[] extent(final String source,
                                final char[] masked,
                                final int lineStart,
                                final int from,
                                final int end,
                                final boolean allowExpression) {
        final int indent = indentOf(source, lineStart, end);
        int parens = 0;
        boolean expression = false;
        for (int k = from; k < end; k++) {
            final char c = masked[k];
            if (c == '(' || c == '[') {
                parens++;
            } else if (c == ')' || c == ']') {
                parens--;
            } else if (parens > 0) {
                continue;
            } else if (c == '{') {
                final int close = matchingBrace(masked, k, end);
                return new int[]{k + 1, close, lineEnd(source, close, end)};
            } else if (c == ';') {
                return expression ? new int[]{k + 1, k + 1, lineEnd(source, k, end)} : null;
            } else if (c == '=' && allowExpression && isAssignment(masked, k, end)) {
                expression = true;
            } else if (c == '\n') {
                final int next = k + 1;
                if (next >= end) {
                    return expression ? new int[]{next, next, next} : null;
                }
                if (expression) {
                    if (indentOf(source, next, end) <= indent && !isBlankLine(masked, next, end)) {
                        return new int[]{next, next, next};
                    }
                    if (isBlankLine(masked, next, end)) {
                        return new int[]{next, next, next};
                    }
                } else if (!continuesSignature(masked, lineStartOf(masked, k), k, next, end)) {
                    return null;
                }
            }
        }
        return expression ? new int[]{end, end, end} : null;
    }

    private static boolean isAssignment(final char[] masked, final int k, final int end) {
        final char prev = k > 0 ? masked[k - 1] : ' ';
        final char next = k + 1 < end ? masked[k + 1] : ' ';
        return next != '=' && "=<>!+-*/%&|^:".indexOf(prev) < 0;
    }

    private static boolean continuesSignature(final char[] masked,
                                              final int lineStart,
                                              final int lineFeed,
                                              final int next,
                                              final int end) {
        final String current = new String(masked, lineStart, lineFeed - lineStart).strip();
        if (current.endsWith(",") || current.endsWith("(") || current.endsWith(":")
                || current.endsWith("->") || current.endsWith("=>") || current.endsWith("&&")
                || current.endsWith("||") || current.endsWith("<")) {
            return true;
        }
        final String following = new String(masked, next, lineEnd(masked, next, end) - next).strip();
        if (following.startsWith("{") || following.startsWith(":") || following.startsWith("->")
                || following.startsWith("=>")) {
            return true;
        }
        final int space = following.indexOf(' ');
        final String word = space < 0 ? following : following.substring(0, space);
        return SIGNATURE_CONTINUATIONS.contains(word);
    }

    private static int matchingBrace(final char[] masked, final int open, final int end) {
        int depth = 0;
        for (int k = open; k < end; k++) {
            if (masked[k] == '{') {
                depth++;
            } else if (masked[k] == '}') {
                depth--;
                if (depth == 0) {
                    return k;
                }
            }
        }
        throw new CodeParseException("unbalanced braces: block opened at offset " + open + " is never closed");
    }

    /**
     * Walks back over comment and annotation lines directly above {@code lineStart}.
     */
    private static int leadingComments(final String source, final char[] masked, final int lineStart, final int floor) {
        int start = lineStart;
        while (start > floor) {
            final int prevStart = lineStartOf(masked, start - 1);
            if (prevStart < floor) {
                break;
            }
            final String original = source.substring(prevStart, start).strip();
            final boolean blankMasked = isBlankLine(masked, prevStart, start);
            final boolean comment = !original.isEmpty() && blankMasked;
            final boolean annotation = original.startsWith("@") || original.startsWith("#[");
            if (!comment && !annotation) {
                break;
            }
            start = prevStart;
        }
        return start;
    }

    /**
     * Copy of the source with comments and string literals in {@code [start, end)} replaced by
     * spaces. Line feeds survive so line arithmetic still holds.
     */
    char[] mask(final String source, final int start, final int end) {
        final char[] m = source.toCharArray();
        int i = start;
        while (i < end) {
            final char c = source.charAt(i);
            if (source.startsWith("//", i) || (hashComments && c == '#' && !source.startsWith("#[", i))) {
                final int j = lineFeedOrEnd(source, i, end);
                blank(m, i, j);
                i = j;
            } else if (source.startsWith("/*", i)) {
                final int close = source.indexOf("*/", i + 2);
                if (close < 0 || close + 2 > end) {
                    throw new CodeParseException("unterminated block comment at offset " + i);
                }
                blank(m, i, close + 2);
                i = close + 2;
            } else if (tripleQuoteStrings && source.startsWith("\"\"\"", i)) {
                final int close = source.indexOf("\"\"\"", i + 3);
                if (close < 0 || close + 3 > end) {
                    throw new CodeParseException("unterminated text block at offset " + i);
                }
                blank(m, i, close + 3);
                i = close + 3;
            } else if (c == '"' || (c == '\'' && singleQuoteStrings) || (c == '`' && backtickStrings)) {
                final int close = closingQuote(source, i, end, c, c == '`');
                blank(m, i, close);
                i = close;
            } else if (c == '\'') {
                final int close = charLiteralEnd(source, i, end);
                if (close > 0) {
                    blank(m, i, close);
                    i = close;
                } else {
                    // lifetime or apostrophe
                    i++;
                }
            } else {
                i++;
            }
        }
        return m;
    }

    private static int closingQuote(final String source, final int open, final int end, final char quote, final boolean multiline) {
        int k = open + 1;
        while (k < end) {
            final char c = source.charAt(k);
            if (c == '\\' && quote != '`') {
                k += 2;
                continue;
            }
            if (c == quote) {
                return k + 1;
            }
            if (c == '\n' && !multiline) {
                break;
            }
            k++;
        }
        throw new CodeParseException("unterminated string literal at offset " + open);
    }

    private static int charLiteralEnd(final String source, final int open, final int end) {
        if (open + 1 < end && source.charAt(open + 1) == '\\') {
            final int limit = Math.min(end, open + 12);
            for (int k = open + 3; k < limit; k++) {
                if (source.charAt(k) == '\'') {
                    return k + 1;
                }
            }
            return -1;
        }
        if (open + 2 < end && source.charAt(open + 2) == '\'' && source.charAt(open + 1) != '\n') {
            return open + 3;
        }
        return -1;
    }

    private static void blank(final char[] m, final int from, final int to) {
        for (int k = from; k < to; k++) {
            if (m[k] != '\n') {
                m[k] = ' ';
            }
        }
    }

    private static int lineFeedOrEnd(final String source, final int from, final int end) {
        final int nl = source.indexOf('\n', from);
        return nl < 0 || nl >= end ? end : nl;
    }

    private static int lineEnd(final String source, final int from, final int end) {
        final int nl = source.indexOf('\n', from);
        return nl < 0 || nl >= end ? end : nl + 1;
    }

    private static int lineEnd(final char[] masked, final int from, final int end) {
        for (int k = from; k < end; k++) {
            if (masked[k] == '\n') {
                return k;
            }
        }
        return end;
    }

    private static int lineStartOf(final char[] masked, final int offset) {
        int k = offset;
        while (k > 0 && masked[k - 1] != '\n') {
            k--;
        }
        return k;
    }

    private static boolean isBlankLine(final char[] masked, final int from, final int end) {
        for (int k = from; k < end && masked[k] != '\n'; k++) {
            if (!Character.isWhitespace(masked[k])) {
                return false;
            }
        }
        return true;
    }

    private static int indentOf(final String source, final int lineStart, final int end) {
        int k = lineStart;
        while (k < end && (source.charAt(k) == ' ' || source.charAt(k) == '\t')) {
            k++;
        }
        return k - lineStart;
    }
}
