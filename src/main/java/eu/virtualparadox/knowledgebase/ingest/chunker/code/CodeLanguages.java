package eu.virtualparadox.knowledgebase.ingest.chunker.code;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Programming language detection and the structural parser for each supported language.
 */
public final class CodeLanguages {

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            entry("py", "python"),
            entry("js", "javascript"),
            entry("jsx", "javascript"),
            entry("mjs", "javascript"),
            entry("ts", "typescript"),
            entry("tsx", "typescript"),
            entry("java", "java"),
            entry("kt", "kotlin"),
            entry("go", "go"),
            entry("rs", "rust"),
            entry("c", "c"),
            entry("h", "c"),
            entry("cpp", "cpp"),
            entry("cc", "cpp"),
            entry("hpp", "cpp"),
            entry("cs", "csharp"),
            entry("rb", "ruby"),
            entry("php", "php"),
            entry("swift", "swift"),
            entry("scala", "scala"),
            entry("sh", "shell"),
            entry("sql", "sql"));

    private static final Pattern PYTHON = Pattern.compile("(?m)^(?:async\\s+)?def\\s+\\w+\\s*\\(.*\\)\\s*(?:->.*)?:\\s*$|^class\\s+\\w+.*:\\s*$");
    private static final Pattern GO = Pattern.compile("(?m)^package\\s+\\w+\\s*$|^func\\s+(?:\\([^)]*\\)\\s*)?\\w+\\(");
    private static final Pattern RUST = Pattern.compile("(?m)^\\s*(?:pub\\s+)?fn\\s+\\w+|^\\s*use\\s+\\w+::");
    private static final Pattern JAVA = Pattern.compile("(?m)^\\s*(?:package|import)\\s+[\\w.]+;\\s*$|^\\s*public\\s+(?:final\\s+)?class\\s+\\w+");
    private static final Pattern JAVASCRIPT = Pattern.compile("(?m)^\\s*(?:export\\s+)?(?:async\\s+)?function\\s+\\w+|^\\s*(?:const|let)\\s+\\w+\\s*=\\s*(?:async\\s*)?\\(");
    private static final Pattern C = Pattern.compile("(?m)^#include\\s*[<\"]");

    private static final Map<String, StructuralParser> PARSERS = Map.ofEntries(
            entry("python", new IndentLanguageParser()),
            entry("javascript", BraceLanguageParser.forLanguage("javascript")),
            entry("typescript", BraceLanguageParser.forLanguage("typescript")),
            entry("java", BraceLanguageParser.forLanguage("java")),
            entry("kotlin", BraceLanguageParser.forLanguage("kotlin")),
            entry("go", BraceLanguageParser.forLanguage("go")),
            entry("rust", BraceLanguageParser.forLanguage("rust")),
            entry("c", BraceLanguageParser.forLanguage("c")),
            entry("cpp", BraceLanguageParser.forLanguage("cpp")),
            entry("csharp", BraceLanguageParser.forLanguage("csharp")),
            entry("php", BraceLanguageParser.forLanguage("php")),
            entry("swift", BraceLanguageParser.forLanguage("swift")),
            entry("scala", BraceLanguageParser.forLanguage("scala")));

    private CodeLanguages() {
        // prevent instantiation
    }

    /**
     * Language from the origin's extension, else sniffed from the content.
     *
     * @return language name, or {@code "unknown"}
     */
    public static String detect(final String origin, final String content) {
        if (origin != null) {
            final String name = origin.replace('\\', '/');
            final int dot = name.lastIndexOf('.');
            if (dot >= 0 && dot > name.lastIndexOf('/')) {
                final String lang = BY_EXTENSION.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
                if (lang != null) {
                    return lang;
                }
            }
        }
        if (content == null) {
            return "unknown";
        }
        if (GO.matcher(content).find()) {
            return "go";
        }
        if (JAVA.matcher(content).find()) {
            return "java";
        }
        if (RUST.matcher(content).find()) {
            return "rust";
        }
        if (PYTHON.matcher(content).find()) {
            return "python";
        }
        if (JAVASCRIPT.matcher(content).find()) {
            return "javascript";
        }
        if (C.matcher(content).find()) {
            return "c";
        }
        return "unknown";
    }

    public static Optional<StructuralParser> parserFor(final String language) {
        return Optional.ofNullable(PARSERS.get(language));
    }
}
