package com.raditha.magpie.normalization;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import static com.raditha.magpie.normalization.LanguagePatterns.C_KEYWORDS;
import static com.raditha.magpie.normalization.LanguagePatterns.C_STRING;
import static com.raditha.magpie.normalization.LanguagePatterns.C_STYLE_COMMENT;
import static com.raditha.magpie.normalization.LanguagePatterns.JS_IMPORTS;
import static com.raditha.magpie.normalization.LanguagePatterns.JS_KEYWORDS;
import static com.raditha.magpie.normalization.LanguagePatterns.JS_STRING;
import static com.raditha.magpie.normalization.LanguagePatterns.union;

/**
 * Languages the preprocessor understands.
 * <p>
 * Each variant carries the file extensions it owns, a single pattern that matches either a
 * comment (group {@code comment}) or a string literal (group {@code string}), the patterns of
 * its import statements and its reserved words. Comments and strings are matched by one
 * left-to-right scan so that comment markers inside strings are left alone.
 */
public enum Language {

    PYTHON("python",
            List.of(".py"),
            "#[^\\n]*|\"\"\"[\\s\\S]*?\"\"\"|'''[\\s\\S]*?'''",
            C_STRING,
            List.of("^[ \\t]*(?:from[ \\t]+\\S+[ \\t]+)?import[ \\t]+[^\\n]*$"),
            Set.of("False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
                    "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
                    "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
                    "return", "try", "while", "with", "yield", "self", "print")),

    JAVA("java",
            List.of(".java"),
            C_STYLE_COMMENT,
            C_STRING,
            List.of("^[ \\t]*import[ \\t]+(?:static[ \\t]+)?[\\w.*]+[ \\t]*;"),
            Set.of("abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
                    "const", "continue", "default", "do", "double", "else", "enum", "extends", "final",
                    "finally", "float", "for", "if", "implements", "import", "instanceof", "int",
                    "interface", "long", "native", "new", "package", "private", "protected", "public",
                    "return", "short", "static", "super", "switch", "synchronized", "this", "throw",
                    "throws", "try", "void", "volatile", "while", "var", "record", "true", "false", "null")),

    JAVASCRIPT("javascript",
            List.of(".js", ".jsx", ".mjs"),
            C_STYLE_COMMENT,
            JS_STRING,
            JS_IMPORTS,
            JS_KEYWORDS),

    TYPESCRIPT("typescript",
            List.of(".ts", ".tsx"),
            C_STYLE_COMMENT,
            JS_STRING,
            JS_IMPORTS,
            union(JS_KEYWORDS, Set.of("interface", "type", "implements", "private", "public", "protected",
                    "readonly", "enum", "namespace", "declare", "abstract", "any", "number", "string",
                    "boolean", "void", "never", "unknown"))),

    CSHARP("csharp",
            List.of(".cs"),
            C_STYLE_COMMENT,
            "@\"(?:\"\"|[^\"])*\"|\"(?:\\\\.|[^\"\\\\\\n])*\"|'(?:\\\\.|[^'\\\\\\n])*'",
            List.of("^[ \\t]*using[ \\t]+(?:static[ \\t]+)?[\\w.= \\t]+;"),
            Set.of("abstract", "as", "base", "bool", "break", "case", "catch", "char", "class", "const",
                    "continue", "decimal", "default", "delegate", "do", "double", "else", "enum", "event",
                    "false", "finally", "float", "for", "foreach", "if", "in", "int", "interface",
                    "internal", "is", "lock", "long", "namespace", "new", "null", "object", "out",
                    "override", "private", "protected", "public", "readonly", "ref", "return", "sealed",
                    "static", "string", "struct", "switch", "this", "throw", "true", "try", "typeof",
                    "using", "var", "virtual", "void", "while", "async", "await")),

    CPP("cpp",
            List.of(".cpp", ".cc", ".cxx", ".hpp", ".h"),
            C_STYLE_COMMENT,
            C_STRING,
            List.of("^[ \\t]*#[ \\t]*include\\b[^\\n]*$", "^[ \\t]*using[ \\t]+namespace[ \\t]+[\\w:]+[ \\t]*;"),
            union(C_KEYWORDS, Set.of("bool", "catch", "class", "delete", "explicit", "false", "friend",
                    "inline", "namespace", "new", "nullptr", "operator", "private", "protected", "public",
                    "template", "this", "throw", "true", "try", "typename", "using", "virtual", "auto",
                    "std"))),

    C("c",
            List.of(".c", ".h"),
            C_STYLE_COMMENT,
            C_STRING,
            List.of("^[ \\t]*#[ \\t]*include\\b[^\\n]*$"),
            C_KEYWORDS),

    GO("go",
            List.of(".go"),
            C_STYLE_COMMENT,
            "`[^`]*`|\"(?:\\\\.|[^\"\\\\\\n])*\"|'(?:\\\\.|[^'\\\\\\n])*'",
            List.of("^[ \\t]*import[ \\t]*\\([^)]*\\)", "^[ \\t]*import[ \\t]+[^\\n]*$"),
            Set.of("break", "case", "chan", "const", "continue", "default", "defer", "else",
                    "fallthrough", "for", "func", "go", "goto", "if", "import", "interface", "map",
                    "package", "range", "return", "select", "struct", "switch", "type", "var", "nil",
                    "true", "false", "int", "string", "bool", "error", "byte", "rune", "float64")),

    RUST("rust",
            List.of(".rs"),
            C_STYLE_COMMENT,
            "\"(?:\\\\.|[^\"\\\\])*\"|'(?:\\\\.|[^'\\\\\\n])'",
            List.of("^[ \\t]*(?:pub[ \\t]+)?use[ \\t]+[^;]+;", "^[ \\t]*extern[ \\t]+crate[ \\t]+\\w+[ \\t]*;"),
            Set.of("as", "async", "await", "break", "const", "continue", "crate", "else", "enum",
                    "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod",
                    "move", "mut", "pub", "ref", "return", "self", "Self", "static", "struct", "super",
                    "trait", "true", "type", "unsafe", "use", "where", "while", "dyn", "Some", "None",
                    "Ok", "Err", "String", "Vec", "Option", "Result"));

    private final String tag;
    private final List<String> extensions;
    private final Pattern commentOrString;
    private final List<Pattern> importPatterns;
    private final Set<String> keywords;

    Language(String tag, List<String> extensions, String commentRegex, String stringRegex,
            List<String> importRegexes, Set<String> keywords) {
        this.tag = tag;
        this.extensions = extensions;
        // Comment alternative first so that Python docstrings win over empty string literals
        this.commentOrString = Pattern.compile("(?<comment>" + commentRegex + ")|(?<string>" + stringRegex + ")");
        this.importPatterns = importRegexes.stream()
                .map(regex -> Pattern.compile(regex, Pattern.MULTILINE))
                .toList();
        this.keywords = keywords;
    }

    public String tag() {
        return tag;
    }

    public List<String> extensions() {
        return extensions;
    }

    Pattern commentOrString() {
        return commentOrString;
    }

    List<Pattern> importPatterns() {
        return importPatterns;
    }

    public Set<String> keywords() {
        return keywords;
    }

    public boolean isKeyword(String word) {
        return keywords.contains(word);
    }

    /**
     * Whether a repository path belongs to this language, judged by its extension.
     */
    public boolean matches(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolve a language from its name or a common alias.
     *
     * @throws IllegalArgumentException if the tag names no supported language
     */
    public static Language fromTag(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Language must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "python", "py" -> PYTHON;
            case "java" -> JAVA;
            case "javascript", "js" -> JAVASCRIPT;
            case "typescript", "ts" -> TYPESCRIPT;
            case "csharp", "cs", "c#" -> CSHARP;
            case "cpp", "c++", "cxx" -> CPP;
            case "c" -> C;
            case "go", "golang" -> GO;
            case "rust", "rs" -> RUST;
            default -> throw new IllegalArgumentException("Unsupported language: " + value);
        };
    }

}
