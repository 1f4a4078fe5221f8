package com.raditha.magpie.normalization;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pattern fragments and word lists shared by several {@link Language} variants.
 */
final class LanguagePatterns {

    static final String C_STYLE_COMMENT = "//[^\\n]*|/\\*[\\s\\S]*?\\*/";

    static final String C_STRING = "\"(?:\\\\.|[^\"\\\\\\n])*\"|'(?:\\\\.|[^'\\\\\\n])*'";

    static final String JS_STRING = "`(?:\\\\.|[^`\\\\])*`|" + C_STRING;

    static final List<String> JS_IMPORTS = List.of(
            "^[ \\t]*import[ \\t(][^\\n]*$",
            "^[ \\t]*(?:const|let|var)[ \\t]+[^\\n=]+=[ \\t]*require\\([^\\n]*\\)[ \\t]*;?[ \\t]*$");

    static final Set<String> JS_KEYWORDS = Set.of("async", "await", "break", "case", "catch", "class",
            "const", "continue", "debugger", "default", "delete", "do", "else", "export", "extends",
            "false", "finally", "for", "function", "if", "import", "in", "instanceof", "let", "new",
            "null", "return", "super", "switch", "this", "throw", "true", "try", "typeof", "undefined",
            "var", "void", "while", "yield", "of");

    static final Set<String> C_KEYWORDS = Set.of("auto", "break", "case", "char", "const", "continue",
            "default", "do", "double", "else", "enum", "extern", "float", "for", "goto", "if", "int",
            "long", "register", "return", "short", "signed", "sizeof", "static", "struct", "switch",
            "typedef", "union", "unsigned", "void", "volatile", "while", "NULL");

    private LanguagePatterns() {
    }

    static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }
}
