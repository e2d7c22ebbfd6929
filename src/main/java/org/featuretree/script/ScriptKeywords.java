package org.featuretree.script;

import java.util.Set;

/**
 * 脚本语言保留字。
 */
public final class ScriptKeywords {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    private ScriptKeywords() {
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }
}
