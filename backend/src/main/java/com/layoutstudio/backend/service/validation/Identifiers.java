package com.layoutstudio.backend.service.validation;

import java.util.Set;

/**
 * Identifier rules of the generated Rust code.
 */
public final class Identifiers {

    /** Strict and reserved keywords; none of them can name a field or variant. */
    public static final Set<String> RUST_KEYWORDS = Set.of(
            "as", "async", "await", "break", "const", "continue", "crate", "dyn", "else", "enum",
            "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move",
            "mut", "pub", "ref", "return", "self", "Self", "static", "struct", "super", "trait", "true",
            "type", "unsafe", "use", "where", "while",
            "abstract", "become", "box", "do", "final", "macro", "override", "priv", "try", "typeof",
            "unsized", "virtual", "yield"
    );

    private Identifiers() {
    }

    /**
     * ASCII only: a letter or underscore, then letters, digits or underscores.
     * A lone underscore is a wildcard, not a name.
     */
    public static boolean isValidIdentifier(String s) {
        if (s == null || s.isEmpty() || s.equals("_")) return false;
        char first = s.charAt(0);
        if (!(isAsciiLetter(first) || first == '_')) return false;
        for (int i = 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!(isAsciiLetter(c) || (c >= '0' && c <= '9') || c == '_')) return false;
        }
        return true;
    }

    public static boolean isReservedWord(String s) {
        return s != null && RUST_KEYWORDS.contains(s);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
