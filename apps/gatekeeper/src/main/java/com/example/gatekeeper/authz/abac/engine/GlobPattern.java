package com.example.gatekeeper.authz.abac.engine;

import org.springframework.lang.NonNull;

import java.util.regex.Pattern;

/**
 * Glob matching for policy patterns: {@code *} matches any run of characters (including none),
 * {@code ?} exactly one; everything else is literal. Matches the whole value.
 */
public final class GlobPattern {

    private GlobPattern() {}

    public static boolean matches(@NonNull String pattern, @NonNull String value) {
        return compile(pattern).matcher(value).matches();
    }

    @NonNull
    static Pattern compile(@NonNull String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                flushLiteral(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(regex, literal);
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
