package dev.reviewthor.review;

import java.util.regex.Pattern;

/**
 * Path glob matching and syntax checking.
 *
 * <p>Grammar, read left to right:
 * <pre>
 *   **&#47;   zero or more whole directories
 *   /**   (at the end) the base path itself or anything below it
 *   **    any run of characters, including '/'
 *   *     any run of characters except '/'
 *   ?     exactly one character except '/'
 *   [..]  character class; a leading '!' or '^' negates; 'a-z' ranges
 *   other literal character
 * </pre>
 * An unterminated '[' is taken literally. Patterns come from repository files and are compiled per call.
 */
public final class GlobPattern {

    private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9\\-_.*/?\\[\\]!{}]+$");

    private GlobPattern() {}

    public static boolean matches(String glob, String path) {
        if (glob == null || path == null) return false;
        return compile(glob).matcher(path).matches();
    }

    /**
     * Conservative syntax check: brackets must balance without ever closing more than were
     * opened, and only {@code [A-Za-z0-9-_.*&#47;?[]!{}]} may appear. Never throws.
     */
    public static boolean isValid(String glob) {
        if (glob == null) return false;
        int depth = 0;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '[') depth++;
            if (c == ']') depth--;
            if (depth < 0) return false;
        }
        return depth == 0 && ALLOWED.matcher(glob).matches();
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() * 2);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i);
            if (c == '/' && glob.startsWith("/**", i) && i + 3 == n) {
                regex.append("(?:/.*)?");
                i += 3;
            } else if (c == '*' && glob.startsWith("**/", i)) {
                regex.append("(?:.*/)?");
                i += 3;
            } else if (c == '*' && glob.startsWith("**", i)) {
                regex.append(".*");
                i += 2;
            } else if (c == '*') {
                regex.append("[^/]*");
                i++;
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else if (c == '[' && glob.indexOf(']', i + 1) > i + 1) {
                int close = glob.indexOf(']', i + 1);
                regex.append(characterClass(glob.substring(i + 1, close)));
                i = close + 1;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return Pattern.compile(regex.toString());
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int start = 0;
        if (body.charAt(0) == '!' || body.charAt(0) == '^') {
            if (body.length() == 1) return Pattern.quote("[" + body + "]");
            cls.append('^');
            start = 1;
        }
        for (int j = start; j < body.length(); j++) {
            char c = body.charAt(j);
            if (c == '-' && j > start && j < body.length() - 1) {
                cls.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                cls.append(c);
            } else {
                cls.append('\\').append(c);
            }
        }
        return cls.append(']').toString();
    }
}
