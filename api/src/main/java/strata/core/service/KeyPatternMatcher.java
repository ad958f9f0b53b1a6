package strata.core.service;

import java.util.regex.Pattern;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Matches cache keys against Redis-style glob patterns, so a pattern clear selects the same
 * keys in the memory tier as {@code KEYS}/{@code SCAN MATCH} selects in the remote tier.
 *
 * <p>Supported syntax: {@code *} (any run of characters, including none), {@code ?} (exactly
 * one character), {@code [abc]}, {@code [a-z]}, {@code [^a]} and backslash escapes. Path globs
 * such as {@code /admin/**} also work, since {@code *} crosses {@code /}.
 *
 * <p>Compiled patterns are kept in a bounded cache.
 */
public class KeyPatternMatcher {

    private static final int MAX_CACHED_PATTERNS = 1_000;

    private final Cache<String, Pattern> compiled =
            Caffeine.newBuilder().maximumSize(MAX_CACHED_PATTERNS).build();

    /**
     * Tests if a key matches a glob pattern.
     *
     * @param glob the glob pattern (e.g., "car:*", "user:?:profile")
     * @param key the key to test
     * @return true if the whole key matches
     */
    public boolean matches(String glob, String key) {
        return compiled.get(glob, KeyPatternMatcher::compile).matcher(key).matches();
    }

    static Pattern compile(String glob) {
        var regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        i++;
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    } else {
                        regex.append("\\\\");
                    }
                }
                case '[' -> {
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0 || close == i + 1) {
                        regex.append("\\[");
                    } else {
                        regex.append(characterClass(glob.substring(i + 1, close)));
                        i = close;
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static String characterClass(String body) {
        var out = new StringBuilder("[");
        int start = 0;
        if (body.startsWith("^")) {
            out.append('^');
            start = 1;
        }
        for (int j = start; j < body.length(); j++) {
            char c = body.charAt(j);
            if (c == '-' && j > start && j < body.length() - 1) {
                out.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                out.append(c);
            } else {
                out.append('\\').append(c);
            }
        }
        return out.append(']').toString();
    }
}
