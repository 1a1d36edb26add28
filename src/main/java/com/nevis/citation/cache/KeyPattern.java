package com.nevis.citation.cache;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Glob over cache key segments. {@code *} in the middle matches exactly one segment, a
 * trailing {@code *} matches everything after it.
 */
final class KeyPattern {

    private final Pattern regex;

    private KeyPattern(Pattern regex) {
        this.regex = regex;
    }

    static KeyPattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Cache key pattern must not be blank");
        }
        String[] segments = pattern.split(CacheKey.SEPARATOR, -1);
        boolean openEnded = segments[segments.length - 1].equals(CacheKey.WILDCARD);
        int fixed = openEnded ? segments.length - 1 : segments.length;

        String body = Arrays.stream(segments, 0, fixed)
            .map(s -> s.equals(CacheKey.WILDCARD) ? "[^:]*" : Pattern.quote(s))
            .collect(Collectors.joining(CacheKey.SEPARATOR));

        String regex;
        if (!openEnded) {
            regex = body;
        } else if (fixed == 0) {
            regex = ".*";
        } else {
            regex = body + "(?::.*)?";
        }
        return new KeyPattern(Pattern.compile(regex));
    }

    boolean matches(String key) {
        return regex.matcher(key).matches();
    }
}
