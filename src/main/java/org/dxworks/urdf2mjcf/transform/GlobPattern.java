package org.dxworks.urdf2mjcf.transform;

/**
 * Shell-style attribute value pattern. Values containing {@code *} are globs
 * ({@code *} any run, {@code ?} any single character, case-sensitive); anything
 * else is compared verbatim.
 */
final class GlobPattern {

    private GlobPattern() {
        // utility class
    }

    static boolean hasWildcard(String pattern) {
        return pattern != null && pattern.indexOf('*') >= 0;
    }

    static boolean matches(String value, String pattern) {
        if (value == null || pattern == null) return false;
        if (!hasWildcard(pattern)) {
            return value.equals(pattern);
        }
        return glob(value, pattern);
    }

    // Iterative matcher with single-star backtracking.
    private static boolean glob(String value, String pattern) {
        int v = 0;
        int p = 0;
        int starIdx = -1;
        int matchIdx = 0;
        while (v < value.length()) {
            if (p < pattern.length() && (pattern.charAt(p) == '?' || pattern.charAt(p) == value.charAt(v))) {
                v++;
                p++;
            } else if (p < pattern.length() && pattern.charAt(p) == '*') {
                starIdx = p++;
                matchIdx = v;
            } else if (starIdx != -1) {
                p = starIdx + 1;
                v = ++matchIdx;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') {
            p++;
        }
        return p == pattern.length();
    }
}
