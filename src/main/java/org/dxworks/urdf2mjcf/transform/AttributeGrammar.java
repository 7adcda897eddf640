package org.dxworks.urdf2mjcf.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scanner for the quoted key/value mini-language used in operation attributes:
 * <pre>
 *   pairs      := (noise | pair)*
 *   pair       := identifier (":=" | "=") quote value quote
 *   identifier := [A-Za-z0-9_]+
 *   quote      := ' | "
 * </pre>
 * A value runs up to the next occurrence of its opening quote on the same line,
 * so separators and spaces inside quotes are part of the value. Anything that
 * does not form a pair is skipped.
 */
public final class AttributeGrammar {

    private AttributeGrammar() {
        // utility class
    }

    public static ParsedAttributes parse(String source) {
        ParsedAttributes result = new ParsedAttributes();
        if (source == null) {
            return result;
        }
        int pos = 0;
        int len = source.length();
        while (pos < len) {
            if (!isIdentifierChar(source.charAt(pos))) {
                pos++;
                continue;
            }
            int keyStart = pos;
            while (pos < len && isIdentifierChar(source.charAt(pos))) {
                pos++;
            }
            String key = source.substring(keyStart, pos);

            int cursor = pos;
            if (cursor < len && source.charAt(cursor) == ':') {
                cursor++;
            }
            if (cursor >= len || source.charAt(cursor) != '=') {
                continue;
            }
            cursor++;
            if (cursor >= len || !isQuote(source.charAt(cursor))) {
                continue;
            }
            char quote = source.charAt(cursor);
            int valueStart = cursor + 1;
            int valueEnd = closingQuote(source, valueStart, quote);
            if (valueEnd < 0) {
                continue;
            }
            result.put(key, source.substring(valueStart, valueEnd));
            pos = valueEnd + 1;
        }
        return result;
    }

    /**
     * Position of the first colon that separates a conditional replacement: outside
     * quotes and not the first half of a {@code :=} assignment. Returns -1 when absent.
     */
    public static int topLevelSeparator(String source) {
        if (source == null) return -1;
        char quote = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (isQuote(c)) {
                quote = c;
            } else if (c == ':' && (i + 1 >= source.length() || source.charAt(i + 1) != '=')) {
                return i;
            }
        }
        return -1;
    }

    private static int closingQuote(String source, int from, char quote) {
        for (int i = from; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == quote) return i;
            if (c == '\n') return -1;
        }
        return -1;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    /** Ordered result of a scan. Duplicate keys keep the last value and are remembered. */
    public static final class ParsedAttributes {
        private final LinkedHashMap<String, String> pairs = new LinkedHashMap<>();
        private final List<String> duplicateKeys = new ArrayList<>();

        void put(String key, String value) {
            if (pairs.containsKey(key)) {
                duplicateKeys.add(key);
            }
            pairs.put(key, value);
        }

        public Map<String, String> pairs() {
            return Collections.unmodifiableMap(pairs);
        }

        public List<String> duplicateKeys() {
            return Collections.unmodifiableList(duplicateKeys);
        }

        public boolean isEmpty() {
            return pairs.isEmpty();
        }
    }
}
