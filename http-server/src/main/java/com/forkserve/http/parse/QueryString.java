package com.forkserve.http.parse;

import java.util.HashMap;
import java.util.Map;

/**
 * Query-string scanner.
 *
 * Pairs are separated by {@code &}; a pair without {@code =} has an empty
 * value; empty keys are skipped; the last occurrence of a key wins. A pair
 * whose key or value fails to decode is dropped.
 */
public final class QueryString {

    private QueryString() {}

    /**
     * @param query text after the first '?', without it
     */
    public static Map<String, String> parse(String query) {
        Map<String, String> result = new HashMap<>();
        int len = query.length();
        int start = 0;
        int index = 0;

        while (index < len) {
            while (index < len && query.charAt(index) != '=' && query.charAt(index) != '&') {
                index++;
            }
            String key = query.substring(start, index);
            if (key.isEmpty()) {
                index++;
                start = index;
                continue;
            }

            String value = "";
            if (index < len && query.charAt(index) == '=') {
                start = ++index;
                while (index < len && query.charAt(index) != '&') {
                    index++;
                }
                value = query.substring(start, index);
            }

            String rawValue = value;
            PercentDecoder.decode(key)
                    .flatMap(k -> PercentDecoder.decode(rawValue).map(v -> Map.entry(k, v)))
                    .onSuccess(e -> result.put(e.getKey(), e.getValue()));

            index++;
            start = index;
        }
        return result;
    }
}
