package com.websocket.fanout;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Extracts the message body from a trigger request path such as
 * {@code /broadcast/hello%20all}.
 */
public final class TriggerPath {

    private TriggerPath() {
    }

    /**
     * @param path   raw request path, optionally with a query string
     * @param prefix prefix ending in {@code /}, e.g. {@code /broadcast/}
     * @return the percent-decoded segment right after the prefix
     * @throws IllegalArgumentException if the path lacks the prefix, the segment is empty
     *                                  or a {@code %} escape is malformed
     */
    public static String parse(String path, String prefix) {
        if (path == null) {
            throw new IllegalArgumentException("Missing request path");
        }
        int query = path.indexOf('?');
        String rawPath = query < 0 ? path : path.substring(0, query);
        if (!rawPath.startsWith(prefix)) {
            throw new IllegalArgumentException("Expected " + prefix + "<message>");
        }
        String rest = rawPath.substring(prefix.length());
        int slash = rest.indexOf('/');
        String segment = slash < 0 ? rest : rest.substring(0, slash);
        if (segment.isEmpty()) {
            throw new IllegalArgumentException("Missing message after " + prefix);
        }
        try {
            // '+' is literal in a path
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed message segment: " + segment, e);
        }
    }
}
