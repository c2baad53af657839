package com.websocket.fanout.javanet;

import lombok.Getter;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Request line and headers of an HTTP/1.1 request.
 * <p>
 * Read byte by byte so that nothing past the blank line is consumed: after an upgrade
 * the same stream carries WebSocket frames.
 */
@Getter
public final class HttpRequestHead {

    static final int MAX_HEAD_BYTES = 8 * 1024;

    private final String method;
    private final String target;
    private final String version;
    /** Lower-cased names. Repeated headers are joined with ", ". */
    private final Map<String, String> headers;

    private HttpRequestHead(String method, String target, String version, Map<String, String> headers) {
        this.method = method;
        this.target = target;
        this.version = version;
        this.headers = Collections.unmodifiableMap(headers);
    }

    public static HttpRequestHead read(InputStream in) throws IOException {
        int[] budget = {MAX_HEAD_BYTES};
        // the target may carry raw UTF-8; header values stay ISO-8859-1
        String requestLine = readLine(in, budget, StandardCharsets.UTF_8);
        String[] parts = requestLine.split(" ");
        if (parts.length != 3 || !parts[2].startsWith("HTTP/")) {
            throw new BadRequestException("Malformed request line: " + requestLine);
        }
        Map<String, String> headers = new LinkedHashMap<>();
        String line;
        while (!(line = readLine(in, budget, StandardCharsets.ISO_8859_1)).isEmpty()) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new BadRequestException("Malformed header: " + line);
            }
            String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();
            headers.merge(name, value, (a, b) -> a + ", " + b);
        }
        return new HttpRequestHead(parts[0], parts[1], parts[2], headers);
    }

    /** Target without the query string. */
    public String path() {
        int query = target.indexOf('?');
        return query < 0 ? target : target.substring(0, query);
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean isWebSocketUpgrade() {
        String upgrade = header("upgrade");
        String connection = header("connection");
        return upgrade != null && upgrade.equalsIgnoreCase("websocket")
              && connection != null && connection.toLowerCase(Locale.ROOT).contains("upgrade");
    }

    private static String readLine(InputStream in, int[] budget, Charset charset) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        while (true) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("Connection closed inside request head");
            }
            if (--budget[0] < 0) {
                throw new BadRequestException("Request head exceeds " + MAX_HEAD_BYTES + " bytes");
            }
            if (b == '\n') {
                break;
            }
            line.write(b);
        }
        byte[] bytes = line.toByteArray();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        return new String(bytes, 0, length, charset);
    }
}
