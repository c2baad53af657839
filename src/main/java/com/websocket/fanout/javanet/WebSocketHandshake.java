package com.websocket.fanout.javanet;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Server half of the RFC 6455 opening handshake.
 */
final class WebSocketHandshake {

    static final String SUPPORTED_VERSION = "13";
    private static final String GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    private WebSocketHandshake() {
    }

    static String acceptKey(String key) {
        try {
            return Base64.getEncoder().encodeToString(
                  MessageDigest.getInstance("SHA-1")
                        .digest((key + GUID).getBytes(StandardCharsets.UTF_8))
            );
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException(e);
        }
    }

    /**
     * Answers the upgrade request with 101, or with 400/426 when it cannot be honoured.
     *
     * @return whether the connection now speaks WebSocket
     */
    static boolean respond(HttpRequestHead head, OutputStream out) throws IOException {
        String key = head.header("sec-websocket-key");
        if (key == null || key.isEmpty()) {
            HttpResponses.write(out, 400, "Bad Request", "Missing Sec-WebSocket-Key");
            return false;
        }
        if (!SUPPORTED_VERSION.equals(head.header("sec-websocket-version"))) {
            HttpResponses.write(out, 426, "Upgrade Required", "Unsupported WebSocket version",
                  "Sec-WebSocket-Version: " + SUPPORTED_VERSION);
            return false;
        }
        String response = "HTTP/1.1 101 Switching Protocols\r\n"
              + "Upgrade: websocket\r\n"
              + "Connection: Upgrade\r\n"
              + "Sec-WebSocket-Accept: " + acceptKey(key) + "\r\n"
              + "\r\n";
        out.write(response.getBytes(StandardCharsets.US_ASCII));
        out.flush();
        return true;
    }
}
