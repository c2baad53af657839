package com.websocket.fanout.javanet;

import com.websocket.fanout.BroadcastTrigger;
import com.websocket.fanout.ConnectionAcceptor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;

/**
 * Serves one accepted socket: either upgrades it to a WebSocket session, which then
 * owns the socket, or answers a single plain HTTP request and closes.
 */
@Slf4j
class ExchangeHandler implements Runnable {

    private final Socket client;
    private final String websocketPath;
    private final int headTimeoutMillis;
    private final ConnectionAcceptor acceptor;
    private final BroadcastTrigger trigger;

    ExchangeHandler(Socket client, String websocketPath, int headTimeoutMillis,
          ConnectionAcceptor acceptor, BroadcastTrigger trigger) {
        this.client = client;
        this.websocketPath = websocketPath;
        this.headTimeoutMillis = headTimeoutMillis;
        this.acceptor = acceptor;
        this.trigger = trigger;
    }

    @Override
    public void run() {
        boolean upgraded = false;
        try {
            client.setSoTimeout(headTimeoutMillis);
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream());
            HttpRequestHead head;
            try {
                head = HttpRequestHead.read(in);
            } catch (BadRequestException e) {
                log.debug("Bad request from {}: {}", client.getRemoteSocketAddress(), e.getMessage());
                HttpResponses.write(out, 400, "Bad Request", e.getMessage());
                return;
            }
            String path = head.path();
            log.debug("{} {} from {}", head.getMethod(), head.getTarget(), client.getRemoteSocketAddress());

            if (path.equals(websocketPath) && head.isWebSocketUpgrade()) {
                if (!"GET".equals(head.getMethod())) {
                    HttpResponses.write(out, 405, "Method Not Allowed", "Upgrade requires GET", "Allow: GET");
                } else if (WebSocketHandshake.respond(head, out)) {
                    upgraded = true;
                    // sessions may idle indefinitely
                    client.setSoTimeout(0);
                    acceptor.accept(new FrameConnection(client, in, out));
                }
            } else if (trigger.matches(path)) {
                handleTrigger(head, out);
            } else {
                HttpResponses.write(out, 404, "Not Found", "No route for " + path);
            }
        } catch (EOFException e) {
            log.debug("{} hung up before sending a request", client.getRemoteSocketAddress());
        } catch (SocketTimeoutException e) {
            log.debug("{} sent no request within {} ms", client.getRemoteSocketAddress(), headTimeoutMillis);
        } catch (IOException e) {
            log.warn("Exchange with {} failed: {}", client.getRemoteSocketAddress(), e.getMessage());
        } finally {
            if (!upgraded) {
                closeSocket();
            }
        }
    }

    private void handleTrigger(HttpRequestHead head, OutputStream out) throws IOException {
        if (!"GET".equals(head.getMethod())) {
            HttpResponses.write(out, 405, "Method Not Allowed", "Use GET", "Allow: GET");
            return;
        }
        String confirmation;
        try {
            confirmation = trigger.handle(head.getTarget());
        } catch (IllegalArgumentException e) {
            HttpResponses.write(out, 400, "Bad Request", e.getMessage());
            return;
        }
        HttpResponses.write(out, 200, "OK", confirmation);
    }

    private void closeSocket() {
        try {
            client.close();
        } catch (IOException e) {
            log.debug("Closing {} failed: {}", client.getRemoteSocketAddress(), e.getMessage());
        }
    }
}
