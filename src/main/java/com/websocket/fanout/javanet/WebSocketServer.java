package com.websocket.fanout.javanet;

import com.websocket.fanout.FanoutConfig;
import com.websocket.fanout.FanoutServer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.RejectedExecutionException;

import javax.net.ServerSocketFactory;

/**
 * WebSocket broadcast server on a plain {@link ServerSocket}:
 *  - accept loop on its own thread
 *  - one worker per exchange, two per upgraded connection
 *  - {@code GET <websocketPath>} upgrades, {@code GET <triggerPrefix><text>} broadcasts
 */
@Slf4j
public class WebSocketServer extends FanoutServer {

    static final long ACCEPT_BACKOFF_MILLIS = 100;

    private final ServerSocketFactory socketFactory;
    private ServerSocket serverSocket;
    private Thread acceptThread;

    public WebSocketServer(FanoutConfig config) {
        this(config, ServerSocketFactory.getDefault());
    }

    WebSocketServer(FanoutConfig config, ServerSocketFactory socketFactory) {
        super(config);
        this.socketFactory = socketFactory;
    }

    @Override
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Already started");
        }
        serverSocket = socketFactory.createServerSocket(config.getPort());
        acceptThread = new Thread(this::acceptLoop, "fanout-accept");
        acceptThread.start();
        log.info("WebSocket broadcast server on port {} (websocket {}, trigger {}<text>)",
              port(), config.getWebsocketPath(), config.getTriggerPrefix());
    }

    @Override
    public int port() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    @Override
    protected synchronized void stopTransport() {
        if (serverSocket == null) {
            return;
        }
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Closing server socket failed: {}", e.getMessage());
        }
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            final Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                if (!serverSocket.isClosed()) {
                    log.warn("Accept failed, retrying in {} ms: {}", ACCEPT_BACKOFF_MILLIS, e.getMessage());
                    // e.g. out of file descriptors; give sessions a chance to release some
                    if (!backOff()) {
                        break;
                    }
                }
                continue;
            }
            try {
                client.setTcpNoDelay(true);
                getExecutor().execute(new ExchangeHandler(client, config.getWebsocketPath(),
                      config.getRequestHeadTimeoutMillis(), getAcceptor(), getTrigger()));
            } catch (SocketException | RejectedExecutionException e) {
                log.warn("Rejecting {}: {}", client.getRemoteSocketAddress(), e.toString());
                try {
                    client.close();
                } catch (IOException closeFailure) {
                    log.debug("Closing rejected socket failed: {}", closeFailure.getMessage());
                }
            }
        }
        log.info("Accept loop stopped");
    }

    private boolean backOff() {
        try {
            Thread.sleep(ACCEPT_BACKOFF_MILLIS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
