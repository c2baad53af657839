package com.websocket.fanout;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for a freshly upgraded connection. Blocks for the lifetime of the
 * client; the connection is closed when this returns, whichever way it returns.
 */
@Slf4j
public class ConnectionAcceptor {

    public static final Message GREETING = Message.fromServer("Welcome!");

    private final SessionRegistry registry;
    private final Broadcaster broadcaster;
    private final MessageCodec codec;
    private final ExecutorService executor;
    private final FanoutConfig config;

    public ConnectionAcceptor(SessionRegistry registry, Broadcaster broadcaster, MessageCodec codec,
          ExecutorService executor, FanoutConfig config) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.codec = codec;
        this.executor = executor;
        this.config = config;
    }

    public void accept(Connection connection) {
        try (Session session = new Session(connection, registry, broadcaster, codec, executor, config)) {
            registry.add(session);
            // only the newcomer is greeted, and before its write loop exists
            session.sendDirect(GREETING);
            log.info("Client connected: {} ({} live)", session.id(), registry.size());
            session.run();
        } catch (IOException e) {
            log.warn("Could not greet client {}: {}", connection.id(), e.getMessage());
        }
    }
}
