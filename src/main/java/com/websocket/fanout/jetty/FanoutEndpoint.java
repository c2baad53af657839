package com.websocket.fanout.jetty;

import com.websocket.fanout.ConnectionAcceptor;
import jakarta.websocket.CloseReason;
import jakarta.websocket.Endpoint;
import jakarta.websocket.EndpointConfig;
import jakarta.websocket.MessageHandler;
import jakarta.websocket.Session;
import jakarta.websocket.server.ServerEndpointConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * One instance per client. Container callbacks feed the {@link JakartaConnection}; the
 * session itself runs on the server's worker pool so Jetty threads are never parked.
 */
@Slf4j
public class FanoutEndpoint extends Endpoint {

    private final ConnectionAcceptor acceptor;
    private final Executor executor;
    private JakartaConnection connection;

    public FanoutEndpoint(ConnectionAcceptor acceptor, Executor executor) {
        this.acceptor = acceptor;
        this.executor = executor;
    }

    @Override
    public void onOpen(Session session, EndpointConfig config) {
        log.debug("Client connected: {}", session.getId());
        JakartaConnection opened = new JakartaConnection(session);
        connection = opened;
        session.addMessageHandler(String.class, (MessageHandler.Whole<String>) opened::push);
        try {
            executor.execute(() -> acceptor.accept(opened));
        } catch (RejectedExecutionException e) {
            log.warn("No worker available for client {}", session.getId());
            opened.close();
        }
    }

    @Override
    public void onClose(Session session, CloseReason closeReason) {
        log.debug("Client disconnected: {} ({})", session.getId(), closeReason);
        if (connection != null) {
            connection.endOfStream();
        }
    }

    @Override
    public void onError(Session session, Throwable throwable) {
        log.warn("Error on client {}: {}", session.getId(), throwable.toString());
    }

    /** Hands Jetty a fresh endpoint wired to this server for every connection. */
    static class Configurator extends ServerEndpointConfig.Configurator {

        private final ConnectionAcceptor acceptor;
        private final Executor executor;

        Configurator(ConnectionAcceptor acceptor, Executor executor) {
            this.acceptor = acceptor;
            this.executor = executor;
        }

        @Override
        public <T> T getEndpointInstance(Class<T> endpointClass) throws InstantiationException {
            if (!endpointClass.isAssignableFrom(FanoutEndpoint.class)) {
                throw new InstantiationException("Unexpected endpoint " + endpointClass.getName());
            }
            return endpointClass.cast(new FanoutEndpoint(acceptor, executor));
        }
    }
}
