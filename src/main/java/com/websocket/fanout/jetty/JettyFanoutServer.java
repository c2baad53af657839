package com.websocket.fanout.jetty;

import com.websocket.fanout.FanoutConfig;
import com.websocket.fanout.FanoutServer;
import jakarta.websocket.server.ServerEndpointConfig;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.websocket.jakarta.server.config.JakartaWebSocketServletContainerInitializer;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

import java.io.IOException;

/**
 * The broadcast server on Jetty: a Jakarta endpoint for clients and a servlet for the
 * trigger, sharing one context.
 */
@Slf4j
public class JettyFanoutServer extends FanoutServer {

    private Server server;
    private ServerConnector connector;

    public JettyFanoutServer(FanoutConfig config) {
        super(config);
    }

    @Override
    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Already started");
        }
        server = new Server();
        connector = new ServerConnector(server);
        connector.setPort(config.getPort());
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler();
        context.setContextPath("/");
        server.setHandler(context);

        String prefix = config.getTriggerPrefix();
        context.addServlet(new ServletHolder(new BroadcastServlet(getTrigger())), prefix + "*");

        ServerEndpointConfig endpoint = ServerEndpointConfig.Builder
              .create(FanoutEndpoint.class, config.getWebsocketPath())
              .configurator(new FanoutEndpoint.Configurator(getAcceptor(), getExecutor()))
              .build();
        JakartaWebSocketServletContainerInitializer.configure(context, (servletContext, container) -> {
            container.addEndpoint(endpoint);
        });

        try {
            server.start();
        } catch (Exception e) {
            throw new IOException("Jetty failed to start on port " + config.getPort(), e);
        }
        log.info("Jetty broadcast server on port {} (websocket {}, trigger {}<text>)",
              port(), config.getWebsocketPath(), prefix);
    }

    @Override
    public int port() {
        return connector == null ? -1 : connector.getLocalPort();
    }

    @Override
    protected synchronized void stopTransport() {
        if (server == null) {
            return;
        }
        try {
            server.stop();
        } catch (Exception e) {
            log.warn("Stopping Jetty failed: {}", e.toString());
        }
    }
}
