package com.websocket.fanout;

import com.websocket.fanout.jetty.JettyFanoutServer;
import com.websocket.fanout.javanet.WebSocketServer;
import lombok.extern.slf4j.Slf4j;

/**
 * Starts a broadcast server. Settings come from {@code -Dfanout.*} system properties;
 * an optional first argument overrides the port.
 */
@Slf4j
public class FanoutApplication {

    public static void main(String[] args) throws Exception {
        FanoutConfig config = FanoutConfig.fromProperties(System.getProperties());
        if (args.length > 0) {
            config = config.toBuilder().port(Integer.parseInt(args[0])).build().validate();
        }
        FanoutServer server = create(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "fanout-shutdown"));
        server.start();
    }

    static FanoutServer create(FanoutConfig config) {
        switch (config.getTransport()) {
            case JETTY:
                return new JettyFanoutServer(config);
            case JAVANET:
            default:
                return new WebSocketServer(config);
        }
    }
}
