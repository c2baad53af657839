package com.websocket.fanout;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Properties;

/**
 * Server settings. Every value has a default; {@link #fromProperties(Properties)} reads
 * overrides from {@code fanout.*} keys.
 */
@Value
@Builder(toBuilder = true)
public class FanoutConfig {

    public static final String PROPERTY_PREFIX = "fanout.";

    public enum Transport {
        /** Hand-rolled RFC 6455 server on a plain {@link java.net.ServerSocket}. */
        JAVANET,
        /** Jetty with a Jakarta WebSocket endpoint. */
        JETTY;

        public static Transport parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown transport '" + value + "', expected javanet or jetty");
            }
        }
    }

    /** 0 binds an ephemeral port. */
    @Builder.Default int port = 3000;
    @Builder.Default Transport transport = Transport.JAVANET;
    /** Capacity of every session's outbound queue. */
    @Builder.Default int queueCapacity = 100;
    /** Upper bound on worker threads; each live connection holds two. */
    @Builder.Default int maxThreads = 512;
    /** Undecodable frames in a row before a session is dropped. */
    @Builder.Default int maxConsecutiveReadErrors = 10;
    /** How long a new socket may take to send its request head. */
    @Builder.Default int requestHeadTimeoutMillis = 10_000;
    @Builder.Default String websocketPath = "/ws";
    @Builder.Default String triggerPrefix = "/broadcast/";

    public static FanoutConfig defaults() {
        return builder().build();
    }

    public static FanoutConfig fromProperties(Properties properties) {
        FanoutConfig defaults = defaults();
        return builder()
              .port(intProperty(properties, "port", defaults.port))
              .transport(Transport.parse(properties.getProperty(PROPERTY_PREFIX + "transport", defaults.transport.name())))
              .queueCapacity(intProperty(properties, "queueCapacity", defaults.queueCapacity))
              .maxThreads(intProperty(properties, "maxThreads", defaults.maxThreads))
              .maxConsecutiveReadErrors(intProperty(properties, "maxConsecutiveReadErrors", defaults.maxConsecutiveReadErrors))
              .requestHeadTimeoutMillis(intProperty(properties, "requestHeadTimeoutMillis", defaults.requestHeadTimeoutMillis))
              .websocketPath(properties.getProperty(PROPERTY_PREFIX + "websocketPath", defaults.websocketPath))
              .triggerPrefix(properties.getProperty(PROPERTY_PREFIX + "triggerPrefix", defaults.triggerPrefix))
              .build()
              .validate();
    }

    /**
     * @return this config
     * @throws IllegalArgumentException naming the first offending setting
     */
    public FanoutConfig validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport is required");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        if (maxThreads < 2) {
            throw new IllegalArgumentException("maxThreads must allow at least one connection: " + maxThreads);
        }
        if (maxConsecutiveReadErrors < 1) {
            throw new IllegalArgumentException("maxConsecutiveReadErrors must be positive: " + maxConsecutiveReadErrors);
        }
        if (requestHeadTimeoutMillis < 1) {
            throw new IllegalArgumentException("requestHeadTimeoutMillis must be positive: " + requestHeadTimeoutMillis);
        }
        if (websocketPath == null || !websocketPath.startsWith("/")) {
            throw new IllegalArgumentException("websocketPath must start with '/': " + websocketPath);
        }
        if (triggerPrefix == null || triggerPrefix.length() < 2
              || !triggerPrefix.startsWith("/") || !triggerPrefix.endsWith("/")) {
            throw new IllegalArgumentException("triggerPrefix must look like '/name/': " + triggerPrefix);
        }
        return this;
    }

    private static int intProperty(Properties properties, String name, int defaultValue) {
        String raw = properties.getProperty(PROPERTY_PREFIX + name);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PROPERTY_PREFIX + name + " is not a number: " + raw, e);
        }
    }
}
