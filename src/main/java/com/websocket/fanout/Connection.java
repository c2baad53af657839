package com.websocket.fanout;

import java.io.Closeable;
import java.io.IOException;

/**
 * One client's duplex text channel, as seen by its {@link Session}.
 * <p>
 * Implementations allow one reader and one writer to work concurrently. {@link #close()}
 * must unblock a pending {@link #readText()} and may be called more than once.
 */
public interface Connection extends Closeable {

    /** Identifier used in logs. */
    String id();

    /**
     * Blocks for the next complete text message.
     *
     * @return the text, or {@code null} once the peer has ended the stream cleanly
     * @throws IOException if the transport failed or was closed locally
     */
    String readText() throws IOException;

    void sendText(String text) throws IOException;

    @Override
    void close();
}
