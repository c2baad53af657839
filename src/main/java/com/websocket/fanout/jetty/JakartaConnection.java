package com.websocket.fanout.jetty;

import com.websocket.fanout.Connection;
import jakarta.websocket.CloseReason;
import jakarta.websocket.Session;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns Jakarta's push callbacks into the pull-style {@link Connection} a session reads
 * from. Container threads only enqueue; the session's read loop takes.
 */
@Slf4j
public class JakartaConnection implements Connection {

    private final Session session;
    private final String id;
    /** Empty marks the end of the stream. */
    private final BlockingQueue<Optional<String>> frames = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public JakartaConnection(Session session) {
        this.session = session;
        this.id = "jetty-" + session.getId();
    }

    @Override
    public String id() {
        return id;
    }

    void push(String text) {
        frames.add(Optional.of(text));
    }

    void endOfStream() {
        frames.add(Optional.empty());
    }

    @Override
    public String readText() throws IOException {
        try {
            return frames.take().orElse(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for a frame from " + id);
        }
    }

    @Override
    public void sendText(String text) throws IOException {
        if (closed.get()) {
            throw new IOException("Connection " + id + " is closed");
        }
        session.getBasicRemote().sendText(text);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        endOfStream();
        if (session.isOpen()) {
            try {
                session.close(new CloseReason(CloseReason.CloseCodes.NORMAL_CLOSURE, "Session ended"));
            } catch (IOException e) {
                log.debug("Closing {} failed: {}", id, e.getMessage());
            }
        }
    }
}
