package com.websocket.fanout;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server side of one client connection.
 * <p>
 * Two loops run per session. The write loop drains the bounded inbound queue onto the
 * connection; the read loop decodes what the client sends and hands it to the
 * {@link Broadcaster}. Whichever side stops first terminates the session, which
 * removes it from the registry, interrupts the writer and closes the connection so
 * the reader wakes up. Termination happens once.
 */
@Slf4j
public class Session implements AutoCloseable {

    private static final long WRITER_EXIT_TIMEOUT_SECONDS = 5;

    private final Connection connection;
    private final SessionRegistry registry;
    private final Broadcaster broadcaster;
    private final MessageCodec codec;
    private final ExecutorService executor;
    private final BlockingQueue<Message> inbound;
    private final int maxConsecutiveReadErrors;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.ACTIVE);
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch writerExited = new CountDownLatch(1);
    private final Object writerLock = new Object();
    private Thread writerThread; // guarded by writerLock

    public Session(Connection connection, SessionRegistry registry, Broadcaster broadcaster,
          MessageCodec codec, ExecutorService executor, FanoutConfig config) {
        this.connection = connection;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.codec = codec;
        this.executor = executor;
        this.inbound = new ArrayBlockingQueue<>(config.getQueueCapacity());
        this.maxConsecutiveReadErrors = config.getMaxConsecutiveReadErrors();
    }

    public String id() {
        return connection.id();
    }

    public SessionState state() {
        return state.get();
    }

    /** Messages queued and not yet written. */
    public int pending() {
        return inbound.size();
    }

    public int capacity() {
        return inbound.size() + inbound.remainingCapacity();
    }

    /**
     * Queues a message for this client without blocking.
     *
     * @return false if the queue is full or the session is no longer active; the
     *         message is then dropped for this client
     */
    public boolean offer(Message message) {
        if (state.get() != SessionState.ACTIVE) {
            return false;
        }
        return inbound.offer(message);
    }

    /**
     * Writes straight to the connection, bypassing the queue. Only valid before
     * {@link #run()}, while nothing else writes.
     */
    public void sendDirect(Message message) throws IOException {
        if (started.get()) {
            throw new IllegalStateException("Session " + id() + " is already running");
        }
        connection.sendText(codec.encode(message));
    }

    /**
     * Starts the write loop on the executor and runs the read loop on the calling thread.
     * Returns after both loops have ended and the connection is released.
     */
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Session " + id() + " already started");
        }
        try {
            try {
                executor.execute(this::writeLoop);
            } catch (RejectedExecutionException e) {
                log.warn("No worker available for the write side of session {}", id());
                writerExited.countDown();
                return;
            }
            readLoop();
        } finally {
            terminate();
            awaitWriter();
            state.set(SessionState.CLOSED);
            log.info("Session {} closed", id());
        }
    }

    /**
     * Raises the termination signal. The first call removes the session from the
     * registry, interrupts the writer and closes the connection; later calls do nothing.
     */
    public void terminate() {
        if (!state.compareAndSet(SessionState.ACTIVE, SessionState.TERMINATING)) {
            return;
        }
        log.debug("Terminating session {}", id());
        registry.remove(this);
        synchronized (writerLock) {
            if (writerThread != null) {
                writerThread.interrupt();
            }
        }
        connection.close();
    }

    /**
     * Terminates the session. A session that never ran is closed at once; a running one
     * reaches {@link SessionState#CLOSED} when {@link #run()} returns.
     */
    @Override
    public void close() {
        terminate();
        if (!started.get()) {
            state.compareAndSet(SessionState.TERMINATING, SessionState.CLOSED);
        }
    }

    private void writeLoop() {
        synchronized (writerLock) {
            writerThread = Thread.currentThread();
        }
        try {
            while (state.get() == SessionState.ACTIVE) {
                Message message = inbound.take();
                connection.sendText(codec.encode(message));
                log.debug("Sent {} to session {}", message, id());
            }
        } catch (InterruptedException e) {
            log.debug("Write loop of session {} stopped by termination", id());
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (state.get() == SessionState.ACTIVE) {
                log.warn("Send to session {} failed: {}", id(), e.getMessage());
            }
        } finally {
            synchronized (writerLock) {
                writerThread = null;
            }
            // the reader may be parked on the connection
            terminate();
            writerExited.countDown();
        }
    }

    private void readLoop() {
        int consecutiveErrors = 0;
        while (state.get() == SessionState.ACTIVE) {
            String text;
            try {
                text = connection.readText();
            } catch (IOException e) {
                if (state.get() == SessionState.ACTIVE) {
                    log.warn("Read from session {} failed: {}", id(), e.toString());
                }
                return;
            }
            if (text == null) {
                log.info("Session {} ended the stream", id());
                return;
            }
            try {
                Message message = codec.decode(text);
                consecutiveErrors = 0;
                log.debug("Received {} from session {}", message, id());
                broadcaster.broadcast(message);
            } catch (MessageFormatException e) {
                consecutiveErrors++;
                log.warn("Skipping frame from session {} ({}/{}): {}",
                      id(), consecutiveErrors, maxConsecutiveReadErrors, e.getMessage());
                if (consecutiveErrors >= maxConsecutiveReadErrors) {
                    log.warn("Dropping session {} after {} undecodable frames in a row", id(), consecutiveErrors);
                    return;
                }
            }
        }
    }

    private void awaitWriter() {
        try {
            if (!writerExited.await(WRITER_EXIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Write loop of session {} did not stop within {}s", id(), WRITER_EXIT_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "Session[" + id() + ", " + state.get() + "]";
    }
}
