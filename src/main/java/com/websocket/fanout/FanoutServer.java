package com.websocket.fanout;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns everything one broadcast server shares: the registry, the broadcaster, the
 * worker pool and the two entry points. Transports subclass it and only bind sockets.
 */
@Slf4j
@Getter
public abstract class FanoutServer implements AutoCloseable {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    protected final FanoutConfig config;
    private final SessionRegistry registry;
    private final Broadcaster broadcaster;
    private final MessageCodec codec;
    private final ExecutorService executor;
    private final ConnectionAcceptor acceptor;
    private final BroadcastTrigger trigger;

    protected FanoutServer(FanoutConfig config) {
        this.config = config.validate();
        this.registry = new SessionRegistry();
        this.broadcaster = new Broadcaster(registry);
        this.codec = new MessageCodec();
        this.executor = newWorkerPool(config.getMaxThreads());
        this.acceptor = new ConnectionAcceptor(registry, broadcaster, codec, executor, config);
        this.trigger = new BroadcastTrigger(broadcaster, config.getTriggerPrefix());
    }

    public abstract void start() throws IOException;

    /** The bound port; differs from the configured one when that was 0. */
    public abstract int port();

    protected abstract void stopTransport();

    public void stop() {
        log.info("Stopping broadcast server on port {} ({} live sessions)", port(), registry.size());
        stopTransport();
        registry.forEach(Session::terminate);
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker pool still busy after {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Readers park a thread each for the whole connection, so tasks are handed straight
     * to a thread instead of waiting in a queue behind them.
     */
    private static ExecutorService newWorkerPool(int maxThreads) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "fanout-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
              0,
              maxThreads,
              60L, TimeUnit.SECONDS,
              new SynchronousQueue<>(),
              threads,
              new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
