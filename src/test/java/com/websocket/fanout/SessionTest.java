package com.websocket.fanout;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class SessionTest {

    private final MessageCodec codec = new MessageCodec();
    private final SessionRegistry registry = new SessionRegistry();
    private final Broadcaster broadcaster = new Broadcaster(registry);
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private Session newSession(InMemoryConnection connection, FanoutConfig config) {
        return new Session(connection, registry, broadcaster, codec, executor, config);
    }

    private Session newSession(InMemoryConnection connection) {
        return newSession(connection, FanoutConfig.defaults());
    }

    private CompletableFuture<Void> runInBackground(Session session) {
        return CompletableFuture.runAsync(session::run, executor);
    }

    @Test
    public void testOfferIsBoundedByCapacity() {
        Session session = newSession(new InMemoryConnection(), FanoutConfig.builder().queueCapacity(2).build());

        assertTrue(session.offer(new Message("A", "1")));
        assertTrue(session.offer(new Message("A", "2")));
        assertFalse(session.offer(new Message("A", "3")), "third message must be dropped, not block");
        assertEquals(2, session.pending());
        assertEquals(2, session.capacity());
    }

    @Test
    public void testWriteLoopSendsQueuedMessagesInOrder() throws Exception {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection);
        session.offer(new Message("A", "first"));
        session.offer(new Message("B", "second"));

        CompletableFuture<Void> running = runInBackground(session);

        assertEquals(codec.encode(new Message("A", "first")), connection.awaitSent());
        assertEquals(codec.encode(new Message("B", "second")), connection.awaitSent());

        connection.clientHangsUp();
        running.get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testReadMessageIsBroadcastIncludingSelf() throws Exception {
        InMemoryConnection connectionA = new InMemoryConnection();
        Session a = newSession(connectionA);
        Session b = newSession(new InMemoryConnection());
        registry.add(a);
        registry.add(b);
        CompletableFuture<Void> running = runInBackground(a);

        connectionA.clientSends("{\"author\":\"A\",\"body\":\"hi\"}");

        assertEquals(codec.encode(new Message("A", "hi")), connectionA.awaitSent(), "sender hears its own message");
        Conditions.await("b received the message", () -> b.pending() == 1);

        connectionA.clientHangsUp();
        running.get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testCleanEndOfStreamReleasesEverythingOnce() throws Exception {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection);
        registry.add(session);
        CompletableFuture<Void> running = runInBackground(session);

        connection.clientHangsUp();
        running.get(5, TimeUnit.SECONDS);

        assertEquals(SessionState.CLOSED, session.state());
        assertFalse(registry.contains(session));
        assertEquals(1, connection.closeCalls());
        assertFalse(session.offer(new Message("Server", "late")));
    }

    @Test
    public void testUndecodableFramesAreSkipped() throws Exception {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection);
        registry.add(session);
        CompletableFuture<Void> running = runInBackground(session);

        connection.clientSends("not json");
        connection.clientSends("{\"author\":\"A\",\"body\":\"still here\"}");

        assertEquals(codec.encode(new Message("A", "still here")), connection.awaitSent());
        assertEquals(SessionState.ACTIVE, session.state());

        connection.clientHangsUp();
        running.get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testTooManyUndecodableFramesTerminate() throws Exception {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection, FanoutConfig.builder().maxConsecutiveReadErrors(3).build());
        registry.add(session);
        CompletableFuture<Void> running = runInBackground(session);

        connection.clientSends("garbage");
        connection.clientSends("{\"author\":\"A\",\"body\":\"resets the count\"}");
        connection.clientSends("garbage");
        connection.clientSends("garbage");
        connection.clientSends("garbage");

        running.get(5, TimeUnit.SECONDS);
        assertEquals(SessionState.CLOSED, session.state());
        assertFalse(registry.contains(session));
        assertEquals(1, connection.closeCalls());
    }

    @Test
    public void testTerminateStopsBothLoops() throws Exception {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection);
        registry.add(session);
        CompletableFuture<Void> running = runInBackground(session);

        session.terminate();
        session.terminate();

        running.get(5, TimeUnit.SECONDS);
        assertEquals(SessionState.CLOSED, session.state());
        assertFalse(registry.contains(session));
        assertEquals(1, connection.closeCalls());
    }

    @Test
    public void testSendFailureTerminates() throws Exception {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection);
        registry.add(session);
        connection.failSends();
        CompletableFuture<Void> running = runInBackground(session);

        session.offer(new Message("Server", "nobody hears this"));

        running.get(5, TimeUnit.SECONDS);
        assertEquals(SessionState.CLOSED, session.state());
        assertFalse(registry.contains(session));
        assertEquals(1, connection.closeCalls());
    }

    @Test
    public void testCloseBeforeRun() {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection);
        registry.add(session);

        session.close();
        session.close();

        assertEquals(SessionState.CLOSED, session.state());
        assertFalse(registry.contains(session));
        assertEquals(1, connection.closeCalls());
    }

    @Test
    public void testRunTwiceIsRejected() throws Exception {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection);
        connection.clientHangsUp();
        session.run();

        assertThrows(IllegalStateException.class, session::run);
    }

    @Test
    public void testSendDirectOnlyBeforeRun() throws Exception {
        InMemoryConnection connection = new InMemoryConnection();
        Session session = newSession(connection);

        session.sendDirect(Message.fromServer("hello"));
        assertEquals(codec.encode(Message.fromServer("hello")), connection.awaitSent());

        connection.clientHangsUp();
        session.run();
        assertThrows(IllegalStateException.class, () -> session.sendDirect(Message.fromServer("too late")));
    }
}
