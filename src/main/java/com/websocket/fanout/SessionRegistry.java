package com.websocket.fanout;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * Live sessions of one server. Iteration walks a snapshot in registration order, so
 * fan-out never sees a half-applied add or remove.
 */
@Slf4j
public class SessionRegistry {

    private final Set<Session> sessions = new CopyOnWriteArraySet<>();

    public void add(Session session) {
        if (sessions.add(session)) {
            log.debug("Registered session {} ({} live)", session.id(), sessions.size());
        }
    }

    public void remove(Session session) {
        if (sessions.remove(session)) {
            log.debug("Removed session {} ({} live)", session.id(), sessions.size());
        }
    }

    public void forEach(Consumer<? super Session> action) {
        sessions.forEach(action);
    }

    public boolean contains(Session session) {
        return sessions.contains(session);
    }

    public int size() {
        return sessions.size();
    }
}
