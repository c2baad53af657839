package com.websocket.fanout;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The one path every message takes to reach clients.
 * <p>
 * Delivery is best effort: a session whose queue is full loses the message, and the
 * caller is never told. Slow clients therefore cannot stall a broadcast.
 */
@Slf4j
@RequiredArgsConstructor
public class Broadcaster {

    private final SessionRegistry registry;

    public void broadcast(Message message) {
        log.debug("Broadcasting {} to {} sessions", message, registry.size());
        registry.forEach(session -> {
            if (!session.offer(message)) {
                log.debug("Dropped message for session {} (queue full or closing)", session.id());
            }
        });
    }
}
