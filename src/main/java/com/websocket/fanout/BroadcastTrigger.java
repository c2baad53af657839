package com.websocket.fanout;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Side entry into the broadcast: the server itself speaks to every client.
 */
@Slf4j
@RequiredArgsConstructor
public class BroadcastTrigger {

    private final Broadcaster broadcaster;
    private final String prefix;

    /**
     * @return the confirmation returned to the caller
     */
    public String trigger(String body) {
        log.info("Triggered broadcast: {}", body);
        broadcaster.broadcast(Message.fromServer(body));
        return "Broadcasting " + body;
    }

    /**
     * @throws IllegalArgumentException if the path carries no message
     */
    public String handle(String path) {
        return trigger(TriggerPath.parse(path, prefix));
    }

    /** True if the path belongs to the trigger, including malformed forms such as {@code /broadcast}. */
    public boolean matches(String path) {
        return path.startsWith(prefix) || path.equals(prefix.substring(0, prefix.length() - 1));
    }
}
