package com.websocket.fanout.javanet;

import lombok.Getter;

import java.io.IOException;

/**
 * The peer broke the framing rules. The close frame carrying {@link #getCloseCode()}
 * has already been sent when this is thrown.
 */
@Getter
public class WebSocketProtocolException extends IOException {

    private final int closeCode;

    public WebSocketProtocolException(int closeCode, String reason) {
        super(reason + " (close " + closeCode + ")");
        this.closeCode = closeCode;
    }
}
