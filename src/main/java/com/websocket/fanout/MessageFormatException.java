package com.websocket.fanout;

import java.io.IOException;

/**
 * A frame arrived intact but does not hold a {@link Message}.
 */
public class MessageFormatException extends IOException {

    public MessageFormatException(String message) {
        super(message);
    }

    public MessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
