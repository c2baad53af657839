package com.websocket.fanout.javanet;

import java.io.IOException;

/**
 * The request head could not be parsed; answered with 400.
 */
public class BadRequestException extends IOException {

    public BadRequestException(String message) {
        super(message);
    }
}
