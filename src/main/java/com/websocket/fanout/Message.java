package com.websocket.fanout;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * The unit exchanged between clients: who wrote it and what it says.
 * Equal messages are interchangeable; there is no identity beyond the two fields.
 */
@Value
@JsonPropertyOrder({"author", "body"})
@JsonIgnoreProperties(ignoreUnknown = true)
public class Message {

    public static final String SERVER_AUTHOR = "Server";

    String author;
    String body;

    public static Message fromServer(String body) {
        return new Message(SERVER_AUTHOR, body);
    }
}
