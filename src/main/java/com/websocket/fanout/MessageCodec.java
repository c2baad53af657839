package com.websocket.fanout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;

/**
 * JSON envelope: {@code {"author": "...", "body": "..."}} in both directions.
 */
public class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(new ObjectMapper()
              .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Message message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            // two strings always serialize
            throw new UncheckedIOException(e);
        }
    }

    public Message decode(String text) throws MessageFormatException {
        Message message;
        try {
            message = mapper.readValue(text, Message.class);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Malformed message: " + e.getOriginalMessage(), e);
        }
        if (message == null) {
            throw new MessageFormatException("Empty message");
        }
        if (message.getAuthor() == null || message.getBody() == null) {
            // absent fields go out as empty strings, never as null
            return new Message(orEmpty(message.getAuthor()), orEmpty(message.getBody()));
        }
        return message;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
