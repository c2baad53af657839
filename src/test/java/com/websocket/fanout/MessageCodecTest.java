package com.websocket.fanout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Test
    public void testEncodeKeepsFieldOrder() {
        assertEquals("{\"author\":\"Server\",\"body\":\"Welcome!\"}", codec.encode(Message.fromServer("Welcome!")));
    }

    @Test
    public void testDecode() throws Exception {
        assertEquals(new Message("A", "hi"), codec.decode("{\"author\":\"A\",\"body\":\"hi\"}"));
    }

    @Test
    public void testDecodeIgnoresUnknownFields() throws Exception {
        Message message = codec.decode("{\"body\":\"hi\",\"author\":\"A\",\"room\":\"lobby\"}");
        assertEquals(new Message("A", "hi"), message);
    }

    @Test
    public void testMissingFieldDecodesAsEmpty() throws Exception {
        assertEquals(new Message("", "anonymous"), codec.decode("{\"body\":\"anonymous\"}"));
        assertEquals(new Message("A", ""), codec.decode("{\"author\":\"A\",\"body\":null}"));
    }

    @Test
    public void testEmptyObjectReencodesAsEmptyStrings() throws Exception {
        assertEquals("{\"author\":\"\",\"body\":\"\"}", codec.encode(codec.decode("{}")));
    }

    @Test
    public void testNonJsonIsRejected() {
        assertThrows(MessageFormatException.class, () -> codec.decode("hello there"));
    }

    @Test
    public void testNonObjectIsRejected() {
        assertThrows(MessageFormatException.class, () -> codec.decode("[\"A\",\"hi\"]"));
        assertThrows(MessageFormatException.class, () -> codec.decode("null"));
    }

    @Test
    public void testTrailingGarbageIsRejected() {
        assertThrows(MessageFormatException.class, () -> codec.decode("{\"author\":\"A\",\"body\":\"hi\"} extra"));
    }
}
