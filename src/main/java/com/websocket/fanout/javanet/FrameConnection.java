package com.websocket.fanout.javanet;

import com.websocket.fanout.Connection;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

// 0x80    1000 0000   FIN
// 0x40    0100 0000   RSV1
// 0x20    0010 0000   RSV2
// 0x10    0001 0000   RSV3
// 0x0F    0000 1111   opcode
// 0x7F    0111 1111   payload length

/* ---------------------------------------------------------------------------
   FrameConnection: RFC 6455 frames over an upgraded socket.
   Text only, fragmentation reassembly, ping/pong, close handshake.
   --------------------------------------------------------------------------- */
@Slf4j
public class FrameConnection implements Connection {

    static final int OP_CONTINUATION = 0x0;
    static final int OP_TEXT = 0x1;
    static final int OP_BINARY = 0x2;
    static final int OP_CLOSE = 0x8;
    static final int OP_PING = 0x9;
    static final int OP_PONG = 0xA;

    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_PROTOCOL_ERROR = 1002;
    static final int CLOSE_UNSUPPORTED_DATA = 1003;
    static final int CLOSE_INVALID_PAYLOAD = 1007;
    static final int CLOSE_TOO_BIG = 1009;

    private static final int CTRL_MAX_LEN = 125;           // RFC: control frames <= 125
    static final int MAX_MESSAGE_BYTES = 1024 * 1024;       // assembled message limit

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final String id;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closeSent = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    // Fragmentation assembly state, reader thread only
    private boolean assembling = false;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(4096);

    public FrameConnection(Socket socket, InputStream in, OutputStream out) {
        this.socket = socket;
        this.in = in;
        this.out = out;
        this.id = "ws-" + SEQUENCE.incrementAndGet() + "@" + socket.getRemoteSocketAddress();
    }

    @Override
    public String id() {
        return id;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String readText() throws IOException {
        while (true) {
            int b1 = in.read();
            if (b1 == -1) {
                // peer went away between frames
                return null;
            }
            int b2 = readByte();
            boolean fin = (b1 & 0x80) != 0;
            boolean rsv = (b1 & 0x70) != 0;
            int opcode = (b1 & 0x0F);
            boolean masked = (b2 & 0x80) != 0;
            long payloadLen = decodeExtendedLength(b2 & 0x7F);

            if (rsv) {
                fail(CLOSE_PROTOCOL_ERROR, "RSV bits set but no extension negotiated");
            }
            if (!masked) {
                fail(CLOSE_PROTOCOL_ERROR, "Client frames MUST be masked");
            }
            boolean isControl = (opcode & 0x08) != 0;
            if (isControl) {
                if (!fin) {
                    fail(CLOSE_PROTOCOL_ERROR, "Control frames must not be fragmented");
                }
                if (payloadLen > CTRL_MAX_LEN) {
                    fail(CLOSE_PROTOCOL_ERROR, "Control frame too large");
                }
            } else if ((assembling ? buffer.size() + payloadLen : payloadLen) > MAX_MESSAGE_BYTES) {
                fail(CLOSE_TOO_BIG, "Message too large");
            }

            byte[] mask = readN(4);
            byte[] payload = readN((int) payloadLen);
            for (int i = 0; i < payload.length; i++) {
                payload[i] = (byte) (payload[i] ^ mask[i & 3]);
            }

            switch (opcode) {
                case OP_TEXT:
                    if (assembling) {
                        fail(CLOSE_PROTOCOL_ERROR, "Received new data frame while continuation expected");
                    }
                    if (fin) {
                        return decodeText(payload);
                    }
                    assembling = true;
                    buffer.reset();
                    buffer.write(payload);
                    break;

                case OP_CONTINUATION:
                    if (!assembling) {
                        fail(CLOSE_PROTOCOL_ERROR, "Unexpected continuation");
                    }
                    buffer.write(payload);
                    if (fin) {
                        assembling = false;
                        byte[] full = buffer.toByteArray();
                        buffer.reset();
                        return decodeText(full);
                    }
                    break;

                case OP_BINARY:
                    fail(CLOSE_UNSUPPORTED_DATA, "Binary messages are not supported");
                    break;

                case OP_CLOSE:
                    handleClose(payload);
                    return null;

                case OP_PING:
                    // pong must carry identical payload
                    sendControlFrame(OP_PONG, payload);
                    break;

                case OP_PONG:
                    log.trace("Pong from {}", id);
                    break;

                default:
                    fail(CLOSE_UNSUPPORTED_DATA, "Unsupported opcode " + opcode);
            }
        }
    }

    @Override
    public void sendText(String text) throws IOException {
        if (closed.get()) {
            throw new IOException("Connection " + id + " is closed");
        }
        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        writeLock.lock();
        try {
            out.write(0x80 | OP_TEXT);
            int len = payload.length;
            if (len <= 125) {
                out.write(len);
            } else if (len <= 0xFFFF) {
                out.write(126);
                out.write((len >>> 8) & 0xFF);
                out.write(len & 0xFF);
            } else {
                out.write(127);
                for (int i = 7; i >= 0; i--) {
                    out.write((int) ((long) len >>> (8 * i)) & 0xFF);
                }
            }
            out.write(payload);
            out.flush();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Sends a normal close frame if the writer is not stuck mid-frame, then closes the
     * socket. Any blocked {@link #readText()} fails with a {@link java.net.SocketException}.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        trySendClose(CLOSE_NORMAL, "");
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Closing {} failed: {}", id, e.getMessage());
        }
        log.debug("[CONNECTION] Closed {}", id);
    }

    /* ----------------------------- Close handling ------------------------- */

    private void handleClose(byte[] payload) throws IOException {
        int code = CLOSE_NORMAL;
        String reason = "";
        if (payload.length >= 2) {
            code = ((payload[0] & 0xFF) << 8) | (payload[1] & 0xFF);
            if (payload.length > 2) {
                byte[] r = Arrays.copyOfRange(payload, 2, payload.length);
                if (!isValidUtf8(r)) {
                    fail(CLOSE_INVALID_PAYLOAD, "Invalid UTF-8 in close reason");
                }
                reason = new String(r, StandardCharsets.UTF_8);
            }
        }
        log.debug("[CLOSE] {} sent close code={} reason={}", id, code, reason);
        // Echo close with same code/reason
        trySendClose(code, reason);
    }

    private void fail(int code, String reason) throws WebSocketProtocolException {
        log.debug("[ERROR] {} violated the protocol: {}", id, reason);
        trySendClose(code, reason);
        throw new WebSocketProtocolException(code, reason);
    }

    private void trySendClose(int code, String reason) {
        if (!closeSent.compareAndSet(false, true)) {
            return;
        }
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        payload.write((code >>> 8) & 0xFF);
        payload.write(code & 0xFF);
        byte[] r = reason.getBytes(StandardCharsets.UTF_8);
        payload.write(r, 0, Math.min(r.length, CTRL_MAX_LEN - 2));
        // a writer blocked on a slow peer keeps the lock; skip the frame rather than wait
        if (!writeLock.tryLock()) {
            log.debug("Skipped close frame to {}: writer busy", id);
            return;
        }
        try {
            writeControlFrame(OP_CLOSE, payload.toByteArray());
        } catch (IOException e) {
            log.debug("Close frame to {} not sent: {}", id, e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }

    private void sendControlFrame(int opcode, byte[] payload) throws IOException {
        writeLock.lock();
        try {
            writeControlFrame(opcode, payload);
        } finally {
            writeLock.unlock();
        }
    }

    // Control frames must be <=125 and not masked (server->client)
    private void writeControlFrame(int opcode, byte[] payload) throws IOException {
        out.write(0x80 | (opcode & 0x0F));
        out.write(payload.length & 0x7F);
        if (payload.length > 0) {
            out.write(payload);
        }
        out.flush();
    }

    /* ----------------------------- IO helpers ----------------------------- */

    private int readByte() throws IOException {
        int b = in.read();
        if (b == -1) {
            throw new EOFException("Stream ended inside a frame");
        }
        return b & 0xFF;
    }

    private byte[] readN(int n) throws IOException {
        byte[] buf = new byte[n];
        int off = 0;
        while (off < n) {
            int r = in.read(buf, off, n - off);
            if (r == -1) {
                throw new EOFException("Stream ended inside a frame");
            }
            off += r;
        }
        return buf;
    }

    private long decodeExtendedLength(int len7) throws IOException {
        long payloadLen = len7;
        if (len7 == 126) {
            payloadLen = (readByte() << 8) | readByte();
        } else if (len7 == 127) {
            payloadLen = 0;
            for (int i = 0; i < 8; i++) {
                payloadLen = (payloadLen << 8) | readByte();
            }
            // Per RFC: the most significant bit MUST be 0
            if (payloadLen < 0) {
                fail(CLOSE_PROTOCOL_ERROR, "Invalid 64-bit payload length");
            }
        }
        return payloadLen;
    }

    private String decodeText(byte[] payload) throws WebSocketProtocolException {
        if (!isValidUtf8(payload)) {
            fail(CLOSE_INVALID_PAYLOAD, "Invalid UTF-8");
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    private static boolean isValidUtf8(byte[] data) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                  .onMalformedInput(CodingErrorAction.REPORT)
                  .onUnmappableCharacter(CodingErrorAction.REPORT)
                  .decode(ByteBuffer.wrap(data));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }
}
