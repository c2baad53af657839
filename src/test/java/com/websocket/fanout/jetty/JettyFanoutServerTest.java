package com.websocket.fanout.jetty;

import com.websocket.fanout.Conditions;
import com.websocket.fanout.FanoutConfig;
import com.websocket.fanout.Message;
import com.websocket.fanout.MessageCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class JettyFanoutServerTest {

    private final MessageCodec codec = new MessageCodec();
    private final HttpClient http = HttpClient.newBuilder()
          .version(HttpClient.Version.HTTP_1_1)
          .connectTimeout(Duration.ofSeconds(5))
          .build();

    private JettyFanoutServer server;

    @BeforeEach
    void startServer() throws Exception {
        server = new JettyFanoutServer(FanoutConfig.builder()
              .transport(FanoutConfig.Transport.JETTY)
              .port(0)
              .build());
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    /** Collects whole text messages, reassembling partial deliveries. */
    private static final class Inbox implements WebSocket.Listener {
        private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        String next() throws InterruptedException {
            String message = messages.poll(5, TimeUnit.SECONDS);
            assertNotNull(message, "no message within 5s");
            return message;
        }
    }

    private WebSocket connect(Inbox inbox) throws Exception {
        WebSocket socket = http.newWebSocketBuilder()
              .buildAsync(URI.create("ws://localhost:" + server.port() + "/ws"), inbox)
              .get(5, TimeUnit.SECONDS);
        assertEquals(codec.encode(Message.fromServer("Welcome!")), inbox.next());
        return socket;
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path))
              .timeout(Duration.ofSeconds(5))
              .GET()
              .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testBroadcastScenario() throws Exception {
        Inbox aInbox = new Inbox();
        Inbox bInbox = new Inbox();
        WebSocket a = connect(aInbox);
        WebSocket b = connect(bInbox);
        Conditions.await("both registered", () -> server.getRegistry().size() == 2);

        a.sendText(codec.encode(new Message("A", "hi")), true).get(5, TimeUnit.SECONDS);
        String hi = codec.encode(new Message("A", "hi"));
        assertEquals(hi, aInbox.next());
        assertEquals(hi, bInbox.next());

        HttpResponse<String> ping = get("/broadcast/ping");
        assertEquals(200, ping.statusCode());
        assertEquals("Broadcasting ping", ping.body());
        String serverPing = codec.encode(Message.fromServer("ping"));
        assertEquals(serverPing, aInbox.next());
        assertEquals(serverPing, bInbox.next());

        a.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        Conditions.await("A left the registry", () -> server.getRegistry().size() == 1);

        assertEquals(200, get("/broadcast/after").statusCode());
        assertEquals(codec.encode(Message.fromServer("after")), bInbox.next());
        b.sendClose(WebSocket.NORMAL_CLOSURE, "").get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testMalformedMessageKeepsSessionOpen() throws Exception {
        Inbox inbox = new Inbox();
        WebSocket socket = connect(inbox);

        socket.sendText("not json", true).get(5, TimeUnit.SECONDS);
        socket.sendText(codec.encode(new Message("A", "still here")), true).get(5, TimeUnit.SECONDS);

        assertEquals(codec.encode(new Message("A", "still here")), inbox.next());
        socket.sendClose(WebSocket.NORMAL_CLOSURE, "").get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testTriggerStatusCodes() throws Exception {
        assertEquals("Broadcasting hello world", get("/broadcast/hello%20world").body());
        assertEquals(400, get("/broadcast/").statusCode());
        assertEquals(404, get("/elsewhere").statusCode());
    }
}
