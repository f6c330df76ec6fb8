package com.automate.ScanOps.client;

import com.automate.ScanOps.Models.StatusEvent;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScanOpsStatusClientTest {

    private static final UUID RUN_ID = UUID.fromString("7b0c6a2e-51f4-4c55-9d7e-0a4f2f3f9e11");

    private HttpServer server;
    private ScanOpsStatusClient client;
    private final AtomicInteger polls = new AtomicInteger();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        client = ScanOpsStatusClient.create("http://localhost:" + server.getAddress().getPort(), "token",
                Duration.ofMillis(50));
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void send(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } else {
            exchange.close();
        }
    }

    private static String snapshot(String status, String stdout, Integer exitCode) {
        return "{\"runId\":\"" + RUN_ID + "\",\"target\":\"scanme.example.com\",\"status\":\"" + status + "\","
                + "\"exitCode\":" + exitCode + ",\"stdout\":\"" + stdout + "\",\"stderr\":\"\","
                + "\"durationSeconds\":" + (exitCode == null ? "null" : "4") + ",\"errorMessage\":null}";
    }

    private void serveSnapshots(String... bodies) {
        server.createContext("/api/runs/" + RUN_ID + "/status", exchange -> {
            int i = Math.min(polls.getAndIncrement(), bodies.length - 1);
            send(exchange, 200, "application/json", bodies[i]);
        });
    }

    private static List<StatusEvent.Type> types(List<StatusEvent> events) {
        return events.stream().map(StatusEvent::type).toList();
    }

    @Test
    void followsPushStreamUntilTerminal() {
        server.createContext("/api/sse/runs/" + RUN_ID, exchange -> send(exchange, 200, "text/event-stream",
                "event:init\ndata:{\"type\":\"init\",\"data\":{\"status\":\"RUNNING\",\"target\":\"scanme.example.com\"}}\n\n"
                        + "event:output-chunk\ndata:{\"type\":\"output-chunk\",\"data\":{\"stream\":\"stdout\",\"chunk\":\"80/tcp open\"}}\n\n"
                        + "event:completed\ndata:{\"type\":\"completed\",\"data\":{\"status\":\"COMPLETED\",\"exitCode\":0,\"duration\":4}}\n\n"));
        serveSnapshots(snapshot("COMPLETED", "80/tcp open", 0));

        List<StatusEvent> events = client.followRun(RUN_ID).collectList().block(Duration.ofSeconds(10));

        assertEquals(List.of(StatusEvent.Type.INIT, StatusEvent.Type.OUTPUT_CHUNK, StatusEvent.Type.COMPLETED), types(events));
        assertEquals(0, polls.get());
    }

    @Test
    void fallsBackToPollingWhenPushFails() {
        server.createContext("/api/sse/runs/" + RUN_ID, exchange -> send(exchange, 503, "application/json", "{}"));
        serveSnapshots(
                snapshot("RUNNING", "", null),
                snapshot("RUNNING", "22/tcp open", null),
                snapshot("COMPLETED", "22/tcp open\\n80/tcp open", 0));

        StepVerifier.create(client.followRun(RUN_ID))
                .assertNext(e -> assertEquals(StatusEvent.Type.INIT, e.type()))
                .assertNext(e -> assertEquals("22/tcp open", e.data().get("chunk")))
                .assertNext(e -> assertEquals("\n80/tcp open", e.data().get("chunk")))
                .assertNext(e -> {
                    assertEquals(StatusEvent.Type.COMPLETED, e.type());
                    assertEquals(0, e.data().get("exitCode"));
                })
                .expectComplete()
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void pushEndingEarlyDoesNotRepeatInit() {
        server.createContext("/api/sse/runs/" + RUN_ID, exchange -> send(exchange, 200, "text/event-stream",
                "event:init\ndata:{\"type\":\"init\",\"data\":{\"status\":\"RUNNING\",\"target\":\"scanme.example.com\"}}\n\n"));
        serveSnapshots(snapshot("COMPLETED", "done", 0));

        List<StatusEvent> events = client.followRun(RUN_ID).collectList().block(Duration.ofSeconds(10));

        assertEquals(List.of(StatusEvent.Type.INIT, StatusEvent.Type.OUTPUT_CHUNK, StatusEvent.Type.COMPLETED), types(events));
        assertEquals(1, events.stream().filter(StatusEvent::isTerminal).count());
    }

    @Test
    void outputAlreadyPushedIsNotRepeatedAfterFallback() {
        server.createContext("/api/sse/runs/" + RUN_ID, exchange -> send(exchange, 200, "text/event-stream",
                "event:init\ndata:{\"type\":\"init\",\"data\":{\"status\":\"RUNNING\",\"target\":\"scanme.example.com\"}}\n\n"
                        + "event:output-chunk\ndata:{\"type\":\"output-chunk\",\"data\":{\"stream\":\"stdout\",\"chunk\":\"80/tcp open\"}}\n\n"));
        serveSnapshots(snapshot("COMPLETED", "80/tcp open", 0));

        List<StatusEvent> events = client.followRun(RUN_ID).collectList().block(Duration.ofSeconds(10));

        assertEquals(List.of(StatusEvent.Type.INIT, StatusEvent.Type.OUTPUT_CHUNK, StatusEvent.Type.COMPLETED), types(events));
        assertEquals(1, events.stream().filter(e -> e.type() == StatusEvent.Type.OUTPUT_CHUNK).count());
    }

    @Test
    void onlyTheUnpushedTailOfOutputIsSentAfterFallback() {
        server.createContext("/api/sse/runs/" + RUN_ID, exchange -> send(exchange, 200, "text/event-stream",
                "event:output-chunk\ndata:{\"type\":\"output-chunk\",\"data\":{\"stream\":\"stdout\",\"chunk\":\"22/tcp open\"}}\n\n"));
        serveSnapshots(snapshot("COMPLETED", "22/tcp open\\n80/tcp open", 0));

        List<StatusEvent> events = client.followRun(RUN_ID).collectList().block(Duration.ofSeconds(10));

        List<Object> chunks = events.stream()
                .filter(e -> e.type() == StatusEvent.Type.OUTPUT_CHUNK)
                .map(e -> e.data().get("chunk"))
                .toList();
        assertEquals(List.of("22/tcp open", "\n80/tcp open"), chunks);
        assertEquals(StatusEvent.Type.COMPLETED, events.get(events.size() - 1).type());
    }

    @Test
    void stepEventsAlreadyPushedAreDropped() {
        ScanOpsStatusClient.DeliveredEvents delivered = new ScanOpsStatusClient.DeliveredEvents();
        delivered.pushed(StatusEvent.init("RUNNING", "scanme.example.com"));
        delivered.pushed(StatusEvent.toolStart(1, "Intelligence Planning", null, "INTELLIGENCE_PLANNING"));
        delivered.pushed(StatusEvent.toolComplete(1, null, "COMPLETED", 0L, null));
        delivered.pushed(StatusEvent.toolStart(2, "Port and Service Scan", "nmap", "AUTOMATED_SCAN"));

        assertNull(delivered.polled(StatusEvent.init("RUNNING", "scanme.example.com")));
        assertNull(delivered.polled(StatusEvent.toolStart(1, "Intelligence Planning", null, "INTELLIGENCE_PLANNING")));
        assertNull(delivered.polled(StatusEvent.toolComplete(1, null, "COMPLETED", 0L, null)));
        assertNull(delivered.polled(StatusEvent.toolStart(2, "Port and Service Scan", "nmap", "AUTOMATED_SCAN")));

        StatusEvent done = StatusEvent.toolComplete(2, "nmap", "COMPLETED", 3L, RUN_ID);
        assertSame(done, delivered.polled(done));
        assertNull(delivered.polled(done));
        assertFalse(delivered.terminalSeen());
    }
}
