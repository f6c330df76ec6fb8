package com.automate.ScanOps.client;

import com.automate.ScanOps.Models.StatusEvent;
import com.automate.ScanOps.Service.StatusEventSynthesizer;
import com.automate.ScanOps.dto.response.RunStatusSnapshot;
import com.automate.ScanOps.dto.response.SmartScanStatusSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * Follows a run or a smart scan from outside the service.
 * <p>
 * Tries the SSE endpoint first. If the push connection fails or ends before a terminal event,
 * it switches to polling the status snapshot and rebuilds the same events from consecutive
 * snapshots. Nothing push already delivered is emitted again after the switch.
 */
@Slf4j
public class ScanOpsStatusClient {

    private static final ParameterizedTypeReference<ServerSentEvent<StatusEvent>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final Duration pollInterval;

    public ScanOpsStatusClient(WebClient webClient, Duration pollInterval) {
        this.webClient = webClient;
        this.pollInterval = pollInterval;
    }

    public static ScanOpsStatusClient create(String baseUrl, String bearerToken, Duration pollInterval) {
        WebClient client = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                .build();
        return new ScanOpsStatusClient(client, pollInterval);
    }

    public Flux<StatusEvent> followRun(UUID runId) {
        return this.<RunStatusSnapshot>follow("/api/sse/runs/" + runId, "/api/runs/" + runId + "/status",
                RunStatusSnapshot.class, StatusEventSynthesizer::diff);
    }

    public Flux<StatusEvent> followSmartScan(UUID sessionId) {
        return this.<SmartScanStatusSnapshot>follow("/api/sse/smart-scans/" + sessionId, "/api/smart-scans/" + sessionId + "/status",
                SmartScanStatusSnapshot.class, StatusEventSynthesizer::diff);
    }

    private <S> Flux<StatusEvent> follow(String ssePath, String statusPath, Class<S> snapshotType,
                                         BiFunction<S, S, List<StatusEvent>> diff) {
        return Flux.defer(() -> {
            DeliveredEvents delivered = new DeliveredEvents();

            Flux<StatusEvent> push = push(ssePath)
                    .doOnNext(delivered::pushed)
                    .onErrorResume(e -> {
                        log.warn("Push stream {} failed, falling back to polling: {}", ssePath, e.toString());
                        return Flux.empty();
                    });

            Flux<StatusEvent> fallback = Flux.defer(() -> delivered.terminalSeen()
                    ? Flux.<StatusEvent>empty()
                    : poll(statusPath, snapshotType, diff).mapNotNull(delivered::polled));

            return push.concatWith(fallback);
        });
    }

    Flux<StatusEvent> push(String ssePath) {
        return webClient.get()
                .uri(ssePath)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .mapNotNull(ServerSentEvent::data)
                .takeUntil(StatusEvent::isTerminal);
    }

    <S> Flux<StatusEvent> poll(String statusPath, Class<S> snapshotType, BiFunction<S, S, List<StatusEvent>> diff) {
        return Flux.defer(() -> {
            AtomicReference<S> previous = new AtomicReference<>();
            return Flux.interval(Duration.ZERO, pollInterval)
                    .concatMap(tick -> webClient.get()
                            .uri(statusPath)
                            .accept(MediaType.APPLICATION_JSON)
                            .retrieve()
                            .bodyToMono(snapshotType))
                    .concatMapIterable(current -> diff.apply(previous.getAndSet(current), current))
                    .takeUntil(StatusEvent::isTerminal);
        });
    }

    /**
     * What the push stream already handed out, so the polling fallback only adds what is new.
     * Polled output chunks are consecutive slices of one growing text per stream; the part of a
     * slice that push already covered is cut off.
     */
    static final class DeliveredEvents {
        private boolean initSeen;
        private boolean terminalSeen;
        private final Map<String, Integer> pushedChars = new HashMap<>();
        private final Map<String, Integer> polledChars = new HashMap<>();
        private final Set<String> startedSteps = new HashSet<>();
        private final Set<String> completedSteps = new HashSet<>();

        synchronized boolean terminalSeen() {
            return terminalSeen;
        }

        synchronized void pushed(StatusEvent event) {
            switch (event.type()) {
                case INIT -> initSeen = true;
                case OUTPUT_CHUNK -> pushedChars.merge(stream(event), chunk(event).length(), Integer::sum);
                case TOOL_START -> startedSteps.add(step(event));
                case TOOL_COMPLETE -> completedSteps.add(step(event));
                case COMPLETED, FAILED -> terminalSeen = true;
                default -> {
                }
            }
        }

        /** @return the polled event, trimmed to what push did not deliver, or null when nothing is left */
        synchronized StatusEvent polled(StatusEvent event) {
            switch (event.type()) {
                case INIT:
                    if (initSeen) {
                        return null;
                    }
                    initSeen = true;
                    return event;
                case OUTPUT_CHUNK: {
                    String stream = stream(event);
                    String chunk = chunk(event);
                    int offset = polledChars.getOrDefault(stream, 0);
                    polledChars.put(stream, offset + chunk.length());
                    int covered = pushedChars.getOrDefault(stream, 0) - offset;
                    if (covered <= 0) {
                        return event;
                    }
                    if (covered >= chunk.length()) {
                        return null;
                    }
                    return StatusEvent.outputChunk(stream, chunk.substring(covered));
                }
                case TOOL_START:
                    return startedSteps.add(step(event)) ? event : null;
                case TOOL_COMPLETE:
                    return completedSteps.add(step(event)) ? event : null;
                case COMPLETED:
                case FAILED:
                    if (terminalSeen) {
                        return null;
                    }
                    terminalSeen = true;
                    return event;
                default:
                    return event;
            }
        }

        private static String stream(StatusEvent event) {
            return String.valueOf(event.data().get("stream"));
        }

        private static String chunk(StatusEvent event) {
            Object chunk = event.data().get("chunk");
            return chunk == null ? "" : chunk.toString();
        }

        private static String step(StatusEvent event) {
            return String.valueOf(event.data().get("step"));
        }
    }
}
