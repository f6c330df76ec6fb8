package com.automate.ScanOps.Controller;

import com.automate.ScanOps.Config.StreamProperties;
import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Models.StatusEvent;
import com.automate.ScanOps.Service.RunService;
import com.automate.ScanOps.Service.SmartScanService;
import com.automate.ScanOps.Service.StatusEventSynthesizer;
import com.automate.ScanOps.Service.StatusStreamService;
import com.automate.ScanOps.dto.response.RunStatusSnapshot;
import com.automate.ScanOps.dto.response.SmartScanStatusSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/sse")
@CrossOrigin(origins = "${app.cors.allowed-origins:http://localhost:4200}")
public class SseController {

    private final StatusStreamService streamService;
    private final RunService runService;
    private final SmartScanService smartScanService;
    private final StreamProperties props;

    public SseController(StatusStreamService streamService,
                         RunService runService,
                         SmartScanService smartScanService,
                         StreamProperties props) {
        this.streamService = streamService;
        this.runService = runService;
        this.smartScanService = smartScanService;
        this.props = props;
    }

    @GetMapping(value = "/runs/{runId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribeRun(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable UUID runId) {
        // also the ownership check
        RunStatusSnapshot snapshot = runService.getStatus(user, runId);
        StatusEvent terminal = snapshot.status().isTerminal() ? StatusEventSynthesizer.terminalEvent(snapshot) : null;
        log.info("SSE subscribe run={} user={}", runId, user.userId());
        return open(StatusStreamService.runKey(runId), terminal);
    }

    @GetMapping(value = "/smart-scans/{sessionId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribeScan(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable UUID sessionId) {
        SmartScanStatusSnapshot snapshot = smartScanService.getStatus(user, sessionId);
        StatusEvent terminal = snapshot.status().isTerminal() ? StatusEventSynthesizer.terminalEvent(snapshot) : null;
        log.info("SSE subscribe scan={} user={}", sessionId, user.userId());
        return open(StatusStreamService.scanKey(sessionId), terminal);
    }

    /**
     * A finished run whose channel was already disposed gets just its terminal event, rebuilt from
     * the stored state.
     */
    private SseEmitter open(String key, StatusEvent terminalIfGone) {
        SseEmitter emitter = new SseEmitter(props.getEmitterTimeoutMs());

        if (terminalIfGone != null && !streamService.hasChannel(key)) {
            try {
                send(emitter, terminalIfGone);
                emitter.complete();
            } catch (IOException e) {
                log.warn("SSE connection dead for key={} before terminal event", key);
                emitter.completeWithError(e);
            }
            return emitter;
        }

        Runnable unsubscribe = streamService.subscribe(key, new StatusStreamService.StatusSubscriber() {
            @Override
            public void onEvent(StatusEvent event) throws IOException {
                send(emitter, event);
            }

            @Override
            public void onComplete() {
                emitter.complete();
            }
        });

        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(() -> {
            unsubscribe.run();
            emitter.complete();
        });
        emitter.onError(e -> {
            log.warn("SSE connection error for key={}: {}", key, e.toString());
            unsubscribe.run();
        });
        return emitter;
    }

    private static void send(SseEmitter emitter, StatusEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(event.type().wireName())
                .data(event, MediaType.APPLICATION_JSON));
    }
}
