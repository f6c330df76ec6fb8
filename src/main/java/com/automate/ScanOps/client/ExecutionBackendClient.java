package com.automate.ScanOps.client;

import com.automate.ScanOps.Models.ResourceLimits;
import com.automate.ScanOps.Models.RunResult;
import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.dto.ExecuteRequest;
import com.automate.ScanOps.dto.ExecuteResponse;
import com.automate.ScanOps.exception.ExecutorBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches an argument vector to the sandboxed execution backend and classifies the outcome.
 * <p>
 * The backend call races a client side timer and the caller's {@link CancellationToken};
 * whichever settles first cancels the others. Execution problems come back as a
 * {@link RunResult}, never as an exception, and nothing is retried.
 */
@Slf4j
@Component
public class ExecutionBackendClient {

    private static final String EXECUTE_PATH = "/execute";

    private final WebClient executorWebClient;

    public ExecutionBackendClient(@Qualifier("executorWebClient") WebClient executorWebClient) {
        this.executorWebClient = executorWebClient;
    }

    public RunResult execute(List<String> argv, int timeoutSeconds, ResourceLimits limits, CancellationToken token) {
        CancellationToken cancellation = token == null ? CancellationToken.none() : token;
        String tool = argv.isEmpty() ? null : argv.get(0);
        long start = System.nanoTime();

        if (cancellation.isCancelled()) {
            return cancelled(start);
        }

        ExecuteRequest body = new ExecuteRequest(tool, argv, timeoutSeconds, limits.memoryLimitMb(), limits.cpuLimit());
        log.debug("Dispatching {} to execution backend, timeout={}s", tool, timeoutSeconds);

        ExecuteResponse response;
        try {
            response = executorWebClient.post()
                    .uri(EXECUTE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .flatMap(b -> Mono.error(
                                            ExecutorBackendException.of(resp.statusCode().value(), EXECUTE_PATH, b)))
                    )
                    .bodyToMono(ExecuteResponse.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .takeUntilOther(cancellation.whenCancelled())
                    .block();
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (cause instanceof TimeoutException) {
                log.warn("Execution of {} timed out after {}s", tool, timeoutSeconds);
                return new RunResult(RunStatus.TIMEOUT, null, "",
                        "Tool execution timed out after " + timeoutSeconds + " seconds", elapsedSeconds(start));
            }
            String message = classify(cause);
            log.warn("Execution of {} failed: {}", tool, message);
            return new RunResult(RunStatus.FAILED, null, "", message, elapsedSeconds(start));
        }

        if (response == null) {
            if (cancellation.isCancelled()) {
                return cancelled(start);
            }
            return new RunResult(RunStatus.FAILED, null, "", "Execution backend returned an empty response",
                    elapsedSeconds(start));
        }

        Integer exitCode = response.exitCode();
        RunStatus status = exitCode != null && exitCode == 0 ? RunStatus.COMPLETED : RunStatus.FAILED;
        return new RunResult(status, exitCode, nullToEmpty(response.stdout()), nullToEmpty(response.stderr()),
                elapsedSeconds(start));
    }

    private RunResult cancelled(long start) {
        return new RunResult(RunStatus.CANCELLED, null, "", "Run cancelled", elapsedSeconds(start));
    }

    /** user facing text for a transport or backend failure, no stack traces */
    static String classify(Throwable cause) {
        if (cause instanceof ExecutorBackendException ebe) {
            String preview = ebe.bodyPreview();
            return "Execution backend returned " + ebe.getStatusCode()
                    + (preview == null || preview.isBlank() ? "" : ": " + preview);
        }
        if (cause instanceof WebClientRequestException wre) {
            Throwable root = wre.getMostSpecificCause();
            return "Execution backend unreachable: " + (root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName());
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static long elapsedSeconds(long startNanos) {
        return Math.round((System.nanoTime() - startNanos) / 1_000_000_000.0);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
