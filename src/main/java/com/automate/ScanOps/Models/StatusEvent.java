package com.automate.ScanOps.Models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One live status update for a run or a smart-scan session, serialized as {@code {type, data}}.
 * <p>
 * The push path (server side) and the polling synthesizer both build events through the
 * factories below so consumers never need to know which transport produced them.
 */
public record StatusEvent(Type type, Map<String, Object> data) {

    public enum Type {
        INIT("init"),
        OUTPUT_CHUNK("output-chunk"),
        TOOL_START("tool-start"),
        TOOL_COMPLETE("tool-complete"),
        PROGRESS("progress"),
        COMPLETED("completed"),
        FAILED("failed");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        @JsonCreator
        public static Type fromWire(String value) {
            for (Type t : values()) {
                if (t.wireName.equals(value)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown status event type: " + value);
        }
    }

    public StatusEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type.isTerminal();
    }

    public static StatusEvent init(String status, String target) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("status", status);
        d.put("target", target);
        return new StatusEvent(Type.INIT, d);
    }

    /** {@code stream} is either {@code stdout} or {@code stderr}. */
    public static StatusEvent outputChunk(String stream, String chunk) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("stream", stream);
        d.put("chunk", chunk);
        return new StatusEvent(Type.OUTPUT_CHUNK, d);
    }

    public static StatusEvent toolStart(int stepNumber, String stepName, String tool, String phase) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("step", stepNumber);
        d.put("name", stepName);
        d.put("tool", tool);
        d.put("phase", phase);
        return new StatusEvent(Type.TOOL_START, d);
    }

    /** {@code runId} is null for internal steps and for steps rejected before a run existed. */
    public static StatusEvent toolComplete(int stepNumber, String tool, String status, Long durationSeconds, UUID runId) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("step", stepNumber);
        d.put("tool", tool);
        d.put("status", status);
        d.put("duration", durationSeconds);
        d.put("runId", runId == null ? null : runId.toString());
        return new StatusEvent(Type.TOOL_COMPLETE, d);
    }

    public static StatusEvent progress(int progress, String currentPhase) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("progress", progress);
        d.put("phase", currentPhase);
        return new StatusEvent(Type.PROGRESS, d);
    }

    public static StatusEvent completed(String status, Integer exitCode, Long durationSeconds) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("status", status);
        d.put("exitCode", exitCode);
        d.put("duration", durationSeconds);
        return new StatusEvent(Type.COMPLETED, d);
    }

    public static StatusEvent failed(String status, String error) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("status", status);
        d.put("error", error);
        return new StatusEvent(Type.FAILED, d);
    }
}
