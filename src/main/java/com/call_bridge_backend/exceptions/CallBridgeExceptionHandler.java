package com.call_bridge_backend.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice(basePackages = "com.call_bridge_backend.controllers")
@Slf4j
public class CallBridgeExceptionHandler {

    /**
     * Handle failures to reach the AI provider's realtime endpoint
     */
    @ExceptionHandler(RealtimeConnectionException.class)
    public ResponseEntity<?> handleRealtimeConnection(RealtimeConnectionException e) {
        log.error("Realtime connection error: {}", e.getMessage(), e);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "Voice AI realtime service unavailable");
        errorResponse.put("type", "REALTIME_CONNECTION_ERROR");
        errorResponse.put("attempts", e.getAttemptedUrls());
        errorResponse.put("timestamp", LocalDateTime.now());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorResponse);
    }

    @ExceptionHandler(AssistantSyncException.class)
    public ResponseEntity<?> handleAssistantSync(AssistantSyncException e) {
        log.error("Assistant sync error: {}", e.getMessages());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", e.getMessage());
        errorResponse.put("messages", e.getMessages());
        errorResponse.put("type", "ASSISTANT_SYNC_ERROR");
        errorResponse.put("timestamp", LocalDateTime.now());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(errorResponse);
    }

    @ExceptionHandler(CallSessionException.class)
    public ResponseEntity<?> handleCallSession(CallSessionException e) {
        log.warn("Call session error: {}", e.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", e.getMessage());
        errorResponse.put("type", "CALL_SESSION_ERROR");
        errorResponse.put("timestamp", LocalDateTime.now());

        if (e.getCallId() != null) {
            errorResponse.put("callId", e.getCallId());
        }

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * Handle illegal argument exceptions (validation errors)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Validation error: {}", e.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", e.getMessage());
        errorResponse.put("type", "VALIDATION_ERROR");
        errorResponse.put("timestamp", LocalDateTime.now());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    // Custom exception classes
    public static class CallSessionException extends RuntimeException {
        private final String callId;

        public CallSessionException(String message, String callId) {
            super(message);
            this.callId = callId;
        }

        public CallSessionException(String message, String callId, Throwable cause) {
            super(message, cause);
            this.callId = callId;
        }

        public String getCallId() {
            return callId;
        }
    }

    /**
     * Every candidate realtime URL failed. Each underlying failure is attached as a suppressed exception.
     */
    public static class RealtimeConnectionException extends RuntimeException {
        private final List<String> attemptedUrls;

        public RealtimeConnectionException(String message, List<String> attemptedUrls, List<? extends Throwable> causes) {
            super(message, causes.isEmpty() ? null : causes.get(causes.size() - 1));
            this.attemptedUrls = Collections.unmodifiableList(new ArrayList<>(attemptedUrls));
            causes.forEach(this::addSuppressed);
        }

        public List<String> getAttemptedUrls() {
            return attemptedUrls;
        }

        public List<Throwable> getCauses() {
            return List.of(getSuppressed());
        }
    }

    public static class AssistantSyncException extends RuntimeException {
        private final List<String> messages;

        public AssistantSyncException(List<String> messages) {
            super(messages.isEmpty() ? "Assistant sync failed" : messages.get(0));
            this.messages = messages.isEmpty() ? List.of("Assistant sync failed") : List.copyOf(messages);
        }

        public List<String> getMessages() {
            return messages;
        }
    }

    /**
     * A tool call is missing or has an invalid required argument.
     */
    public static class ToolArgumentException extends RuntimeException {
        private final List<String> fields;

        public ToolArgumentException(String message, List<String> fields) {
            super(message);
            this.fields = List.copyOf(fields);
        }

        public List<String> getFields() {
            return fields;
        }
    }
}
