package com.call_bridge_backend.services;

import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResponse;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.models.BusinessConfig;
import com.call_bridge_backend.models.CallSessionState;
import com.call_bridge_backend.services.realtime.RealtimeGateway;
import com.call_bridge_backend.services.realtime.RealtimeSession;
import com.call_bridge_backend.services.realtime.RealtimeSessionListener;
import com.call_bridge_backend.utils.AudioCodecUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One active call. Owns the carrier socket and the realtime session, runs turn detection on the
 * caller's audio and relays audio both ways.
 *
 * <p>Lifecycle: IDLE, STARTING, STREAMING, STOPPING, CLOSED. Caller audio received while
 * STARTING is held (bounded, oldest dropped) and forwarded in order once the realtime session is
 * up. {@link #teardown(String)} may be called from any thread any number of times; only the first
 * call releases resources.
 */
@Slf4j
public class CallSession implements RealtimeSessionListener {

    private final String callId;
    private final String streamId;
    private final String destinationNumber;
    private final WebSocketSession carrier;
    private final CallSessionFactory.Collaborators collaborators;
    private final TurnDetector turnDetector;
    private final Runnable onClosed;

    private final AtomicReference<CallSessionState> state = new AtomicReference<>(CallSessionState.IDLE);
    private final AtomicBoolean assistantSpeaking = new AtomicBoolean(false);
    private final AtomicBoolean turnMarkSent = new AtomicBoolean(false);
    private final AtomicInteger turnCounter = new AtomicInteger();
    private final Object lifecycleLock = new Object();
    private final Deque<byte[]> pendingAudio = new ArrayDeque<>();

    private volatile RealtimeSession aiSession;
    private volatile ScheduledFuture<?> keepalive;
    private volatile BusinessConfig business;
    private volatile String lastMarkName;
    private volatile String closeReason;
    private CompletableFuture<Void> toolChain = CompletableFuture.completedFuture(null);

    CallSession(String callId,
                String streamId,
                String destinationNumber,
                WebSocketSession carrier,
                CallSessionFactory.Collaborators collaborators,
                Runnable onClosed) {
        this.callId = callId;
        this.streamId = streamId;
        this.destinationNumber = destinationNumber;
        this.carrier = carrier;
        this.collaborators = collaborators;
        this.turnDetector = new TurnDetector(collaborators.getVadConfig());
        this.onClosed = onClosed;
    }

    public String getCallId() {
        return callId;
    }

    public String getStreamId() {
        return streamId;
    }

    public String getDestinationNumber() {
        return destinationNumber;
    }

    public CallSessionState getState() {
        return state.get();
    }

    public Optional<String> getAiCallId() {
        RealtimeSession session = aiSession;
        return session == null ? Optional.empty() : Optional.ofNullable(session.getAiCallId());
    }

    public Optional<BusinessConfig> getBusiness() {
        return Optional.ofNullable(business);
    }

    public boolean isAssistantSpeaking() {
        return assistantSpeaking.get();
    }

    /**
     * Start the call on the startup executor. Only the first call has an effect.
     */
    public CompletableFuture<Void> start() {
        if (!state.compareAndSet(CallSessionState.IDLE, CallSessionState.STARTING)) {
            log.debug("[{}] Start ignored in state {}", callId, state.get());
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(this::doStart, collaborators.getStartupExecutor())
                .exceptionally(error -> {
                    log.error("[{}] Call startup failed", callId, error);
                    teardown("startup failed");
                    return null;
                });
    }

    private void doStart() {
        log.info("[{}] Starting call session (stream {}, to {})", callId, streamId, destinationNumber);

        CompanyLookupService lookup = collaborators.getCompanyLookup().getIfAvailable();
        Optional<BusinessConfig> resolved = lookup == null ? Optional.empty() : lookup.findByPhoneNumber(destinationNumber);
        if (resolved.isEmpty()) {
            log.warn("[{}] No business found for destination {}", callId, destinationNumber);
            teardown("unknown destination number");
            return;
        }
        business = resolved.get();

        synchronized (lifecycleLock) {
            if (state.get() != CallSessionState.STARTING) {
                return;
            }
            collaborators.getGateway().registerCallConfig(callId, business);
            collaborators.getRegistry().register(callId, null, this);
        }

        RealtimeSession session;
        try {
            session = collaborators.getGateway().openSession(callId, this);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to open realtime session: {}", callId, e.getMessage(), e);
            teardown("realtime session failed");
            return;
        }

        synchronized (lifecycleLock) {
            if (state.get() != CallSessionState.STARTING) {
                session.close();
                return;
            }
            aiSession = session;
            Duration interval = collaborators.getVoiceConfig().getKeepaliveInterval();
            keepalive = collaborators.getTaskScheduler()
                    .scheduleAtFixedRate(this::keepalive, Instant.now().plus(interval), interval);
            collaborators.getRegistry().register(callId, session.getAiCallId(), this);
            flushPendingAudio(session);
            if (state.get() != CallSessionState.STARTING) {
                return;
            }
            state.set(CallSessionState.STREAMING);
        }
        log.info("[{}] Call streaming (ai call {})", callId, session.getAiCallId());
    }

    /**
     * Forward audio held during startup. Runs under the lifecycle lock so frames arriving
     * meanwhile queue behind it.
     */
    private void flushPendingAudio(RealtimeSession session) {
        if (!pendingAudio.isEmpty()) {
            log.debug("[{}] Forwarding {} frames received during startup", callId, pendingAudio.size());
        }
        while (!pendingAudio.isEmpty() && state.get() == CallSessionState.STARTING) {
            forwardAudio(session, pendingAudio.pollFirst());
        }
        pendingAudio.clear();
    }

    /**
     * One carrier media frame of μ-law audio.
     */
    public void onCarrierMedia(byte[] payload) {
        if (state.get() != CallSessionState.STREAMING) {
            synchronized (lifecycleLock) {
                CallSessionState current = state.get();
                if (current == CallSessionState.STARTING) {
                    holdAudio(payload);
                    return;
                }
                if (current != CallSessionState.STREAMING) {
                    return;
                }
            }
        }
        forwardAudio(aiSession, payload);
    }

    private void holdAudio(byte[] payload) {
        int limit = collaborators.getVoiceConfig().getMaxBufferedFrames();
        if (limit <= 0) {
            return;
        }
        while (pendingAudio.size() >= limit) {
            pendingAudio.pollFirst();
        }
        pendingAudio.addLast(payload);
    }

    private void forwardAudio(RealtimeSession session, byte[] payload) {
        try {
            session.sendAudio(payload);
        } catch (IOException | RuntimeException e) {
            log.error("[{}] Failed to forward audio: {}", callId, e.getMessage());
            teardown("realtime send failed");
            return;
        }

        double energy = AudioCodecUtils.mulawFrameEnergy(payload);
        TurnDetector.Decision decision = turnDetector.onFrame(energy);
        switch (decision) {
            case SPEECH_STARTED:
                if (assistantSpeaking.compareAndSet(true, false)) {
                    log.debug("[{}] Caller interrupted the assistant", callId);
                    turnMarkSent.set(false);
                    sendCarrier(event("clear"));
                }
                break;
            case COMMIT:
                log.debug("[{}] End of caller turn", callId);
                try {
                    session.commitUserAudio();
                } catch (IOException | RuntimeException e) {
                    log.error("[{}] Failed to commit audio: {}", callId, e.getMessage());
                    teardown("realtime send failed");
                }
                break;
            case DISCARD:
                log.debug("[{}] Discarded short or quiet segment", callId);
                break;
            default:
                break;
        }
    }

    /**
     * The carrier finished playing up to a mark we sent.
     */
    public void onCarrierMark(String name) {
        if (name != null && name.equals(lastMarkName)) {
            assistantSpeaking.set(false);
        }
    }

    @Override
    public void onAudio(byte[] audio) {
        CallSessionState current = state.get();
        if (current == CallSessionState.STOPPING || current == CallSessionState.CLOSED) {
            return;
        }
        if (turnMarkSent.compareAndSet(false, true)) {
            sendMark("turn-" + turnCounter.incrementAndGet());
        }
        assistantSpeaking.set(true);

        Map<String, Object> media = event("media");
        media.put("media", Map.of("payload", Base64.getEncoder().encodeToString(audio)));
        sendCarrier(media);
    }

    @Override
    public void onText(String text) {
        log.debug("[{}] Assistant text: {}", callId, text);
    }

    @Override
    public void onTurnCompleted() {
        if (turnMarkSent.compareAndSet(true, false)) {
            sendMark("turn-" + turnCounter.get() + "-end");
        }
    }

    @Override
    public void onToolCalls(List<ToolCall> toolCalls) {
        for (ToolCall call : toolCalls) {
            enqueueToolCall(call);
        }
    }

    @Override
    public void onProviderError(String message) {
        log.warn("[{}] Realtime provider error: {}", callId, message);
    }

    @Override
    public void onTransportError(Throwable error) {
        log.error("[{}] Realtime transport error: {}", callId, error.getMessage());
        teardown("realtime transport error");
    }

    @Override
    public void onClosed(CloseStatus status) {
        teardown("realtime session closed (" + status.getCode() + ")");
    }

    /**
     * Run tool calls synchronously and return their results; used by the tool webhook.
     */
    public List<ToolResponse> executeToolCalls(List<ToolCall> toolCalls) {
        List<ToolResponse> responses = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            responses.add(runTool(call));
        }
        return responses;
    }

    private void enqueueToolCall(ToolCall call) {
        Executor executor = collaborators.getToolExecutor();
        synchronized (this) {
            toolChain = toolChain.thenRunAsync(() -> {
                ToolResponse response = runTool(call);
                RealtimeSession session = aiSession;
                if (session == null || state.get() == CallSessionState.CLOSED) {
                    log.debug("[{}] Dropping result of tool call {}; session closed", callId, call.getId());
                    return;
                }
                try {
                    session.sendToolResponse(response.getToolCallId(), response.getResult());
                } catch (IOException | RuntimeException e) {
                    log.error("[{}] Failed to send tool response {}: {}", callId, call.getId(), e.getMessage());
                }
            }, executor).exceptionally(error -> {
                // the chain must stay usable for the next tool call
                log.error("[{}] Tool call {} did not complete", callId, call.getId(), error);
                return null;
            });
        }
    }

    private ToolResponse runTool(ToolCall call) {
        try {
            return collaborators.getGateway().dispatchToolCall(callId, call);
        } catch (RuntimeException e) {
            log.error("[{}] Tool call {} failed", callId, call.getId(), e);
            return new ToolResponse(call.getId(), ToolResult.failure("Tool execution failed"));
        }
    }

    private void keepalive() {
        RealtimeSession session = aiSession;
        if (session == null || state.get() != CallSessionState.STREAMING) {
            return;
        }
        try {
            session.ping();
        } catch (IOException | RuntimeException e) {
            log.warn("[{}] Keepalive ping failed: {}", callId, e.getMessage());
            teardown("keepalive failed");
            return;
        }
        collaborators.getRegistry().refresh(callId);
    }

    /**
     * Release everything the call holds. Safe to call repeatedly and from any thread.
     */
    public void teardown(String reason) {
        synchronized (lifecycleLock) {
            CallSessionState previous = state.get();
            if (previous == CallSessionState.STOPPING || previous == CallSessionState.CLOSED) {
                return;
            }
            state.set(CallSessionState.STOPPING);
            closeReason = reason;
            pendingAudio.clear();
        }
        log.info("[{}] Tearing down call: {}", callId, reason);

        ScheduledFuture<?> timer = keepalive;
        if (timer != null) {
            timer.cancel(false);
            keepalive = null;
        }

        RealtimeSession session = aiSession;
        if (session != null) {
            session.close();
        }

        try {
            collaborators.getRegistry().unregister(callId);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to unregister call", callId, e);
        }
        collaborators.getGateway().releaseCallConfig(callId);
        turnDetector.reset();
        assistantSpeaking.set(false);
        turnMarkSent.set(false);

        if (carrier.isOpen()) {
            try {
                carrier.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("[{}] Failed to close carrier socket: {}", callId, e.getMessage());
            }
        }

        state.set(CallSessionState.CLOSED);
        if (onClosed != null) {
            try {
                onClosed.run();
            } catch (RuntimeException e) {
                log.error("[{}] Close callback failed", callId, e);
            }
        }
    }

    public String getCloseReason() {
        return closeReason;
    }

    private void sendMark(String name) {
        lastMarkName = name;
        Map<String, Object> mark = event("mark");
        mark.put("mark", Map.of("name", name));
        sendCarrier(mark);
    }

    private Map<String, Object> event(String type) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", type);
        event.put("streamSid", streamId);
        return event;
    }

    private void sendCarrier(Map<String, Object> message) {
        if (!carrier.isOpen()) {
            return;
        }
        try {
            carrier.sendMessage(new TextMessage(collaborators.getObjectMapper().writeValueAsString(message)));
        } catch (JsonProcessingException e) {
            log.error("[{}] Failed to serialize carrier message", callId, e);
        } catch (IOException e) {
            log.error("[{}] Failed to write to carrier: {}", callId, e.getMessage());
            teardown("carrier send failed");
        }
    }
}
