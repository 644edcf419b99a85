package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResponse;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.CallSessionException;
import com.call_bridge_backend.models.BusinessConfig;
import com.call_bridge_backend.services.tools.ToolCallContext;
import com.call_bridge_backend.services.tools.ToolCallDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point to the voice provider for calls: keeps each call's business snapshot, opens realtime
 * sessions, and dispatches the tool calls a session makes.
 *
 * <p>Snapshots are keyed by call id. The most recently registered snapshot is also kept as
 * "current", but it is only consulted while at most one call is registered.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RealtimeGateway {

    private final AssistantProvisioner assistantProvisioner;
    private final RealtimeConnector connector;
    private final ToolCallDispatcher toolCallDispatcher;

    private final Map<String, BusinessConfig> callConfigs = new ConcurrentHashMap<>();
    private final AtomicReference<BusinessConfig> currentConfig = new AtomicReference<>();

    public void registerCallConfig(String callId, BusinessConfig config) {
        callConfigs.put(callId, config);
        currentConfig.set(config);
        log.debug("[{}] Registered config for company {}", callId, config.getCompanyId());
    }

    public void releaseCallConfig(String callId) {
        BusinessConfig removed = callConfigs.remove(callId);
        if (removed != null) {
            currentConfig.compareAndSet(removed, null);
        }
    }

    public Optional<BusinessConfig> configFor(String callId) {
        if (callId != null) {
            BusinessConfig config = callConfigs.get(callId);
            if (config != null) {
                return Optional.of(config);
            }
        }
        if (callConfigs.size() <= 1) {
            return Optional.ofNullable(currentConfig.get());
        }
        log.warn("[{}] No config registered and {} calls active; not using the current config", callId, callConfigs.size());
        return Optional.empty();
    }

    /**
     * Provision the business's assistant and open a realtime socket for the call.
     */
    public RealtimeSession openSession(String callId, RealtimeSessionListener listener) {
        BusinessConfig config = configFor(callId)
                .orElseThrow(() -> new CallSessionException("No business config registered for call", callId));
        String assistantId = assistantProvisioner.ensureAssistant(config);
        log.info("[{}] Using assistant {} for company {}", callId, assistantId, config.getCompanyId());
        return connector.connect(callId, assistantId, listener);
    }

    public ToolResponse dispatchToolCall(String callId, ToolCall call) {
        ToolCallContext context = ToolCallContext.builder()
                .callId(callId)
                .business(configFor(callId).orElse(null))
                .build();
        return toolCallDispatcher.dispatch(call, context);
    }

    public int registeredCallCount() {
        return callConfigs.size();
    }
}
