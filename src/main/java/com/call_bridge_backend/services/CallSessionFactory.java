package com.call_bridge_backend.services;

import com.call_bridge_backend.config.VadConfig;
import com.call_bridge_backend.config.VoiceConfig;
import com.call_bridge_backend.services.realtime.RealtimeGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.concurrent.Executor;

/**
 * Creates {@link CallSession}s wired to the shared services.
 */
@Component
public class CallSessionFactory {

    private final Collaborators collaborators;

    public CallSessionFactory(CallSessionRegistry registry,
                              RealtimeGateway gateway,
                              ObjectProvider<CompanyLookupService> companyLookup,
                              VadConfig vadConfig,
                              VoiceConfig voiceConfig,
                              TaskScheduler taskScheduler,
                              @Qualifier("toolCallExecutor") Executor toolExecutor,
                              @Qualifier("callStartupExecutor") Executor startupExecutor,
                              ObjectMapper objectMapper) {
        this(Collaborators.builder()
                .registry(registry)
                .gateway(gateway)
                .companyLookup(companyLookup)
                .vadConfig(vadConfig)
                .voiceConfig(voiceConfig)
                .taskScheduler(taskScheduler)
                .toolExecutor(toolExecutor)
                .startupExecutor(startupExecutor)
                .objectMapper(objectMapper)
                .build());
    }

    CallSessionFactory(Collaborators collaborators) {
        this.collaborators = collaborators;
    }

    /**
     * @param carrier   the carrier socket, already safe for concurrent writes
     * @param onClosed  run once after the session has torn down
     */
    public CallSession create(WebSocketSession carrier, String callId, String streamId,
                              String destinationNumber, Runnable onClosed) {
        return new CallSession(callId, streamId, destinationNumber, carrier, collaborators, onClosed);
    }

    @Value
    @Builder
    static class Collaborators {
        CallSessionRegistry registry;
        RealtimeGateway gateway;
        ObjectProvider<CompanyLookupService> companyLookup;
        VadConfig vadConfig;
        VoiceConfig voiceConfig;
        TaskScheduler taskScheduler;
        Executor toolExecutor;
        Executor startupExecutor;
        ObjectMapper objectMapper;
    }
}
