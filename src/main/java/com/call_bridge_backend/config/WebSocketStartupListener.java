package com.call_bridge_backend.config;

import com.call_bridge_backend.services.CallSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class WebSocketStartupListener {

    private final CallSessionRegistry callSessionRegistry;
    private final WorkerConfig workerConfig;
    private final VoiceConfig voiceConfig;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String workerId = workerConfig.getWorkerId();
        callSessionRegistry.clearWorkerSessions(workerId);

        log.info("Call bridge worker {} ready", workerId);
        log.info("Media stream endpoint: {}?to=<destination number>", voiceConfig.getMediaStreamPath());
        log.info("Tool webhook: POST /vapi/tools (internal: POST /internal/vapi/tools)");
        if (workerConfig.getAddress() == null || workerConfig.getAddress().isBlank()) {
            log.warn("worker.address is not set; tool webhooks for this worker's calls cannot be forwarded from other workers");
        }
    }
}
