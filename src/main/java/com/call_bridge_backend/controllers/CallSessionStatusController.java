package com.call_bridge_backend.controllers;

import com.call_bridge_backend.config.VoiceConfig;
import com.call_bridge_backend.config.WorkerConfig;
import com.call_bridge_backend.services.CallSessionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/voice")
@RequiredArgsConstructor
public class CallSessionStatusController {

    private final CallSessionRegistry callSessionRegistry;
    private final WorkerConfig workerConfig;
    private final VoiceConfig voiceConfig;

    @GetMapping("/sessions")
    public Map<String, Object> getSessions() {
        List<String> activeCalls = callSessionRegistry.activeCallIds();

        Map<String, Object> status = new HashMap<>();
        status.put("workerId", workerConfig.getWorkerId());
        status.put("activeCalls", activeCalls);
        status.put("activeCallCount", activeCalls.size());
        status.put("mediaStreamPath", voiceConfig.getMediaStreamPath());
        status.put("timestamp", LocalDateTime.now());
        return status;
    }
}
