package com.call_bridge_backend.controllers;

import com.call_bridge_backend.services.ToolWebhookService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
public class VapiToolController {

    private final ToolWebhookService toolWebhookService;

    /**
     * Tool-call webhook from the voice provider. Always answers 200 so the assistant can read out errors.
     */
    @PostMapping("/vapi/tools")
    public ResponseEntity<Map<String, Object>> handleToolWebhook(@RequestBody JsonNode body) {
        try {
            return ResponseEntity.ok(toolWebhookService.handle(body, true));
        } catch (RuntimeException e) {
            log.error("Tool webhook error", e);
            return ResponseEntity.ok(toolWebhookService.failure(body, ToolWebhookService.sanitizeMessage(e)));
        }
    }

    /**
     * Tool webhook forwarded by another worker.
     */
    @PostMapping("/internal/vapi/tools")
    public ResponseEntity<Map<String, Object>> handleForwardedToolWebhook(
            @RequestHeader(value = ToolWebhookService.PROXY_TOKEN_HEADER, required = false) String token,
            @RequestBody JsonNode body) {
        if (!toolWebhookService.isAuthorized(token)) {
            log.warn("Rejected forwarded tool webhook with invalid proxy token");
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "Forbidden"));
        }
        try {
            return ResponseEntity.ok(toolWebhookService.handle(body, false));
        } catch (RuntimeException e) {
            log.error("Forwarded tool webhook error", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Internal tool handler error"));
        }
    }
}
