package com.call_bridge_backend.dto.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of the provider's create and update assistant calls.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssistantRequest {
    private String name;
    private String firstMessage;
    private ModelConfig model;
    private VoiceConfig voice;
    private ServerConfig server;
    private Map<String, Object> metadata;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ModelConfig {
        private String provider;
        private String model;
        private List<Message> messages;
        private List<ToolDefinition> tools;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;
        private String content;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class VoiceConfig {
        private String provider;
        private String voiceId;
        private Double speed;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServerConfig {
        private String url;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolDefinition {
        private String type = "function";
        private FunctionDefinition function;

        public ToolDefinition(FunctionDefinition function) {
            this.function = function;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FunctionDefinition {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }
}
