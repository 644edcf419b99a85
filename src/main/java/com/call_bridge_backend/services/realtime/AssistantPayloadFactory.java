package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.config.RealtimeConfig;
import com.call_bridge_backend.dto.realtime.AssistantRequest;
import com.call_bridge_backend.dto.realtime.AssistantRequest.FunctionDefinition;
import com.call_bridge_backend.dto.realtime.AssistantRequest.ToolDefinition;
import com.call_bridge_backend.models.BusinessConfig;
import com.call_bridge_backend.services.tools.ToolName;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the assistant definition for a business. Calendar tools are only offered when the
 * business has a calendar connected; call transfer is always offered.
 */
@Component
@RequiredArgsConstructor
public class AssistantPayloadFactory {

    private final RealtimeConfig realtimeConfig;
    private final AssistantPromptBuilder promptBuilder;
    private final Clock clock;

    public String assistantName(BusinessConfig business) {
        return realtimeConfig.getAssistantNamePrefix() + "-" + business.getCompanyId();
    }

    public AssistantRequest build(BusinessConfig business) {
        String instructions = promptBuilder.build(business, LocalDate.now(clock));

        AssistantRequest.ModelConfig model = AssistantRequest.ModelConfig.builder()
                .provider(realtimeConfig.getModelProvider())
                .model(realtimeConfig.getModel())
                .messages(List.of(new AssistantRequest.Message("system", instructions)))
                .tools(tools(business.isCalendarEnabled()))
                .build();

        BusinessConfig.VoiceSettings settings = business.getVoiceSettings();
        String voiceId = settings != null && settings.getVoiceId() != null && !settings.getVoiceId().isBlank()
                ? settings.getVoiceId()
                : realtimeConfig.getDefaultVoiceId();
        Double speed = settings != null && settings.getTalkingSpeed() > 0 ? settings.getTalkingSpeed() : null;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("companyId", business.getCompanyId());
        metadata.put("companyName", business.getCompanyName());
        metadata.put("calendarEnabled", business.isCalendarEnabled());

        String webhook = realtimeConfig.getToolWebhookUrl();
        return AssistantRequest.builder()
                .name(assistantName(business))
                .firstMessage(settings != null ? settings.getWelcomePhrase() : null)
                .model(model)
                .voice(new AssistantRequest.VoiceConfig(realtimeConfig.getVoiceProvider(), voiceId, speed))
                .server(webhook == null || webhook.isBlank() ? null : new AssistantRequest.ServerConfig(webhook))
                .metadata(metadata)
                .build();
    }

    List<ToolDefinition> tools(boolean calendarEnabled) {
        List<ToolDefinition> tools = new ArrayList<>();
        tools.add(tool(ToolName.TRANSFER_CALL,
                "Transfer the caller to another phone number. Only use a number you were explicitly given.",
                schema(properties(
                        "phoneNumber", "The phone number to transfer to, in international format",
                        "reason", "Short reason for the transfer"), List.of("phoneNumber"))));
        if (!calendarEnabled) {
            return tools;
        }
        tools.add(tool(ToolName.CHECK_CALENDAR_AVAILABILITY,
                "Check the calendar for available times on a specific date.",
                schema(properties("date", "The date to check in YYYY-MM-DD format"), List.of("date"))));
        tools.add(tool(ToolName.CREATE_CALENDAR_EVENT,
                "Create an appointment in the calendar. First agree on a date and time, then ask for the caller's name and date of birth.",
                schema(properties(
                        "summary", "Title of the appointment",
                        "location", "Location of the appointment",
                        "description", "Description of the appointment",
                        "start", "Start time in ISO 8601 format (e.g. 2025-07-21T10:00:00)",
                        "end", "End time in ISO 8601 format (e.g. 2025-07-21T11:00:00)",
                        "name", "Full name of the caller",
                        "dateOfBirth", "Date of birth of the caller (DD-MM-YYYY)",
                        "attendeeEmail", "Email address of the caller, if given"),
                        List.of("summary", "start", "end", "name", "dateOfBirth"))));
        tools.add(tool(ToolName.CANCEL_CALENDAR_EVENT,
                "Cancel an appointment using the caller's name, date of birth and the date of the appointment.",
                schema(properties(
                        "name", "Full name of the caller",
                        "dateOfBirth", "Date of birth of the caller (DD-MM-YYYY)",
                        "date", "Date of the appointment in YYYY-MM-DD format"),
                        List.of("name", "dateOfBirth", "date"))));
        return tools;
    }

    private static ToolDefinition tool(ToolName name, String description, Map<String, Object> parameters) {
        return new ToolDefinition(new FunctionDefinition(name.getCanonicalName(), description, parameters));
    }

    private static Map<String, Object> schema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    private static Map<String, Object> properties(String... nameDescriptionPairs) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i + 1 < nameDescriptionPairs.length; i += 2) {
            properties.put(nameDescriptionPairs[i], Map.of("type", "string", "description", nameDescriptionPairs[i + 1]));
        }
        return properties;
    }
}
