package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.ToolCall;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCallNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolCallNormalizer normalizer = new ToolCallNormalizer(objectMapper);

    @Test
    void shouldNormalizeEveryKnownShapeToTheSameCall() throws Exception {
        List<String> shapes = List.of(
                "{\"id\":\"tc_1\",\"name\":\"transfer_call\",\"arguments\":{\"phoneNumber\":\"+31201234567\"}}",
                "{\"id\":\"tc_1\",\"name\":\"transfer_call\",\"arguments\":\"{\\\"phoneNumber\\\":\\\"+31201234567\\\"}\"}",
                "{\"id\":\"tc_1\",\"function\":{\"name\":\"transfer_call\",\"arguments\":\"{\\\"phoneNumber\\\":\\\"+31201234567\\\"}\"}}",
                "{\"tool_call\":{\"id\":\"tc_1\",\"function\":{\"name\":\"transfer_call\",\"arguments\":{\"phoneNumber\":\"+31201234567\"}}}}",
                "{\"toolCall\":{\"toolCallId\":\"tc_1\",\"tool_name\":\"transfer_call\",\"input\":{\"phoneNumber\":\"+31201234567\"}}}",
                "{\"tool\":{\"call_id\":\"tc_1\",\"action\":\"transfer_call\",\"parameters\":{\"phoneNumber\":\"+31201234567\"}}}",
                "{\"tool_call_id\":\" tc_1 \",\"name\":\"transferCall\",\"payload\":{\"phoneNumber\":\"+31201234567\"}}");

        for (String shape : shapes) {
            Optional<ToolCall> call = normalizer.normalize(objectMapper.readTree(shape));

            assertThat(call).as(shape).isPresent();
            assertThat(call.get().getId()).as(shape).isEqualTo("tc_1");
            assertThat(call.get().getName()).as(shape).isEqualTo("transfer_call");
            assertThat(call.get().getArgs()).as(shape).containsEntry("phoneNumber", "+31201234567");
        }
    }

    @Test
    void shouldCanonicalizeLegacyCalendarNames() throws Exception {
        JsonNode node = objectMapper.readTree("{\"id\":\"tc_2\",\"name\":\"schedule_google_calendar_event\",\"arguments\":{}}");

        assertThat(normalizer.normalize(node)).get()
                .extracting(ToolCall::getName)
                .isEqualTo("create_calendar_event");
    }

    @Test
    void shouldKeepUnknownNamesAsGiven() throws Exception {
        JsonNode node = objectMapper.readTree("{\"id\":\"tc_3\",\"name\":\" order_pizza \"}");

        ToolCall call = normalizer.normalize(node).orElseThrow();

        assertThat(call.getName()).isEqualTo("order_pizza");
        assertThat(call.getArgs()).isEmpty();
    }

    @Test
    void shouldUseEmptyArgumentsWhenJsonIsInvalid() throws Exception {
        JsonNode node = objectMapper.readTree("{\"id\":\"tc_4\",\"name\":\"transfer_call\",\"arguments\":\"{not json\"}");

        assertThat(normalizer.normalize(node)).get()
                .extracting(ToolCall::getArgs)
                .isEqualTo(Map.of());
    }

    @Test
    void shouldUseEmptyArgumentsWhenArgumentsAreNotAnObject() throws Exception {
        JsonNode node = objectMapper.readTree("{\"id\":\"tc_5\",\"name\":\"transfer_call\",\"arguments\":\"[1,2]\"}");

        assertThat(normalizer.normalize(node).orElseThrow().getArgs()).isEmpty();
    }

    @Test
    void shouldRejectCallsWithoutIdOrName() throws Exception {
        assertThat(normalizer.normalize(objectMapper.readTree("{\"name\":\"transfer_call\"}"))).isEmpty();
        assertThat(normalizer.normalize(objectMapper.readTree("{\"id\":\"tc_6\"}"))).isEmpty();
        assertThat(normalizer.normalize(objectMapper.readTree("\"transfer_call\""))).isEmpty();
        assertThat(normalizer.normalize(null)).isEmpty();
    }

    @Test
    void shouldCollectArraysAndDropDuplicateIds() throws Exception {
        JsonNode message = objectMapper.readTree("{\"toolCalls\":["
                + "{\"id\":\"a\",\"function\":{\"name\":\"check_calendar_availability\",\"arguments\":{\"date\":\"2026-10-20\"}}},"
                + "{\"id\":\"b\",\"name\":\"transfer_call\",\"arguments\":{}},"
                + "{\"id\":\"a\",\"name\":\"transfer_call\",\"arguments\":{}},"
                + "{\"garbage\":true}]}");

        List<ToolCall> calls = normalizer.normalizeAll(message);

        assertThat(calls).extracting(ToolCall::getId).containsExactly("a", "b");
        assertThat(calls.get(0).getName()).isEqualTo("check_calendar_availability");
    }

    @Test
    void shouldReadToolWithToolCallList() throws Exception {
        JsonNode message = objectMapper.readTree("{\"toolWithToolCallList\":["
                + "{\"name\":\"transfer_call\",\"toolCall\":{\"id\":\"x\",\"function\":{\"name\":\"transfer_call\",\"arguments\":{}}}}]}");

        assertThat(normalizer.hasToolCallArray(message)).isTrue();
        assertThat(normalizer.normalizeAll(message)).extracting(ToolCall::getId).containsExactly("x");
    }

    @Test
    void shouldTreatPlainObjectAsSingleCall() throws Exception {
        JsonNode node = objectMapper.readTree("{\"id\":\"solo\",\"name\":\"transfer_call\"}");

        assertThat(normalizer.hasToolCallArray(node)).isFalse();
        assertThat(normalizer.normalizeAll(node)).extracting(ToolCall::getId).containsExactly("solo");
        assertThat(normalizer.normalizeAll(null)).isEmpty();
    }
}
