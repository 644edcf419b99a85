package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.realtime.RealtimeEvent;
import com.call_bridge_backend.dto.realtime.RealtimeEvent.Kind;
import com.call_bridge_backend.services.tools.ToolCallNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThat;

class RealtimeEventNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RealtimeEventNormalizer normalizer =
            new RealtimeEventNormalizer(objectMapper, new ToolCallNormalizer(objectMapper));

    @Test
    void shouldTreatBinaryFramesAsAudio() {
        RealtimeEvent event = normalizer.fromBinary(ByteBuffer.wrap(new byte[]{1, 2, 3}));

        assertThat(event.getKind()).isEqualTo(Kind.AUDIO);
        assertThat(event.getAudio()).containsExactly(1, 2, 3);
    }

    @Test
    void shouldDecodeAudioDeltaFromAnyKnownField() {
        for (String field : new String[]{"audio", "delta", "data"}) {
            RealtimeEvent event = normalizer.fromText("{\"type\":\"response.audio.delta\",\"" + field + "\":\"AQI=\"}");

            assertThat(event.getKind()).as(field).isEqualTo(Kind.AUDIO);
            assertThat(event.getAudio()).as(field).containsExactly(1, 2);
        }
    }

    @Test
    void shouldIgnoreAudioDeltaWithBadBase64() {
        assertThat(normalizer.fromText("{\"type\":\"response.audio.delta\",\"delta\":\"***\"}").getKind())
                .isEqualTo(Kind.IGNORED);
    }

    @Test
    void shouldReadTextEvents() {
        assertThat(normalizer.fromText("{\"type\":\"response.output_text.delta\",\"delta\":\"Hello\"}").getText())
                .isEqualTo("Hello");
        assertThat(normalizer.fromText("{\"type\":\"response.message.delta\",\"delta\":{\"text\":\"Hi\"}}").getText())
                .isEqualTo("Hi");
        assertThat(normalizer.fromText("{\"type\":\"transcript\",\"transcript\":\"I need an appointment\"}").getKind())
                .isEqualTo(Kind.TEXT);
    }

    @Test
    void shouldReportTurnCompletion() {
        assertThat(normalizer.fromText("{\"type\":\"response.completed\"}").getKind()).isEqualTo(Kind.TURN_COMPLETED);
        assertThat(normalizer.fromText("{\"type\":\"response.done\"}").getKind()).isEqualTo(Kind.TURN_COMPLETED);
    }

    @Test
    void shouldExtractErrorMessage() {
        assertThat(normalizer.fromText("{\"type\":\"error\",\"error\":{\"message\":\"rate limited\"}}").getError())
                .isEqualTo("rate limited");
        assertThat(normalizer.fromText("{\"type\":\"error\"}").getError()).isEqualTo("Unknown realtime error");
    }

    @Test
    void shouldCollectToolCalls() {
        RealtimeEvent event = normalizer.fromText("{\"type\":\"response.tool_call\",\"tool_call\":"
                + "{\"id\":\"tc_1\",\"function\":{\"name\":\"check_google_calendar_availability\",\"arguments\":\"{\\\"date\\\":\\\"2026-10-20\\\"}\"}}}");

        assertThat(event.getKind()).isEqualTo(Kind.TOOL_CALLS);
        assertThat(event.getToolCalls()).extracting(ToolCall::getName).containsExactly("check_calendar_availability");
        assertThat(event.getToolCalls().get(0).getArgs()).containsEntry("date", "2026-10-20");
    }

    @Test
    void shouldDetectToolCallArrayOnAnyEventType() {
        RealtimeEvent event = normalizer.fromText("{\"type\":\"conversation.item\",\"tool_calls\":["
                + "{\"id\":\"a\",\"name\":\"transfer_call\",\"arguments\":{}},{\"id\":\"b\",\"name\":\"transfer_call\",\"arguments\":{}}]}");

        assertThat(event.getKind()).isEqualTo(Kind.TOOL_CALLS);
        assertThat(event.getToolCalls()).hasSize(2);
    }

    @Test
    void shouldIgnoreToolEventWithoutUsableCalls() {
        assertThat(normalizer.fromText("{\"type\":\"tool.call\",\"tool_call\":{\"name\":\"transfer_call\"}}").getKind())
                .isEqualTo(Kind.IGNORED);
    }

    @Test
    void shouldIgnoreMalformedAndUnknownFrames() {
        assertThat(normalizer.fromText("{not json").getKind()).isEqualTo(Kind.IGNORED);
        assertThat(normalizer.fromText("[1,2]").getKind()).isEqualTo(Kind.IGNORED);
        assertThat(normalizer.fromText("{\"type\":\"session.created\"}").getKind()).isEqualTo(Kind.IGNORED);
    }
}
