package com.my.timesheet.adapter.out.llm;

import com.my.timesheet.adapter.out.clock.OffsetClockAdapter;
import com.my.timesheet.domain.exception.IntentParseException;
import com.my.timesheet.domain.model.LlmResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OpenAiLlmAdapterTest {

    private OpenAiLlmAdapter.IntentAssistant assistant;
    private OpenAiLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        assistant = mock(OpenAiLlmAdapter.IntentAssistant.class);
        Clock clock = Clock.fixed(Instant.parse("2026-02-11T01:30:00Z"), ZoneOffset.UTC);
        adapter = new OpenAiLlmAdapter(assistant, OffsetClockAdapter.of(clock));
    }

    @Test
    void passes_local_date_of_requested_timezone() {
        when(assistant.parse(anyString(), anyString(), anyString(), anyString())).thenReturn("{\"intent\":\"create_timesheets\"}");

        LlmResponse response = adapter.parseTimesheetIntent("last week 9-12 Alpha", "America/Sao_Paulo", "monday");

        assertThat(response.success()).isTrue();
        assertThat(response.response()).isEqualTo("{\"intent\":\"create_timesheets\"}");
        verify(assistant).parse("last week 9-12 Alpha", "2026-02-10", "America/Sao_Paulo", "monday");
    }

    @Test
    void defaults_blank_timezone_and_week_start() {
        when(assistant.parse(anyString(), anyString(), anyString(), anyString())).thenReturn("{}");

        adapter.parseTimesheetIntent("prompt", " ", null);

        verify(assistant).parse("prompt", "2026-02-11", "UTC", "monday");
    }

    @Test
    void blank_answer_is_a_parse_error() {
        when(assistant.parse(anyString(), anyString(), anyString(), anyString())).thenReturn("  ");

        assertThatThrownBy(() -> adapter.parseTimesheetIntent("prompt", "UTC", "monday"))
                .isInstanceOf(IntentParseException.class);
    }

    @Test
    void fallback_reports_unavailable() {
        LlmResponse response = adapter.unavailable("prompt", "UTC", "monday");

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("AI intent parsing is unavailable.");
    }
}
