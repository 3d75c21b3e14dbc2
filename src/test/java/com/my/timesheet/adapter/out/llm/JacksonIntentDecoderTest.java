package com.my.timesheet.adapter.out.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.timesheet.domain.model.Intent;
import com.my.timesheet.domain.model.IntentBlock;
import com.my.timesheet.domain.model.IntentDateRange;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonIntentDecoderTest {

    private final JacksonIntentDecoder decoder = new JacksonIntentDecoder(new ObjectMapper());

    @Test
    void decodesFullIntent() {
        String json = """
                {"intent": "create_timesheets",
                 "date_range": {"type": "relative", "value": "last_n_workdays", "count": 3},
                 "schedule": [{"from": "09:00", "to": "12:00"}, {"from": "13:00", "to": "17:00"}],
                 "breaks": [{"from": "12:00", "to": "13:00"}],
                 "project": "Alpha", "task": null, "notes": "site visit",
                 "missing_fields": ["task"]}
                """;

        Intent intent = decoder.decode(json).orElseThrow();

        assertThat(intent.intent()).isEqualTo(Intent.CREATE_TIMESHEETS);
        assertThat(intent.dateRange()).isEqualTo(new IntentDateRange("relative", null, null, "last_n_workdays", 3));
        assertThat(intent.schedule()).containsExactly(new IntentBlock("09:00", "12:00"), new IntentBlock("13:00", "17:00"));
        assertThat(intent.breaks()).containsExactly(new IntentBlock("12:00", "13:00"));
        assertThat(intent.project()).isEqualTo("Alpha");
        assertThat(intent.task()).isNull();
        assertThat(intent.notes()).isEqualTo("site visit");
        assertThat(intent.missingFields()).containsExactly("task");
    }

    @Test
    void acceptsAlternateScheduleKeys() {
        String json = "{\"intent\":\"create_timesheets\",\"schedule_blocks\":[{\"start_time\":\"08:00\",\"end_time\":\"10:30\"}]}";

        Intent intent = decoder.decode(json).orElseThrow();

        assertThat(intent.schedule()).containsExactly(new IntentBlock("08:00", "10:30"));
        assertThat(intent.dateRange()).isNull();
        assertThat(intent.missingFields()).isEmpty();
    }

    @Test
    void extractsObjectWrappedInProse() {
        String text = "Sure! Here you go:\n```json\n{\"intent\":\"create_timesheets\",\"project\":\"Beta\"}\n```";

        assertThat(decoder.decode(text).map(Intent::project)).contains("Beta");
    }

    @Test
    void rejectsNonObjects() {
        assertThat(decoder.decode("")).isEmpty();
        assertThat(decoder.decode(null)).isEmpty();
        assertThat(decoder.decode("[1, 2]")).isEqualTo(Optional.empty());
        assertThat(decoder.decode("no json at all")).isEmpty();
    }
}
