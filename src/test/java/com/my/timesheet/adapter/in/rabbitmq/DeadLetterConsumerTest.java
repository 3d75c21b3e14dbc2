package com.my.timesheet.adapter.in.rabbitmq;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterConsumerTest {

    @Test
    void readsDeathHeaders() {
        Optional<Map<String, Object>> headers = Optional.of(Map.of("x-first-death-reason", "rejected"));

        assertThat(DeadLetterConsumer.header(headers, "x-first-death-reason")).isEqualTo("rejected");
        assertThat(DeadLetterConsumer.header(headers, "x-first-death-queue")).isEqualTo("unknown");
        assertThat(DeadLetterConsumer.header(Optional.empty(), "x-first-death-reason")).isEqualTo("unknown");
    }
}
