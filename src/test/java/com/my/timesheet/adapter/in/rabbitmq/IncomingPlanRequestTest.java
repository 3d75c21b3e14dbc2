package com.my.timesheet.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.my.timesheet.domain.exception.InvalidRequestException;
import com.my.timesheet.domain.model.PlanCommitCommand;
import com.my.timesheet.domain.model.PlanPreviewCommand;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IncomingPlanRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void mapsPreviewPayload() throws Exception {
        String payload = "{" +
                "\"eventId\":\"evt-1\"," +
                "\"action\":\"preview\"," +
                "\"actorId\":42," +
                "\"prompt\":\"last week 9-12 Alpha\"," +
                "\"timezone\":\"America/Sao_Paulo\"," +
                "\"unknownField\":true" +
                "}";

        IncomingPlanRequest incoming = objectMapper.readValue(payload, IncomingPlanRequest.class);
        PlanPreviewCommand command = incoming.toPreviewCommand();

        assertThat(incoming.resolveAction()).isEqualTo(IncomingPlanRequest.Action.PREVIEW);
        assertThat(command.actorId()).isEqualTo(42L);
        assertThat(command.technicianId()).isNull();
        assertThat(command.prompt()).isEqualTo("last week 9-12 Alpha");
        assertThat(command.timezone()).isEqualTo("America/Sao_Paulo");
    }

    @Test
    void mapsCommitPayloadWithPlan() throws Exception {
        String payload = "{" +
                "\"eventId\":\"evt-2\"," +
                "\"action\":\"COMMIT\"," +
                "\"actorId\":42," +
                "\"technicianId\":7," +
                "\"requestId\":\"req-1\"," +
                "\"confirmed\":true," +
                "\"plan\":{\"timezone\":\"UTC\",\"days\":[{\"date\":\"2026-02-10\",\"entries\":[" +
                "{\"projectId\":1,\"projectName\":\"Alpha\",\"startTime\":\"09:00\",\"endTime\":\"12:00\"}]}]}" +
                "}";

        IncomingPlanRequest incoming = objectMapper.readValue(payload, IncomingPlanRequest.class);
        PlanCommitCommand command = incoming.toCommitCommand();

        assertThat(incoming.resolveAction()).isEqualTo(IncomingPlanRequest.Action.COMMIT);
        assertThat(command.commitKey()).isEqualTo("42:req-1");
        assertThat(command.confirmed()).isTrue();
        assertThat(command.technicianId()).isEqualTo(7L);
        assertThat(command.plan().days()).hasSize(1);
        assertThat(command.plan().days().get(0).date()).isEqualTo(LocalDate.of(2026, 2, 10));
        assertThat(command.plan().days().get(0).entries().get(0).projectName()).isEqualTo("Alpha");
        assertThat(command.plan().days().get(0).breaks()).isEmpty();
    }

    @Test
    void missingConfirmationIsNotConfirmed() throws Exception {
        String payload = "{\"eventId\":\"evt-3\",\"action\":\"commit\",\"actorId\":42,\"requestId\":\"req-1\"}";

        PlanCommitCommand command = objectMapper.readValue(payload, IncomingPlanRequest.class).toCommitCommand();

        assertThat(command.confirmed()).isFalse();
        assertThat(command.plan()).isNull();
    }

    @Test
    void rejectsMissingFields() {
        String payload = "{\"action\":\"preview\",\"actorId\":42,\"prompt\":\"hello\"}";

        assertThrows(ValueInstantiationException.class,
                () -> objectMapper.readValue(payload, IncomingPlanRequest.class));
    }

    @Test
    void rejectsUnknownActionAndBadPrompts() throws Exception {
        IncomingPlanRequest unknown = objectMapper.readValue(
                "{\"eventId\":\"evt-4\",\"action\":\"delete\",\"actorId\":42}", IncomingPlanRequest.class);
        assertThatThrownBy(unknown::resolveAction).isInstanceOf(InvalidRequestException.class);

        IncomingPlanRequest blank = new IncomingPlanRequest("evt-5", "preview", 42L, null, "  ", null, null, null, null, null, null);
        assertThatThrownBy(blank::toPreviewCommand).isInstanceOf(InvalidRequestException.class);

        IncomingPlanRequest tooLong = new IncomingPlanRequest("evt-6", "preview", 42L, null, "a".repeat(2001), null, null, null, null, null, null);
        assertThatThrownBy(tooLong::toPreviewCommand).isInstanceOf(InvalidRequestException.class);
    }
}
