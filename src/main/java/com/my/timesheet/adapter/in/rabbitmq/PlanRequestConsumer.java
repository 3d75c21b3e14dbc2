package com.my.timesheet.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.timesheet.adapter.in.idempotency.IdempotencyStore;
import com.my.timesheet.domain.exception.InvalidRequestException;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.PlanCommit;
import com.my.timesheet.domain.model.PlanCommitCommand;
import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.model.ReplyKind;
import com.my.timesheet.domain.model.ReplyMessage;
import com.my.timesheet.domain.port.in.TimesheetPlanUseCase;
import com.my.timesheet.domain.port.out.ReplyPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * 왜: RabbitMQ 소비자를 통해 미리보기/커밋 유스케이스로 진입시키는 단일 경로를 제공하기 위함.
 *
 * <p>커밋은 (요청자, requestId) 단위로 한 번만 반영하고, 반복 요청에는 중복 응답을 보낸다.
 */
@ApplicationScoped
public class PlanRequestConsumer {

    private static final Logger log = Logger.getLogger(PlanRequestConsumer.class);

    private final TimesheetPlanUseCase timesheetPlanUseCase;
    private final IdempotencyStore idempotencyStore;
    private final ReplyPort replyPort;
    private final ObjectMapper objectMapper;

    @Inject
    public PlanRequestConsumer(TimesheetPlanUseCase timesheetPlanUseCase,
                               IdempotencyStore idempotencyStore,
                               ReplyPort replyPort,
                               ObjectMapper objectMapper) {
        this.timesheetPlanUseCase = timesheetPlanUseCase;
        this.idempotencyStore = idempotencyStore;
        this.replyPort = replyPort;
        this.objectMapper = objectMapper;
    }

    @Incoming("timesheet-plan-requests")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload(), resolveCorrelationId(message));
            return null;
        }).replaceWithVoid();
    }

    void handle(String payload, Optional<String> correlationId) {
        IncomingPlanRequest incoming;
        IncomingPlanRequest.Action action;
        try {
            incoming = objectMapper.readValue(payload, IncomingPlanRequest.class);
            action = incoming.resolveAction();
        } catch (IOException | InvalidRequestException e) {
            log.warnf("요청 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("correlationId", correlationId.orElse(incoming.eventId()));
        MDC.put("eventId", incoming.eventId());
        MDC.put("actorId", String.valueOf(incoming.actorId()));
        try {
            switch (action) {
                case PREVIEW -> timesheetPlanUseCase.preview(incoming.toPreviewCommand());
                case COMMIT -> commit(incoming);
            }
        } catch (InvalidRequestException e) {
            log.warnf("요청 검증 실패로 처리 중단: %s", e.getMessage());
        } finally {
            MDC.remove("correlationId");
            MDC.remove("eventId");
            MDC.remove("actorId");
        }
    }

    private void commit(IncomingPlanRequest incoming) {
        PlanCommitCommand command = incoming.toCommitCommand();
        boolean keyed = command.requestId() != null && !command.requestId().isBlank();
        if (keyed && idempotencyStore.isProcessed(command.commitKey())) {
            log.infof("중복 커밋 요청을 건너뜁니다: %s", command.commitKey());
            PlanCommit duplicate = PlanCommit.failed(List.of(PlanIssue.of(IssueCode.DUPLICATE_REQUEST)));
            replyPort.send(new ReplyMessage(String.valueOf(incoming.actorId()), incoming.eventId(), ReplyKind.COMMIT, duplicate));
            return;
        }
        PlanCommit result = timesheetPlanUseCase.commit(command);
        if (result.ok()) {
            idempotencyStore.markProcessed(command.commitKey());
        }
    }

    private Optional<String> resolveCorrelationId(Message<String> message) {
        return message.getMetadata(IncomingRabbitMQMetadata.class)
                .flatMap(IncomingRabbitMQMetadata::getCorrelationId);
    }
}
