package com.my.timesheet.config;

import com.my.timesheet.adapter.out.clock.OffsetClockAdapter;
import com.my.timesheet.domain.model.TimesheetPolicy;
import com.my.timesheet.domain.port.in.ApplyPlanUseCase;
import com.my.timesheet.domain.port.in.BuildPlanUseCase;
import com.my.timesheet.domain.port.in.ExtractIntentUseCase;
import com.my.timesheet.domain.port.in.TimesheetPlanUseCase;
import com.my.timesheet.domain.port.in.ValidatePlanUseCase;
import com.my.timesheet.domain.port.out.AccountDirectoryPort;
import com.my.timesheet.domain.port.out.ClockPort;
import com.my.timesheet.domain.port.out.IntentPayloadDecoder;
import com.my.timesheet.domain.port.out.LlmPort;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;
import com.my.timesheet.domain.port.out.ReplyPort;
import com.my.timesheet.domain.port.out.TimesheetStorePort;
import com.my.timesheet.domain.service.IntentExtractionService;
import com.my.timesheet.domain.service.PlanApplyService;
import com.my.timesheet.domain.service.PlanBuilderService;
import com.my.timesheet.domain.service.PlanValidationService;
import com.my.timesheet.domain.service.TimesheetPlanService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public TimesheetPolicy timesheetPolicy(AppConfig appConfig) {
        AppConfig.TimesheetsConfig timesheets = appConfig.timesheets();
        return new TimesheetPolicy(
                timesheets.dailyHourCap(),
                timesheets.breakRequiredAfterHours(),
                timesheets.breakMinMinutes(),
                timesheets.enforceBreaks(),
                timesheets.defaultTimezone(),
                timesheets.weekStart());
    }

    @Produces
    @ApplicationScoped
    public ExtractIntentUseCase extractIntentUseCase(LlmPort llmPort,
                                                     IntentPayloadDecoder intentPayloadDecoder,
                                                     ProjectDirectoryPort projectDirectoryPort) {
        return new IntentExtractionService(llmPort, intentPayloadDecoder, projectDirectoryPort);
    }

    @Produces
    @ApplicationScoped
    public BuildPlanUseCase buildPlanUseCase(ProjectDirectoryPort projectDirectoryPort, ClockPort clockPort) {
        return new PlanBuilderService(projectDirectoryPort, clockPort);
    }

    @Produces
    @ApplicationScoped
    public ValidatePlanUseCase validatePlanUseCase(ProjectDirectoryPort projectDirectoryPort,
                                                   TimesheetStorePort timesheetStorePort,
                                                   TimesheetPolicy timesheetPolicy) {
        return new PlanValidationService(projectDirectoryPort, timesheetStorePort, timesheetPolicy);
    }

    @Produces
    @ApplicationScoped
    public ApplyPlanUseCase applyPlanUseCase(TimesheetStorePort timesheetStorePort) {
        return new PlanApplyService(timesheetStorePort);
    }

    @Produces
    @ApplicationScoped
    public TimesheetPlanUseCase timesheetPlanUseCase(ExtractIntentUseCase extractIntentUseCase,
                                                     BuildPlanUseCase buildPlanUseCase,
                                                     ValidatePlanUseCase validatePlanUseCase,
                                                     ApplyPlanUseCase applyPlanUseCase,
                                                     AccountDirectoryPort accountDirectoryPort,
                                                     ReplyPort replyPort,
                                                     TimesheetPolicy timesheetPolicy) {
        return new TimesheetPlanService(extractIntentUseCase, buildPlanUseCase, validatePlanUseCase,
                applyPlanUseCase, accountDirectoryPort, replyPort, timesheetPolicy);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return OffsetClockAdapter.system();
    }
}
