package com.my.timesheet.domain.service;

import com.my.timesheet.domain.exception.DuplicateCommitException;
import com.my.timesheet.domain.model.Actor;
import com.my.timesheet.domain.model.ApplyResult;
import com.my.timesheet.domain.model.Intent;
import com.my.timesheet.domain.model.IntentRequest;
import com.my.timesheet.domain.model.IntentResult;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.PlanBuildResult;
import com.my.timesheet.domain.model.PlanCommit;
import com.my.timesheet.domain.model.PlanCommitCommand;
import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.model.PlanPreview;
import com.my.timesheet.domain.model.PlanPreviewCommand;
import com.my.timesheet.domain.model.PlanRequest;
import com.my.timesheet.domain.model.PlanTarget;
import com.my.timesheet.domain.model.ReplyKind;
import com.my.timesheet.domain.model.ReplyMessage;
import com.my.timesheet.domain.model.Technician;
import com.my.timesheet.domain.model.TimesheetPolicy;
import com.my.timesheet.domain.model.ValidationResult;
import com.my.timesheet.domain.port.in.ApplyPlanUseCase;
import com.my.timesheet.domain.port.in.BuildPlanUseCase;
import com.my.timesheet.domain.port.in.ExtractIntentUseCase;
import com.my.timesheet.domain.port.in.TimesheetPlanUseCase;
import com.my.timesheet.domain.port.in.ValidatePlanUseCase;
import com.my.timesheet.domain.port.out.AccountDirectoryPort;
import com.my.timesheet.domain.port.out.ReplyPort;
import com.my.timesheet.domain.service.daterange.WorkCalendar;
import com.my.timesheet.domain.service.text.BuilderPrompt;
import com.my.timesheet.domain.service.text.TextNormalizer;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 요청자/대상 확인, 의도 추출, 계획 생성, 검증, 저장을 미리보기와 커밋 두 흐름으로 묶고 결과를 응답 채널로 보내기 위함.
 *
 * <p>의도 추출이 실패해도 미리보기는 프롬프트 규칙만으로 계속 진행한다.
 */
public class TimesheetPlanService implements TimesheetPlanUseCase {

    private static final Logger log = Logger.getLogger(TimesheetPlanService.class);
    private static final String OWNER = "Owner";
    private static final String ADMIN = "Admin";

    private final ExtractIntentUseCase intentExtractor;
    private final BuildPlanUseCase planBuilder;
    private final ValidatePlanUseCase planValidator;
    private final ApplyPlanUseCase planApplier;
    private final AccountDirectoryPort accountDirectory;
    private final ReplyPort replyPort;
    private final TimesheetPolicy policy;

    public TimesheetPlanService(ExtractIntentUseCase intentExtractor,
                                BuildPlanUseCase planBuilder,
                                ValidatePlanUseCase planValidator,
                                ApplyPlanUseCase planApplier,
                                AccountDirectoryPort accountDirectory,
                                ReplyPort replyPort,
                                TimesheetPolicy policy) {
        this.intentExtractor = intentExtractor;
        this.planBuilder = planBuilder;
        this.planValidator = planValidator;
        this.planApplier = planApplier;
        this.accountDirectory = accountDirectory;
        this.replyPort = replyPort;
        this.policy = policy;
    }

    @Override
    public PlanPreview preview(PlanPreviewCommand command) {
        PlanPreview preview = buildPreview(command);
        replyPort.send(new ReplyMessage(String.valueOf(command.actorId()), command.eventId(), ReplyKind.PREVIEW, preview));
        return preview;
    }

    @Override
    public PlanCommit commit(PlanCommitCommand command) {
        PlanCommit commit = runCommit(command);
        replyPort.send(new ReplyMessage(String.valueOf(command.actorId()), command.eventId(), ReplyKind.COMMIT, commit));
        return commit;
    }

    private PlanPreview buildPreview(PlanPreviewCommand command) {
        Optional<Actor> actor = accountDirectory.findActor(command.actorId());
        if (actor.isEmpty()) {
            return PlanPreview.failed(List.of(PlanIssue.of(IssueCode.ACTOR_NOT_FOUND)), List.of());
        }
        TargetResolution resolution = resolveTarget(actor.get(), command.technicianId());
        if (resolution.error() != null) {
            return PlanPreview.failed(List.of(resolution.error()), List.of());
        }
        PlanTarget target = resolution.target();

        String timezone = resolveTimezone(command.timezone());
        String rawPrompt = command.prompt();
        log.infof("미리보기 요청: technician=%d, timezone=%s, prompt=%s", target.technician().id(), timezone, rawPrompt);
        boolean builderShaped = BuilderPrompt.looksLikeBuilderPrompt(rawPrompt);
        String prompt = builderShaped ? rawPrompt : TextNormalizer.normalizeFreeText(rawPrompt);

        IntentResult intentResult = extractIntent(new IntentRequest(
                prompt, timezone, policy.weekStart(), command.startDate(), command.endDate()));
        Intent intent = intentResult != null && intentResult.ok() ? intentResult.intent() : null;

        PlanRequest request = new PlanRequest(prompt, timezone, policy.weekStart(), command.startDate(), command.endDate(), intent);
        PlanBuildResult built = planBuilder.build(request, target);
        if (!built.ok()) {
            List<String> missing = mergeMissingFields(intentResult, built.errors());
            Optional<String> builderProject = builderShaped ? BuilderPrompt.extractProject(rawPrompt) : Optional.empty();
            if (missing.contains("project") && builderProject.isPresent()) {
                log.infof("추출한 프로젝트로 계획 재생성: project=%s", builderProject.get());
                String patched = rawPrompt.stripTrailing() + "\n\nproject \"" + builderProject.get() + "\"";
                built = planBuilder.build(request.withPrompt(patched), target);
            }
            if (!built.ok()) {
                return PlanPreview.failed(built.errors(), missing);
            }
        }

        ValidationResult validation = planValidator.validate(built.plan(), actor.get(), target, false);
        if (!validation.ok()) {
            return PlanPreview.failed(validation.errors(), List.of());
        }

        Set<PlanIssue> warnings = new LinkedHashSet<>(built.warnings());
        warnings.addAll(validation.warnings());
        return new PlanPreview(List.of(), List.of(), new ArrayList<>(warnings), validation.normalizedPlan(), validation.totals());
    }

    private PlanCommit runCommit(PlanCommitCommand command) {
        if (TextNormalizer.isBlank(command.requestId())) {
            return PlanCommit.failed(List.of(PlanIssue.of(IssueCode.REQUEST_ID_REQUIRED)));
        }
        if (!command.confirmed()) {
            return PlanCommit.failed(List.of(PlanIssue.of(IssueCode.NOT_CONFIRMED)));
        }
        if (command.plan() == null) {
            return PlanCommit.failed(List.of(PlanIssue.of(IssueCode.PLAN_REQUIRED)));
        }

        Optional<Actor> actor = accountDirectory.findActor(command.actorId());
        if (actor.isEmpty()) {
            return PlanCommit.failed(List.of(PlanIssue.of(IssueCode.ACTOR_NOT_FOUND)));
        }
        TargetResolution resolution = resolveTarget(actor.get(), command.technicianId());
        if (resolution.error() != null) {
            return PlanCommit.failed(List.of(resolution.error()));
        }
        PlanTarget target = resolution.target();

        ValidationResult validation = planValidator.validate(
                command.plan().forTarget(target), actor.get(), target, policy.enforceBreaks());
        if (!validation.ok()) {
            log.infof("커밋 검증 실패: requestId=%s, errors=%d", command.requestId(), validation.errors().size());
            return PlanCommit.failed(validation.errors());
        }

        ApplyResult applied;
        try {
            applied = planApplier.apply(validation.normalizedPlan(), actor.get(), command.commitKey());
        } catch (DuplicateCommitException e) {
            log.infof("이미 저장된 커밋, 초안을 만들지 않음: key=%s", e.commitKey());
            return PlanCommit.failed(List.of(PlanIssue.of(IssueCode.DUPLICATE_REQUEST)));
        }
        log.infof("타임시트 초안 생성 완료: requestId=%s, count=%d", command.requestId(), applied.createdCount());
        return new PlanCommit(List.of(), applied.createdIds(), validation.totals());
    }

    private IntentResult extractIntent(IntentRequest request) {
        try {
            IntentResult result = intentExtractor.extract(request);
            if (result != null && !result.ok()) {
                log.warnf("의도 추출 실패, 프롬프트 규칙으로 진행: errors=%s, missing=%s", result.errors(), result.missingFields());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("의도 추출 중 예외 발생, 프롬프트 규칙으로 진행", e);
            return null;
        }
    }

    /**
     * 대상 기술자 지정은 Owner/Admin만 가능하다. 미지정이면 요청자 본인의 기술자 프로필(userId, 그다음 이메일).
     */
    private TargetResolution resolveTarget(Actor actor, Long technicianId) {
        Optional<Technician> technician;
        if (technicianId != null) {
            if (!actor.hasRole(OWNER) && !actor.hasRole(ADMIN)) {
                return TargetResolution.failed(IssueCode.TECHNICIAN_FORBIDDEN);
            }
            technician = accountDirectory.findTechnician(technicianId);
            if (technician.isEmpty()) {
                return TargetResolution.failed(IssueCode.TECHNICIAN_NOT_FOUND);
            }
        } else {
            technician = accountDirectory.findTechnicianByUserId(actor.id())
                    .or(() -> TextNormalizer.isBlank(actor.email())
                            ? Optional.<Technician>empty()
                            : accountDirectory.findTechnicianByEmail(actor.email()));
            if (technician.isEmpty()) {
                return TargetResolution.failed(IssueCode.TECHNICIAN_PROFILE_NOT_FOUND);
            }
        }
        if (technician.get().userId() == null) {
            return TargetResolution.failed(IssueCode.TECHNICIAN_WITHOUT_USER);
        }
        return new TargetResolution(new PlanTarget(technician.get(), technician.get().userId()), null);
    }

    private String resolveTimezone(String requested) {
        String candidate = TextNormalizer.isBlank(requested) ? policy.defaultTimezone() : requested.trim();
        if (WorkCalendar.zone(candidate).isPresent()) {
            return candidate;
        }
        log.warnf("알 수 없는 시간대, UTC로 대체: timezone=%s", candidate);
        return "UTC";
    }

    /**
     * AI가 되묻는 필드와 계획 오류에서 유추한 필드를 합친다.
     */
    private static List<String> mergeMissingFields(IntentResult intentResult, List<PlanIssue> errors) {
        Set<String> missing = new LinkedHashSet<>();
        if (intentResult != null) {
            missing.addAll(intentResult.missingFields());
        }
        for (PlanIssue error : errors) {
            if (error.code().missingField() != null) {
                missing.add(error.code().missingField());
            }
        }
        return new ArrayList<>(missing);
    }

    private record TargetResolution(PlanTarget target, PlanIssue error) {

        static TargetResolution failed(IssueCode code) {
            return new TargetResolution(null, PlanIssue.of(code));
        }
    }
}
