package com.my.timesheet.domain.service;

import com.my.timesheet.domain.model.Intent;
import com.my.timesheet.domain.model.IntentDateRange;
import com.my.timesheet.domain.model.IntentRequest;
import com.my.timesheet.domain.model.IntentResult;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.LlmResponse;
import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.port.in.ExtractIntentUseCase;
import com.my.timesheet.domain.port.out.IntentPayloadDecoder;
import com.my.timesheet.domain.port.out.LlmPort;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;
import com.my.timesheet.domain.service.text.BuilderPrompt;
import com.my.timesheet.domain.service.text.TextNormalizer;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: AI가 돌려준 의도에 프롬프트의 "project: X" 같은 명시 라벨을 보강하고, 되물어야 할 필드를 판정하기 위함.
 *
 * <p>AI 값이 비어 있을 때만 라벨 값으로 채운다.
 */
public class IntentExtractionService implements ExtractIntentUseCase {

    private static final Logger log = Logger.getLogger(IntentExtractionService.class);

    static final String AI_UNAVAILABLE_DETAIL = "AI intent parsing is unavailable.";

    private final LlmPort llmPort;
    private final IntentPayloadDecoder decoder;
    private final ProjectDirectoryPort projectDirectory;

    public IntentExtractionService(LlmPort llmPort, IntentPayloadDecoder decoder, ProjectDirectoryPort projectDirectory) {
        this.llmPort = llmPort;
        this.decoder = decoder;
        this.projectDirectory = projectDirectory;
    }

    @Override
    public IntentResult extract(IntentRequest request) {
        String prompt = request.prompt();
        Map<String, String> labeled = extractLabeledFields(prompt);

        LlmResponse response = llmPort.parseTimesheetIntent(prompt, request.timezone(), request.weekStart());
        if (response == null || !response.success()) {
            String detail = response == null || TextNormalizer.isBlank(response.error()) ? AI_UNAVAILABLE_DETAIL : response.error();
            return IntentResult.failed(PlanIssue.of(IssueCode.AI_UNAVAILABLE).with("detail", detail));
        }

        Optional<Intent> decoded = decoder.decode(response.response() == null ? "" : response.response());
        if (decoded.isEmpty()) {
            return IntentResult.failed(PlanIssue.of(IssueCode.AI_INVALID_JSON));
        }

        Intent intent = mergeLabeledFields(decoded.get(), labeled);
        intent = resolveBuilderProject(intent, prompt);
        intent = applyRequestBounds(intent, request);

        List<String> missing = missingFields(intent);
        return new IntentResult(intent, List.of(), missing);
    }

    /**
     * "project: X", "tarefa = Y" 같은 줄. 라벨은 소문자 + 악센트 제거 후 비교한다.
     */
    static Map<String, String> extractLabeledFields(String prompt) {
        Map<String, String> fields = new HashMap<>();
        for (String line : prompt.split("\\r\\n|\\r|\\n")) {
            String normalized = TextNormalizer.normalizeQuotes(line);
            String[] parts = normalized.split("[:=]", 2);
            if (parts.length < 2) {
                continue;
            }
            String label = TextNormalizer.foldAscii(TextNormalizer.lower(parts[0].trim())).trim();
            String value = TextNormalizer.stripQuotes(parts[1].trim());
            if (label.isEmpty() || value.isEmpty()) {
                continue;
            }
            switch (label) {
                case "project", "projeto" -> fields.put("project", value);
                case "task", "tarefa" -> fields.put("task", value);
                case "descricao", "description" -> fields.put("description", value);
                case "notes", "note", "observacoes", "observacao" -> fields.put("notes", value);
                default -> {
                }
            }
        }
        return fields;
    }

    private static Intent mergeLabeledFields(Intent intent, Map<String, String> labeled) {
        Intent merged = intent;
        if (labeled.containsKey("project") && TextNormalizer.isBlank(merged.project())) {
            merged = merged.withProject(labeled.get("project"));
        }
        if (labeled.containsKey("task") && TextNormalizer.isBlank(merged.task())) {
            merged = merged.withTask(labeled.get("task"));
        }
        if (labeled.containsKey("description") && TextNormalizer.isBlank(merged.description())) {
            merged = merged.withDescription(labeled.get("description"));
        }
        if (labeled.containsKey("notes") && TextNormalizer.isBlank(merged.notes())) {
            merged = merged.withNotes(labeled.get("notes"));
        }
        return merged;
    }

    /**
     * 빌더 형식이고 프로젝트가 비었거나 AI가 되묻는 경우, project 줄을 디렉터리의 실제 이름으로 바꿔 넣는다.
     */
    private Intent resolveBuilderProject(Intent intent, String prompt) {
        if (!BuilderPrompt.looksLikeBuilderPrompt(prompt)) {
            return intent;
        }
        Optional<String> builderProject = BuilderPrompt.extractProject(prompt);
        if (builderProject.isEmpty()) {
            return intent;
        }
        boolean projectMissing = !intent.hasProject() || intent.missingFields().contains("project");
        if (!projectMissing) {
            return intent;
        }
        List<Project> matches = projectDirectory.findProjectsByName(builderProject.get());
        if (matches.size() > 1) {
            // 임의로 고르지 않는다. 계획 생성 단계의 프로젝트 확정이 모호 오류로 보고한다
            log.infof("빌더 프로젝트 이름이 여러 프로젝트와 일치: project=%s, matches=%d", builderProject.get(), matches.size());
            return intent;
        }
        return matches.isEmpty() ? intent : intent.withProject(matches.get(0).name());
    }

    private static Intent applyRequestBounds(Intent intent, IntentRequest request) {
        if (intent.dateRange() != null) {
            return intent;
        }
        String start = TextNormalizer.isBlank(request.startDate()) ? null : request.startDate();
        String end = TextNormalizer.isBlank(request.endDate()) ? null : request.endDate();
        if (start == null && end == null) {
            return intent;
        }
        String from = start != null ? start : end;
        String to = end != null ? end : start;
        return intent.withDateRange(IntentDateRange.absolute(from, to));
    }

    static List<String> missingFields(Intent intent) {
        Set<String> missing = new LinkedHashSet<>();
        for (String field : intent.missingFields()) {
            if (field != null && !field.isBlank()) {
                missing.add(field);
            }
        }

        if (intent.intent().isEmpty()) {
            missing.add("intent");
            return new ArrayList<>(missing);
        }
        if (!Intent.CREATE_TIMESHEETS.equals(intent.intent())) {
            return List.of("intent");
        }

        IntentDateRange range = intent.dateRange();
        if (range == null) {
            missing.add("date_range");
        } else {
            String type = range.normalizedType();
            if (IntentDateRange.ABSOLUTE.equals(type)) {
                if (TextNormalizer.isBlank(range.from()) || TextNormalizer.isBlank(range.to())) {
                    missing.add("date_range");
                }
            } else if (IntentDateRange.RELATIVE.equals(type)) {
                if (TextNormalizer.isBlank(range.value())) {
                    missing.add("date_range");
                } else if (IntentDateRange.LAST_N_WORKDAYS.equals(range.value())
                        && (range.count() == null || range.count() <= 0)) {
                    missing.add("date_range.count");
                }
            } else {
                missing.add("date_range");
            }
        }

        if (intent.schedule().isEmpty()) {
            missing.add("schedule");
        }
        if (!intent.hasProject()) {
            missing.add("project");
        }
        return new ArrayList<>(missing);
    }
}
