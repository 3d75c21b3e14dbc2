package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.Intent;
import com.my.timesheet.domain.model.IntentBlock;
import com.my.timesheet.domain.model.Interval;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.service.text.ProjectLabels;
import com.my.timesheet.domain.service.text.TextNormalizer;
import com.my.timesheet.domain.service.text.TimeOfDay;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 프롬프트의 "HH:mm-HH:mm 라벨" 반복과 의도의 schedule/breaks를 같은 Interval 형태로 만들기 위함.
 *
 * <p>프로젝트 우선순위: 의도 프로젝트 &gt; 구간 라벨 &gt; 프롬프트 전체에서 뽑은 프로젝트 &gt; 빌더 형식 project 줄.
 */
public class IntervalExtractor {

    private static final Pattern INTERVAL = Pattern.compile(
            "(break\\s*)?(\\d{1,2}:\\d{2})\\s*-\\s*(\\d{1,2}:\\d{2})(.*?)(?=\\d{1,2}:\\d{2}\\s*-\\s*\\d{1,2}:\\d{2}|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BLOCK_LABEL = Pattern.compile("\\b(?:bloco|block)\\s*\\d+\\s*:\\s*", Pattern.CASE_INSENSITIVE);

    /**
     * @param intentProject 의도에 담긴 프로젝트(없으면 빈 문자열)
     * @param intentNotes   모든 근무 구간에 붙일 메모
     * @param builderProject 디렉터리에서 확인된 빌더 프로젝트명(없으면 빈 문자열)
     */
    public IntervalExtraction fromPrompt(String prompt, String intentProject, String intentNotes, String builderProject) {
        String text = BLOCK_LABEL.matcher(TextNormalizer.normalizeDashes(prompt)).replaceAll("");
        List<Interval> intervals = new ArrayList<>();
        List<PlanIssue> errors = new ArrayList<>();

        Matcher matcher = INTERVAL.matcher(text);
        String fallbackProject = ProjectLabels.extractProjectName(text);
        String hint = intentProject == null ? "" : intentProject.trim();
        String builder = builderProject == null ? "" : builderProject;

        while (matcher.find()) {
            boolean isBreak = matcher.group(1) != null && !matcher.group(1).isBlank();
            String start = matcher.group(2);
            String end = matcher.group(3);
            String label = trimLabel(matcher.group(4));

            String labelLower = label.toLowerCase(Locale.ROOT);
            if (labelLower.contains("break") || labelLower.contains("lunch")) {
                isBreak = true;
            }

            if (!TimeOfDay.isValidClock(start) || !TimeOfDay.isValidClock(end)) {
                errors.add(invalidRange(start, end));
                continue;
            }
            if (isBreak) {
                intervals.add(Interval.pause(start, end));
                continue;
            }

            String projectRaw = TextNormalizer.normalizeLabel(label);
            String projectLabel = ProjectLabels.extractProjectName(label);
            if (ProjectLabels.isConnector(projectLabel)) {
                projectLabel = "";
                projectRaw = "";
            }

            if (!hint.isEmpty()) {
                projectLabel = hint;
                projectRaw = hint;
            } else if (projectLabel.isEmpty() && !fallbackProject.isEmpty()) {
                projectLabel = fallbackProject;
                projectRaw = fallbackProject;
            } else if (projectLabel.isEmpty() && !builder.isEmpty()) {
                projectLabel = builder;
                projectRaw = builder;
            }

            if (projectLabel.isEmpty()) {
                errors.add(PlanIssue.of(IssueCode.MISSING_PROJECT_NAME).with("start", start).with("end", end));
                continue;
            }
            intervals.add(Interval.work(start, end, projectLabel, projectRaw, intentNotes));
        }
        return new IntervalExtraction(intervals, errors);
    }

    /**
     * 의도의 schedule은 의도 프로젝트로 근무 구간을, breaks는 휴식 구간을 만든다.
     */
    public IntervalExtraction fromIntent(Intent intent) {
        List<Interval> intervals = new ArrayList<>();
        List<PlanIssue> errors = new ArrayList<>();

        String project = TextNormalizer.normalizeLabel(intent.project());
        if (project.isEmpty()) {
            errors.add(PlanIssue.of(IssueCode.PROJECT_REQUIRED));
            return new IntervalExtraction(intervals, errors);
        }
        if (intent.schedule().isEmpty()) {
            errors.add(PlanIssue.of(IssueCode.SCHEDULE_REQUIRED));
            return new IntervalExtraction(intervals, errors);
        }

        String notes = intent.mergedNotes();
        for (IntentBlock block : intent.schedule()) {
            String start = nullToEmpty(block.from());
            String end = nullToEmpty(block.to());
            if (!TimeOfDay.isValidClock(start) || !TimeOfDay.isValidClock(end)) {
                errors.add(invalidRange(start, end));
                continue;
            }
            intervals.add(Interval.work(start, end, project, project, notes));
        }
        for (IntentBlock block : intent.breaks()) {
            String start = nullToEmpty(block.from());
            String end = nullToEmpty(block.to());
            if (!TimeOfDay.isValidClock(start) || !TimeOfDay.isValidClock(end)) {
                errors.add(invalidRange(start, end));
                continue;
            }
            intervals.add(Interval.pause(start, end));
        }
        return new IntervalExtraction(intervals, errors);
    }

    private static String trimLabel(String label) {
        String value = label == null ? "" : label.trim();
        int from = 0;
        int to = value.length();
        while (from < to && (Character.isWhitespace(value.charAt(from)) || value.charAt(from) == '.')) {
            from++;
        }
        while (to > from && (Character.isWhitespace(value.charAt(to - 1)) || value.charAt(to - 1) == '.')) {
            to--;
        }
        return value.substring(from, to);
    }

    private static PlanIssue invalidRange(String start, String end) {
        return PlanIssue.of(IssueCode.INVALID_TIME_RANGE).with("start", start).with("end", end);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
