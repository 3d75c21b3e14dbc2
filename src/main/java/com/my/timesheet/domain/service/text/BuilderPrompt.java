package com.my.timesheet.domain.service.text;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 화면의 폼 빌더가 만든 "DATE_RANGE=..", "projeto: X" 형식 프롬프트를 자유 문장과 구분하기 위함.
 */
public final class BuilderPrompt {

    private static final Pattern DATE_RANGE_TOKEN = Pattern.compile(
            "\\bDATE_RANGE\\s*=\\s*\\d{4}-\\d{2}-\\d{2}\\s*\\.\\.\\s*\\d{4}-\\d{2}-\\d{2}\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LABEL_LINE = Pattern.compile(
            "^\\s*(projeto|project|tarefa|task|descri[cç]ao|description|bloco|block)\\s*[:=]",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE);
    private static final Pattern PROJECT_LINE = Pattern.compile(
            "^\\s*(projeto|project)\\s*[:=]\\s*[\"']?(.+?)[\"']?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private BuilderPrompt() {
    }

    public static boolean looksLikeBuilderPrompt(String prompt) {
        if (prompt == null) {
            return false;
        }
        return DATE_RANGE_TOKEN.matcher(prompt).find() || LABEL_LINE.matcher(prompt).find();
    }

    /**
     * "project: X" / "projeto = 'X'" 줄의 프로젝트명.
     */
    public static Optional<String> extractProject(String prompt) {
        Matcher matcher = PROJECT_LINE.matcher(TextNormalizer.normalizeQuotes(prompt));
        if (!matcher.find()) {
            return Optional.empty();
        }
        String project = TextNormalizer.stripQuotes(matcher.group(2).trim()).trim();
        return project.isEmpty() ? Optional.empty() : Optional.of(project);
    }
}
