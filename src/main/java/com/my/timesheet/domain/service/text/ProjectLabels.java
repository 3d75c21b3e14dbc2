package com.my.timesheet.domain.service.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 시간 구간 뒤에 붙은 자유 텍스트에서 프로젝트명만 잘라내는 규칙을 모아두기 위함.
 */
public final class ProjectLabels {

    private static final Pattern QUOTED_LINE = Pattern.compile(
            "^\\s*(?:project|projeto)\\s*[:=]\\s*[\"']?(.+?)[\"']?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern PREFIX_ASSIGN = Pattern.compile("\\b(?:project|projeto)\\s*[:=]\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PREFIX_WORD = Pattern.compile("\\b(?:project|projeto)\\s+(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_PREFIX = Pattern.compile("^\\s*(?:project|projeto)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern TIME_TOKEN = Pattern.compile("\\b\\d{1,2}:\\d{2}\\b");
    private static final Pattern RANGE_WORD = Pattern.compile(
            "\\b(?:from|to|de|a|ate|até|until)\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern DATE_RANGE_TOKEN = Pattern.compile("DATE_RANGE\\s*=");
    private static final Pattern PUNCTUATION = Pattern.compile("[;,.]");
    private static final Pattern CONJUNCTION = Pattern.compile("\\b(and|e)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIELD_WORD = Pattern.compile(
            "\\b(task|tarefa|descricao|description|nota|notas|notes|pausa|break|lunch)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPEN_PAREN = Pattern.compile("\\(");

    private static final Pattern BLOCK_CONNECTOR = Pattern.compile("^(bloco|block)\\s*\\d+(?:\\s*/\\s*\\d+)?$");

    private ProjectLabels() {
    }

    /**
     * 라벨(또는 프롬프트 전체)에서 프로젝트명을 추출한다. 없으면 빈 문자열.
     */
    public static String extractProjectName(String label) {
        String clean = TextNormalizer.normalizeLabel(label);
        if (clean.isEmpty()) {
            return "";
        }

        Matcher quoted = QUOTED_LINE.matcher(clean);
        if (quoted.find()) {
            return quoted.group(1).trim();
        }

        String raw = clean;
        boolean matchedPrefix = false;
        Matcher assign = PREFIX_ASSIGN.matcher(raw);
        Matcher word = PREFIX_WORD.matcher(raw);
        if (assign.find()) {
            raw = assign.group(1);
            matchedPrefix = true;
        } else if (word.find()) {
            raw = word.group(1);
            matchedPrefix = true;
        }

        raw = trimAtBoundary(raw);
        raw = TextNormalizer.normalizeLabel(raw);
        if (!matchedPrefix) {
            raw = LEADING_PREFIX.matcher(raw).replaceFirst("");
        }
        raw = TextNormalizer.stripQuotes(raw);
        return raw.trim();
    }

    /**
     * 선행 "project"/"projeto" 단어를 제거한다.
     */
    public static String stripProjectPrefix(String label) {
        return LEADING_PREFIX.matcher(label).replaceFirst("");
    }

    /**
     * 시간, 범위 단어, 구두점, 필드명 등 프로젝트명이 끝나는 가장 이른 위치에서 자른다.
     */
    static String trimAtBoundary(String value) {
        String raw = value.trim();
        if (raw.isEmpty()) {
            return "";
        }

        List<Integer> offsets = new ArrayList<>();
        addFirstOffset(TIME_TOKEN, raw, offsets);
        addFirstOffset(RANGE_WORD, raw, offsets);
        addFirstOffset(DATE_RANGE_TOKEN, raw, offsets);
        addFirstOffset(PUNCTUATION, raw, offsets);
        Matcher conjunction = CONJUNCTION.matcher(raw);
        if (conjunction.find() && TIME_TOKEN.matcher(raw.substring(conjunction.start())).find()) {
            offsets.add(conjunction.start());
        }
        addFirstOffset(FIELD_WORD, raw, offsets);
        addFirstOffset(OPEN_PAREN, raw, offsets);

        if (offsets.isEmpty()) {
            return raw;
        }
        int cut = offsets.stream().mapToInt(Integer::intValue).min().orElse(0);
        if (cut <= 0) {
            return raw;
        }
        return raw.substring(0, cut).trim();
    }

    /**
     * ",", "e", "and", "block 1" 같은 연결어는 프로젝트명이 아니다.
     */
    public static boolean isConnector(String label) {
        String normalized = TextNormalizer.normalizePrompt(label).trim();
        if (normalized.isEmpty() || normalized.equals(",")) {
            return true;
        }
        if (normalized.equals("e") || normalized.equals("and")) {
            return true;
        }
        return BLOCK_CONNECTOR.matcher(normalized).matches();
    }

    private static void addFirstOffset(Pattern pattern, String raw, List<Integer> offsets) {
        Matcher matcher = pattern.matcher(raw);
        if (matcher.find()) {
            offsets.add(matcher.start());
        }
    }
}
