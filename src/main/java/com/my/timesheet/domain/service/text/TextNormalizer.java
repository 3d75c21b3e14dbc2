package com.my.timesheet.domain.service.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 왜: 영어/포르투갈어 입력의 따옴표, 대시, 악센트 차이를 한 곳에서 흡수해 규칙들이 같은 형태의 문자열만 보도록 하기 위함.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalizeQuotes(String value) {
        if (value == null) {
            return "";
        }
        return value
                .replace('“', '"')
                .replace('”', '"')
                .replace('„', '"')
                .replace('’', '\'');
    }

    /**
     * 양 끝이 같은 따옴표로 감싸져 있으면 벗긴다.
     */
    public static String stripQuotes(String value) {
        String trimmed = normalizeQuotes(value).trim();
        if (trimmed.length() < 2) {
            return trimmed;
        }
        char first = trimmed.charAt(0);
        char last = trimmed.charAt(trimmed.length() - 1);
        if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    /**
     * 따옴표 정규화 + trim + 바깥 따옴표 제거.
     */
    public static String normalizeLabel(String value) {
        return stripQuotes(normalizeQuotes(value).trim());
    }

    public static String foldAscii(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    /**
     * 소문자 + ASCII 접기 + 공백 축약. 상대 주/요일 규칙 매칭용.
     */
    public static String normalizePrompt(String prompt) {
        String folded = foldAscii(prompt == null ? "" : prompt.toLowerCase(Locale.ROOT));
        return WHITESPACE.matcher(folded).replaceAll(" ");
    }

    /**
     * 사람이 입력한 프롬프트를 AI에 보내기 전 정리한다(빌더 형식 프롬프트에는 쓰지 않는다).
     */
    public static String normalizeFreeText(String prompt) {
        String folded = foldAscii(normalizeQuotes(prompt));
        return WHITESPACE.matcher(folded).replaceAll(" ").trim();
    }

    public static String normalizeDashes(String value) {
        if (value == null) {
            return "";
        }
        return value
                .replace('–', '-')
                .replace('—', '-')
                .replace('−', '-')
                .replace('‑', '-');
    }

    public static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
