package com.my.timesheet.domain.service.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void normalizeFreeText_folds_accents_quotes_and_whitespace() {
        String cleaned = TextNormalizer.normalizeFreeText("  Trabalhei  “Projeto Ágil”\n de 09:00 ");

        assertThat(cleaned).isEqualTo("Trabalhei \"Projeto Agil\" de 09:00");
    }

    @Test
    void normalizePrompt_lowercases_and_collapses_spaces() {
        assertThat(TextNormalizer.normalizePrompt("Últimos  3 Dias")).isEqualTo("ultimos 3 dias");
    }

    @Test
    void stripQuotes_only_removes_matching_pairs() {
        assertThat(TextNormalizer.stripQuotes("'Alpha'")).isEqualTo("Alpha");
        assertThat(TextNormalizer.stripQuotes("“Alpha”")).isEqualTo("Alpha");
        assertThat(TextNormalizer.stripQuotes("\"Alpha")).isEqualTo("\"Alpha");
        assertThat(TextNormalizer.stripQuotes("x")).isEqualTo("x");
    }

    @Test
    void normalizeDashes_turns_typographic_dashes_into_hyphen() {
        assertThat(TextNormalizer.normalizeDashes("09:00–13:00 — 14:00−18:00")).isEqualTo("09:00-13:00 - 14:00-18:00");
    }
}
