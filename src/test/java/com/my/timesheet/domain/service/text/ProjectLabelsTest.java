package com.my.timesheet.domain.service.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProjectLabelsTest {

    @Test
    void reads_assignment_line() {
        assertThat(ProjectLabels.extractProjectName("project: Alpha Build")).isEqualTo("Alpha Build");
    }

    @Test
    void cuts_label_at_punctuation_and_field_words() {
        assertThat(ProjectLabels.extractProjectName("Alpha; task review")).isEqualTo("Alpha");
        assertThat(ProjectLabels.extractProjectName("Alpha (on site)")).isEqualTo("Alpha");
    }

    @Test
    void cuts_prefixed_label_at_range_word() {
        assertThat(ProjectLabels.extractProjectName("projeto Beta de 10:00")).isEqualTo("Beta");
    }

    @Test
    void keeps_quoted_label_whole() {
        assertThat(ProjectLabels.extractProjectName("\"Gamma Ops\"")).isEqualTo("Gamma Ops");
    }

    @Test
    void blank_label_yields_empty() {
        assertThat(ProjectLabels.extractProjectName("   ")).isEmpty();
        assertThat(ProjectLabels.extractProjectName(null)).isEmpty();
    }

    @Test
    void connectors_are_not_projects() {
        assertThat(ProjectLabels.isConnector("and")).isTrue();
        assertThat(ProjectLabels.isConnector(",")).isTrue();
        assertThat(ProjectLabels.isConnector("Block 2")).isTrue();
        assertThat(ProjectLabels.isConnector("bloco 1/2")).isTrue();
        assertThat(ProjectLabels.isConnector("Alpha")).isFalse();
    }
}
