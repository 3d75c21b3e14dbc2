package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.Interval;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProjectResolverTest {

    private ProjectDirectoryPort directory;
    private ProjectResolver resolver;

    @BeforeEach
    void setUp() {
        directory = mock(ProjectDirectoryPort.class);
        resolver = new ProjectResolver(directory);
    }

    @Test
    void exact_name_resolves_once_per_key() {
        Project alpha = new Project(1, "Alpha");
        when(directory.findProjectsByName("Alpha")).thenReturn(List.of(alpha));

        ProjectResolution resolution = resolver.resolve(List.of(
                Interval.work("09:00", "12:00", "Alpha", "Alpha", null),
                Interval.pause("12:00", "13:00"),
                Interval.work("13:00", "17:00", "Alpha", "Alpha", null)));

        assertThat(resolution.errors()).isEmpty();
        assertThat(resolution.project("alpha")).contains(alpha);
        verify(directory, times(1)).findProjectsByName("Alpha");
        verify(directory, never()).findAllProjects();
    }

    @Test
    void multiple_matches_are_ambiguous() {
        when(directory.findProjectsByName("Alpha")).thenReturn(List.of(new Project(1, "Alpha"), new Project(2, "ALPHA")));

        ProjectResolution resolution = resolver.resolve(List.of(Interval.work("09:00", "12:00", "Alpha", "Alpha", null)));

        assertThat(resolution.projects()).isEmpty();
        assertThat(resolution.errors()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.PROJECT_AMBIGUOUS);
            assertThat(issue.message()).isEqualTo("Project name \"Alpha\" is ambiguous: Alpha, ALPHA.");
        });
    }

    @Test
    void unknown_project_is_not_found() {
        ProjectResolution resolution = resolver.resolve(List.of(Interval.work("09:00", "12:00", "Zeta", "Zeta", null)));

        assertThat(resolution.errors()).singleElement()
                .satisfies(issue -> assertThat(issue.message()).isEqualTo("Project \"Zeta\" not found."));
    }

    @Test
    void project_prefix_is_stripped_from_raw_label() {
        Project alpha = new Project(1, "Alpha");
        when(directory.findProjectsByName("Alpha")).thenReturn(List.of(alpha));

        ProjectResolution resolution = resolver.resolve(List.of(
                Interval.work("09:00", "12:00", "project Alpha", "project Alpha", null)));

        assertThat(resolution.project("project alpha")).contains(alpha);
    }

    @Test
    void accent_insensitive_scan_is_the_last_resort() {
        Project agil = new Project(3, "Projeto Ágil");
        when(directory.findAllProjects()).thenReturn(List.of(new Project(1, "Alpha"), agil));

        ProjectResolution resolution = resolver.resolve(List.of(
                Interval.work("09:00", "12:00", "Projeto Agil", "Projeto Agil", null)));

        assertThat(resolution.errors()).isEmpty();
        assertThat(resolution.project("projeto agil")).contains(agil);
    }

    @Test
    void first_strategy_with_results_wins() {
        Project first = new Project(1, "Alpha");
        ProjectResolver custom = new ProjectResolver(directory, List.of(
                (query, dir) -> List.of(first),
                (query, dir) -> List.of(new Project(2, "Other"), new Project(3, "Another"))));

        ProjectResolution resolution = custom.resolve(List.of(Interval.work("09:00", "12:00", "x", "x", null)));

        assertThat(resolution.project("x")).contains(first);
    }
}
