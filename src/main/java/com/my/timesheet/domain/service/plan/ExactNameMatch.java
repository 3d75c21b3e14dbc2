package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;

import java.util.List;
import java.util.function.Function;

/**
 * 라벨에서 파생한 후보 문자열로 대소문자 무시 정확 일치 조회.
 * 후보가 비었거나 비교 기준과 같으면(이미 앞 단계에서 본 값) 건너뛴다.
 */
public class ExactNameMatch implements ProjectMatchStrategy {

    private final Function<ProjectQuery, String> candidate;
    private final Function<ProjectQuery, String> baseline;

    public ExactNameMatch(Function<ProjectQuery, String> candidate, Function<ProjectQuery, String> baseline) {
        this.candidate = candidate;
        this.baseline = baseline;
    }

    public static ExactNameMatch of(Function<ProjectQuery, String> candidate) {
        return new ExactNameMatch(candidate, null);
    }

    public static ExactNameMatch ifDiffers(Function<ProjectQuery, String> candidate, Function<ProjectQuery, String> baseline) {
        return new ExactNameMatch(candidate, baseline);
    }

    @Override
    public List<Project> match(ProjectQuery query, ProjectDirectoryPort directory) {
        String value = candidate.apply(query);
        if (value == null || value.isBlank()) {
            return List.of();
        }
        if (baseline != null && value.equals(baseline.apply(query))) {
            return List.of();
        }
        return directory.findProjectsByName(value);
    }
}
