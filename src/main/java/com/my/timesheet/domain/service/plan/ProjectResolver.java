package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.Interval;
import com.my.timesheet.domain.model.IssueCode;
import com.my.timesheet.domain.model.PlanIssue;
import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;
import com.my.timesheet.domain.service.text.ProjectLabels;
import com.my.timesheet.domain.service.text.TextNormalizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 왜: 구간 라벨을 테넌트 프로젝트로 확정하되 모호하면 조용히 첫 번째를 고르지 않고 오류로 돌려주기 위함.
 *
 * <p>전략은 순서대로 시도하며, 결과가 나온 첫 전략에서 멈춘다. 1건이면 확정, 여러 건이면 모호 오류.
 */
public class ProjectResolver {

    private final ProjectDirectoryPort directory;
    private final List<ProjectMatchStrategy> strategies;

    public ProjectResolver(ProjectDirectoryPort directory) {
        this(directory, defaultStrategies());
    }

    public ProjectResolver(ProjectDirectoryPort directory, List<ProjectMatchStrategy> strategies) {
        this.directory = directory;
        this.strategies = List.copyOf(strategies);
    }

    public static List<ProjectMatchStrategy> defaultStrategies() {
        return List.of(
                ExactNameMatch.of(ProjectQuery::nameNormalized),
                ExactNameMatch.ifDiffers(ProjectQuery::rawNormalized, ProjectQuery::nameNormalized),
                ExactNameMatch.ifDiffers(query -> TextNormalizer.normalizeQuotes(query.name()), ProjectQuery::nameNormalized),
                ExactNameMatch.ifDiffers(query -> TextNormalizer.normalizeQuotes(query.raw()), ProjectQuery::rawNormalized),
                ExactNameMatch.ifDiffers(query -> ProjectLabels.stripProjectPrefix(query.rawNormalized()), ProjectQuery::rawNormalized),
                new AsciiFoldScanMatch()
        );
    }

    public ProjectResolution resolve(List<Interval> intervals) {
        Map<String, ProjectQuery> queries = new LinkedHashMap<>();
        for (Interval interval : intervals) {
            if (interval.isBreak()) {
                continue;
            }
            queries.put(interval.projectKey(), new ProjectQuery(interval.projectName(), interval.projectRaw()));
        }

        Map<String, Project> resolved = new HashMap<>();
        List<PlanIssue> errors = new ArrayList<>();
        for (Map.Entry<String, ProjectQuery> entry : queries.entrySet()) {
            ProjectQuery query = entry.getValue();
            List<Project> matches = firstMatches(query);
            if (matches.isEmpty()) {
                errors.add(PlanIssue.of(IssueCode.PROJECT_NOT_FOUND).with("project", query.nameNormalized()));
            } else if (matches.size() > 1) {
                String candidates = matches.stream().map(Project::name).collect(Collectors.joining(", "));
                errors.add(PlanIssue.of(IssueCode.PROJECT_AMBIGUOUS)
                        .with("project", query.nameNormalized())
                        .with("candidates", candidates));
            } else {
                resolved.put(entry.getKey(), matches.get(0));
            }
        }
        return new ProjectResolution(resolved, errors);
    }

    private List<Project> firstMatches(ProjectQuery query) {
        for (ProjectMatchStrategy strategy : strategies) {
            List<Project> matches = strategy.match(query, directory);
            if (!matches.isEmpty()) {
                return matches;
            }
        }
        return List.of();
    }
}
