package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;
import com.my.timesheet.domain.service.text.TextNormalizer;

import java.util.List;

/**
 * 마지막 단계: 전체 프로젝트를 훑어 악센트를 지운 소문자 이름으로 비교한다. 정규화 이름, 그다음 원문 순.
 */
public class AsciiFoldScanMatch implements ProjectMatchStrategy {

    @Override
    public List<Project> match(ProjectQuery query, ProjectDirectoryPort directory) {
        List<Project> all = directory.findAllProjects();
        List<Project> byName = scan(all, query.nameNormalized());
        if (!byName.isEmpty()) {
            return byName;
        }
        return scan(all, query.rawNormalized());
    }

    private static List<Project> scan(List<Project> projects, String label) {
        String key = fold(label);
        if (key.isEmpty()) {
            return List.of();
        }
        return projects.stream()
                .filter(project -> fold(project.name()).equals(key))
                .toList();
    }

    private static String fold(String value) {
        return TextNormalizer.foldAscii(TextNormalizer.lower(value)).trim();
    }
}
