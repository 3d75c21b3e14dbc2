package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.port.out.ProjectDirectoryPort;

import java.util.List;

/**
 * 왜: 철자/대소문자/따옴표 차이를 단계적으로 흡수하되 각 단계의 결과(0/1/다수)를 그대로 드러내기 위함.
 */
@FunctionalInterface
public interface ProjectMatchStrategy {

    /**
     * @return 적용 대상이 아니거나 일치가 없으면 빈 목록
     */
    List<Project> match(ProjectQuery query, ProjectDirectoryPort directory);
}
