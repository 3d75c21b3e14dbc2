package com.my.timesheet.domain.port.out;

import com.my.timesheet.domain.model.Location;
import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 테넌트의 프로젝트/작업/위치 조회를 읽기 전용 계약으로 묶어 계획 단계가 저장 방식에 묶이지 않게 하기 위함.
 */
public interface ProjectDirectoryPort {

    /**
     * 대소문자 무시 정확 일치. id 오름차순.
     */
    List<Project> findProjectsByName(String name);

    List<Project> findAllProjects();

    Optional<Project> findProject(long projectId);

    boolean isProjectMember(long projectId, long userId);

    Optional<Task> findTask(long taskId, long projectId);

    /**
     * 활성 작업 우선, 그다음 id 오름차순으로 첫 작업.
     */
    Optional<Task> findDefaultTask(long projectId);

    Optional<Location> findLocation(long locationId);

    Optional<Location> findFirstTaskLocation(long taskId);

    /**
     * 테넌트 전체에서 활성 위치 우선으로 첫 위치.
     */
    Optional<Location> findFallbackLocation();
}
