package com.my.timesheet.domain.model;

import java.util.Locale;

/**
 * 왜: 프롬프트/의도에서 뽑아낸 시간 구간을 프로젝트 라벨과 함께 묶어 중복 제거와 프로젝트 해석에 쓰기 위함.
 *
 * <p>휴식 구간은 프로젝트를 갖지 않는다.
 */
public record Interval(
        String startTime,
        String endTime,
        String projectName,
        String projectKey,
        String projectRaw,
        boolean isBreak,
        String notes
) {

    public static Interval work(String startTime, String endTime, String projectName, String projectRaw, String notes) {
        return new Interval(startTime, endTime, projectName, projectName.toLowerCase(Locale.ROOT), projectRaw, false, notes);
    }

    public static Interval pause(String startTime, String endTime) {
        return new Interval(startTime, endTime, "", "", "", true, null);
    }

    public boolean hasProject() {
        return projectName != null && !projectName.isBlank();
    }

    public Interval withProject(String project) {
        return work(startTime, endTime, project, project, notes);
    }

    /**
     * (시작, 종료, 프로젝트, 휴식 여부) 기준 중복 제거 키.
     */
    public String dedupKey() {
        String project = isBreak ? "break" : (projectKey == null ? "" : projectKey);
        return String.format("%s-%s-%s-%d", startTime, endTime, project, isBreak ? 1 : 0).toLowerCase(Locale.ROOT);
    }
}
