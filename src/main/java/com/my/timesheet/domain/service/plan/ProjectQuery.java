package com.my.timesheet.domain.service.plan;

import com.my.timesheet.domain.service.text.TextNormalizer;

/**
 * 구간에서 모은 프로젝트 라벨. name은 잘라낸 이름, raw는 라벨 원문.
 */
public record ProjectQuery(String name, String raw) {

    public String nameNormalized() {
        return TextNormalizer.normalizeLabel(name);
    }

    public String rawNormalized() {
        return TextNormalizer.normalizeLabel(raw);
    }
}
