package com.my.timesheet.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 왜: 오류를 미리 포맷된 문자열 대신 종류와 문맥 필드로 보관해 표시 계층이 자유롭게 가공하도록 하기 위함.
 */
public record PlanIssue(IssueCode code, Map<String, String> fields) {

    public PlanIssue {
        Objects.requireNonNull(code, "code");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static PlanIssue of(IssueCode code) {
        return new PlanIssue(code, Map.of());
    }

    public PlanIssue with(String name, Object value) {
        Map<String, String> copy = new LinkedHashMap<>(fields);
        copy.put(name, value == null ? "" : String.valueOf(value));
        return new PlanIssue(code, copy);
    }

    public String field(String name) {
        return fields.get(name);
    }

    @JsonProperty("message")
    public String message() {
        String rendered = code.template();
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", entry.getValue());
        }
        return rendered;
    }

    @Override
    public String toString() {
        return message();
    }
}
