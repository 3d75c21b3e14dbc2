package com.my.timesheet.domain.model;

public enum ReplyKind {
    PREVIEW,
    COMMIT
}
