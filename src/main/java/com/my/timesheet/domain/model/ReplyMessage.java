package com.my.timesheet.domain.model;

import java.util.Objects;

/**
 * 왜: 최종 응답 메시지의 계약을 고정하여 어댑터가 일관된 포맷으로 전송하도록 하기 위함.
 */
public record ReplyMessage(String replyToUserId, String eventId, ReplyKind kind, Object body) {
    public ReplyMessage {
        Objects.requireNonNull(replyToUserId, "replyToUserId");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(kind, "kind");
        if (replyToUserId.isBlank()) {
            throw new IllegalArgumentException("replyToUserId는 비어 있을 수 없습니다.");
        }
    }
}
