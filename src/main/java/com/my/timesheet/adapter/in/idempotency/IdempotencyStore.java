package com.my.timesheet.adapter.in.idempotency;

/**
 * 키는 미리보기는 eventId, 커밋은 "actorId:requestId".
 */
public interface IdempotencyStore {

    boolean isProcessed(String key);

    void markProcessed(String key);
}
