package com.my.timesheet.domain.exception;

/**
 * 왜: 같은 커밋 키가 이미 저장된 경우 저장소가 트랜잭션을 되돌린 뒤 상위 계층에 중복임을 알리기 위함.
 */
public class DuplicateCommitException extends RuntimeException {

    private final String commitKey;

    public DuplicateCommitException(String commitKey) {
        super("이미 처리된 커밋 키: " + commitKey);
        this.commitKey = commitKey;
    }

    public String commitKey() {
        return commitKey;
    }
}
