package com.my.timesheet.domain.port.out;

import com.my.timesheet.domain.model.ReplyMessage;

/**
 * 왜: 미리보기/커밋 결과를 요청자에게 돌려보내는 채널을 도메인에서 감추기 위함.
 */
public interface ReplyPort {

    void send(ReplyMessage reply);
}
