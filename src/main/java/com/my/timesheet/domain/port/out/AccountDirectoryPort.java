package com.my.timesheet.domain.port.out;

import com.my.timesheet.domain.model.Actor;
import com.my.timesheet.domain.model.Technician;

import java.util.Optional;

/**
 * 왜: 요청자와 대상 기술자 조회를 인증/테넌트 구현과 분리하기 위함.
 */
public interface AccountDirectoryPort {

    Optional<Actor> findActor(long userId);

    Optional<Technician> findTechnician(long technicianId);

    Optional<Technician> findTechnicianByUserId(long userId);

    Optional<Technician> findTechnicianByEmail(String email);
}
