package com.primemath.backend.global.common.time;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * 센터 현지 시간대 기준의 "오늘"과 현재 시각.
 * 출결 날짜(checkInDate)와 근무일(workDate)은 UTC가 아니라 이 시간대의 달력 날짜를 따른다.
 */
public class CenterTime {

    private final Clock clock;
    private final ZoneId zone;

    public CenterTime(Clock clock, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    public int currentYear() {
        return today().getYear();
    }

    public YearMonth currentMonth() {
        return YearMonth.from(today());
    }

    public ZonedDateTime toLocal(OffsetDateTime instant) {
        return instant.atZoneSameInstant(zone);
    }

    public ZoneId zone() {
        return zone;
    }
}
