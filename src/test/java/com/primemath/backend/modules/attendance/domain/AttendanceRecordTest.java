package com.primemath.backend.modules.attendance.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class AttendanceRecordTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-03T09:00:00Z");

    private final AttendanceRecord record = new AttendanceRecord(
            UUID.randomUUID(), UUID.randomUUID(), null, LocalDate.of(2025, 3, 3));

    @Test
    void newRecordIsPending() {
        assertThat(record.getAttendanceStatus()).isEqualTo(AttendanceStatus.PENDING);
        assertThat(record.hasCheckedIn()).isFalse();
    }

    @Test
    void checkOutWithoutCheckInFillsBothTimestamps() {
        record.checkOut(NOW);

        assertThat(record.getCheckInAt()).isEqualTo(NOW);
        assertThat(record.getCheckOutAt()).isEqualTo(NOW);
        assertThat(record.getAttendanceStatus()).isEqualTo(AttendanceStatus.PRESENT);
    }

    @Test
    void checkOutKeepsLateStatus() {
        record.manualCheckIn(NOW, true);
        record.checkOut(NOW.plusHours(2));

        assertThat(record.getAttendanceStatus()).isEqualTo(AttendanceStatus.LATE);
        assertThat(record.isWasLate()).isTrue();
        assertThat(record.getCheckInAt()).isEqualTo(NOW);
    }

    @Test
    void overrideStatusTracksLateFlag() {
        record.overrideStatus(AttendanceStatus.LATE);
        assertThat(record.isWasLate()).isTrue();

        record.overrideStatus(AttendanceStatus.ABSENT);
        assertThat(record.isWasLate()).isFalse();
        assertThat(record.getAttendanceStatus()).isEqualTo(AttendanceStatus.ABSENT);
    }
}
