package com.primemath.backend.modules.attendance.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.AttendanceRecord;
import com.primemath.backend.modules.attendance.domain.AttendanceStatus;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationEvent;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationType;
import com.primemath.backend.modules.attendance.infrastructure.persistence.AttendanceRecordRepository;
import com.primemath.backend.modules.attendance.presentation.dto.AttendanceRecordResponse;
import com.primemath.backend.modules.attendance.presentation.dto.ManualCheckInRequest;
import com.primemath.backend.modules.attendance.presentation.dto.UpdateAttendanceStatusRequest;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.center.domain.TutoringClass;
import com.primemath.backend.modules.center.infrastructure.persistence.CenterMembershipRepository;
import com.primemath.backend.modules.center.infrastructure.persistence.TutoringClassRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AttendanceLedgerServiceTest {

    private static final UUID CENTER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID STUDENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final UUID CLASS_ID = UUID.fromString("00000000-0000-0000-0000-000000000c01");
    // 2025-03-02T16:30Z = 2025-03-03 01:30 KST
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-02T16:30:00Z");
    private static final LocalDate CENTER_TODAY = LocalDate.of(2025, 3, 3);

    @Mock
    private AttendanceRecordRepository attendanceRecordRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private TutoringClassRepository tutoringClassRepository;

    @Mock
    private CenterMembershipRepository centerMembershipRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private AttendanceLedgerService ledgerService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        ledgerService = new AttendanceLedgerService(
                attendanceRecordRepository,
                appUserRepository,
                tutoringClassRepository,
                centerMembershipRepository,
                eventPublisher,
                new CenterTime(clock, ZoneId.of("Asia/Seoul"))
        );
        lenient().when(attendanceRecordRepository.saveAndFlush(any(AttendanceRecord.class)))
                .thenAnswer(invocation -> {
                    AttendanceRecord record = invocation.getArgument(0);
                    ReflectionTestUtils.setField(record, "id", UUID.randomUUID());
                    return record;
                });
    }

    @Test
    @DisplayName("등원 기록의 날짜는 센터 현지 날짜다")
    void checkInCreatesRecordOnCenterLocalDate() {
        AttendanceRecord record = ledgerService.checkIn(CENTER_ID, STUDENT_ID, null);

        assertThat(record.getCheckInDate()).isEqualTo(CENTER_TODAY);
        assertThat(record.getCheckInAt()).isEqualTo(NOW);
        assertThat(record.getAttendanceStatus()).isEqualTo(AttendanceStatus.PRESENT);

        AttendanceNotificationEvent event = capturePublishedEvent();
        assertThat(event.type()).isEqualTo(AttendanceNotificationType.CHECK_IN);
        assertThat(event.recordId()).isEqualTo(record.getId());
    }

    @Test
    void secondCheckInIsRejectedWithoutEvent() {
        AttendanceRecord existing = new AttendanceRecord(STUDENT_ID, CENTER_ID, null, CENTER_TODAY);
        existing.checkIn(NOW.minusMinutes(10));
        when(attendanceRecordRepository.findByKey(STUDENT_ID, CENTER_TODAY, null)).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> ledgerService.checkIn(CENTER_ID, STUDENT_ID, null))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(problem.getCode()).isEqualTo("attendance.already_checked_in");
                });
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    @DisplayName("동시 삽입으로 유니크 제약에 걸리면 이미 처리됨으로 응답한다")
    void concurrentInsertMapsToAlreadyCheckedIn() {
        when(attendanceRecordRepository.saveAndFlush(any(AttendanceRecord.class)))
                .thenThrow(new DataIntegrityViolationException("uq_attendance_record_center"));

        assertThatThrownBy(() -> ledgerService.checkIn(CENTER_ID, STUDENT_ID, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("attendance.already_checked_in");
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void checkOutWithoutCheckInCreatesCompletedRecord() {
        AttendanceRecord record = ledgerService.checkOut(CENTER_ID, STUDENT_ID, null);

        assertThat(record.getCheckInAt()).isEqualTo(NOW);
        assertThat(record.getCheckOutAt()).isEqualTo(NOW);
        assertThat(capturePublishedEvent().type()).isEqualTo(AttendanceNotificationType.CHECK_OUT);
    }

    @Test
    void secondCheckOutIsRejected() {
        AttendanceRecord existing = new AttendanceRecord(STUDENT_ID, CENTER_ID, null, CENTER_TODAY);
        existing.checkOut(NOW.minusMinutes(1));
        when(attendanceRecordRepository.findByKey(STUDENT_ID, CENTER_TODAY, null)).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> ledgerService.checkOut(CENTER_ID, STUDENT_ID, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("attendance.already_checked_out");
    }

    @Test
    @DisplayName("수동 상태 변경은 알림을 보내지 않는다")
    void manualStatusUpdateDoesNotNotify() {
        givenStudentInCenter();

        AttendanceRecordResponse response = ledgerService.manualStatusUpdate(
                new UpdateAttendanceStatusRequest(STUDENT_ID, CENTER_ID, null, "late", null));

        assertThat(response.status()).isEqualTo(AttendanceStatus.LATE);
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void manualStatusUpdateRejectsUnknownStatus() {
        assertThatThrownBy(() -> ledgerService.manualStatusUpdate(
                new UpdateAttendanceStatusRequest(STUDENT_ID, CENTER_ID, null, "excused", null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("attendance.invalid_status");
    }

    @Test
    void manualLateCheckInPublishesLateNotice() {
        givenStudentInCenter();

        ledgerService.manualCheckIn(new ManualCheckInRequest(STUDENT_ID, CENTER_ID, null, true));

        assertThat(capturePublishedEvent().type()).isEqualTo(AttendanceNotificationType.LATE);
    }

    @Test
    void resendRejectsUnknownType() {
        assertThatThrownBy(() -> ledgerService.resendNotification(UUID.randomUUID(), "birthday"))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("attendance.invalid_notification_type");
    }

    @Test
    @DisplayName("다른 센터의 수업으로는 등원할 수 없다")
    void checkInRejectsClassFromAnotherCenter() {
        TutoringClass otherCenterClass = new TutoringClass();
        ReflectionTestUtils.setField(otherCenterClass, "id", CLASS_ID);
        otherCenterClass.setCenterId(UUID.randomUUID());
        otherCenterClass.setName("B센터 수업");
        when(tutoringClassRepository.findById(CLASS_ID)).thenReturn(Optional.of(otherCenterClass));

        assertThatThrownBy(() -> ledgerService.checkIn(CENTER_ID, STUDENT_ID, CLASS_ID))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("attendance.class_not_found");
        verify(attendanceRecordRepository, never()).saveAndFlush(any());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void unknownClassIsNotFoundRatherThanAlreadyProcessed() {
        when(tutoringClassRepository.findById(CLASS_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.checkOut(CENTER_ID, STUDENT_ID, CLASS_ID))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(problem.getCode()).isEqualTo("attendance.class_not_found");
                });
        verify(attendanceRecordRepository, never()).saveAndFlush(any());
    }

    @Test
    void classScopedCheckInUsesTheClassKey() {
        TutoringClass tutoringClass = new TutoringClass();
        ReflectionTestUtils.setField(tutoringClass, "id", CLASS_ID);
        tutoringClass.setCenterId(CENTER_ID);
        tutoringClass.setName("중등 심화");
        when(tutoringClassRepository.findById(CLASS_ID)).thenReturn(Optional.of(tutoringClass));
        AttendanceRecord centerScoped = new AttendanceRecord(STUDENT_ID, CENTER_ID, null, CENTER_TODAY);
        centerScoped.checkIn(NOW.minusHours(1));
        lenient().when(attendanceRecordRepository.findByKey(STUDENT_ID, CENTER_TODAY, null))
                .thenReturn(Optional.of(centerScoped));

        AttendanceRecord record = ledgerService.checkIn(CENTER_ID, STUDENT_ID, CLASS_ID);

        assertThat(record).isNotSameAs(centerScoped);
        assertThat(record.getClassId()).isEqualTo(CLASS_ID);
        verify(attendanceRecordRepository).findByKey(STUDENT_ID, CENTER_TODAY, CLASS_ID);
    }

    @Test
    void historyRejectsInvertedRange() {
        assertThatThrownBy(() -> ledgerService.listRecordsForStudent(
                STUDENT_ID, LocalDate.of(2025, 3, 10), LocalDate.of(2025, 3, 1)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("attendance.invalid_date_range");
    }

    private void givenStudentInCenter() {
        AppUser student = new AppUser();
        ReflectionTestUtils.setField(student, "id", STUDENT_ID);
        student.setFullName("김민수");
        when(appUserRepository.findById(STUDENT_ID)).thenReturn(Optional.of(student));
        when(centerMembershipRepository.existsByCenterIdAndUserId(CENTER_ID, STUDENT_ID)).thenReturn(true);
    }

    private AttendanceNotificationEvent capturePublishedEvent() {
        ArgumentCaptor<AttendanceNotificationEvent> captor = ArgumentCaptor.forClass(AttendanceNotificationEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }
}
