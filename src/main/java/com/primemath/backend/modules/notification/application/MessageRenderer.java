package com.primemath.backend.modules.notification.application;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.primemath.backend.global.common.time.CenterTime;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationType;

import org.springframework.stereotype.Component;

/**
 * 문자 본문 렌더링. {학생명}과 {{studentName}}처럼 한글/영문 키와 단일/이중 중괄호를 모두 치환한다.
 */
@Component
public class MessageRenderer {

    public static final String DEFAULT_CENTER_NAME = "프라임수학";

    public static final String DEFAULT_CHECK_IN = "[프라임수학] {학생명} 학생이 {시간}에 출석하였습니다.";
    public static final String DEFAULT_LATE =
            "[프라임수학] {학생명} 학생이 수업에 참여하지 않았습니다. 빠르게 등원할 수 있도록 해주세요.";
    public static final String DEFAULT_CHECK_OUT = "[프라임수학] {{studentName}}(이)가 {{time}}에 하원하였습니다.";
    public static final String DEFAULT_STAFF_ARRIVAL = "[{center}] {name} 선생님 출근 확인 ({time})";

    private static final DateTimeFormatter GUARDIAN_TIME = DateTimeFormatter.ofPattern("a hh:mm", Locale.KOREAN);
    private static final DateTimeFormatter GUARDIAN_DATE = DateTimeFormatter.ofPattern("yyyy년 M월 d일", Locale.KOREAN);
    private static final DateTimeFormatter STAFF_TIME = DateTimeFormatter.ofPattern("HH시 mm분", Locale.KOREAN);
    private static final DateTimeFormatter STAFF_DATE = DateTimeFormatter.ofPattern("M월 d일", Locale.KOREAN);

    private final CenterTime centerTime;

    public MessageRenderer(CenterTime centerTime) {
        this.centerTime = centerTime;
    }

    public static String defaultBody(AttendanceNotificationType type) {
        return switch (type) {
            case CHECK_IN -> DEFAULT_CHECK_IN;
            case LATE -> DEFAULT_LATE;
            case CHECK_OUT -> DEFAULT_CHECK_OUT;
        };
    }

    public String renderGuardianMessage(String template, String studentName, String centerName, OffsetDateTime at) {
        ZonedDateTime local = centerTime.toLocal(at);
        Map<String, String> values = new LinkedHashMap<>();
        values.put("학생명", studentName);
        values.put("studentName", studentName);
        values.put("시간", GUARDIAN_TIME.format(local));
        values.put("time", GUARDIAN_TIME.format(local));
        values.put("날짜", GUARDIAN_DATE.format(local));
        values.put("date", GUARDIAN_DATE.format(local));
        values.put("센터명", centerOrDefault(centerName));
        values.put("center", centerOrDefault(centerName));
        return render(template, values);
    }

    public String renderStaffArrival(String template, String staffName, String centerName, OffsetDateTime at) {
        ZonedDateTime local = centerTime.toLocal(at);
        Map<String, String> values = new LinkedHashMap<>();
        values.put("선생님명", staffName);
        values.put("name", staffName);
        values.put("시간", STAFF_TIME.format(local));
        values.put("time", STAFF_TIME.format(local));
        values.put("날짜", STAFF_DATE.format(local));
        values.put("date", STAFF_DATE.format(local));
        values.put("센터명", centerOrDefault(centerName));
        values.put("center", centerOrDefault(centerName));
        String body = template == null || template.isBlank() ? DEFAULT_STAFF_ARRIVAL : template;
        return render(body, values);
    }

    static String render(String template, Map<String, String> values) {
        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue();
            result = result.replace("{{" + entry.getKey() + "}}", value)
                    .replace("{" + entry.getKey() + "}", value);
        }
        return result;
    }

    private static String centerOrDefault(String centerName) {
        return centerName == null || centerName.isBlank() ? DEFAULT_CENTER_NAME : centerName;
    }
}
