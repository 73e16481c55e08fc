package com.primemath.backend.modules.attendance.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 전화번호에서 4자리 출결번호 후보를 뽑는 규칙.
 * 후보 순서는 끝 4자리, 그 다음 4~7번째 자리(010-XXXX-YYYY의 XXXX)이다.
 */
public final class PhoneCodes {

    public static final Pattern CODE_PATTERN = Pattern.compile("^\\d{4}$");
    private static final int MIN_DIGITS_FOR_REGISTRATION = 8;

    private PhoneCodes() {
    }

    public static boolean isValidCode(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }

    public static String digitsOnly(String phone) {
        if (phone == null) {
            return "";
        }
        return phone.replaceAll("\\D", "");
    }

    public static List<String> registrationCandidates(String phone) {
        String digits = digitsOnly(phone);
        if (digits.length() < MIN_DIGITS_FOR_REGISTRATION) {
            return List.of();
        }
        List<String> candidates = new ArrayList<>(2);
        candidates.add(digits.substring(digits.length() - 4));
        String middle = digits.substring(3, 7);
        if (!candidates.contains(middle)) {
            candidates.add(middle);
        }
        return candidates;
    }

    public static boolean matchesLegacyPhone(String phone, String code) {
        String digits = digitsOnly(phone);
        if (digits.length() < 4) {
            return false;
        }
        if (digits.substring(digits.length() - 4).equals(code)) {
            return true;
        }
        return digits.length() >= 7 && digits.substring(3, 7).equals(code);
    }
}
