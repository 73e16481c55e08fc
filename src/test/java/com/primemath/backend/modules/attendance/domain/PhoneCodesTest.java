package com.primemath.backend.modules.attendance.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PhoneCodesTest {

    @Test
    @DisplayName("등록 후보는 끝 4자리, 가운데 4자리 순서")
    void registrationCandidatesPreferLastFourDigits() {
        assertThat(PhoneCodes.registrationCandidates("010-1234-5678")).containsExactly("5678", "1234");
    }

    @Test
    void registrationCandidatesDeduplicate() {
        assertThat(PhoneCodes.registrationCandidates("010-5678-5678")).containsExactly("5678");
    }

    @Test
    @DisplayName("숫자가 8자리 미만이면 후보가 없다")
    void shortPhoneHasNoCandidates() {
        assertThat(PhoneCodes.registrationCandidates("123-4567")).isEmpty();
        assertThat(PhoneCodes.registrationCandidates(null)).isEmpty();
    }

    @Test
    void legacyMatchAcceptsLastOrMiddleDigits() {
        assertThat(PhoneCodes.matchesLegacyPhone("010-2222-3333", "3333")).isTrue();
        assertThat(PhoneCodes.matchesLegacyPhone("010-2222-3333", "2222")).isTrue();
        assertThat(PhoneCodes.matchesLegacyPhone("010-2222-3333", "0102")).isFalse();
        assertThat(PhoneCodes.matchesLegacyPhone("333", "0333")).isFalse();
    }

    @Test
    void validCodeIsExactlyFourDigits() {
        assertThat(PhoneCodes.isValidCode("0420")).isTrue();
        assertThat(PhoneCodes.isValidCode("042")).isFalse();
        assertThat(PhoneCodes.isValidCode("04200")).isFalse();
        assertThat(PhoneCodes.isValidCode("12a4")).isFalse();
        assertThat(PhoneCodes.isValidCode(null)).isFalse();
    }
}
