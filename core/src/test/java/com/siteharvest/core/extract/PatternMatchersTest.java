package com.siteharvest.core.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatternMatchersTest {

    private final PatternMatchers pm = new PatternMatchers();

    @Test
    @DisplayName("예시 문장: 전화 2건, 우편번호 1건(확장형 우선)")
    void phonesAndZips_fromSampleSentence() {
        String text = "Call (555) 123-4567 or 555-987-6543. Visit us at 30301-1234.";

        assertThat(pm.findPhoneNumbers(text)).containsExactly("(555) 123-4567", "555-987-6543");
        assertThat(pm.findZipCodes(text)).containsExactly("30301-1234");
    }

    @Test
    @DisplayName("같은 번호가 여러 번 나와도 한 번만, 처음 등장 순서 유지")
    void duplicates_collapsed_in_first_seen_order() {
        String text = "555-000-1111 then 12345 then 555-000-1111 and 67890 and 12345";

        assertThat(pm.findPhoneNumbers(text)).containsExactly("555-000-1111");
        assertThat(pm.findZipCodes(text)).containsExactly("12345", "67890");
    }

    @Test
    void nothing_found_in_plain_text() {
        assertThat(pm.findPhoneNumbers("no digits here")).isEmpty();
        assertThat(pm.findZipCodes("1234 is too short")).isEmpty();
    }

    @Test
    @DisplayName("치수/해시 노이즈는 토큰 앞부분만 본다")
    void noise_checks_anchor_at_start() {
        assertThat(pm.isDimensionNoise("12px")).isTrue();
        assertThat(pm.isDimensionNoise("3rem;")).isTrue();
        assertThat(pm.isDimensionNoise("width12px")).isFalse();
        assertThat(pm.isDimensionNoise("px")).isFalse();

        assertThat(pm.isHashNoise("d41d8cd98f00b204e9800998ecf8427e")).isTrue();
        assertThat(pm.isHashNoise("d41d8cd98f00b204")).isFalse();           // 16자는 짧다
        assertThat(pm.isHashNoise("D41D8CD98F00B204E9800998ECF8427E")).isFalse(); // 대문자 제외
    }
}
