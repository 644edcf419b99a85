package com.call_bridge_backend.utils;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PhoneNumbersTest {

    @Test
    void shouldStripFormatting() {
        assertThat(PhoneNumbers.normalize("+31 (20) 123-4567")).contains("+31201234567");
        assertThat(PhoneNumbers.normalize(" 020.123.4567 ")).contains("0201234567");
    }

    @Test
    void shouldRejectBlankAndNull() {
        assertThat(PhoneNumbers.normalize(null)).isEmpty();
        assertThat(PhoneNumbers.normalize("   ")).isEmpty();
    }

    @Test
    void shouldRejectLettersAndMisplacedPlus() {
        assertThat(PhoneNumbers.normalize("call me")).isEmpty();
        assertThat(PhoneNumbers.normalize("1+23456789")).isEmpty();
        assertThat(PhoneNumbers.normalize("++31201234567")).isEmpty();
    }

    @Test
    void shouldRejectImplausibleLengths() {
        assertThat(PhoneNumbers.normalize("12345")).isEmpty();
        assertThat(PhoneNumbers.normalize("1234567890123456")).isEmpty();
        assertThat(PhoneNumbers.normalize("123456")).contains("123456");
    }

    @Test
    void shouldPickFirstValidCandidate() {
        List<String> candidates = Arrays.asList(null, "unknown", "06-1234 5678", "+31201234567");

        assertThat(PhoneNumbers.firstValid(candidates)).contains("0612345678");
        assertThat(PhoneNumbers.firstValid(List.of("x", ""))).isEmpty();
        assertThat(PhoneNumbers.firstValid(null)).isEmpty();
    }
}
