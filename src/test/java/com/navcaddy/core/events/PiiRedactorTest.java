package com.navcaddy.core.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class PiiRedactorTest {

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "mail me at pat.golfer@example.com today|mail me at [EMAIL] today",
            "card 4111 1111 1111 1111 on file|card [CARD] on file",
            "ssn 123-45-6789|ssn [SSN]",
            "call 555-123-4567 later|call [PHONE] later",
            "call (555) 123-4567 later|call [PHONE] later",
            "I live at 42 Fairway Drive near the club|I live at [ADDRESS] near the club"
    })
    @DisplayName("masks personal data")
    void masks(String input, String expected) {
        assertEquals(expected, PiiRedactor.redact(input));
    }

    @Test
    @DisplayName("golf numbers are left alone")
    void golfTextUntouched() {
        String text = "hit 7-iron 150 yards on hole 12, shot 82";
        assertEquals(text, PiiRedactor.redact(text));
    }

    @Test
    void nullAndEmpty() {
        assertNull(PiiRedactor.redact(null));
        assertEquals("", PiiRedactor.redact(""));
    }
}
