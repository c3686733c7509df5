package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.UserIdError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class UserIdTest {

    @Test
    void shouldParseValidId() {
        var result = UserId.parse("42");

        assertTrue(result.isSuccess());
        assertEquals(42L, result.getOrThrow().value());
    }

    @Test
    void shouldTrimBeforeParsing() {
        assertEquals(UserId.of(7), UserId.parse(" 7 ").getOrThrow());
    }

    @Test
    void shouldRejectNull() {
        var result = UserId.parse(null);
        assertInstanceOf(UserIdError.Empty.class, result.errorOrNull());
    }

    @Test
    void shouldRejectBlank() {
        var result = UserId.parse("  ");
        assertInstanceOf(UserIdError.Empty.class, result.errorOrNull());
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "0", "-3", "1.5", "99999999999999999999"})
    void shouldRejectInvalidFormat(String value) {
        var result = UserId.parse(value);

        assertTrue(result.isFailure());
        assertInstanceOf(UserIdError.InvalidFormat.class, result.errorOrNull());
        assertEquals("ValidationError", result.errorOrNull().code());
    }

    @Test
    void shouldRejectNonPositiveValueInConstructor() {
        assertThrows(IllegalStateException.class, () -> UserId.of(0));
    }

    @Test
    void shouldRenderAsPlainNumber() {
        assertEquals("15", UserId.of(15).toString());
    }
}
