package com.fedivotes.domain.model;

import com.fedivotes.domain.error.ValidationError.PaginationError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PageWindowTest {

    @Test
    void shouldApplyDefaultsWhenParametersMissing() {
        var result = PageWindow.parse(null, null, 50, 250);

        assertTrue(result.isSuccess());
        assertEquals(new PageWindow(0, 50), result.getOrThrow());
    }

    @Test
    void shouldAcceptBoundaryLimits() {
        assertEquals(1, PageWindow.parse(0, 1, 50, 250).getOrThrow().limit());
        assertEquals(250, PageWindow.parse(0, 250, 50, 250).getOrThrow().limit());
    }

    @Test
    void shouldRejectNegativeOffset() {
        var result = PageWindow.parse(-1, 10, 50, 250);

        assertTrue(result.isFailure());
        assertInstanceOf(PaginationError.NegativeOffset.class, result.errorOrNull());
        assertEquals("OFFSET_NEGATIVE", result.errorOrNull().code());
    }

    @Test
    void shouldRejectZeroLimit() {
        var result = PageWindow.parse(0, 0, 50, 250);

        assertTrue(result.isFailure());
        assertInstanceOf(PaginationError.LimitOutOfRange.class, result.errorOrNull());
    }

    @Test
    void shouldRejectLimitAboveMaximum() {
        var result = PageWindow.parse(0, 251, 50, 250);

        assertTrue(result.isFailure());
        assertEquals("LIMIT_OUT_OF_RANGE", result.errorOrNull().code());
        assertTrue(result.errorOrNull().message().contains("250"));
    }
}
