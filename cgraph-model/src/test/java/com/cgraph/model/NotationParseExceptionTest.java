package com.cgraph.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class NotationParseExceptionTest {

    @Test
    void carriesPosition() {
        NotationParseException e = new NotationParseException("expected 'end'", 4, 7);
        assertEquals("Parse error at 4:7: expected 'end'", e.getMessage());
        assertEquals(4, e.getLine());
        assertEquals(7, e.getColumn());
    }

    @Test
    void wrapsCauseWithoutPosition() {
        IllegalStateException cause = new IllegalStateException("lexer");
        NotationParseException e = new NotationParseException("bad input", cause);
        assertSame(cause, e.getCause());
        assertEquals(-1, e.getLine());
    }
}
