package org.twistmodal.logic.common;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestLogicException {

    @Test
    public void test1() {
        UndefinedOperationException cause = new UndefinedOperationException("No unique Join found for 'a' and 'b'");
        InvalidAlgebraException e = new InvalidAlgebraException("M3", cause);
        assertEquals("The object 'M3' is not a valid lattice: No unique Join found for 'a' and 'b'", e.getMessage());
        assertSame(cause, e.getCause());
        assertEquals(ErrorKind.INVALID_ALGEBRA, e.kind());
        assertTrue(e.kind().isConstruction());
        assertEquals(ErrorKind.UNDEFINED_OPERATION, cause.kind());
        assertFalse(cause.kind().isConstruction());
    }

    @Test
    public void test2() {
        UndefinedAtomException one = new UndefinedAtomException("w1", List.of("p"));
        assertEquals("Undefined atom: 'p' is not assigned in state 'w1'", one.getMessage());
        UndefinedAtomException two = new UndefinedAtomException("w1", List.of("p", "q"));
        assertEquals("State 'w1' is missing assignments for: p, q", two.getMessage());
        assertEquals(List.of("p", "q"), two.getAtoms());
    }

    @Test
    public void test3() {
        FormulaSyntaxException e = new FormulaSyntaxException(4, "Unknown character '#'");
        assertEquals(4, e.position());
        assertEquals("Syntax error at index 4: Unknown character '#'", e.getMessage());
        assertEquals("PLTS 'M': duplicate state w1", new InvalidModelException("M", "duplicate state w1").getMessage());
        LogicException action = new UndefinedActionException("a", "M");
        assertEquals(ErrorKind.UNDEFINED_ACTION, action.kind());
    }
}
