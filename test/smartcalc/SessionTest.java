package smartcalc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

public class SessionTest {
    private Session session;

    @Before
    public void setUp() {
        session = new Session();
    }

    @Test
    public void blankLinesAreIgnored() {
        assertNull(session.process(""));
        assertNull(session.process("   "));
    }

    @Test
    public void commands() {
        assertEquals(Session.HELP, session.process("/help"));
        assertEquals("Unknown command", session.process("/go"));
        assertFalse(session.isFinished());
        assertEquals("Bye!", session.process("/exit"));
        assertTrue(session.isFinished());
    }

    @Test
    public void assignmentResolvesValueImmediately() {
        assertNull(session.process("a = 5"));
        assertNull(session.process("b = a"));
        assertNull(session.process("a = 7"));
        assertEquals("7", session.process("a"));
        assertEquals("5", session.process("b"));
        assertEquals("12", session.process("a + b"));
    }

    @Test
    public void assignmentNormalizesSigns() {
        assertNull(session.process("n = -- 5"));
        assertEquals("5", session.process("n"));
        assertNull(session.process("m = +- 5"));
        assertEquals("-5", session.process("m"));
    }

    @Test
    public void badAssignments() {
        assertEquals("Invalid identifier", session.process("a2a = 5"));
        assertEquals("Invalid assignment", session.process("a = 7 + 8"));
        assertEquals("Invalid assignment", session.process("a = b = 3"));
        assertEquals("Invalid assignment", session.process("a = 2a"));
        assertEquals("Invalid assignment", session.process("a ="));
        assertEquals("Unknown variable", session.process("a = c"));
        assertEquals("Unknown variable", session.process("a"));
    }

    @Test
    public void identifiers() {
        assertEquals("Invalid identifier", session.process("a2a"));
        assertEquals("Unknown variable", session.process("x"));
        assertEquals("123", session.process("123"));
    }

    @Test
    public void expressions() {
        assertEquals("5", session.process("  8 --- 3 "));
        assertEquals("14", session.process("2 * (3 + 4)"));
        assertEquals("-5", session.process("-5"));
        assertEquals("3", session.process("7 / 2"));
        assertEquals("Division by zero", session.process("7 / 0"));
        assertEquals("Invalid exponent", session.process("2 ^ -1"));
        assertEquals("Invalid exponent", session.process("10 ^ 2000000000"));
        assertEquals("1", session.process("1 ^ 3000000000"));
        assertEquals("Unknown variable", session.process("x + 1"));
    }

    @Test
    public void invalidExpressions() {
        assertEquals("Invalid expression", session.process("(2+3"));
        assertEquals("Invalid expression", session.process("2+3)"));
        assertEquals("Invalid expression", session.process("2 ** 3"));
        assertEquals("Invalid expression", session.process("2 +"));
        assertEquals("Invalid expression", session.process("2 % 3"));
        assertEquals("Invalid expression", session.process("2 * -a"));
    }

    @Test
    public void wellFormedness() {
        assertTrue(Session.isWellFormed("-(a+2)*b^2"));
        assertTrue(Session.isWellFormed("2*-3"));
        assertTrue(Session.isWellFormed("2*-(a)"));
        assertTrue(Session.isWellFormed("2-a"));
        assertFalse(Session.isWellFormed("2*-a"));
        assertFalse(Session.isWellFormed("2^-b"));
        assertFalse(Session.isWellFormed("()"));
        assertFalse(Session.isWellFormed("2(3)"));
        assertFalse(Session.isWellFormed("(2)(3)"));
        assertFalse(Session.isWellFormed(")2("));
        assertFalse(Session.isWellFormed("a2"));
        assertFalse(Session.isWellFormed("*2"));
        assertFalse(Session.isWellFormed(""));
    }

    @Test
    public void sharesVariablesGivenFromOutside() {
        var vars = new Variables();
        vars.assign("x", "4");
        var s = new Session(vars);
        assertEquals("16", s.process("x ^ 2"));
        s.process("y = x");
        assertEquals("4", vars.lookupVariable("y"));
    }
}
