package smartcalc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import smartcalc.Expr.Fail;

public class ValueStackTest {
    @Test
    public void lastInFirstOut() throws Fail {
        var stack = new ValueStack();
        stack.push("1");
        stack.push("+");
        assertEquals("+", stack.peek());
        assertEquals("+", stack.pop());
        assertEquals("1", stack.pop());
        assertTrue(stack.isEmpty());
    }

    @Test
    public void keepsEverythingPushed() throws Fail {
        var stack = new ValueStack();
        for (int i = 0; i < 100; i++) stack.push(String.valueOf(i));
        assertEquals(100, stack.size());
        for (int i = 99; i >= 0; i--) assertEquals(String.valueOf(i), stack.pop());
        assertFalse(stack.size() > 0);
    }

    @Test
    public void emptyStackMeansMalformedExpression() {
        var stack = new ValueStack();
        assertEquals(Fail.Kind.MALFORMED_EXPRESSION, assertThrows(Fail.class, stack::pop).kind());
        assertEquals(Fail.Kind.MALFORMED_EXPRESSION, assertThrows(Fail.class, stack::peek).kind());
    }
}
