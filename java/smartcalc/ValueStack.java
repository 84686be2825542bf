package smartcalc;

import java.util.ArrayList;
import java.util.List;

import smartcalc.Expr.Fail;

/**
 * Last-in-first-out store for operands and operators in their textual form.
 * Grows as needed; taking from an empty stack means the expression was malformed.
 */
public class ValueStack {
    private final List<String> data = new ArrayList<>();

    public boolean isEmpty() {
        return data.isEmpty();
    }

    public int size() {
        return data.size();
    }

    public void push(String value) {
        data.add(value);
    }

    public String pop() throws Fail {
        if (data.isEmpty()) throw new Fail(Fail.Kind.MALFORMED_EXPRESSION, "missing operand");
        return data.remove(data.size() - 1);
    }

    public String peek() throws Fail {
        if (data.isEmpty()) throw new Fail(Fail.Kind.MALFORMED_EXPRESSION, "missing operand");
        return data.get(data.size() - 1);
    }

    @Override
    public String toString() {
        return data.toString();
    }
}
