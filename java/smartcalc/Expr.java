package smartcalc;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Evaluation engine for integer expressions like {@code 3 + a * (2 - b) ^ 2}.
 * Text is normalized, innermost bracket groups are replaced by their value until
 * none are left, and each bracket-free piece runs through the shunting yard and a
 * postfix stack machine over {@link BigInteger}.
 */
public final class Expr {
    static final boolean DEBUG = false;

    private Expr() {}

    /**
     * source of variable values during evaluation
     */
    public interface Context {
        /**
         * @param name identifier, letters only
         * @return decimal value, or null if the variable does not exist
         */
        default String lookupVariable(String name) {
            return null;
        }
    }

    /**
     * Evaluation failure, tagged with what went wrong.
     */
    public static class Fail extends Exception {
        public enum Kind {
            UNKNOWN_VARIABLE("Unknown variable"),
            DIVISION_BY_ZERO("Division by zero"),
            MALFORMED_EXPRESSION("Invalid expression"),
            INVALID_EXPONENT("Invalid exponent");
            private final String message;
            Kind(String message) {
                this.message = message;
            }
            public String message() {
                return message;
            }
        }
        private final Kind kind;
        public Fail(Kind kind, String detail) {
            super(kind.message() + ": " + detail);
            this.kind = kind;
        }
        public Kind kind() {
            return kind;
        }
    }

    /**
     * outcome of {@link Expr#evaluate}: either a value or the kind of failure
     */
    public record Result(String value, Fail.Kind error) {
        public static Result ok(String value) {
            return new Result(value, null);
        }
        public static Result failed(Fail.Kind error) {
            return new Result(null, error);
        }
        public boolean isOk() {
            return error == null;
        }
    }

    /**
     * Binary operators with their priority. {@code apply} gets the operands in pop order,
     * so b is the right hand side.
     */
    public enum Operator {
        ADD('+', 0),
        SUB('-', 0),
        MUL('*', 1),
        DIV('/', 1),
        POW('^', 2);
        private final char symbol;
        private final int priority;
        Operator(char symbol, int priority) {
            this.symbol = symbol;
            this.priority = priority;
        }
        public char symbol() {
            return symbol;
        }
        public int priority() {
            return priority;
        }
        public static Operator of(char c) {
            for (var op : values())
                if (op.symbol == c) return op;
            return null;
        }
        public static Operator of(String s) {
            return s.length() == 1 ? of(s.charAt(0)) : null;
        }
        public BigInteger apply(BigInteger b, BigInteger a) throws Fail {
            switch (this) {
                case ADD: return a.add(b);
                case SUB: return a.subtract(b);
                case MUL: return a.multiply(b);
                case DIV:
                    if (b.signum() == 0) throw new Fail(Fail.Kind.DIVISION_BY_ZERO, a + " / " + b);
                    return a.divide(b);
                case POW:
                    if (b.signum() < 0) throw new Fail(Fail.Kind.INVALID_EXPONENT, a + " ^ " + b);
                    if (b.signum() == 0) return BigInteger.ONE;
                    // bases 0, 1 and -1 stay small for any exponent
                    if (a.abs().compareTo(BigInteger.ONE) <= 0)
                        return a.signum() < 0 && b.testBit(0) ? a : a.abs();
                    if (b.bitLength() > 31) throw new Fail(Fail.Kind.INVALID_EXPONENT, a + " ^ " + b + " is too large");
                    try {
                        return a.pow(b.intValue());
                    } catch (ArithmeticException e) {
                        throw new Fail(Fail.Kind.INVALID_EXPONENT, a + " ^ " + b + " is too large");
                    }
                default: throw new IllegalStateException("unknown operator " + this);
            }
        }
    }

    public enum TokenType {
        OPERATOR, NAME, INTCONST
    }

    /**
     * classified piece of an expression, as produced by {@link #scan}
     */
    public record Token(TokenType type, String input) {
        @Override
        public String toString() {
            return input;
        }
    }

    /**
     * Removes whitespace and collapses sign runs: {@code --} becomes {@code +},
     * {@code ++} becomes {@code +}, {@code +-} and {@code -+} become {@code -}.
     */
    public static String normalize(String s) {
        var compact = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isWhitespace(c)) compact.append(c);
        }
        var out = new StringBuilder();
        for (int i = 0; i < compact.length(); ) {
            char c = compact.charAt(i);
            if (c != '+' && c != '-') {
                out.append(c);
                i++;
                continue;
            }
            int j = i;
            int minus = 0;
            while (j < compact.length() && (compact.charAt(j) == '+' || compact.charAt(j) == '-')) {
                if (compact.charAt(j) == '-') minus++;
                j++;
            }
            out.append(minus % 2 == 0 ? '+' : '-');
            i = j;
        }
        return out.toString();
    }

    /**
     * Splits normalized text into operators, names and integer constants, left to right.
     * Characters that fit none of these are skipped. The returned iterator reads the
     * text lazily and can be walked only once.
     */
    public static Iterator<Token> scan(String expression) {
        return new Scanner(expression);
    }

    private static final class Scanner implements Iterator<Token> {
        private final String s;
        private int i = 0;
        private Token previous = null;

        Scanner(String s) {
            this.s = s;
        }

        @Override
        public boolean hasNext() {
            while (i < s.length() && !isTokenStart(s.charAt(i))) i++;
            return i < s.length();
        }

        @Override
        public Token next() {
            if (!hasNext()) throw new NoSuchElementException();
            char c = s.charAt(i);
            Token t;
            if (c == '-' && operandExpected() && i + 1 < s.length() && isDigit(s.charAt(i + 1))) {
                t = new Token(TokenType.INTCONST, read(i + 1, true));
            } else if (Operator.of(c) != null) {
                t = new Token(TokenType.OPERATOR, String.valueOf(c));
                i++;
            } else if (isDigit(c)) {
                t = new Token(TokenType.INTCONST, read(i, true));
            } else {
                t = new Token(TokenType.NAME, read(i, false));
            }
            previous = t;
            return t;
        }

        // a sign is part of the literal at the very start or right behind an operator
        private boolean operandExpected() {
            return previous == null || previous.type() == TokenType.OPERATOR;
        }

        private String read(int from, boolean digits) {
            int start = i;
            int j = from;
            while (j < s.length() && (digits ? isDigit(s.charAt(j)) : isLetter(s.charAt(j)))) j++;
            i = j;
            return s.substring(start, j);
        }

        private static boolean isTokenStart(char c) {
            return Operator.of(c) != null || isDigit(c) || isLetter(c);
        }
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * @return true if s is a non-empty run of letters
     */
    public static boolean isName(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++)
            if (!isLetter(s.charAt(i))) return false;
        return true;
    }

    /**
     * @return true if s is an integer constant with at most one leading sign
     */
    public static boolean isIntConst(String s) {
        int start = !s.isEmpty() && (s.charAt(0) == '+' || s.charAt(0) == '-') ? 1 : 0;
        if (s.length() == start) return false;
        for (int i = start; i < s.length(); i++)
            if (!isDigit(s.charAt(i))) return false;
        return true;
    }

    /**
     * Shunting yard for bracket-free token streams. An operator with higher priority
     * than the stack top is stacked; any other operator first empties the whole
     * stack into the output.
     */
    public static class Shuntyard {
        private final Iterator<Token> terminals;
        public Shuntyard(Iterator<Token> terminals) {
            this.terminals = terminals;
        }
        public List<String> postfix() throws Fail {
            List<String> output = new ArrayList<>();
            var operators = new ValueStack();
            while (terminals.hasNext()) {
                var t = terminals.next();
                if (t.type() != TokenType.OPERATOR) {
                    output.add(t.input());
                    continue;
                }
                var op = Operator.of(t.input());
                if (!operators.isEmpty() && op.priority() <= Operator.of(operators.peek()).priority()) {
                    while (!operators.isEmpty())
                        output.add(operators.pop());
                }
                operators.push(t.input());
            }
            while (!operators.isEmpty())
                output.add(operators.pop());
            if (DEBUG) System.err.println("Postfix output: " + output);
            return output;
        }
    }

    /**
     * Runs a postfix sequence on a value stack. Names are replaced by their value
     * from ctx when pushed.
     * @return the single remaining value, in decimal
     */
    public static String evalPostfix(List<String> postfix, Context ctx) throws Fail {
        var backlog = new ValueStack();
        for (var t : postfix) {
            var op = Operator.of(t);
            if (op != null) {
                var b = operand(backlog.pop(), ctx);
                var a = operand(backlog.pop(), ctx);
                backlog.push(op.apply(b, a).toString());
            } else {
                backlog.push(operand(t, ctx).toString());
            }
        }
        var result = backlog.pop();
        if (!backlog.isEmpty())
            throw new Fail(Fail.Kind.MALFORMED_EXPRESSION, backlog.size() + " values left over");
        return result;
    }

    private static BigInteger operand(String t, Context ctx) throws Fail {
        if (isName(t)) {
            var value = ctx.lookupVariable(t);
            if (value == null) throw new Fail(Fail.Kind.UNKNOWN_VARIABLE, t);
            t = value;
        }
        if (!isIntConst(t)) throw new Fail(Fail.Kind.MALFORMED_EXPRESSION, "not a number: " + t);
        return new BigInteger(t);
    }

    /**
     * evaluates a bracket-free expression
     */
    static String evalFlat(String expression, Context ctx) throws Fail {
        return evalPostfix(new Shuntyard(scan(expression)).postfix(), ctx);
    }

    /**
     * Replaces innermost bracket groups by their value, one nesting level per pass,
     * until no brackets are left. Brackets must be balanced.
     */
    public static class Flattener {
        private final Context ctx;
        private int passes = 0;
        public Flattener(Context ctx) {
            this.ctx = ctx;
        }
        public String flatten(String expression) throws Fail {
            var text = expression;
            var groups = innermostGroups(text);
            while (!groups.isEmpty()) {
                passes++;
                for (var group : groups) {
                    var value = evalFlat(group.substring(1, group.length() - 1), ctx);
                    text = text.replace(group, value);
                }
                if (DEBUG) System.err.println("Pass " + passes + ": " + text);
                groups = innermostGroups(text);
            }
            return text;
        }
        /**
         * @return number of flattening passes done so far
         */
        public int passes() {
            return passes;
        }
        private static List<String> innermostGroups(String text) {
            var groups = new LinkedHashSet<String>();
            int open = -1;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '(') open = i;
                else if (c == ')' && open >= 0) {
                    groups.add(text.substring(open, i + 1));
                    open = -1;
                }
            }
            return new ArrayList<>(groups);
        }
    }

    /**
     * Evaluates a normalized expression with balanced brackets.
     * @throws Fail if a variable is unknown, the arithmetic fails or the expression does not reduce to one value
     */
    public static String eval(String expression, Context ctx) throws Fail {
        // a zero in front of every group start gives leading signs a left operand
        var text = normalize("0+" + expression.replace("(", "(0+"));
        return evalFlat(new Flattener(ctx).flatten(text), ctx);
    }

    /**
     * like {@link #eval}, but reports failure as a {@link Result} instead of throwing
     */
    public static Result evaluate(String expression, Context ctx) {
        try {
            return Result.ok(eval(expression, ctx));
        } catch (Fail f) {
            if (DEBUG) f.printStackTrace();
            return Result.failed(f.kind());
        }
    }
}
