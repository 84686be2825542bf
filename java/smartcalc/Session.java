package smartcalc;

/**
 * One interactive calculator session: classifies each input line as command,
 * assignment, identifier or expression and answers it. Variables live as long
 * as the session.
 */
public class Session {
    public static final String HELP = String.join("\n",
            "The program evaluates integer expressions like 4 + 6 - 8, 2 * (3 + a) or 2 ^ 100.",
            "Operators: + - * / ^, brackets are allowed, division truncates.",
            "A sign right after * / or ^ needs a number or brackets: 2 * -3, 2 * (-a).",
            "Assign a variable with name = value, show it by typing its name.",
            "/help shows this text, /exit ends the program.");
    static final String INVALID_EXPRESSION = Expr.Fail.Kind.MALFORMED_EXPRESSION.message();
    static final String INVALID_IDENTIFIER = "Invalid identifier";
    static final String INVALID_ASSIGNMENT = "Invalid assignment";
    static final String UNKNOWN_VARIABLE = Expr.Fail.Kind.UNKNOWN_VARIABLE.message();
    static final String UNKNOWN_COMMAND = "Unknown command";

    private final Variables variables;
    private boolean finished = false;

    public Session() {
        this(new Variables());
    }

    public Session(Variables variables) {
        this.variables = variables;
    }

    public Variables variables() {
        return variables;
    }

    /**
     * @return true once /exit was processed
     */
    public boolean isFinished() {
        return finished;
    }

    /**
     * Handles one line of input.
     * @return the text to show, or null if there is nothing to show
     */
    public String process(String line) {
        var input = line.trim();
        if (input.isEmpty()) return null;
        if (input.startsWith("/")) return command(input);
        var normalized = Expr.normalize(input);
        if (normalized.contains("=")) return assignment(normalized);
        if (isAlphanumeric(normalized) && !Expr.isIntConst(normalized)) return identifier(normalized);
        return expression(normalized);
    }

    private String command(String command) {
        switch (command) {
            case "/help": return HELP;
            case "/exit":
                finished = true;
                return "Bye!";
            default: return UNKNOWN_COMMAND;
        }
    }

    private String assignment(String assignment) {
        var sides = assignment.split("=", -1);
        if (sides.length != 2 || sides[0].isEmpty() || sides[1].isEmpty()) return INVALID_ASSIGNMENT;
        var name = sides[0];
        var value = sides[1];
        if (!Expr.isName(name)) return INVALID_IDENTIFIER;
        if (Expr.isName(value)) {
            if (!variables.contains(value)) return UNKNOWN_VARIABLE;
            value = variables.lookupVariable(value);
        } else if (!Expr.isIntConst(value)) {
            return INVALID_ASSIGNMENT;
        }
        variables.assign(name, value);
        return null;
    }

    private String identifier(String identifier) {
        if (!Expr.isName(identifier)) return INVALID_IDENTIFIER;
        var value = variables.lookupVariable(identifier);
        return value != null ? value : UNKNOWN_VARIABLE;
    }

    private String expression(String expression) {
        if (!isWellFormed(expression)) return INVALID_EXPRESSION;
        var result = Expr.evaluate(expression, variables);
        return result.isOk() ? result.value() : result.error().message();
    }

    private static boolean isAlphanumeric(String s) {
        for (int i = 0; i < s.length(); i++)
            if (!Expr.isLetter(s.charAt(i)) && !Expr.isDigit(s.charAt(i))) return false;
        return true;
    }

    private enum Last { START, LETTER, DIGIT, SIGN, OPERATOR, OPEN, CLOSE }

    /**
     * Checks that a normalized expression has balanced brackets, only known characters,
     * and operators between operands. A sign directly behind {@code * / ^} may only
     * precede a number or a bracket.
     */
    static boolean isWellFormed(String expression) {
        var last = Last.START;
        int depth = 0;
        boolean signAfterOperator = false;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            boolean afterOperand = last == Last.LETTER || last == Last.DIGIT || last == Last.CLOSE;
            if (Expr.isLetter(c)) {
                if (last == Last.DIGIT || last == Last.CLOSE) return false;
                // the scanner only folds such a sign into a number
                if (last == Last.SIGN && signAfterOperator) return false;
                last = Last.LETTER;
            } else if (Expr.isDigit(c)) {
                if (last == Last.LETTER || last == Last.CLOSE) return false;
                last = Last.DIGIT;
            } else if (c == '+' || c == '-') {
                if (last == Last.SIGN) return false;
                signAfterOperator = last == Last.OPERATOR;
                last = Last.SIGN;
            } else if (c == '*' || c == '/' || c == '^') {
                if (!afterOperand) return false;
                last = Last.OPERATOR;
            } else if (c == '(') {
                if (afterOperand) return false;
                depth++;
                last = Last.OPEN;
            } else if (c == ')') {
                if (!afterOperand || --depth < 0) return false;
                last = Last.CLOSE;
            } else {
                return false;
            }
        }
        return depth == 0 && (last == Last.LETTER || last == Last.DIGIT || last == Last.CLOSE);
    }
}
