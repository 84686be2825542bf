package smartcalc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.googlecode.lanterna.TerminalPosition;
import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.graphics.TextGraphics;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.WindowBasedTextGUI;
import com.googlecode.lanterna.gui2.dialogs.TextInputDialog;
import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.input.KeyType;
import com.googlecode.lanterna.screen.Screen;
import com.googlecode.lanterna.screen.TerminalScreen;
import com.googlecode.lanterna.terminal.DefaultTerminalFactory;

/**
 * Full screen front end: history of inputs and answers on the left,
 * variables on the right. Enter asks for the next line, Escape leaves.
 */
public class CalculatorScreen {
    public static final int VARCOLUMN = 50;
    private static final Set<String> PROBLEMS = Set.of(
            Session.INVALID_EXPRESSION, Session.INVALID_IDENTIFIER, Session.INVALID_ASSIGNMENT,
            Session.UNKNOWN_VARIABLE, Session.UNKNOWN_COMMAND,
            Expr.Fail.Kind.DIVISION_BY_ZERO.message(), Expr.Fail.Kind.INVALID_EXPONENT.message());
    private final Session session = new Session();
    private final List<String> history = new ArrayList<>();

    public Session session() {
        return session;
    }

    public List<String> history() {
        return history;
    }

    /**
     * hands one input line to the session and records both sides in the history
     */
    public void submit(String input) {
        if (input == null || input.isBlank()) return;
        history.add("> " + input);
        var answer = session.process(input);
        if (answer != null) history.addAll(List.of(answer.split("\n")));
    }

    /**
     *  draws a vertical divider and the variable table starting at column VARCOLUMN
     */
    private void drawVariables(TextGraphics textGraphics, int height) {
        textGraphics.drawLine(VARCOLUMN - 2, 0, VARCOLUMN - 2, height - 1, (char)0x2502); // |
        textGraphics.setForegroundColor(TextColor.ANSI.CYAN);
        textGraphics.putString(VARCOLUMN, 0, "Variables");
        textGraphics.setForegroundColor(TextColor.ANSI.DEFAULT);
        int row = 2;
        for (var name : session.variables().names()) {
            if (row >= height - 1) break;
            textGraphics.putString(VARCOLUMN, row++, name + " = " + session.variables().lookupVariable(name));
        }
    }

    /**
     *  prints the last lines of the history, answers in red when they report a failure
     */
    public void printToConsole(Screen screen, TextGraphics textGraphics) {
        screen.clear();
        TerminalSize size = screen.getTerminalSize();
        int lines = size.getRows() - 2;
        int first = Math.max(0, history.size() - lines);
        for (int i = first; i < history.size(); i++) {
            var line = history.get(i);
            boolean problem = PROBLEMS.contains(line);
            textGraphics.setForegroundColor(problem ? TextColor.ANSI.RED : TextColor.ANSI.DEFAULT);
            textGraphics.putString(1, i - first, line.length() > VARCOLUMN - 4 ? line.substring(0, VARCOLUMN - 4) : line);
        }
        textGraphics.setForegroundColor(TextColor.ANSI.DEFAULT);
        drawVariables(textGraphics, size.getRows());
        var prompt = "[Enter] input  [Esc] quit";
        textGraphics.putString(1, size.getRows() - 1, prompt);
        screen.setCursorPosition(new TerminalPosition(1 + prompt.length(), size.getRows() - 1));
    }

    public static void main(String[] args) throws IOException {
        var calc = new CalculatorScreen();
        var terminal = new DefaultTerminalFactory().createTerminal();
        var screen = new TerminalScreen(terminal);
        screen.startScreen();
        var textGraphics = screen.newTextGraphics();
        KeyStroke key;
        final WindowBasedTextGUI textGUI = new MultiWindowTextGUI(screen);
        do {
            calc.printToConsole(screen, textGraphics);
            screen.refresh();
            key = screen.readInput();
            if (key.getKeyType() == KeyType.Enter) {
                String input = TextInputDialog.showDialog(textGUI, "Smart Calculator", "expression, assignment or command", "");
                calc.submit(input);
            }
        }
        while (key.getKeyType() != KeyType.Escape && !calc.session().isFinished());
        screen.stopScreen();
        screen.close();
        System.out.println(calc.session().variables());
    }
}
