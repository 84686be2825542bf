package smartcalc;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Scanner;

public class Calculator {
    /**
     * Reads lines from in and prints the answers to out until /exit or end of input.
     * @return the session, with the variables assigned on the way
     */
    public static Session run(InputStream in, PrintStream out) {
        var session = new Session();
        var keyboard = new Scanner(in);
        while (!session.isFinished() && keyboard.hasNextLine()) {
            var answer = session.process(keyboard.nextLine());
            if (answer != null) out.println(answer);
        }
        keyboard.close();
        return session;
    }

    public static void main(String[] args) {
        if (Arrays.asList(args).contains("--screen")) {
            try {
                CalculatorScreen.main(args);
            } catch (Exception e) {
                e.printStackTrace();
                System.exit(1);
            }
            return;
        }
        run(System.in, System.out);
    }
}
