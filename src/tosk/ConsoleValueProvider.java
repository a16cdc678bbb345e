package tosk;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads answers from the terminal. Uses {@link Console} when one is attached so hidden
 * prompts do not echo; falls back to plain stdin (piped input, IDE consoles).
 */
public class ConsoleValueProvider implements ValueProvider {

    private final Console console;
    private final BufferedReader stdin;
    private final PrintStream out;

    public ConsoleValueProvider() {
        this.console = System.console();
        this.stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        this.out = System.out;
    }

    @Override
    public String ask(String prompt, boolean hidden) throws IOException {
        if (console != null) {
            if (hidden) {
                char[] chars = console.readPassword("%s: ", prompt);
                return chars == null ? "" : new String(chars);
            }
            String line = console.readLine("%s: ", prompt);
            return line == null ? "" : line;
        }
        out.print(prompt + ": ");
        out.flush();
        String line = stdin.readLine();
        return line == null ? "" : line;
    }
}
