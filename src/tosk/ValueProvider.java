package tosk;

import java.io.IOException;

/**
 * Where the secret store gets answers to its questions: the terminal in production,
 * a scripted list of answers in tests.
 */
public interface ValueProvider {

    /**
     * Ask for one value.
     *
     * @param prompt text shown to the user
     * @param hidden true to suppress echo (e.g. when re-entering an existing master password)
     * @return the answer without its line terminator; never null (EOF yields "")
     */
    String ask(String prompt, boolean hidden) throws IOException;
}
