package com.flagship.bank_ledger.console;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented console used by the menu. Wraps the input and output
 * streams so the menu can be driven from tests.
 */
public class ConsoleIO {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleIO(Reader in, PrintStream out) {
        this.in = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        this.out = out;
    }

    public static ConsoleIO system(InputStream in, PrintStream out) {
        return new ConsoleIO(new InputStreamReader(in, StandardCharsets.UTF_8), out);
    }

    /**
     * Prints the prompt and reads one line.
     *
     * @return the line without its terminator, or null at end of input
     */
    public String prompt(String message) {
        out.print(message);
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? null : line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }

    public void println(String message) {
        out.println(message);
    }
}
