package exchange.core2.primality.cli;

import exchange.core2.primality.Primality;
import exchange.core2.primality.PrimalityVerdict;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads one integer (first argument, or stdin when there is none) and prints
 * {@code "<n> is PRIME"} or {@code "<n> is COMPOSITE"}.
 */
public final class PrimalityCli {

    private static final Logger log = LoggerFactory.getLogger(PrimalityCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_BAD_INPUT = 2;

    static final String PROMPT = "Enter a number: ";

    private PrimalityCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(@NotNull final String[] args,
                          @NotNull final InputStream in,
                          @NotNull final PrintStream out,
                          @NotNull final PrintStream err) {

        final String input;
        if (args.length > 0) {
            input = args[0];
        } else {
            out.print(PROMPT);
            out.flush();
            input = readLine(in);
            if (input == null) {
                err.println("No number given");
                return EXIT_BAD_INPUT;
            }
        }

        final long n;
        try {
            n = Long.parseLong(input.trim());
        } catch (NumberFormatException ex) {
            log.warn("Rejected input '{}': {}", input, ex.getMessage());
            err.println("Not a 64-bit integer: " + input.trim());
            return EXIT_BAD_INPUT;
        }

        final PrimalityVerdict verdict = Primality.verdict(n);
        log.debug("{} -> {}", n, verdict);
        out.println(formatVerdict(n, verdict));
        return EXIT_OK;
    }

    static String formatVerdict(final long n, final PrimalityVerdict verdict) {
        return n + " is " + verdict.name();
    }

    private static String readLine(final InputStream in) {
        try {
            final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            return reader.readLine();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
