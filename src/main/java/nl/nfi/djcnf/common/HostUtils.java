package nl.nfi.djcnf.common;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;

public final class HostUtils {

    private static final String UNKNOWN_HOST = "localhost";

    // falls back to localhost when the hostname command gives no output
    public static String hostname() {
        try {
            final Process hostname = Runtime.getRuntime().exec(new String[]{"hostname"});
            try (final BufferedReader output = new BufferedReader(new InputStreamReader(hostname.getInputStream()))) {
                final String name = output.readLine();
                return name == null || name.isBlank() ? UNKNOWN_HOST : name.trim();
            }
        } catch (final IOException e) {
            throw new UnsupportedOperationException("Could not determine hostname", e);
        }
    }
}
