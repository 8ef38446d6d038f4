package nl.nfi.djcyk.common;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;

public final class HostUtils {

    public static String hostname() {
        try {
            final Process hostname = Runtime.getRuntime().exec(new String[]{"hostname"});
            try (final BufferedReader reader = new BufferedReader(new InputStreamReader(hostname.getInputStream()))) {
                final String name = reader.readLine();
                return name == null || name.isBlank() ? "localhost" : name.trim();
            }
        } catch (final IOException e) {
            throw new UnsupportedOperationException("Could not determine hostname", e);
        }
    }
}
