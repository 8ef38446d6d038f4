package nl.nfi.djcyk.recognize;

import java.util.List;
import java.util.Locale;

public final class Tokenizer {

    private Tokenizer() {
    }

    // lower-cased, split on whitespace
    public static List<String> tokenize(final String sentence) {
        final String normalized = sentence.strip().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split("\\s+"));
    }
}
