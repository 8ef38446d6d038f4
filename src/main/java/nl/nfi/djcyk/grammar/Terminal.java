package nl.nfi.djcyk.grammar;

import static java.util.Objects.requireNonNull;

// a lexical token, e.g. 'eats'
public record Terminal(String text) implements Symbol {

    public Terminal {
        requireNonNull(text, "text");
    }

    @Override
    public String toString() {
        return "'" + text + "'";
    }
}
