package nl.nfi.djcyk.grammar;

// grammar cannot be normalized, e.g. a referenced non-terminal has no rule entry
public class MalformedGrammarException extends IllegalArgumentException {

    public MalformedGrammarException(final String message) {
        super(message);
    }

    public MalformedGrammarException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
