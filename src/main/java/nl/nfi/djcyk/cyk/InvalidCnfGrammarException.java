package nl.nfi.djcyk.cyk;

// a grammar handed to the parser is not in Chomsky Normal Form, which means normalization went wrong
public class InvalidCnfGrammarException extends IllegalStateException {

    public InvalidCnfGrammarException(final String message) {
        super(message);
    }
}
