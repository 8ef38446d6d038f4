package nl.nfi.djcyk.grammar;

// grammar symbols carry their kind explicitly, never derived from spelling
public sealed interface Symbol permits Terminal, NonTerminal {

    String text();
}
