package nl.nfi.djcyk.grammar;

import java.util.List;

import static java.util.stream.Collectors.joining;

// right hand side of a rule, the empty list is the empty (epsilon) production
public record Production(List<Symbol> symbols) {

    public Production {
        symbols = List.copyOf(symbols);
    }

    public static Production of(final Symbol... symbols) {
        return new Production(List.of(symbols));
    }

    public int size() {
        return symbols.size();
    }

    public Symbol symbolAt(final int position) {
        return symbols.get(position);
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    // A -> B
    public boolean isUnit() {
        return symbols.size() == 1 && symbols.get(0) instanceof NonTerminal;
    }

    // A -> 'a'
    public boolean isLexical() {
        return symbols.size() == 1 && symbols.get(0) instanceof Terminal;
    }

    // A -> B C
    public boolean isBinary() {
        return symbols.size() == 2
                && symbols.get(0) instanceof NonTerminal
                && symbols.get(1) instanceof NonTerminal;
    }

    public boolean containsTerminal() {
        return symbols.stream().anyMatch(symbol -> symbol instanceof Terminal);
    }

    @Override
    public String toString() {
        if (symbols.isEmpty()) {
            return "''";
        }
        return symbols.stream().map(Symbol::toString).collect(joining(" "));
    }
}
