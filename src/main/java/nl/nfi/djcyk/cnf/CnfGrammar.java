package nl.nfi.djcyk.cnf;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.grammar.Production;

import java.util.List;

// a grammar in Chomsky Normal Form, remembering the start symbol of the grammar it was derived from
public record CnfGrammar(Grammar grammar, NonTerminal sourceStart) {

    public NonTerminal start() {
        return grammar.start();
    }

    public List<Production> productionsOf(final NonTerminal nonTerminal) {
        return grammar.productionsOf(nonTerminal);
    }

    // true when every production is A -> B C or A -> 'a'
    public boolean isStrict() {
        return grammar.rules().values().stream()
                .flatMap(List::stream)
                .allMatch(production -> production.isBinary() || production.isLexical());
    }
}
