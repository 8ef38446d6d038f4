package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.cnf.CnfGrammar;

import java.util.List;

public interface SentenceParser {

    CnfGrammar grammar();

    ParseResult parse(final List<String> tokens);
}
