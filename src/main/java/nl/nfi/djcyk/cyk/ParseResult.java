package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.cnf.CnfGrammar;

import java.time.Duration;
import java.util.List;

// elapsed covers filling the chart only, not tokenization or index construction
public record ParseResult(CnfGrammar grammar, List<String> tokens, ParseChart chart, boolean accepted, Duration elapsed) {

    static ParseResult rejectedEmpty(final CnfGrammar grammar) {
        return new ParseResult(grammar, List.of(), ParseChart.forTokenCount(0), false, Duration.ZERO);
    }

    public int tokenCount() {
        return tokens.size();
    }
}
