package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.cnf.CnfGrammar;
import nl.nfi.djcyk.common.Timers.TimedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static nl.nfi.djcyk.common.Timers.time;
import static nl.nfi.djcyk.cyk.CykCommon.fillLexicalCell;
import static nl.nfi.djcyk.cyk.CykCommon.fillSpanCell;

/**
 * Cocke-Younger-Kasami recognizer for a grammar in Chomsky Normal Form.
 *
 * <p>The chart is filled bottom-up by span length, single tokens first. Runs in O(n^3 * |G|).
 */
public final class CykParser implements SentenceParser {

    private static final Logger LOG = LoggerFactory.getLogger(CykParser.class);

    private final CnfGrammar grammar;
    private final BinaryRuleIndex index;

    private CykParser(final CnfGrammar grammar, final BinaryRuleIndex index) {
        this.grammar = grammar;
        this.index = index;
    }

    /**
     * @throws InvalidCnfGrammarException if the grammar is not in Chomsky Normal Form
     */
    public static CykParser init(final CnfGrammar grammar) {
        return new CykParser(grammar, BinaryRuleIndex.build(grammar));
    }

    @Override
    public CnfGrammar grammar() {
        return grammar;
    }

    @Override
    public ParseResult parse(final List<String> tokens) {
        if (tokens.isEmpty()) {
            LOG.debug("Rejecting empty sentence");
            return ParseResult.rejectedEmpty(grammar);
        }

        final TimedResult<ParseChart> filled = time(() -> fill(tokens));
        final ParseChart chart = filled.value();
        final boolean accepted = chart.contains(0, tokens.size(), grammar.start());

        LOG.debug("Parsed {} tokens in {}: accepted {}, {} chart entries", tokens.size(), filled.duration(), accepted, chart.entryCount());
        return new ParseResult(grammar, List.copyOf(tokens), chart, accepted, filled.duration());
    }

    private ParseChart fill(final List<String> tokens) {
        final int tokenCount = tokens.size();
        final ParseChart chart = ParseChart.forTokenCount(tokenCount);

        for (int position = 0; position < tokenCount; position++) {
            fillLexicalCell(chart, index, tokens, position);
        }
        for (int length = 2; length <= tokenCount; length++) {
            for (int start = 0; start + length <= tokenCount; start++) {
                fillSpanCell(chart, index, start, length);
            }
        }
        return chart;
    }
}
