package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.grammar.Terminal;

import java.util.List;
import java.util.Set;

// cell filling shared by the sequential and the threaded parser, each call writes exactly one cell
final class CykCommon {

    private CykCommon() {
    }

    static void fillLexicalCell(final ParseChart chart, final BinaryRuleIndex index, final List<String> tokens, final int position) {
        final Terminal terminal = new Terminal(tokens.get(position));
        final BackPointer leaf = new BackPointer.Lexical(terminal);
        for (final NonTerminal producer : index.producing(terminal)) {
            chart.add(position, 1, producer, leaf);
        }
    }

    // requires every cell shorter than length to be complete
    static void fillSpanCell(final ParseChart chart, final BinaryRuleIndex index, final int start, final int length) {
        for (int leftLength = 1; leftLength < length; leftLength++) {
            final int rightStart = start + leftLength;
            final int rightLength = length - leftLength;

            final Set<NonTerminal> leftSymbols = chart.symbolsAt(start, leftLength);
            if (leftSymbols.isEmpty()) {
                continue;
            }
            final Set<NonTerminal> rightSymbols = chart.symbolsAt(rightStart, rightLength);
            if (rightSymbols.isEmpty()) {
                continue;
            }

            for (final NonTerminal left : leftSymbols) {
                for (final NonTerminal right : rightSymbols) {
                    for (final NonTerminal producer : index.producing(left, right)) {
                        chart.add(start, length, producer, new BackPointer.Binary(left, right, start, leftLength, rightStart, rightLength));
                    }
                }
            }
        }
    }
}
