package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.cnf.CnfGrammar;
import nl.nfi.djcyk.cnf.CnfNormalizer;
import nl.nfi.djcyk.grammar.NonTerminal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.List;

import static nl.nfi.djcyk.Utils.englishCnf;
import static nl.nfi.djcyk.Utils.grammar;
import static nl.nfi.djcyk.Utils.tokens;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadedCykParserTest {

    private static final List<String> SENTENCES = List.of(
            "she eats a cake",
            "she eats",
            "the cat cooks the soup with a dog in the oven",
            "she eats a cake with a fork with a knife with a spoon",
            "eats a cake",
            "the cat quickly drinks beer"
    );

    @ParameterizedTest(name = "{0} threads")
    @ValueSource(ints = {1, 2, 4, 16})
    void fillsSameChartAsSingleThreaded(final int threadCount) {
        final CnfGrammar cnf = englishCnf();
        final CykParser expected = CykParser.init(cnf);
        final ThreadedCykParser actual = ThreadedCykParser.init(cnf).threadCount(threadCount);

        for (final String sentence : SENTENCES) {
            final ParseChart expectedChart = expected.parse(tokens(sentence)).chart();
            final ParseResult result = actual.parse(tokens(sentence));

            assertThat(result.accepted()).as(sentence).isEqualTo(expected.parse(tokens(sentence)).accepted());
            for (int length = 1; length <= expectedChart.tokenCount(); length++) {
                for (int start = 0; start + length <= expectedChart.tokenCount(); start++) {
                    assertThat(result.chart().symbolsAt(start, length))
                            .as("%s (%d, %d)", sentence, start, length)
                            .containsExactlyElementsOf(expectedChart.symbolsAt(start, length));
                    for (final NonTerminal symbol : expectedChart.symbolsAt(start, length)) {
                        assertThat(result.chart().backPointersAt(start, length, symbol))
                                .containsExactlyElementsOf(expectedChart.backPointersAt(start, length, symbol));
                    }
                }
            }
        }
    }

    @Test
    void longSentence() {
        final ThreadedCykParser parser = ThreadedCykParser.init(CnfNormalizer.normalize(grammar("S", "S", "'a' S | 'a'"))).threadCount(3);

        assertThat(parser.parse(Collections.nCopies(60, "a")).accepted()).isTrue();
        assertThat(parser.parse(List.of()).accepted()).isFalse();
    }

    @Test
    void rejectsNonPositiveThreadCount() {
        assertThatThrownBy(() -> ThreadedCykParser.init(englishCnf()).threadCount(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
