package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.cnf.CnfGrammar;
import nl.nfi.djcyk.common.Timers.TimedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.IntConsumer;

import static java.lang.Math.max;
import static java.lang.Math.min;
import static nl.nfi.djcyk.common.Timers.time;
import static nl.nfi.djcyk.cyk.CykCommon.fillLexicalCell;
import static nl.nfi.djcyk.cyk.CykCommon.fillSpanCell;

/**
 * CYK parser that fills the cells of one span length concurrently.
 *
 * <p>A round for length L only starts after every cell of length L - 1 is written. Every cell is filled
 * by a single task running the same loop as {@link CykParser}, so both produce identical charts.
 */
public final class ThreadedCykParser implements SentenceParser {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadedCykParser.class);

    private final CnfGrammar grammar;
    private final BinaryRuleIndex index;
    private final int threadCount;

    private ThreadedCykParser(final CnfGrammar grammar, final BinaryRuleIndex index, final int threadCount) {
        this.grammar = grammar;
        this.index = index;
        this.threadCount = threadCount;
    }

    public static ThreadedCykParser init(final CnfGrammar grammar) {
        return new ThreadedCykParser(grammar, BinaryRuleIndex.build(grammar), Runtime.getRuntime().availableProcessors());
    }

    public ThreadedCykParser threadCount(final int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be positive: %d".formatted(threadCount));
        }
        return new ThreadedCykParser(grammar, index, threadCount);
    }

    public int threadCount() {
        return threadCount;
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

        LOG.debug("Parsed {} tokens in {} using {} threads: accepted {}", tokens.size(), filled.duration(), threadCount, accepted);
        return new ParseResult(grammar, List.copyOf(tokens), chart, accepted, filled.duration());
    }

    private ParseChart fill(final List<String> tokens) {
        final int tokenCount = tokens.size();
        final ParseChart chart = ParseChart.forTokenCount(tokenCount);

        final ExecutorService executorService = Executors.newFixedThreadPool(max(1, min(threadCount, tokenCount)));
        try {
            runRound(executorService, tokenCount, position -> fillLexicalCell(chart, index, tokens, position));
            for (int length = 2; length <= tokenCount; length++) {
                final int spanLength = length;
                runRound(executorService, tokenCount - length + 1, start -> fillSpanCell(chart, index, start, spanLength));
            }
        } finally {
            executorService.shutdownNow();
        }
        return chart;
    }

    // submits one task per cell and waits for all of them
    private static void runRound(final ExecutorService executorService, final int cellCount, final IntConsumer fillCell) {
        final List<Future<?>> futures = new ArrayList<>(cellCount);
        for (int i = 0; i < cellCount; i++) {
            final int cell = i;
            futures.add(executorService.submit(() -> fillCell.accept(cell)));
        }
        try {
            for (final Future<?> future : futures) {
                future.get();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new RuntimeException(e.getCause());
        }
    }
}
