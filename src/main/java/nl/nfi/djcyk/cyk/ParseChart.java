package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.grammar.NonTerminal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The CYK table: for every span (start, length) the non-terminals deriving exactly that span, each with
 * the back-pointers that justify it, in the order they were found.
 *
 * <p>Spans are addressed by start position (0 based) and length (1 based); the cell covering the whole
 * sentence is {@code (0, tokenCount)}.
 */
public final class ParseChart {

    private final int tokenCount;
    private final Cell[][] cells;

    private ParseChart(final int tokenCount) {
        this.tokenCount = tokenCount;
        this.cells = new Cell[tokenCount][];
        for (int start = 0; start < tokenCount; start++) {
            cells[start] = new Cell[tokenCount - start];
            for (int length = 0; length < tokenCount - start; length++) {
                cells[start][length] = new Cell();
            }
        }
    }

    static ParseChart forTokenCount(final int tokenCount) {
        return new ParseChart(tokenCount);
    }

    public int tokenCount() {
        return tokenCount;
    }

    public Set<NonTerminal> symbolsAt(final int start, final int length) {
        return Collections.unmodifiableSet(cell(start, length).entries.keySet());
    }

    public boolean contains(final int start, final int length, final NonTerminal symbol) {
        return cell(start, length).entries.containsKey(symbol);
    }

    public List<BackPointer> backPointersAt(final int start, final int length, final NonTerminal symbol) {
        final List<BackPointer> backPointers = cell(start, length).entries.get(symbol);
        return backPointers == null ? List.of() : Collections.unmodifiableList(backPointers);
    }

    // number of (span, non-terminal) entries over the whole chart
    public long entryCount() {
        long count = 0;
        for (final Cell[] row : cells) {
            for (final Cell cell : row) {
                count += cell.entries.size();
            }
        }
        return count;
    }

    void add(final int start, final int length, final NonTerminal symbol, final BackPointer backPointer) {
        cell(start, length).entries.computeIfAbsent(symbol, key -> new ArrayList<>(1)).add(backPointer);
    }

    private Cell cell(final int start, final int length) {
        if (start < 0 || length < 1 || start + length > tokenCount) {
            throw new IndexOutOfBoundsException("Span (%d, %d) outside of chart for %d tokens".formatted(start, length, tokenCount));
        }
        return cells[start][length - 1];
    }

    private static final class Cell {

        private final Map<NonTerminal, List<BackPointer>> entries = new LinkedHashMap<>();
    }
}
