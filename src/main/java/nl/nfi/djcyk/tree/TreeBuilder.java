package nl.nfi.djcyk.tree;

import nl.nfi.djcyk.cyk.BackPointer;
import nl.nfi.djcyk.cyk.ParseChart;
import nl.nfi.djcyk.cyk.ParseResult;
import nl.nfi.djcyk.grammar.NonTerminal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Rebuilds one derivation from the back-pointers of an accepted parse.
 *
 * <p>Where a span has several justifications the first one recorded is used, so the same chart always
 * gives the same tree. The root is labelled with the start symbol of the source grammar rather than
 * the synthesized CNF start symbol, whose productions are copies of the source start's.
 */
public final class TreeBuilder {

    private TreeBuilder() {
    }

    // null when the sentence was rejected
    public static ParseTree buildTree(final ParseResult result) {
        if (!result.accepted()) {
            return null;
        }

        final ParseChart chart = result.chart();
        final NonTerminal start = result.grammar().start();

        final Deque<Step> pending = new ArrayDeque<>();
        final Deque<ParseTree> built = new ArrayDeque<>();
        pending.push(new Step(start, result.grammar().sourceStart(), 0, result.tokenCount(), false));

        while (!pending.isEmpty()) {
            final Step step = pending.pop();
            final BackPointer backPointer = firstBackPointer(chart, step);

            if (backPointer instanceof BackPointer.Lexical lexical) {
                built.push(new ParseTree.Leaf(step.label(), lexical.terminal()));
                continue;
            }

            final BackPointer.Binary binary = (BackPointer.Binary) backPointer;
            if (step.childrenBuilt()) {
                final ParseTree right = built.pop();
                final ParseTree left = built.pop();
                built.push(new ParseTree.Branch(step.label(), left, right));
            } else {
                // left child is popped and completed first
                pending.push(step.withChildrenBuilt());
                pending.push(Step.of(binary.right(), binary.rightStart(), binary.rightLength()));
                pending.push(Step.of(binary.left(), binary.leftStart(), binary.leftLength()));
            }
        }

        return built.pop();
    }

    private static BackPointer firstBackPointer(final ParseChart chart, final Step step) {
        final List<BackPointer> backPointers = chart.backPointersAt(step.start(), step.length(), step.symbol());
        if (backPointers.isEmpty()) {
            throw new IllegalStateException("No back-pointer for %s over (%d, %d)".formatted(step.symbol(), step.start(), step.length()));
        }
        return backPointers.get(0);
    }

    // symbol is looked up in the chart, label ends up in the tree
    private record Step(NonTerminal symbol, NonTerminal label, int start, int length, boolean childrenBuilt) {

        static Step of(final NonTerminal symbol, final int start, final int length) {
            return new Step(symbol, symbol, start, length, false);
        }

        Step withChildrenBuilt() {
            return new Step(symbol, label, start, length, true);
        }
    }
}
