package nl.nfi.djcyk.tree;

import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.grammar.Terminal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

// a binary derivation tree, owned by whoever asked for it
public sealed interface ParseTree permits ParseTree.Leaf, ParseTree.Branch {

    NonTerminal symbol();

    // leaf terminals, left to right
    default List<String> terminals() {
        final List<String> terminals = new ArrayList<>();
        final Deque<ParseTree> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            final ParseTree node = pending.pop();
            if (node instanceof Leaf leaf) {
                terminals.add(leaf.terminal().text());
            } else {
                final Branch branch = (Branch) node;
                pending.push(branch.right());
                pending.push(branch.left());
            }
        }
        return terminals;
    }

    default int depth() {
        int depth = 0;
        final Deque<ParseTree> level = new ArrayDeque<>();
        level.add(this);
        while (!level.isEmpty()) {
            depth++;
            for (int remaining = level.size(); remaining > 0; remaining--) {
                if (level.poll() instanceof Branch branch) {
                    level.add(branch.left());
                    level.add(branch.right());
                }
            }
        }
        return depth;
    }

    record Leaf(NonTerminal symbol, Terminal terminal) implements ParseTree {
    }

    record Branch(NonTerminal symbol, ParseTree left, ParseTree right) implements ParseTree {
    }
}
