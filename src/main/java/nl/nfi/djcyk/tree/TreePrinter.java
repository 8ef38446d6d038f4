package nl.nfi.djcyk.tree;

import java.util.ArrayDeque;
import java.util.Deque;

public final class TreePrinter {

    private static final String INDENT = "  ";

    private TreePrinter() {
    }

    // one node per line, children indented, leaves as "N -> cake"
    public static String indented(final ParseTree tree) {
        final StringBuilder builder = new StringBuilder();
        final Deque<Node> pending = new ArrayDeque<>();
        pending.push(new Node(tree, 0));
        while (!pending.isEmpty()) {
            final Node node = pending.pop();
            builder.append(INDENT.repeat(node.level()));
            if (node.tree() instanceof ParseTree.Leaf leaf) {
                builder.append(leaf.symbol()).append(" -> ").append(leaf.terminal().text());
            } else {
                final ParseTree.Branch branch = (ParseTree.Branch) node.tree();
                builder.append(branch.symbol());
                pending.push(new Node(branch.right(), node.level() + 1));
                pending.push(new Node(branch.left(), node.level() + 1));
            }
            builder.append(System.lineSeparator());
        }
        return builder.toString();
    }

    // e.g. (S (NP she) (VP eats))
    public static String bracketed(final ParseTree tree) {
        final StringBuilder builder = new StringBuilder();
        final Deque<Bracket> pending = new ArrayDeque<>();
        pending.push(new Bracket.Open(tree));
        while (!pending.isEmpty()) {
            final Bracket next = pending.pop();
            if (next instanceof Bracket.Text text) {
                builder.append(text.value());
                continue;
            }
            final ParseTree node = ((Bracket.Open) next).tree();
            if (node instanceof ParseTree.Leaf leaf) {
                builder.append('(').append(leaf.symbol()).append(' ').append(leaf.terminal().text()).append(')');
            } else {
                final ParseTree.Branch branch = (ParseTree.Branch) node;
                builder.append('(').append(branch.symbol()).append(' ');
                pending.push(new Bracket.Text(")"));
                pending.push(new Bracket.Open(branch.right()));
                pending.push(new Bracket.Text(" "));
                pending.push(new Bracket.Open(branch.left()));
            }
        }
        return builder.toString();
    }

    // a subtree still to print, or text closing one
    private sealed interface Bracket permits Bracket.Open, Bracket.Text {

        record Open(ParseTree tree) implements Bracket {
        }

        record Text(String value) implements Bracket {
        }
    }

    private record Node(ParseTree tree, int level) {
    }
}
