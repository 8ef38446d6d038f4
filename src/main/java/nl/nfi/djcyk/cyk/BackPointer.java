package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.grammar.Terminal;

// why a non-terminal is in a chart cell
public sealed interface BackPointer permits BackPointer.Lexical, BackPointer.Binary {

    // A -> 'a' over a single token
    record Lexical(Terminal terminal) implements BackPointer {
    }

    // A -> B C, B covering [leftStart, leftStart + leftLength), C covering [rightStart, rightStart + rightLength)
    record Binary(NonTerminal left, NonTerminal right,
                  int leftStart, int leftLength,
                  int rightStart, int rightLength) implements BackPointer {

        // position of the first token of the right child
        public int splitPoint() {
            return rightStart;
        }
    }
}
