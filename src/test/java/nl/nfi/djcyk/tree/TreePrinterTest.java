package nl.nfi.djcyk.tree;

import nl.nfi.djcyk.cyk.CykParser;
import org.junit.jupiter.api.Test;

import static nl.nfi.djcyk.Utils.englishCnf;
import static nl.nfi.djcyk.Utils.tokens;
import static org.assertj.core.api.Assertions.assertThat;

class TreePrinterTest {

    private final CykParser english = CykParser.init(englishCnf());

    private ParseTree tree(final String sentence) {
        return TreeBuilder.buildTree(english.parse(tokens(sentence)));
    }

    @Test
    void bracketed() {
        assertThat(TreePrinter.bracketed(tree("she eats a cake")))
                .isEqualTo("(S (NP she) (VP (V eats) (NP (Det a) (N cake))))");
    }

    @Test
    void bracketedNestsPrepositionalPhrase() {
        assertThat(TreePrinter.bracketed(tree("she eats a cake with a fork")))
                .isEqualTo("(S (NP she) (VP (VP (V eats) (NP (Det a) (N cake))) (PP (P with) (NP (Det a) (N fork)))))");
    }

    @Test
    void indented() {
        final String newline = System.lineSeparator();

        assertThat(TreePrinter.indented(tree("she eats a cake"))).isEqualTo(
                "S" + newline
                        + "  NP -> she" + newline
                        + "  VP" + newline
                        + "    V -> eats" + newline
                        + "    NP" + newline
                        + "      Det -> a" + newline
                        + "      N -> cake" + newline);
    }

    @Test
    void singleLeaf() {
        final ParseTree leaf = ((ParseTree.Branch) tree("she eats")).left();

        assertThat(TreePrinter.bracketed(leaf)).isEqualTo("(NP she)");
        assertThat(TreePrinter.indented(leaf)).isEqualTo("NP -> she" + System.lineSeparator());
    }
}
