package nl.nfi.djcyk.grammar;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static nl.nfi.djcyk.Utils.english;
import static nl.nfi.djcyk.Utils.grammar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarTest {

    @Test
    void formatsRulesInDeclarationOrder() {
        final Grammar grammar = grammar("S", "S", "NP VP", "VP", "V NP | 'eats'", "NP", "'she'", "V", "'eats'");

        assertThat(grammar.formatRules(false)).containsExactly(
                "S -> NP VP",
                "VP -> V NP | 'eats'",
                "NP -> 'she'",
                "V -> 'eats'"
        );
        assertThat(grammar.formatRules(true)).containsExactly(
                "NP -> 'she'",
                "S -> NP VP",
                "V -> 'eats'",
                "VP -> V NP | 'eats'"
        );
    }

    @Test
    void collectsTerminals() {
        assertThat(english().terminals())
                .hasSize(21)
                .contains(new Terminal("she"), new Terminal("spoon"), new Terminal("with"));
    }

    @Test
    void validateRejectsUndefinedNonTerminal() {
        final Grammar grammar = grammar("S", "S", "NP VP", "NP", "'she'");

        assertThatThrownBy(grammar::validate)
                .isInstanceOf(MalformedGrammarException.class)
                .hasMessageContaining("VP");
    }

    @Test
    void validateRejectsStartWithoutRule() {
        final Grammar grammar = grammar("S", "A", "'a'");

        assertThatThrownBy(grammar::validate)
                .isInstanceOf(MalformedGrammarException.class)
                .hasMessageContaining("Start symbol S");
    }

    @Test
    void productionsOfUnknownNonTerminalFails() {
        assertThatThrownBy(() -> english().productionsOf(new NonTerminal("Adj")))
                .isInstanceOf(MalformedGrammarException.class);
    }

    @Test
    void isDetachedFromSourceMap() {
        final Map<NonTerminal, List<Production>> rules = new LinkedHashMap<>();
        final List<Production> productions = new ArrayList<>(List.of(Production.of(new Terminal("a"))));
        rules.put(new NonTerminal("S"), productions);
        final Grammar grammar = Grammar.create(new NonTerminal("S"), rules);

        productions.add(Production.of(new Terminal("b")));
        rules.put(new NonTerminal("T"), List.of());

        assertThat(grammar.productionCount()).isEqualTo(1);
        assertThat(grammar.nonTerminals()).containsExactly(new NonTerminal("S"));
    }

    @Test
    void copyRulesIsMutableAndIndependent() {
        final Grammar grammar = english();
        final Map<NonTerminal, List<Production>> copy = grammar.copyRules();

        copy.get(new NonTerminal("S")).clear();

        assertThat(grammar.productionsOf(new NonTerminal("S"))).hasSize(1);
        assertThat(grammar).isEqualTo(english());
    }
}
