package nl.nfi.djcyk.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarsTest {

    @Test
    void quotedWordsAreTerminals() {
        assertThat(Grammars.parseSymbol("'eats'")).isEqualTo(new Terminal("eats"));
        assertThat(Grammars.parseSymbol("VP")).isEqualTo(new NonTerminal("VP"));
    }

    @Test
    void parsesMixedProduction() {
        final Production production = Grammars.parseProduction("  'a'   S  ");

        assertThat(production.symbols()).containsExactly(new Terminal("a"), new NonTerminal("S"));
        assertThat(production.containsTerminal()).isTrue();
        assertThat(production.isBinary()).isFalse();
    }

    @Test
    void emptyStringIsEmptyProduction() {
        final Production production = Grammars.parseProduction("");

        assertThat(production.isEmpty()).isTrue();
        assertThat(production).hasToString("''");
    }

    @ParameterizedTest(name = "{0} is not a valid symbol")
    @ValueSource(strings = {"'", "''", "'eats", "V'P"})
    void rejectsBadSymbols(final String text) {
        assertThatThrownBy(() -> Grammars.parseSymbol(text))
                .isInstanceOf(MalformedGrammarException.class);
    }

    @Test
    void rejectsUpperCaseTerminal() {
        assertThatThrownBy(() -> Grammars.fromRules("S", Map.of("S", List.of("'Paris'"))))
                .isInstanceOf(MalformedGrammarException.class)
                .hasMessageContaining("'Paris'");
        assertThat(Grammars.parseSymbol("Paris")).isEqualTo(new NonTerminal("Paris"));
    }

    @Test
    void keepsRuleOrder() {
        final Grammar grammar = Grammars.fromRules("S", Map.of("S", List.of("'x'")));

        assertThat(grammar.start()).isEqualTo(new NonTerminal("S"));
        assertThat(grammar.productionsOf(new NonTerminal("S"))).containsExactly(Production.of(new Terminal("x")));
    }
}
