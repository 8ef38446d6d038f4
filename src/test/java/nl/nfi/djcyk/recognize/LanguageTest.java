package nl.nfi.djcyk.recognize;

import nl.nfi.djcyk.grammar.MalformedGrammarException;
import nl.nfi.djcyk.grammar.NonTerminal;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static nl.nfi.djcyk.Utils.english;
import static nl.nfi.djcyk.Utils.grammarPath;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageTest {

    @Test
    void loadsBundledEnglish() throws IOException {
        final Language language = Language.loadDefault();

        assertThat(language.name()).isEqualTo("english");
        assertThat(language.grammar()).isEqualTo(english());
        assertThat(language.examples())
                .contains(new ExampleSentence("she eats a cake", true), new ExampleSentence("eats a cake", false));
        assertThat(language.isNormalized()).isFalse();
    }

    @Test
    void normalizesOnce() throws IOException {
        final Language language = Language.loadFrom(grammarPath("repeat.ini"));

        assertThat(language.cnfGrammar()).isSameAs(language.cnfGrammar());
        assertThat(language.isNormalized()).isTrue();
        assertThat(language.cnfGrammar().sourceStart()).isEqualTo(new NonTerminal("S"));
    }

    @Test
    void examplesDefaultToNone() throws IOException {
        final Language language = Language.loadFrom(grammarPath("with_empty.ini"));

        assertThat(language.examples()).isEmpty();
        assertThat(language.description()).isEqualTo("An optional article before a noun");
    }

    @Test
    void requiresRulesSection() {
        assertThatThrownBy(() -> Language.loadFrom(grammarPath("no_rules.ini")))
                .isInstanceOf(MalformedGrammarException.class)
                .hasMessageContaining("[RULES]");
    }

    @Test
    void undefinedNonTerminalFailsOnNormalization() throws IOException {
        final Language language = Language.loadFrom(grammarPath("undefined_nonterminal.ini"));

        assertThatThrownBy(language::cnfGrammar)
                .isInstanceOf(MalformedGrammarException.class)
                .hasMessageContaining("VP");
    }

    @Test
    void missingFile() {
        assertThatThrownBy(() -> Language.loadFrom(grammarPath("does_not_exist.ini")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not exist");
    }
}
