package nl.nfi.djcyk.recognize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Terminal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// categories are non-terminals with A -> 'word' productions, words are all terminals of the grammar
public record Vocabulary(Map<NonTerminal, List<String>> categories, Set<String> words) {

    public static Vocabulary of(final Grammar grammar) {
        final Map<NonTerminal, List<String>> categories = new LinkedHashMap<>();
        grammar.rules().forEach((nonTerminal, productions) -> {
            final List<String> words = new ArrayList<>();
            for (final Production production : productions) {
                if (production.isLexical()) {
                    words.add(((Terminal) production.symbolAt(0)).text());
                }
            }
            if (!words.isEmpty()) {
                categories.put(nonTerminal, List.copyOf(words));
            }
        });

        final Set<String> words = new LinkedHashSet<>();
        grammar.terminals().forEach(terminal -> words.add(terminal.text()));

        return new Vocabulary(Collections.unmodifiableMap(categories), Collections.unmodifiableSet(words));
    }

    public boolean contains(final String word) {
        return words.contains(word);
    }

    public List<String> unknownWords(final List<String> tokens) {
        return tokens.stream().filter(token -> !contains(token)).distinct().toList();
    }
}
