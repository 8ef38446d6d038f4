package nl.nfi.djcyk.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads grammars written in the textual rule notation used by grammar files.
 *
 * <p>A production is a space separated list of symbols: bare words are non-terminals, single quoted
 * words are terminals, e.g. {@code "V NP"} or {@code "'eats'"}. The empty string is the empty production.
 * Terminals are lower case, matching the tokens of a lower-cased sentence.
 */
public final class Grammars {

    private Grammars() {
    }

    public static Grammar fromRules(final String start, final Map<String, ? extends List<String>> rules) {
        final Map<NonTerminal, List<Production>> parsed = new LinkedHashMap<>();
        rules.forEach((name, productions) -> {
            final List<Production> bodies = new ArrayList<>(productions.size());
            for (final String production : productions) {
                bodies.add(parseProduction(production));
            }
            parsed.put(new NonTerminal(checkName(name)), bodies);
        });
        return Grammar.create(new NonTerminal(checkName(start)), parsed);
    }

    public static Production parseProduction(final String text) {
        final String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return Production.of();
        }
        final List<Symbol> symbols = new ArrayList<>();
        for (final String part : trimmed.split("\\s+")) {
            symbols.add(parseSymbol(part));
        }
        return new Production(symbols);
    }

    public static Symbol parseSymbol(final String text) {
        if (text.startsWith("'")) {
            if (text.length() < 3 || !text.endsWith("'")) {
                throw new MalformedGrammarException("Badly quoted terminal: %s".formatted(text));
            }
            final String word = text.substring(1, text.length() - 1);
            // sentences are lower-cased before parsing
            if (!word.equals(word.toLowerCase(Locale.ROOT))) {
                throw new MalformedGrammarException("Terminal must be lower case: %s".formatted(text));
            }
            return new Terminal(word);
        }
        return new NonTerminal(checkName(text));
    }

    private static String checkName(final String name) {
        if (name.isBlank() || name.contains("'") || name.chars().anyMatch(Character::isWhitespace)) {
            throw new MalformedGrammarException("Invalid non-terminal name: '%s'".formatted(name));
        }
        return name;
    }
}
