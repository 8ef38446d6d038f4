package nl.nfi.djcyk.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.stream.Collectors.joining;

/**
 * A context-free grammar: a start non-terminal and, per non-terminal, an ordered list of productions.
 *
 * <p>Rule order and production order are kept as given; they decide which derivation is found first,
 * never whether a sentence is accepted.
 */
public final class Grammar {

    private final NonTerminal start;
    private final Map<NonTerminal, List<Production>> rules;

    private Grammar(final NonTerminal start, final Map<NonTerminal, List<Production>> rules) {
        this.start = start;
        this.rules = rules;
    }

    public static Grammar create(final NonTerminal start, final Map<NonTerminal, ? extends List<Production>> rules) {
        final Map<NonTerminal, List<Production>> copy = new LinkedHashMap<>();
        rules.forEach((nonTerminal, productions) -> copy.put(nonTerminal, List.copyOf(productions)));
        return new Grammar(start, Collections.unmodifiableMap(copy));
    }

    public NonTerminal start() {
        return start;
    }

    public Set<NonTerminal> nonTerminals() {
        return rules.keySet();
    }

    public boolean hasRule(final NonTerminal nonTerminal) {
        return rules.containsKey(nonTerminal);
    }

    public List<Production> productionsOf(final NonTerminal nonTerminal) {
        final List<Production> productions = rules.get(nonTerminal);
        if (productions == null) {
            throw new MalformedGrammarException("No rule found for %s".formatted(nonTerminal));
        }
        return productions;
    }

    public Map<NonTerminal, List<Production>> rules() {
        return rules;
    }

    // mutable copy, used by transformations that rewrite the rules
    public LinkedHashMap<NonTerminal, List<Production>> copyRules() {
        final LinkedHashMap<NonTerminal, List<Production>> copy = new LinkedHashMap<>();
        rules.forEach((nonTerminal, productions) -> copy.put(nonTerminal, new ArrayList<>(productions)));
        return copy;
    }

    public int productionCount() {
        return rules.values().stream().mapToInt(List::size).sum();
    }

    public Set<Terminal> terminals() {
        final Set<Terminal> terminals = new LinkedHashSet<>();
        for (final List<Production> productions : rules.values()) {
            for (final Production production : productions) {
                for (final Symbol symbol : production.symbols()) {
                    if (symbol instanceof Terminal terminal) {
                        terminals.add(terminal);
                    }
                }
            }
        }
        return terminals;
    }

    /**
     * Checks that the start symbol and every non-terminal used in a production body has a rule entry.
     *
     * @throws MalformedGrammarException on the first undefined non-terminal found
     */
    public void validate() {
        if (!rules.containsKey(start)) {
            throw new MalformedGrammarException("Start symbol %s has no rule entry".formatted(start));
        }
        rules.forEach((nonTerminal, productions) -> {
            for (final Production production : productions) {
                for (final Symbol symbol : production.symbols()) {
                    if (symbol instanceof NonTerminal referenced && !rules.containsKey(referenced)) {
                        throw new MalformedGrammarException("Undefined non-terminal %s in rule %s -> %s".formatted(referenced, nonTerminal, production));
                    }
                }
            }
        });
    }

    // one line per non-terminal, e.g. "VP -> V NP | 'eats'"
    public List<String> formatRules(final boolean sortByName) {
        final List<NonTerminal> nonTerminals = new ArrayList<>(rules.keySet());
        if (sortByName) {
            Collections.sort(nonTerminals);
        }
        return nonTerminals.stream()
                .map(nonTerminal -> nonTerminal + " -> " + rules.get(nonTerminal).stream()
                        .map(Production::toString)
                        .collect(joining(" | ")))
                .toList();
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Grammar grammar)) {
            return false;
        }
        return start.equals(grammar.start) && rules.equals(grammar.rules);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + rules.hashCode();
    }

    @Override
    public String toString() {
        return "Grammar[start=%s, rules=%d, productions=%d]".formatted(start, rules.size(), productionCount());
    }
}
