package nl.nfi.djcyk.cnf;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.MalformedGrammarException;
import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites a context-free grammar into Chomsky Normal Form.
 *
 * <p>The steps run in a fixed order: start isolation, nullable computation, unit production
 * elimination, terminal isolation and binarization. Each run owns its own fresh variable counter, so
 * normalizing the same grammar twice gives the same result.
 *
 * <p>Empty productions are not eliminated. The nullable non-terminals are computed and reported, but
 * their productions are carried through unchanged; the supported grammar class is grammars without
 * nullable non-terminals.
 */
public final class CnfNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(CnfNormalizer.class);

    static final String START_NAME = "S0";

    private final Grammar source;
    private final FreshVariables freshVariables;

    private CnfNormalizer(final Grammar source) {
        this.source = source;
        this.freshVariables = FreshVariables.avoiding(source.nonTerminals());
    }

    /**
     * @throws MalformedGrammarException if the start symbol or a referenced non-terminal has no rule entry
     */
    public static CnfGrammar normalize(final Grammar grammar) {
        grammar.validate();
        return new CnfNormalizer(grammar).run();
    }

    public static Set<NonTerminal> nullable(final Grammar grammar) {
        return nullable(grammar.rules());
    }

    private CnfGrammar run() {
        final NonTerminal start = freshVariables.named(START_NAME);

        LinkedHashMap<NonTerminal, List<Production>> rules = isolateStart(start, source);
        logStep("start isolation", rules);

        final Set<NonTerminal> nullable = nullable(rules);
        if (!nullable.isEmpty()) {
            LOG.warn("Grammar has nullable non-terminals {}, their empty productions are kept as is", nullable);
        }

        rules = eliminateUnitProductions(rules);
        logStep("unit elimination", rules);

        rules = isolateTerminals(rules);
        logStep("terminal isolation", rules);

        rules = binarize(rules);
        logStep("binarization", rules);

        final Grammar cnf = Grammar.create(start, rules);
        LOG.info("Normalized grammar from {} rules ({} productions) to {} rules ({} productions), {} fresh variables",
                source.nonTerminals().size(), source.productionCount(),
                cnf.nonTerminals().size(), cnf.productionCount(),
                freshVariables.issued());
        return new CnfGrammar(cnf, source.start());
    }

    // S0 -> S, with S0 first and never on a right hand side
    static LinkedHashMap<NonTerminal, List<Production>> isolateStart(final NonTerminal newStart, final Grammar grammar) {
        final LinkedHashMap<NonTerminal, List<Production>> rules = new LinkedHashMap<>();
        rules.put(newStart, new ArrayList<>(List.of(Production.of(grammar.start()))));
        rules.putAll(grammar.copyRules());
        return rules;
    }

    static Set<NonTerminal> nullable(final Map<NonTerminal, List<Production>> rules) {
        final Set<NonTerminal> nullable = new LinkedHashSet<>();
        boolean changed;
        do {
            changed = false;
            for (final Map.Entry<NonTerminal, List<Production>> entry : rules.entrySet()) {
                if (nullable.contains(entry.getKey())) {
                    continue;
                }
                for (final Production production : entry.getValue()) {
                    if (derivesOnlyFrom(production, nullable)) {
                        nullable.add(entry.getKey());
                        changed = true;
                        break;
                    }
                }
            }
        } while (changed);
        return nullable;
    }

    private static boolean derivesOnlyFrom(final Production production, final Set<NonTerminal> nullable) {
        for (final Symbol symbol : production.symbols()) {
            if (!(symbol instanceof NonTerminal nonTerminal) || !nullable.contains(nonTerminal)) {
                return false;
            }
        }
        return true;
    }

    // per non-terminal: itself, then everything reachable through A -> B chains, in discovery order
    static Map<NonTerminal, Set<NonTerminal>> unitClosures(final Map<NonTerminal, List<Production>> rules) {
        final Map<NonTerminal, Set<NonTerminal>> closures = new LinkedHashMap<>();
        for (final NonTerminal nonTerminal : rules.keySet()) {
            final Set<NonTerminal> closure = new LinkedHashSet<>();
            closure.add(nonTerminal);
            closures.put(nonTerminal, closure);
        }

        boolean changed;
        do {
            changed = false;
            for (final Map.Entry<NonTerminal, List<Production>> entry : rules.entrySet()) {
                final Set<NonTerminal> closure = closures.get(entry.getKey());
                for (final Production production : entry.getValue()) {
                    if (!production.isUnit()) {
                        continue;
                    }
                    final NonTerminal target = (NonTerminal) production.symbolAt(0);
                    // copy, target may be the non-terminal itself
                    for (final NonTerminal reachable : List.copyOf(closures.get(target))) {
                        changed |= closure.add(reachable);
                    }
                }
            }
        } while (changed);

        return closures;
    }

    static LinkedHashMap<NonTerminal, List<Production>> eliminateUnitProductions(final Map<NonTerminal, List<Production>> rules) {
        final Map<NonTerminal, Set<NonTerminal>> closures = unitClosures(rules);

        final LinkedHashMap<NonTerminal, List<Production>> result = new LinkedHashMap<>();
        for (final NonTerminal nonTerminal : rules.keySet()) {
            final Set<Production> productions = new LinkedHashSet<>();
            for (final NonTerminal reachable : closures.get(nonTerminal)) {
                for (final Production production : rules.get(reachable)) {
                    if (!production.isUnit()) {
                        productions.add(production);
                    }
                }
            }
            result.put(nonTerminal, new ArrayList<>(productions));
        }
        return result;
    }

    // A -> 'a' B becomes A -> X1 B, X1 -> 'a'; one variable per distinct terminal
    LinkedHashMap<NonTerminal, List<Production>> isolateTerminals(final Map<NonTerminal, List<Production>> rules) {
        final Map<Terminal, NonTerminal> terminalVariables = new LinkedHashMap<>();

        final LinkedHashMap<NonTerminal, List<Production>> result = new LinkedHashMap<>();
        for (final Map.Entry<NonTerminal, List<Production>> entry : rules.entrySet()) {
            final List<Production> rewritten = new ArrayList<>();
            result.put(entry.getKey(), rewritten);

            for (final Production production : entry.getValue()) {
                if (production.size() < 2 || !production.containsTerminal()) {
                    rewritten.add(production);
                    continue;
                }
                final List<Symbol> symbols = new ArrayList<>(production.size());
                for (final Symbol symbol : production.symbols()) {
                    if (symbol instanceof Terminal terminal) {
                        NonTerminal variable = terminalVariables.get(terminal);
                        if (variable == null) {
                            variable = freshVariables.next();
                            terminalVariables.put(terminal, variable);
                            result.put(variable, new ArrayList<>(List.of(Production.of(terminal))));
                        }
                        symbols.add(variable);
                    } else {
                        symbols.add(symbol);
                    }
                }
                rewritten.add(new Production(symbols));
            }
        }
        return result;
    }

    // A -> B C D becomes A -> B X1, X1 -> C D
    LinkedHashMap<NonTerminal, List<Production>> binarize(final Map<NonTerminal, List<Production>> rules) {
        final LinkedHashMap<NonTerminal, List<Production>> result = new LinkedHashMap<>();
        for (final Map.Entry<NonTerminal, List<Production>> entry : rules.entrySet()) {
            final NonTerminal nonTerminal = entry.getKey();
            result.computeIfAbsent(nonTerminal, key -> new ArrayList<>());

            for (final Production production : entry.getValue()) {
                if (production.size() <= 2) {
                    result.get(nonTerminal).add(production);
                    continue;
                }
                NonTerminal current = nonTerminal;
                for (int i = 0; i < production.size() - 2; i++) {
                    final NonTerminal next = freshVariables.next();
                    result.computeIfAbsent(current, key -> new ArrayList<>()).add(Production.of(production.symbolAt(i), next));
                    current = next;
                }
                result.computeIfAbsent(current, key -> new ArrayList<>())
                        .add(Production.of(production.symbolAt(production.size() - 2), production.symbolAt(production.size() - 1)));
            }
        }
        return result;
    }

    private static void logStep(final String step, final Map<NonTerminal, List<Production>> rules) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("After {}: {} rules, {} productions", step, rules.size(), rules.values().stream().mapToInt(List::size).sum());
        }
    }

    // exposed for tests that drive a single step
    static CnfNormalizer forSteps(final Grammar grammar) {
        return new CnfNormalizer(grammar);
    }
}
