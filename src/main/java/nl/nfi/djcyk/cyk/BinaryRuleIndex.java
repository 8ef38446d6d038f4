package nl.nfi.djcyk.cyk;

import nl.nfi.djcyk.cnf.CnfGrammar;
import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// reverse lookup of a CNF grammar: body -> non-terminals producing it, in grammar order
public final class BinaryRuleIndex {

    private static final Logger LOG = LoggerFactory.getLogger(BinaryRuleIndex.class);

    private final Map<Terminal, List<NonTerminal>> lexical;
    private final Map<Body, List<NonTerminal>> binary;

    private BinaryRuleIndex(final Map<Terminal, List<NonTerminal>> lexical, final Map<Body, List<NonTerminal>> binary) {
        this.lexical = lexical;
        this.binary = binary;
    }

    /**
     * @throws InvalidCnfGrammarException if a production is neither A -> B C nor A -> 'a', or a binary body
     *                                    names a non-terminal without rule entry
     */
    public static BinaryRuleIndex build(final CnfGrammar cnfGrammar) {
        final Grammar grammar = cnfGrammar.grammar();
        if (!grammar.hasRule(grammar.start())) {
            throw new InvalidCnfGrammarException("Start symbol %s has no rule entry".formatted(grammar.start()));
        }

        final Map<Terminal, List<NonTerminal>> lexical = new HashMap<>();
        final Map<Body, List<NonTerminal>> binary = new HashMap<>();
        int skippedEmpty = 0;

        for (final Map.Entry<NonTerminal, List<Production>> entry : grammar.rules().entrySet()) {
            final NonTerminal nonTerminal = entry.getKey();
            for (final Production production : entry.getValue()) {
                if (production.isEmpty()) {
                    // cannot cover a non-empty span
                    skippedEmpty++;
                } else if (production.isLexical()) {
                    addUnique(lexical.computeIfAbsent((Terminal) production.symbolAt(0), key -> new ArrayList<>()), nonTerminal);
                } else if (production.isBinary()) {
                    final NonTerminal left = (NonTerminal) production.symbolAt(0);
                    final NonTerminal right = (NonTerminal) production.symbolAt(1);
                    requireRule(grammar, left, nonTerminal, production);
                    requireRule(grammar, right, nonTerminal, production);
                    addUnique(binary.computeIfAbsent(new Body(left, right), key -> new ArrayList<>()), nonTerminal);
                } else {
                    throw new InvalidCnfGrammarException("Not in Chomsky Normal Form: %s -> %s".formatted(nonTerminal, production));
                }
            }
        }

        if (skippedEmpty > 0) {
            LOG.debug("Skipped {} empty productions while indexing", skippedEmpty);
        }
        LOG.debug("Indexed {} terminals and {} binary bodies", lexical.size(), binary.size());
        return new BinaryRuleIndex(lexical, binary);
    }

    public List<NonTerminal> producing(final Terminal terminal) {
        return lexical.getOrDefault(terminal, List.of());
    }

    public List<NonTerminal> producing(final NonTerminal left, final NonTerminal right) {
        return binary.getOrDefault(new Body(left, right), List.of());
    }

    private static void requireRule(final Grammar grammar, final NonTerminal referenced, final NonTerminal owner, final Production production) {
        if (!grammar.hasRule(referenced)) {
            throw new InvalidCnfGrammarException("Unknown non-terminal %s in %s -> %s".formatted(referenced, owner, production));
        }
    }

    private static void addUnique(final List<NonTerminal> producers, final NonTerminal nonTerminal) {
        if (!producers.contains(nonTerminal)) {
            producers.add(nonTerminal);
        }
    }

    private record Body(NonTerminal left, NonTerminal right) {
    }
}
