package nl.nfi.djcyk.cnf;

import nl.nfi.djcyk.grammar.NonTerminal;

import java.util.HashSet;
import java.util.Set;

// supplies X1, X2, ... for a single normalization run, skipping names that are already taken
final class FreshVariables {

    private static final String PREFIX = "X";

    private final Set<String> taken;
    private int counter;

    private FreshVariables(final Set<String> taken) {
        this.taken = taken;
    }

    static FreshVariables avoiding(final Set<NonTerminal> existing) {
        final Set<String> taken = new HashSet<>();
        for (final NonTerminal nonTerminal : existing) {
            taken.add(nonTerminal.name());
        }
        return new FreshVariables(taken);
    }

    NonTerminal next() {
        String name;
        do {
            counter++;
            name = PREFIX + counter;
        } while (taken.contains(name));
        taken.add(name);
        return new NonTerminal(name);
    }

    // the given name, or the name with primes appended until it is free
    NonTerminal named(final String preferred) {
        String name = preferred;
        while (taken.contains(name)) {
            name += "'";
        }
        taken.add(name);
        return new NonTerminal(name);
    }

    int issued() {
        return counter;
    }
}
