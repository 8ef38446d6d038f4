package nl.nfi.djcyk.grammar;

import static java.util.Objects.requireNonNull;

public record NonTerminal(String name) implements Symbol, Comparable<NonTerminal> {

    public NonTerminal {
        requireNonNull(name, "name");
    }

    @Override
    public String text() {
        return name;
    }

    @Override
    public int compareTo(final NonTerminal other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
