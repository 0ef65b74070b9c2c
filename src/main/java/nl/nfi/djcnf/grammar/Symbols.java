package nl.nfi.djcnf.grammar;

import java.util.List;

// symbols are plain strings, whether one is a terminal or a nonterminal is always
// decided against a specific grammar, see Grammar#isNonTerminal
public final class Symbols {

    public static final String EPSILON = "ε";

    // accepted as a standalone alternative in grammar text
    public static final String EPSILON_ALIAS = "E";

    public static final String ARROW = "→";
    public static final String ASCII_ARROW = "->";

    private Symbols() {
    }

    public static boolean isEpsilon(final String symbol) {
        return EPSILON.equals(symbol);
    }

    public static String concat(final List<String> symbols) {
        return String.join("", symbols.stream().filter(symbol -> !isEpsilon(symbol)).toList());
    }
}
