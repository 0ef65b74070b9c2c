package nl.nfi.djcnf.grammar;

import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.joining;
import static nl.nfi.djcnf.grammar.Symbols.ARROW;

// canonical text form, the start symbol first and the other nonterminals in lexical order:
//      S0 → A B | ε
//      A → a
public final class GrammarFormatter {

    private static final String ALTERNATIVE_SEPARATOR = " | ";

    private GrammarFormatter() {
    }

    public static String format(final Grammar grammar) {
        return format(grammar, grammar.start());
    }

    public static String format(final Grammar grammar, final String start) {
        UndefinedStartException.requireDeclared(grammar, start);

        final List<String> order = new ArrayList<>();
        order.add(start);
        grammar.nonTerminals().stream()
                .filter(nonTerminal -> !nonTerminal.equals(start))
                .sorted()
                .forEach(order::add);

        final List<String> lines = new ArrayList<>();
        for (final String nonTerminal : order) {
            final List<Production> productions = grammar.productions(nonTerminal);
            if (productions.isEmpty()) {
                continue;
            }
            lines.add(nonTerminal + " " + ARROW + " " + productions.stream()
                    .map(Production::toString)
                    .collect(joining(ALTERNATIVE_SEPARATOR)));
        }
        return String.join("\n", lines);
    }
}
