package nl.nfi.djcnf.grammar.analysis;

import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

import static java.util.Collections.unmodifiableSet;
import static nl.nfi.djcnf.grammar.Symbols.isEpsilon;

/**
 * Monotone closures over a grammar snapshot. Each set only grows between passes, so every
 * computation stops after at most one pass per nonterminal.
 */
public final class Fixpoints {

    private Fixpoints() {
    }

    /**
     * Nonterminals deriving the empty string: those with an {@code [ε]} production or a
     * production made up of nullable nonterminals only.
     */
    public static Set<String> nullable(final Grammar grammar) {
        return closure(grammar, (production, nullable) ->
                production.isEpsilon() || production.symbols().stream().allMatch(nullable::contains));
    }

    /**
     * Nonterminals deriving at least one terminal string: those with a production whose
     * symbols are all terminals or generating nonterminals.
     */
    public static Set<String> generating(final Grammar grammar) {
        return closure(grammar, (production, generating) ->
                production.symbols().stream().allMatch(symbol -> isEpsilon(symbol) || grammar.isTerminal(symbol) || generating.contains(symbol)));
    }

    /**
     * Nonterminals reachable from {@code start}, in discovery order, {@code start} included
     * when it is a nonterminal of the grammar.
     */
    public static Set<String> reachable(final Grammar grammar, final String start) {
        final Set<String> reached = new LinkedHashSet<>();
        if (!grammar.isNonTerminal(start)) {
            return Set.of();
        }

        final Deque<String> frontier = new ArrayDeque<>();
        frontier.add(start);
        reached.add(start);
        while (!frontier.isEmpty()) {
            final String nonTerminal = frontier.poll();
            for (final Production production : grammar.productions(nonTerminal)) {
                for (final String symbol : production.symbols()) {
                    if (grammar.isNonTerminal(symbol) && reached.add(symbol)) {
                        frontier.add(symbol);
                    }
                }
            }
        }
        return unmodifiableSet(reached);
    }

    private static Set<String> closure(final Grammar grammar, final Rule rule) {
        final Set<String> found = new LinkedHashSet<>();

        boolean changed = true;
        while (changed) {
            changed = false;
            for (final String nonTerminal : grammar.nonTerminals()) {
                if (found.contains(nonTerminal)) {
                    continue;
                }
                final Predicate<Production> qualifies = production -> rule.qualifies(production, found);
                if (grammar.productions(nonTerminal).stream().anyMatch(qualifies)) {
                    found.add(nonTerminal);
                    changed = true;
                }
            }
        }
        return unmodifiableSet(found);
    }

    @FunctionalInterface
    private interface Rule {
        boolean qualifies(Production production, Set<String> found);
    }
}
