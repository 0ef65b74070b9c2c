package nl.nfi.djcnf.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static nl.nfi.djcnf.grammar.Symbols.isEpsilon;

/**
 * An immutable context-free grammar: an ordered mapping of nonterminals to their
 * productions plus a start symbol.
 *
 * <p>A symbol is a nonterminal exactly when it is a key of this grammar, every other
 * symbol except {@link Symbols#EPSILON} is a terminal. A nonterminal may be declared
 * without productions while a grammar is being rewritten; such a key still classifies
 * its symbol as a nonterminal.
 */
public final class Grammar {

    private final String start;
    private final Map<String, List<Production>> rules;

    private Grammar(final String start, final Map<String, List<Production>> rules) {
        this.start = start;
        this.rules = rules;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String start() {
        return start;
    }

    // in insertion order
    public Set<String> nonTerminals() {
        return rules.keySet();
    }

    public List<Production> productions(final String nonTerminal) {
        final List<Production> productions = rules.get(nonTerminal);
        if (productions == null) {
            throw new IllegalStateException("No productions found for " + nonTerminal);
        }
        return productions;
    }

    public boolean isNonTerminal(final String symbol) {
        return rules.containsKey(symbol);
    }

    public boolean isTerminal(final String symbol) {
        return !isEpsilon(symbol) && !rules.containsKey(symbol);
    }

    // every symbol occurring in this grammar, nonterminals first
    public Set<String> symbols() {
        final Set<String> symbols = new LinkedHashSet<>(rules.keySet());
        for (final List<Production> productions : rules.values()) {
            for (final Production production : productions) {
                for (final String symbol : production.symbols()) {
                    if (!isEpsilon(symbol)) {
                        symbols.add(symbol);
                    }
                }
            }
        }
        return symbols;
    }

    public int productionCount() {
        return rules.values().stream().mapToInt(List::size).sum();
    }

    public Builder toBuilder() {
        final Builder builder = new Builder().start(start);
        rules.forEach((nonTerminal, productions) -> {
            builder.declare(nonTerminal);
            productions.forEach(production -> builder.add(nonTerminal, production));
        });
        return builder;
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
        return "Grammar{start=" + start + ", rules=" + rules + "}";
    }

    public static final class Builder {

        private final Map<String, List<Production>> rules = new LinkedHashMap<>();
        private String start;

        private Builder() {
        }

        // defaults to the first declared nonterminal
        public Builder start(final String start) {
            this.start = start;
            return this;
        }

        public Builder declare(final String nonTerminal) {
            rules.computeIfAbsent(nonTerminal, key -> new ArrayList<>());
            return this;
        }

        // duplicate productions of the same nonterminal are kept once
        public Builder add(final String nonTerminal, final Production production) {
            final List<Production> productions = rules.computeIfAbsent(nonTerminal, key -> new ArrayList<>());
            if (!productions.contains(production)) {
                productions.add(production);
            }
            return this;
        }

        public Builder addAll(final String nonTerminal, final List<Production> productions) {
            declare(nonTerminal);
            productions.forEach(production -> add(nonTerminal, production));
            return this;
        }

        public boolean isDeclared(final String nonTerminal) {
            return rules.containsKey(nonTerminal);
        }

        public Grammar build() {
            final String start = this.start != null ? this.start
                    : rules.keySet().stream().findFirst().orElseThrow(() -> new EmptyGrammarException("Grammar has no rules"));

            final Map<String, List<Production>> copy = new LinkedHashMap<>();
            rules.forEach((nonTerminal, productions) -> copy.put(nonTerminal, List.copyOf(productions)));
            return new Grammar(start, Collections.unmodifiableMap(copy));
        }
    }
}
