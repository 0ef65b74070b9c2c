package nl.nfi.djcnf.generate;

import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;
import nl.nfi.djcnf.grammar.Symbols;
import nl.nfi.djcnf.grammar.UndefinedStartException;
import nl.nfi.djcnf.grammar.analysis.Fixpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Enumerates the words of a grammar up to a maximum length, breadth first over sentential
 * forms, always expanding the leftmost nonterminal.
 *
 * <p>When a production is spliced in, each nullable nonterminal it contains is both kept and
 * erased in separate forms. Every word then has a derivation in which each symbol of each
 * form yields at least one terminal, so forms with more symbols than the maximum length can
 * be pruned without losing words. Together with skipping already seen forms this bounds the
 * search, whatever the recursion in the grammar ({@code S → S S | ε}, unit cycles).
 */
public final class WordEnumerator {

    private static final Logger LOG = LoggerFactory.getLogger(WordEnumerator.class);

    private final Grammar grammar;
    private final Set<String> nullable;

    private WordEnumerator(final Grammar grammar) {
        this.grammar = grammar;
        this.nullable = Fixpoints.nullable(grammar);
    }

    public static WordEnumerator forGrammar(final Grammar grammar) {
        return new WordEnumerator(grammar);
    }

    public static Set<String> generateWords(final Grammar grammar, final int maxLength) {
        return generateWords(grammar, grammar.start(), maxLength);
    }

    public static Set<String> generateWords(final Grammar grammar, final String start, final int maxLength) {
        return forGrammar(grammar).enumerate(start, maxLength, Integer.MAX_VALUE);
    }

    public static Set<String> generateWords(final Grammar grammar, final String start, final int maxLength, final int maxWords) {
        return forGrammar(grammar).enumerate(start, maxLength, maxWords);
    }

    // words in discovery order, at most maxWords of them
    public Set<String> enumerate(final String start, final int maxLength, final int maxWords) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("Maximum word length must be positive: %d".formatted(maxLength));
        }
        if (maxWords <= 0) {
            throw new IllegalArgumentException("Maximum word count must be positive: %d".formatted(maxWords));
        }
        UndefinedStartException.requireDeclared(grammar, start);

        final Set<String> words = new LinkedHashSet<>();
        final Set<List<String>> seen = new HashSet<>();
        final Queue<List<String>> queue = new ArrayDeque<>();
        queue.add(List.of(start));
        seen.add(List.of(start));

        long expanded = 0;
        while (!queue.isEmpty() && words.size() < maxWords) {
            final List<String> form = queue.poll();
            if (realizedLength(form) > maxLength) {
                continue;
            }

            final int position = leftmostNonTerminal(form);
            if (position < 0) {
                words.add(Symbols.concat(form));
                continue;
            }

            expanded++;
            for (final Production production : grammar.productions(form.get(position))) {
                for (final List<String> replacement : erasures(production)) {
                    final List<String> next = splice(form, position, replacement);
                    if (next.size() <= maxLength && seen.add(next)) {
                        queue.add(next);
                    }
                }
            }
        }

        LOG.debug("Enumerated {} words up to length {}: {} forms expanded, {} forms seen", words.size(), maxLength, expanded, seen.size());
        return Collections.unmodifiableSet(words);
    }

    private int realizedLength(final List<String> form) {
        int length = 0;
        for (final String symbol : form) {
            if (grammar.isTerminal(symbol)) {
                length++;
            }
        }
        return length;
    }

    private int leftmostNonTerminal(final List<String> form) {
        for (int position = 0; position < form.size(); position++) {
            if (grammar.isNonTerminal(form.get(position))) {
                return position;
            }
        }
        return -1;
    }

    // the production itself, then every variant with some of its nullable nonterminals erased
    private List<List<String>> erasures(final Production production) {
        if (production.isEpsilon()) {
            return List.of(List.of());
        }

        List<List<String>> variants = new ArrayList<>();
        variants.add(new ArrayList<>());
        for (final String symbol : production.symbols()) {
            final List<List<String>> extended = new ArrayList<>(variants.size() * 2);
            for (final List<String> variant : variants) {
                final List<String> kept = new ArrayList<>(variant);
                kept.add(symbol);
                extended.add(kept);
                if (nullable.contains(symbol)) {
                    extended.add(variant);
                }
            }
            variants = extended;
        }
        return variants;
    }

    private static List<String> splice(final List<String> form, final int position, final List<String> replacement) {
        final List<String> next = new ArrayList<>(form.size() - 1 + replacement.size());
        next.addAll(form.subList(0, position));
        next.addAll(replacement);
        next.addAll(form.subList(position + 1, form.size()));
        return List.copyOf(next);
    }
}
