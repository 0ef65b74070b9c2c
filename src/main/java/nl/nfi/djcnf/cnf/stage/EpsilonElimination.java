package nl.nfi.djcnf.cnf.stage;

import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;
import nl.nfi.djcnf.grammar.analysis.Fixpoints;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Removes {@code [ε]} productions. Every production is replaced by all variants obtained by
 * deleting some of its nullable symbols. Only the start symbol keeps an {@code [ε]}
 * production, and only when it is nullable.
 *
 * <p>Nonterminals left without productions stay declared, so their symbol keeps being a
 * nonterminal until useless symbols are removed.
 */
public final class EpsilonElimination implements GrammarStage {

    @Override
    public String title() {
        return "Remove ε-productions";
    }

    @Override
    public Grammar apply(final Grammar grammar) {
        final Set<String> nullable = Fixpoints.nullable(grammar);
        final String start = grammar.start();

        final Grammar.Builder builder = Grammar.builder().start(start);
        for (final String nonTerminal : grammar.nonTerminals()) {
            builder.declare(nonTerminal);
            for (final Production production : grammar.productions(nonTerminal)) {
                if (production.isEpsilon()) {
                    if (nonTerminal.equals(start)) {
                        builder.add(nonTerminal, production);
                    }
                    continue;
                }
                for (final List<String> variant : variants(production, nullable)) {
                    if (!variant.isEmpty()) {
                        builder.add(nonTerminal, new Production(variant));
                    } else if (nonTerminal.equals(start)) {
                        builder.add(nonTerminal, Production.epsilon());
                    }
                }
            }
        }
        return builder.build();
    }

    // one variant per subset of nullable positions, the unmodified production first
    private static List<List<String>> variants(final Production production, final Set<String> nullable) {
        final List<Integer> positions = new ArrayList<>();
        for (int position = 0; position < production.size(); position++) {
            if (nullable.contains(production.symbolAt(position))) {
                positions.add(position);
            }
        }

        final List<List<String>> variants = new ArrayList<>();
        final long subsetCount = 1L << positions.size();
        for (long mask = 0; mask < subsetCount; mask++) {
            final List<String> variant = new ArrayList<>(production.symbols());
            // remove back to front so earlier positions stay valid
            for (int i = positions.size() - 1; i >= 0; i--) {
                if ((mask >> i & 1) == 1) {
                    variant.remove((int) positions.get(i));
                }
            }
            variants.add(variant);
        }
        return variants;
    }
}
