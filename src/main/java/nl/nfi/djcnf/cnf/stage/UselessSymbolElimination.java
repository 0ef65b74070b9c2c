package nl.nfi.djcnf.cnf.stage;

import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;
import nl.nfi.djcnf.grammar.analysis.Fixpoints;

import java.util.Set;

import static nl.nfi.djcnf.grammar.Symbols.isEpsilon;

/**
 * Drops non-generating nonterminals (with every production mentioning them) and then
 * the nonterminals no longer reachable from the start symbol. The order matters: the
 * first filter can disconnect symbols that the second one removes.
 *
 * <p>When the start symbol itself generates nothing the result declares only the start
 * symbol, without productions.
 */
public final class UselessSymbolElimination implements GrammarStage {

    @Override
    public String title() {
        return "Remove useless symbols";
    }

    @Override
    public Grammar apply(final Grammar grammar) {
        final String start = grammar.start();
        final Grammar generatingOnly = keepGenerating(grammar);
        final Set<String> reachable = Fixpoints.reachable(generatingOnly, start);

        final Grammar.Builder builder = Grammar.builder().start(start);
        for (final String nonTerminal : generatingOnly.nonTerminals()) {
            if (reachable.contains(nonTerminal)) {
                builder.addAll(nonTerminal, generatingOnly.productions(nonTerminal));
            }
        }
        if (!builder.isDeclared(start)) {
            builder.declare(start);
        }
        return builder.build();
    }

    private static Grammar keepGenerating(final Grammar grammar) {
        final Set<String> generating = Fixpoints.generating(grammar);

        final Grammar.Builder builder = Grammar.builder().start(grammar.start());
        for (final String nonTerminal : grammar.nonTerminals()) {
            if (!generating.contains(nonTerminal)) {
                continue;
            }
            builder.declare(nonTerminal);
            for (final Production production : grammar.productions(nonTerminal)) {
                final boolean useful = production.symbols().stream()
                        .allMatch(symbol -> isEpsilon(symbol) || grammar.isTerminal(symbol) || generating.contains(symbol));
                if (useful) {
                    builder.add(nonTerminal, production);
                }
            }
        }
        return builder.build();
    }
}
