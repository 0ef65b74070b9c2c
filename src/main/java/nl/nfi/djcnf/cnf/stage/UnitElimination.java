package nl.nfi.djcnf.cnf.stage;

import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

// replaces A → B chains by the non-unit productions reachable through them
public final class UnitElimination implements GrammarStage {

    @Override
    public String title() {
        return "Remove unit productions";
    }

    @Override
    public Grammar apply(final Grammar grammar) {
        final Grammar.Builder builder = Grammar.builder().start(grammar.start());

        for (final String nonTerminal : grammar.nonTerminals()) {
            builder.declare(nonTerminal);

            final Set<String> visited = new HashSet<>();
            final Deque<String> queue = new ArrayDeque<>();
            visited.add(nonTerminal);
            queue.add(nonTerminal);

            while (!queue.isEmpty()) {
                final String current = queue.poll();
                for (final Production production : grammar.productions(current)) {
                    if (isUnit(grammar, production)) {
                        final String target = production.symbolAt(0);
                        if (visited.add(target)) {
                            queue.add(target);
                        }
                    } else {
                        builder.add(nonTerminal, production);
                    }
                }
            }
        }
        return builder.build();
    }

    static boolean isUnit(final Grammar grammar, final Production production) {
        return production.size() == 1 && grammar.isNonTerminal(production.symbolAt(0));
    }
}
