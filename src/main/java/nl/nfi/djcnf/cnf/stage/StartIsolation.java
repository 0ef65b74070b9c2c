package nl.nfi.djcnf.cnf.stage;

import nl.nfi.djcnf.cnf.NameAllocator;
import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;

// S0 → S, prepended, so that the start symbol never occurs on a right-hand side
public final class StartIsolation implements GrammarStage {

    private static final String START_PREFIX = "S";

    @Override
    public String title() {
        return "Add a new start symbol";
    }

    @Override
    public Grammar apply(final Grammar grammar) {
        final String start = NameAllocator.reserving(grammar).allocate(START_PREFIX, 0).name();

        final Grammar.Builder builder = Grammar.builder()
                .start(start)
                .add(start, Production.of(grammar.start()));
        for (final String nonTerminal : grammar.nonTerminals()) {
            builder.addAll(nonTerminal, grammar.productions(nonTerminal));
        }
        return builder.build();
    }
}
