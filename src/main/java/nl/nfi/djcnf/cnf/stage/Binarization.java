package nl.nfi.djcnf.cnf.stage;

import nl.nfi.djcnf.cnf.NameAllocator;
import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;

// A → X1 X2 X3 X4  becomes  A → X1 Y1, Y1 → X2 Y2, Y2 → X3 X4
public final class Binarization implements GrammarStage {

    private static final String CHAIN_PREFIX = "X";

    @Override
    public String title() {
        return "Binarize long rules";
    }

    @Override
    public Grammar apply(final Grammar grammar) {
        NameAllocator allocator = NameAllocator.reserving(grammar);

        final Grammar.Builder builder = Grammar.builder().start(grammar.start());
        for (final String nonTerminal : grammar.nonTerminals()) {
            builder.declare(nonTerminal);
            for (final Production production : grammar.productions(nonTerminal)) {
                if (production.size() <= 2) {
                    builder.add(nonTerminal, production);
                    continue;
                }

                String previous = nonTerminal;
                for (int position = 0; position < production.size() - 2; position++) {
                    final NameAllocator.Allocation allocation = allocator.allocate(CHAIN_PREFIX, 1);
                    allocator = allocation.allocator();
                    builder.add(previous, Production.of(production.symbolAt(position), allocation.name()));
                    previous = allocation.name();
                }
                builder.add(previous, Production.of(production.symbolAt(production.size() - 2), production.symbolAt(production.size() - 1)));
            }
        }
        return builder.build();
    }
}
