package nl.nfi.djcnf.cnf.stage;

import nl.nfi.djcnf.cnf.NameAllocator;
import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.Production;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// A → a B  becomes  A → T_a B, T_a → a
// single symbol productions are left alone, A → a is valid CNF
public final class TerminalIsolation implements GrammarStage {

    private static final String TERMINAL_PREFIX = "T_";

    @Override
    public String title() {
        return "Replace terminals in long rules";
    }

    @Override
    public Grammar apply(final Grammar grammar) {
        NameAllocator allocator = NameAllocator.reserving(grammar);
        final Map<String, String> replacements = new LinkedHashMap<>();

        final Grammar.Builder builder = Grammar.builder().start(grammar.start());
        for (final String nonTerminal : grammar.nonTerminals()) {
            builder.declare(nonTerminal);
            for (final Production production : grammar.productions(nonTerminal)) {
                if (production.size() == 1) {
                    builder.add(nonTerminal, production);
                    continue;
                }

                final List<String> symbols = new ArrayList<>(production.size());
                for (final String symbol : production.symbols()) {
                    if (!grammar.isTerminal(symbol)) {
                        symbols.add(symbol);
                        continue;
                    }
                    if (!replacements.containsKey(symbol)) {
                        final NameAllocator.Allocation allocation = allocator.allocatePreferring(TERMINAL_PREFIX + symbol);
                        allocator = allocation.allocator();
                        replacements.put(symbol, allocation.name());
                    }
                    symbols.add(replacements.get(symbol));
                }
                builder.add(nonTerminal, new Production(symbols));
            }
        }

        replacements.forEach((terminal, nonTerminal) -> builder.add(nonTerminal, Production.of(terminal)));
        return builder.build();
    }
}
