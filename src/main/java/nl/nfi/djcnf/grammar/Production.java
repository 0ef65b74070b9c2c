package nl.nfi.djcnf.grammar;

import java.util.List;

import static java.lang.String.join;
import static nl.nfi.djcnf.grammar.Symbols.EPSILON;

// right-hand side of a rule, e.g.:
//      A → a B C
//  where symbols = [a, B, C]
//  the empty string is the single symbol production [ε]
public record Production(List<String> symbols) {

    private static final Production EMPTY = new Production(List.of(EPSILON));

    public Production {
        symbols = List.copyOf(symbols);
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("Production must contain at least one symbol, use [%s] for the empty string".formatted(EPSILON));
        }
        if (symbols.size() > 1 && symbols.stream().anyMatch(Symbols::isEpsilon)) {
            throw new IllegalArgumentException("%s must be the only symbol of a production: %s".formatted(EPSILON, symbols));
        }
    }

    public static Production of(final String... symbols) {
        return new Production(List.of(symbols));
    }

    public static Production epsilon() {
        return EMPTY;
    }

    public boolean isEpsilon() {
        return symbols.size() == 1 && Symbols.isEpsilon(symbols.get(0));
    }

    public int size() {
        return symbols.size();
    }

    public String symbolAt(final int position) {
        return symbols.get(position);
    }

    @Override
    public String toString() {
        return join(" ", symbols);
    }
}
