package nl.nfi.djcnf.grammar;

public final class UndefinedStartException extends GrammarException {

    private final String start;

    public UndefinedStartException(final String start) {
        super("Start symbol is not a nonterminal of the grammar: %s".formatted(start));
        this.start = start;
    }

    public String start() {
        return start;
    }

    public static void requireDeclared(final Grammar grammar, final String start) {
        if (!grammar.isNonTerminal(start)) {
            throw new UndefinedStartException(start);
        }
    }
}
