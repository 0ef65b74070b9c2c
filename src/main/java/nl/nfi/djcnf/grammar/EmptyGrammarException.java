package nl.nfi.djcnf.grammar;

public final class EmptyGrammarException extends GrammarException {

    public EmptyGrammarException(final String message) {
        super(message);
    }
}
