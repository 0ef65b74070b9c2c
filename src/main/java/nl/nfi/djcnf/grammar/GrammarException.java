package nl.nfi.djcnf.grammar;

// raised for grammar input that cannot be processed, the pipeline itself never throws it
public class GrammarException extends IllegalArgumentException {

    public GrammarException(final String message) {
        super(message);
    }
}
