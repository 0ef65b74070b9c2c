package nl.nfi.djcnf.grammar;

public final class MalformedRuleException extends GrammarException {

    private final int lineNumber;
    private final String line;

    public MalformedRuleException(final int lineNumber, final String line, final String reason) {
        super("Malformed rule at line %d (%s): %s".formatted(lineNumber, reason, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    // 1-based
    public int lineNumber() {
        return lineNumber;
    }

    public String line() {
        return line;
    }
}
